package org.linescan;

import org.linescan.config.TransformerProperties;
import org.linescan.yaml.AnnotatedValue;
import org.linescan.yaml.LineReconstructor;
import org.linescan.yaml.YamlFileParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Line transformer for YAML documents.
 * <p>
 * The document is parsed, every string or binary mapping value is located on its source line, and
 * a synthetic text is rebuilt with one <code>key: "value"</code> entry per line:
 * <pre>
 * password: hunter2   # prod       -&gt;   password: "hunter2"   # prod
 * token: !!binary aGVsbG8=          -&gt;   token: "aGVsbG8="
 * </pre>
 * Line numbers of the rebuilt text match the source, so findings point back at the real line.
 * <p>
 * Instances are immutable and thread-safe; every call parses with its own state.
 */
public final class YamlTransformer implements LineTransformer {

    private static final Logger logger = LoggerFactory.getLogger(YamlTransformer.class);

    private final TransformerProperties properties;
    private final Set<String> extensions;
    private final Charset fallbackCharset;

    public YamlTransformer() {
        this(new TransformerProperties());
    }

    public YamlTransformer(TransformerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.extensions = properties.getExtensions().stream()
                .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .collect(Collectors.toUnmodifiableSet());
        this.fallbackCharset = properties.fallbackCharset();
    }

    /* =====================================================
     * Public API
     * ===================================================== */

    @Override
    public boolean shouldParseFile(String filename) {
        if (filename == null) {
            return false;
        }
        String name = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    @Override
    public List<String> parseFile(File file) throws IOException, ParsingFailure {
        Objects.requireNonNull(file, "file must not be null");
        return parseFile(file.toPath());
    }

    /**
     * Parses a YAML file into reconstructed lines.
     *
     * @param path file to read
     * @return one entry per source line, index 0 holding line 1
     * @throws IOException    if the file cannot be read
     * @throws ParsingFailure if the file is not well-formed YAML
     */
    public List<String> parseFile(Path path) throws IOException, ParsingFailure {
        Objects.requireNonNull(path, "path must not be null");
        return parseFile(path.toString(), Files.readAllBytes(path), null);
    }

    /**
     * Parses a YAML document read from a stream.
     * <p>
     * The caller owns the stream and is responsible for closing it. The method reads the entire
     * stream into memory.
     *
     * @param name name reported in failures
     * @param in   document content
     */
    public List<String> parseFile(String name, InputStream in) throws IOException, ParsingFailure {
        Objects.requireNonNull(in, "input stream must not be null");
        return parseFile(name, in.readAllBytes(), null);
    }

    /**
     * Parses raw document bytes.
     *
     * @param name         name reported in failures
     * @param data         document content
     * @param encodingHint charset name overriding detection, ignored when {@code null} or unknown
     */
    public List<String> parseFile(String name, byte[] data, String encodingHint) throws ParsingFailure {
        return parse(name, SourceText.decode(data, encodingHint, fallbackCharset));
    }

    /**
     * Runs the transformation on decoded text. Either every line is returned or a
     * {@link ParsingFailure} is thrown; there is no partial result.
     *
     * @param name    name reported in failures
     * @param content document text
     * @return reconstructed lines; at least as many as the document has
     * @throws ParsingFailure if the document is not well-formed YAML
     */
    public List<String> parse(String name, String content) throws ParsingFailure {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");

        YamlFileParser parser = new YamlFileParser(content, properties.toLoaderOptions());
        List<AnnotatedValue> values;
        try {
            values = parser.values();
        } catch (YAMLException e) {
            int line = problemLine(e);
            logger.warn("Unable to parse YAML file {} (line {}): {}", name, line, summary(e));
            throw new ParsingFailure(name, line, summary(e), e);
        }

        List<String> lines = LineReconstructor.reconstruct(values, parser.lines().size());
        logger.debug("Located {} values in {}, rebuilt {} lines", values.size(), name, lines.size());
        return lines;
    }

    /* =====================================================
     * Internal helpers
     * ===================================================== */

    private static int problemLine(YAMLException e) {
        if (e instanceof MarkedYAMLException) {
            MarkedYAMLException marked = (MarkedYAMLException) e;
            Mark mark = marked.getProblemMark() != null ? marked.getProblemMark() : marked.getContextMark();
            if (mark != null) {
                return mark.getLine() + 1;
            }
        }
        return 0;
    }

    private static String summary(YAMLException e) {
        if (e instanceof MarkedYAMLException) {
            MarkedYAMLException marked = (MarkedYAMLException) e;
            if (marked.getProblem() != null) {
                return marked.getProblem();
            }
        }
        Throwable root = e.getCause() != null ? e.getCause() : e;
        return String.valueOf(root.getMessage());
    }
}
