package org.linescan.yaml;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.parser.ParserImpl;
import org.yaml.snakeyaml.reader.StreamReader;
import org.yaml.snakeyaml.resolver.Resolver;
import org.yaml.snakeyaml.scanner.ScannerImpl;

import java.io.StringReader;
import java.util.List;
import java.util.Objects;

/**
 * Parses one YAML document into an annotated tree in which every string or binary mapping value
 * knows the line it came from.
 * <p>
 * Scannable values are assumed to be strings or binaries, never keys. Each value is replaced by
 * an {@link AnnotatedScalar} while the document is composed, so the located values can be read
 * back with {@link #values()} once the document is built.
 * <p>
 * Instances are single-use and not thread-safe.
 */
public final class YamlFileParser {

    private final ParserContext context;
    private final AnnotatedConstructor constructor;
    private boolean consumed;

    public YamlFileParser(String content, LoaderOptions options) {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(options, "options must not be null");

        StreamReader reader = new StreamReader(new StringReader(content));
        FlowMappingLineCorrector corrector = new FlowMappingLineCorrector(new ScannerImpl(reader, options));
        this.context = new ParserContext(content);

        AnnotatedComposer composer = new AnnotatedComposer(
                new ParserImpl(corrector), new Resolver(), options, context, corrector);
        this.constructor = new AnnotatedConstructor(options);
        this.constructor.setComposer(composer);
    }

    /**
     * Composes and constructs the single document of the stream.
     *
     * @return maps, lists and scalars with {@link AnnotatedScalar} in place of string and binary
     *         mapping values; {@code null} for an empty document
     * @throws org.yaml.snakeyaml.error.YAMLException if the document is not well-formed
     * @throws IllegalStateException if the document was already read
     */
    public Object json() {
        if (consumed) {
            throw new IllegalStateException("document has already been parsed");
        }
        consumed = true;
        return constructor.getSingleData(Object.class);
    }

    /**
     * Parses the document and returns its scannable values sorted by line number.
     */
    public List<AnnotatedValue> values() {
        return TreeFlattener.flatten(json(), context.lines());
    }

    /** Raw lines of the document. */
    public List<String> lines() {
        return context.lines();
    }
}
