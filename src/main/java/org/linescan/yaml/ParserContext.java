package org.linescan.yaml;

import org.yaml.snakeyaml.error.Mark;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Mutable state of a single document parse.
 * <p>
 * Holds the raw text split into lines and the inline flow-mapping key flag set by
 * {@link FlowMappingLineCorrector}. One instance is
 * owned by exactly one {@link YamlFileParser} and must never be shared between parses.
 */
public final class ParserContext {

    /** Line breaks recognised by the YAML reader: LF, CR, CRLF, NEL, LS and PS. */
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|[\r\n\u0085\u2028\u2029]");

    private final List<String> lines;
    private boolean inlineMappingKeyPending;

    public ParserContext(String content) {
        Objects.requireNonNull(content, "content must not be null");
        this.lines = splitLines(content);
    }

    /**
     * Returns the 1-based line a mapping value is stamped with: the mapping's start line in an
     * inline key context, the line the value begins on otherwise.
     *
     * @param mappingStart start mark of the mapping owning the value
     * @param valueStart   start mark of the value's first event (tag, anchor, alias or scalar)
     */
    public int valueLine(Mark mappingStart, Mark valueStart) {
        if (inlineMappingKeyPending) {
            return mappingStart.getLine() + 1;
        }
        return valueStart.getLine() + 1;
    }

    public boolean isInlineMappingKeyPending() {
        return inlineMappingKeyPending;
    }

    public void setInlineMappingKeyPending(boolean inlineMappingKeyPending) {
        this.inlineMappingKeyPending = inlineMappingKeyPending;
    }

    public void clearInlineMappingKey() {
        this.inlineMappingKeyPending = false;
    }

    /** Raw document lines, without line terminators. */
    public List<String> lines() {
        return lines;
    }

    /**
     * Returns the raw text of a 1-based line, or an empty string when the line lies outside
     * the document.
     */
    public String sourceLine(int lineNumber) {
        return sourceLine(lines, lineNumber);
    }

    static String sourceLine(List<String> lines, int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return "";
        }
        return lines.get(lineNumber - 1);
    }

    /**
     * Splits text the way the YAML reader counts lines. A trailing line break does not open an
     * extra empty line.
     */
    static List<String> splitLines(String content) {
        if (content.isEmpty()) {
            return Collections.emptyList();
        }
        String[] parts = LINE_BREAK.split(content, -1);
        int count = parts.length;
        if (parts[count - 1].isEmpty()) {
            count--;
        }
        return List.of(Arrays.copyOf(parts, count));
    }
}
