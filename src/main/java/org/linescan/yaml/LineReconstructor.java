package org.linescan.yaml;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders located values back into a synthetic, line-indexed source text that a line-oriented
 * scanner can read without knowing anything about YAML.
 * <p>
 * Every value becomes <code>key: "value"</code> on the line it was found on, followed by the
 * inline comment of the original line. Lines without values are left empty.
 */
public final class LineReconstructor {

    /**
     * A comment starts at the first <code>#</code> preceded by whitespace. A well-formed line
     * cannot hold a <code>#</code> after whitespace anywhere else: in a plain scalar it would
     * end the scalar, and a block scalar header only admits a comment after its indicator.
     */
    private static final Pattern INLINE_COMMENT = Pattern.compile("\\s+#[\\S ]*");

    private static final String VALUE_SEPARATOR = ", ";

    private LineReconstructor() {
    }

    /**
     * @param values    values sorted by ascending line number
     * @param lineCount number of lines to produce; raised to the last value's line if smaller
     * @return one entry per line, index 0 holding line 1
     */
    public static List<String> reconstruct(List<AnnotatedValue> values, int lineCount) {
        Objects.requireNonNull(values, "values must not be null");
        int total = Math.max(lineCount, values.isEmpty() ? 0 : values.get(values.size() - 1).lineNumber());
        List<String> lines = new ArrayList<>(total);

        int i = 0;
        while (i < values.size()) {
            AnnotatedValue first = values.get(i);
            while (lines.size() < first.lineNumber() - 1) {
                lines.add("");
            }

            // several entries of a one-line flow mapping share their line
            StringBuilder line = new StringBuilder(render(first));
            int next = i + 1;
            while (next < values.size() && values.get(next).lineNumber() == first.lineNumber()) {
                line.append(VALUE_SEPARATOR).append(render(values.get(next)));
                next++;
            }
            line.append(extractComment(first.sourceLine()));
            lines.add(line.toString());
            i = next;
        }

        while (lines.size() < total) {
            lines.add("");
        }
        return lines;
    }

    static String render(AnnotatedValue value) {
        return value.key() + ": \"" + escapeQuotes(textOf(value)) + "\"";
    }

    /** Binary scalars arrive decoded and are rendered in standard Base64 again. */
    static String textOf(AnnotatedValue value) {
        if (value.isBinary()) {
            return Base64.getEncoder().encodeToString((byte[]) value.value());
        }
        return String.valueOf(value.value());
    }

    static String escapeQuotes(String text) {
        return text.replace("\"", "\\\"");
    }

    /**
     * Returns the trailing comment of a source line including the whitespace before it, or an
     * empty string.
     */
    static String extractComment(String sourceLine) {
        Matcher matcher = INLINE_COMMENT.matcher(sourceLine.strip());
        return matcher.find() ? matcher.group() : "";
    }
}
