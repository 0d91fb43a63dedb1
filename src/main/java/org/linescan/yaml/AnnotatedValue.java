package org.linescan.yaml;

/**
 * A scannable mapping value located in its source document.
 *
 * @param key        text of the mapping key the value belongs to
 * @param value      {@link String}, or {@code byte[]} for decoded <code>!!binary</code> scalars
 * @param lineNumber 1-based line the value is reported on
 * @param sourceLine raw text of that line, comments included
 */
public record AnnotatedValue(String key, Object value, int lineNumber, String sourceLine) {

    public boolean isBinary() {
        return value instanceof byte[];
    }
}
