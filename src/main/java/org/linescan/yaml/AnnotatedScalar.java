package org.linescan.yaml;

/**
 * Constructed form of a {@link ProvenanceNode}: the resolved value ({@link String} or
 * {@code byte[]} for <code>!!binary</code>), its 1-based line and the key it was found under.
 */
public record AnnotatedScalar(Object value, int line, String originalKey) {
}
