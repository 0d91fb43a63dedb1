package org.linescan.yaml;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Breadth-first walk of a constructed annotated document collecting every
 * {@link AnnotatedScalar} as an {@link AnnotatedValue}.
 */
public final class TreeFlattener {

    private TreeFlattener() {
    }

    /**
     * Flattens the document into values sorted by line number. Sibling subtrees may interleave
     * line ranges, so the result is sorted explicitly; values on the same line keep traversal
     * order.
     *
     * @param document root returned by {@link YamlFileParser#json()}, may be {@code null}
     * @param lines    raw document lines, used to attach each value's source line
     * @return values in ascending line order
     */
    public static List<AnnotatedValue> flatten(Object document, List<String> lines) {
        Objects.requireNonNull(lines, "lines must not be null");
        List<AnnotatedValue> values = new ArrayList<>();
        Deque<Object> toSearch = new ArrayDeque<>();
        // aliases may make a collection reachable from itself
        Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        enqueue(toSearch, document);

        while (!toSearch.isEmpty()) {
            Object item = toSearch.pollFirst();
            if ((item instanceof Map || item instanceof Collection) && !visited.add(item)) {
                continue;
            }
            if (item instanceof AnnotatedScalar) {
                AnnotatedScalar scalar = (AnnotatedScalar) item;
                values.add(new AnnotatedValue(
                        scalar.originalKey(),
                        scalar.value(),
                        scalar.line(),
                        ParserContext.sourceLine(lines, scalar.line())));
            } else if (item instanceof Map) {
                for (Object value : ((Map<?, ?>) item).values()) {
                    enqueue(toSearch, value);
                }
            } else if (item instanceof Collection) {
                for (Object element : (Collection<?>) item) {
                    enqueue(toSearch, element);
                }
            }
            // anything else was never a mapping value worth scanning
        }

        values.sort(Comparator.comparingInt(AnnotatedValue::lineNumber));
        return values;
    }

    // ArrayDeque rejects nulls, and null values carry nothing to scan
    private static void enqueue(Deque<Object> toSearch, Object item) {
        if (item != null) {
            toSearch.addLast(item);
        }
    }
}
