package org.linescan.yaml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.error.Mark;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserContextTest {

    private static ParserContext context(String content) {
        return new ParserContext(content);
    }

    @Test
    @DisplayName("Should split on every YAML line break")
    void shouldSplitOnYamlLineBreaks() {
        assertEquals(List.of("a", "b", "c", "d", "e", "f"),
                ParserContext.splitLines("a\nb\r\nc\rd\u0085e\u2028f"));
    }

    @Test
    @DisplayName("Should not open a line after a trailing break")
    void shouldIgnoreTrailingBreak() {
        assertEquals(List.of("a", ""), ParserContext.splitLines("a\n\n"));
        assertEquals(List.of("a"), ParserContext.splitLines("a\n"));
        assertTrue(ParserContext.splitLines("").isEmpty());
    }

    @Test
    @DisplayName("Should return source lines by 1-based number")
    void shouldReturnSourceLines() {
        ParserContext context = context("first\nsecond\n");

        assertEquals("first", context.sourceLine(1));
        assertEquals("second", context.sourceLine(2));
        assertEquals("", context.sourceLine(0));
        assertEquals("", context.sourceLine(3));
    }

    @Test
    @DisplayName("Should stamp with the mapping start line only in an inline key context, the value's own line otherwise")
    void shouldChooseValueLine() {
        ParserContext context = context("a: b\n");
        Mark mappingStart = new Mark("test", 0, 4, 0, new int[0], 0);
        Mark valueStart = new Mark("test", 0, 6, 0, new int[0], 0);

        assertEquals(7, context.valueLine(mappingStart, valueStart));
        context.setInlineMappingKeyPending(true);
        assertEquals(5, context.valueLine(mappingStart, valueStart));
        context.clearInlineMappingKey();
        assertFalse(context.isInlineMappingKeyPending());
    }
}
