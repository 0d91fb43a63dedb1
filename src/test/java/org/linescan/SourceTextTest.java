package org.linescan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SourceTextTest {

    private static final Charset FALLBACK = StandardCharsets.ISO_8859_1;

    private static byte[] concat(byte[] prefix, byte[] body) {
        byte[] out = new byte[prefix.length + body.length];
        System.arraycopy(prefix, 0, out, 0, prefix.length);
        System.arraycopy(body, 0, out, prefix.length, body.length);
        return out;
    }

    @Test
    @DisplayName("Should detect BOMs and skip them")
    void shouldDetectBoms() {
        byte[] utf8 = concat(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF}, "k: é".getBytes(StandardCharsets.UTF_8));
        byte[] utf16be = concat(new byte[]{(byte) 0xFE, (byte) 0xFF}, "k: é".getBytes(StandardCharsets.UTF_16BE));
        byte[] utf16le = concat(new byte[]{(byte) 0xFF, (byte) 0xFE}, "k: é".getBytes(StandardCharsets.UTF_16LE));

        assertEquals("k: é", SourceText.decode(utf8, null, FALLBACK));
        assertEquals("k: é", SourceText.decode(utf16be, null, FALLBACK));
        assertEquals("k: é", SourceText.decode(utf16le, null, FALLBACK));
        assertEquals(StandardCharsets.UTF_16LE, SourceText.detect(utf16le, FALLBACK).charset());
        assertEquals(2, SourceText.detect(utf16le, FALLBACK).offset());
    }

    @Test
    @DisplayName("Should prefer UTF-8 and fall back for invalid bytes")
    void shouldFallBack() {
        assertEquals(StandardCharsets.UTF_8, SourceText.detect("ü".getBytes(StandardCharsets.UTF_8), FALLBACK).charset());
        assertEquals(FALLBACK, SourceText.detect("ü".getBytes(StandardCharsets.ISO_8859_1), FALLBACK).charset());
        assertEquals("ü", SourceText.decode("ü".getBytes(StandardCharsets.ISO_8859_1), null, FALLBACK));
    }

    @Test
    @DisplayName("Should validate encoding hints")
    void shouldValidateEncodingHints() {
        assertTrue(SourceText.isValidEncoding("UTF-8"));
        assertTrue(SourceText.isValidEncoding("windows-1252"));
        assertFalse(SourceText.isValidEncoding(null));
        assertFalse(SourceText.isValidEncoding(" "));
        assertFalse(SourceText.isValidEncoding("not a charset!"));
        assertFalse(SourceText.isValidEncoding("x-unknown-charset"));
    }
}
