package org.linescan;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Decodes raw document bytes into text: BOM + UTF-8/UTF-16 detection, strict UTF-8, then a
 * fallback charset. An explicit, valid encoding hint always wins over detection.
 */
final class SourceText {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final byte[] UTF16BE_BOM = {(byte) 0xFE, (byte) 0xFF};
    private static final byte[] UTF16LE_BOM = {(byte) 0xFF, (byte) 0xFE};

    private SourceText() {
    }

    static String decode(byte[] content, String encodingHint, Charset fallback) {
        Objects.requireNonNull(content, "content must not be null");
        EncodingInfo info = detect(content, fallback);
        Charset charset = isValidEncoding(encodingHint) ? Charset.forName(encodingHint) : info.charset();
        return new String(content, info.offset(), content.length - info.offset(), charset);
    }

    static EncodingInfo detect(byte[] content, Charset fallback) {
        if (startsWith(content, UTF8_BOM)) {
            return new EncodingInfo(StandardCharsets.UTF_8, UTF8_BOM.length);
        }
        if (startsWith(content, UTF16BE_BOM)) {
            return new EncodingInfo(StandardCharsets.UTF_16BE, UTF16BE_BOM.length);
        }
        if (startsWith(content, UTF16LE_BOM)) {
            return new EncodingInfo(StandardCharsets.UTF_16LE, UTF16LE_BOM.length);
        }
        if (isUtf8(content)) {
            return new EncodingInfo(StandardCharsets.UTF_8, 0);
        }
        return new EncodingInfo(fallback, 0);
    }

    private static boolean isUtf8(byte[] content) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

    static boolean isValidEncoding(String encoding) {
        if (encoding == null || encoding.isBlank()) return false;
        try {
            return Charset.isSupported(encoding);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        if (content.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) return false;
        }
        return true;
    }

    record EncodingInfo(Charset charset, int offset) {}
}
