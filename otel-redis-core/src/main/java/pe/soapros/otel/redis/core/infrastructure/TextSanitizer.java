package pe.soapros.otel.redis.core.infrastructure;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Transformaciones de texto aplicadas a los valores antes de ponerlos en un span.
 */
public final class TextSanitizer {

    private static final String ELLIPSIS = "...";
    private static final char REPLACEMENT = '\uFFFD';

    private TextSanitizer() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Recorta el texto a {@code maxLength} caracteres como máximo, conservando el prefijo
     * y terminando en {@code "..."} cuando hubo recorte.
     */
    public static String truncate(String text, int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must be >= 0, got " + maxLength);
        }
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        if (maxLength < ELLIPSIS.length()) {
            return safePrefix(text, maxLength);
        }
        return safePrefix(text, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Reemplaza los surrogates sin pareja por U+FFFD para que el texto sea UTF-8 válido.
     */
    public static String utf8Encode(String text) {
        if (text == null) {
            return null;
        }
        StringBuilder result = null;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            boolean valid;
            if (Character.isHighSurrogate(c)) {
                valid = i + 1 < length && Character.isLowSurrogate(text.charAt(i + 1));
                if (valid) {
                    if (result != null) {
                        result.append(c).append(text.charAt(i + 1));
                    }
                    i++;
                    continue;
                }
            } else {
                valid = !Character.isLowSurrogate(c);
            }

            if (!valid && result == null) {
                result = new StringBuilder(length).append(text, 0, i);
            }
            if (result != null) {
                result.append(valid ? c : REPLACEMENT);
            }
        }
        return result == null ? text : result.toString();
    }

    /**
     * Decodifica bytes como UTF-8, reemplazando las secuencias inválidas por U+FFFD.
     */
    public static String decode(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // REPLACE nunca reporta errores de codificación
            throw new IllegalStateException("UTF-8 decoding failed", e);
        }
    }

    private static String safePrefix(String text, int length) {
        if (length > 0 && Character.isHighSurrogate(text.charAt(length - 1))) {
            length--;
        }
        return text.substring(0, length);
    }
}
