package pe.soapros.otel.redis.core.domain;

import java.util.Locale;

/**
 * Cómo se renderiza el atributo {@code db.statement}.
 */
public enum StatementPolicy {
    RAW,
    OBFUSCATE,
    OMIT;

    public static StatementPolicy fromString(String value) {
        return StatementPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
