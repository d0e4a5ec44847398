package pe.soapros.otel.redis.instrumentation.infrastructure;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import pe.soapros.otel.redis.core.domain.CommandError;

import static pe.soapros.otel.redis.instrumentation.infrastructure.RedisObservabilityConstants.ERROR_TYPE;

public final class RedisSpanManager {

    private RedisSpanManager() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Marca el span con la respuesta de error que devolvió Redis para el comando.
     */
    public static void recordCommandError(Span span, CommandError error) {
        if (span == null || error == null) return;

        span.recordException(error);
        span.setStatus(StatusCode.ERROR, describe(error));
        span.setAttribute(ERROR_TYPE, error.getClass().getSimpleName());
    }

    /**
     * Marca el span con una falla de transporte. La excepción la relanza quien llama.
     */
    public static void recordFailure(Span span, Throwable failure) {
        if (span == null || failure == null) return;

        span.recordException(failure);
        span.setStatus(StatusCode.ERROR, describe(failure));
        span.setAttribute(ERROR_TYPE, failure.getClass().getSimpleName());
    }

    public static void recordSize(Span span, AttributeKey<Long> key, long size) {
        if (span == null) return;

        span.setAttribute(key, size);
    }

    private static String describe(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}
