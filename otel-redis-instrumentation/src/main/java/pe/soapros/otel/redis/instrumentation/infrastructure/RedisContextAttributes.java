package pe.soapros.otel.redis.instrumentation.infrastructure;

import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import io.opentelemetry.context.Scope;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Atributos extra que se agregan a todos los spans de Redis creados dentro de un bloque.
 *
 * <pre>
 * RedisContextAttributes.withAttributes(Map.of("cache.region", "sessions"), () -> connection.process(commands));
 * </pre>
 *
 * Los bloques anidados combinan sus atributos; ante claves repetidas gana el bloque interno.
 */
public final class RedisContextAttributes {

    private static final ContextKey<Map<String, String>> ATTRIBUTES_KEY =
            ContextKey.named("pe.soapros.otel.redis.attributes");

    private RedisContextAttributes() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Atributos activos en el contexto actual, o un mapa vacío.
     */
    public static Map<String, String> current() {
        return current(Context.current());
    }

    public static Map<String, String> current(Context context) {
        Map<String, String> attributes = context.get(ATTRIBUTES_KEY);
        return attributes == null ? Map.of() : attributes;
    }

    public static Context with(Context context, Map<String, String> attributes) {
        Map<String, String> merged = new LinkedHashMap<>(current(context));
        merged.putAll(attributes);
        return context.with(ATTRIBUTES_KEY, Map.copyOf(merged));
    }

    public static <T> T withAttributes(Map<String, String> attributes, Supplier<T> operation) {
        try (Scope ignored = with(Context.current(), attributes).makeCurrent()) {
            return operation.get();
        }
    }

    public static void withAttributes(Map<String, String> attributes, Runnable runnable) {
        try (Scope ignored = with(Context.current(), attributes).makeCurrent()) {
            runnable.run();
        }
    }
}
