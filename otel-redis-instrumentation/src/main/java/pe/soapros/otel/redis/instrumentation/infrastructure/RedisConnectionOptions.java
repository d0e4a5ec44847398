package pe.soapros.otel.redis.instrumentation.infrastructure;

/**
 * Datos de la conexión que se reportan en cada span.
 */
public record RedisConnectionOptions(String host, int port, int database) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 6379;

    public RedisConnectionOptions {
        if (host == null || host.isBlank()) {
            host = DEFAULT_HOST;
        }
        if (port <= 0) {
            throw new IllegalArgumentException("Redis port must be positive, got " + port);
        }
        if (database < 0) {
            throw new IllegalArgumentException("Redis database index cannot be negative, got " + database);
        }
    }

    public static RedisConnectionOptions defaults() {
        return new RedisConnectionOptions(DEFAULT_HOST, DEFAULT_PORT, 0);
    }
}
