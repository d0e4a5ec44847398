package pe.soapros.otel.redis.instrumentation.infrastructure;

import io.opentelemetry.api.common.AttributeKey;

/**
 * AttributeKeys que la instrumentación de Redis pone en sus spans.
 */
public final class RedisObservabilityConstants {

    public static final String INSTRUMENTATION_NAME = "pe.soapros.otel.redis";
    public static final String DB_SYSTEM_REDIS = "redis";
    public static final String PIPELINED_SPAN_NAME = "PIPELINED";

    // Connection Attributes
    public static final AttributeKey<String> DB_SYSTEM = AttributeKey.stringKey("db.system");
    public static final AttributeKey<String> NET_PEER_NAME = AttributeKey.stringKey("net.peer.name");
    public static final AttributeKey<Long> NET_PEER_PORT = AttributeKey.longKey("net.peer.port");
    public static final AttributeKey<Long> DB_REDIS_DATABASE_INDEX = AttributeKey.longKey("db.redis.database_index");
    public static final AttributeKey<String> PEER_SERVICE = AttributeKey.stringKey("peer.service");

    // Statement Attributes
    public static final AttributeKey<String> DB_STATEMENT = AttributeKey.stringKey("db.statement");

    // Size Attributes
    public static final AttributeKey<Long> DB_SET_VALUE_SIZE_BYTES = AttributeKey.longKey("db.set_value_size_bytes");
    public static final AttributeKey<Long> DB_RETRIEVED_VALUE_SIZE_BYTES = AttributeKey.longKey("db.retrieved_value_size_bytes");

    // Error Attributes
    public static final AttributeKey<String> ERROR_TYPE = AttributeKey.stringKey("error.type");

    private RedisObservabilityConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
