package pe.soapros.otel.redis.instrumentation;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.Test;
import pe.soapros.otel.redis.core.domain.CommandBatch;
import pe.soapros.otel.redis.core.domain.StatementPolicy;
import pe.soapros.otel.redis.core.infrastructure.CommandNormalizer;
import pe.soapros.otel.redis.core.infrastructure.StatementRenderer;
import pe.soapros.otel.redis.core.infrastructure.ValueSizeCalculator;
import pe.soapros.otel.redis.instrumentation.infrastructure.RedisConnectionOptions;
import pe.soapros.otel.redis.instrumentation.infrastructure.RedisInstrumentationConfig;
import pe.soapros.otel.redis.instrumentation.infrastructure.RedisSpanAttributesBuilder;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static pe.soapros.otel.redis.instrumentation.infrastructure.RedisObservabilityConstants.*;

class RedisSpanAttributesBuilderTest {

    private static final RedisConnectionOptions LOCAL = RedisConnectionOptions.defaults();

    private static CommandBatch batch(Object... entries) {
        return CommandNormalizer.normalizeBatch(List.of(entries));
    }

    @Test
    void testConnectionAttributesAreAlwaysSet() {
        Attributes attributes = new RedisSpanAttributesBuilder(RedisInstrumentationConfig.defaultConfig())
                .build(batch(List.of("get", "k")), LOCAL, Map.of());

        assertEquals("redis", attributes.get(DB_SYSTEM));
        assertEquals("localhost", attributes.get(NET_PEER_NAME));
        assertEquals(6379L, attributes.get(NET_PEER_PORT));
        assertNull(attributes.get(DB_REDIS_DATABASE_INDEX));
        assertNull(attributes.get(PEER_SERVICE));
        assertEquals("GET ?", attributes.get(DB_STATEMENT));
    }

    @Test
    void testDatabaseIndexIsSetWhenNotDefault() {
        Attributes attributes = new RedisSpanAttributesBuilder(RedisInstrumentationConfig.defaultConfig())
                .build(batch(List.of("get", "k")), new RedisConnectionOptions("redis", 6379, 5), Map.of());

        assertEquals(5L, attributes.get(DB_REDIS_DATABASE_INDEX));
    }

    @Test
    void testOmitSkipsStatement() {
        RedisInstrumentationConfig config = RedisInstrumentationConfig.builder()
                .dbStatement(StatementPolicy.OMIT)
                .build();

        Attributes attributes = new RedisSpanAttributesBuilder(config).build(batch(List.of("get", "k")), LOCAL, Map.of());

        assertNull(attributes.get(DB_STATEMENT));
    }

    @Test
    void testLongStatementIsTruncatedAfterRendering() {
        RedisInstrumentationConfig config = RedisInstrumentationConfig.builder()
                .dbStatement(StatementPolicy.RAW)
                .build();
        AtomicReference<String> rendered = new AtomicReference<>();
        StatementRenderer capturingRenderer = new StatementRenderer() {
            @Override
            public String render(CommandBatch batch, StatementPolicy policy) {
                String statement = super.render(batch, policy);
                rendered.set(statement);
                return statement;
            }
        };
        String value = "x".repeat(600);

        Attributes attributes = new RedisSpanAttributesBuilder(config, capturingRenderer, new ValueSizeCalculator())
                .build(batch(List.of("set", "k", value)), LOCAL, Map.of());

        assertEquals("SET k " + value, rendered.get());
        String statement = attributes.get(DB_STATEMENT);
        assertEquals(500, statement.length());
        assertTrue(statement.startsWith("SET k xxx"));
    }

    @Test
    void testStatementIsValidUtf8() {
        RedisInstrumentationConfig config = RedisInstrumentationConfig.builder()
                .dbStatement(StatementPolicy.RAW)
                .build();

        Attributes attributes = new RedisSpanAttributesBuilder(config)
                .build(batch(List.of("set", "k", new byte[]{'o', (byte) 0xc3, 'k'})), LOCAL, Map.of());

        assertEquals("SET k o\uFFFDk", attributes.get(DB_STATEMENT));
    }

    @Test
    void testAttributeMergeOrder() {
        RedisInstrumentationConfig config = RedisInstrumentationConfig.builder()
                .peerService("orders-cache")
                .staticAttributes(Map.of("team", "payments", "cache.region", "default"))
                .build();

        Attributes attributes = new RedisSpanAttributesBuilder(config)
                .build(batch(List.of("get", "k")), LOCAL, Map.of("cache.region", "orders", "db.system", "valkey"));

        assertEquals("orders-cache", attributes.get(PEER_SERVICE));
        assertEquals("payments", attributes.get(AttributeKey.stringKey("team")));
        assertEquals("orders", attributes.get(AttributeKey.stringKey("cache.region")));
        assertEquals("valkey", attributes.get(DB_SYSTEM));
    }

    @Test
    void testSentSizeUsesConfiguredCommands() {
        RedisInstrumentationConfig config = RedisInstrumentationConfig.builder()
                .recordValueSize(true)
                .setValueSizeCommands("set", "append")
                .build();

        Attributes attributes = new RedisSpanAttributesBuilder(config)
                .build(batch(List.of("set", "a", "12"), List.of("append", "a", "345")), LOCAL, Map.of());

        assertEquals(5L, attributes.get(DB_SET_VALUE_SIZE_BYTES));
    }

    @Test
    void testRetrievedValueSizeUsesConfiguredCommands() {
        RedisSpanAttributesBuilder builder = new RedisSpanAttributesBuilder(RedisInstrumentationConfig.defaultConfig());

        assertEquals(3L, builder.retrievedValueSize(List.of("abc", "OK"), batch(List.of("get", "a"), List.of("set", "b", "c"))));
    }
}
