package pe.soapros.otel.redis.instrumentation;

import org.junit.jupiter.api.Test;
import pe.soapros.otel.redis.core.domain.StatementPolicy;
import pe.soapros.otel.redis.instrumentation.infrastructure.RedisInstrumentationConfig;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RedisInstrumentationConfigTest {

    @Test
    void testDefaults() {
        RedisInstrumentationConfig config = RedisInstrumentationConfig.defaultConfig();

        assertEquals(StatementPolicy.OBFUSCATE, config.getDbStatement());
        assertFalse(config.isRecordValueSize());
        assertNull(config.getPeerService());
        assertTrue(config.isTraceRootSpans());
        assertTrue(config.getStaticAttributes().isEmpty());
        assertEquals(Set.of("SET"), config.getSetValueSizeCommands());
        assertEquals(Set.of("GET", "MGET"), config.getRetrievedValueSizeCommands());
        assertEquals(500, config.getMaxStatementLength());
    }

    @Test
    void testPresets() {
        assertEquals(StatementPolicy.RAW, RedisInstrumentationConfig.developmentConfig().getDbStatement());
        assertTrue(RedisInstrumentationConfig.developmentConfig().isRecordValueSize());
        assertEquals(StatementPolicy.OMIT, RedisInstrumentationConfig.performanceOptimized().getDbStatement());
        assertFalse(RedisInstrumentationConfig.performanceOptimized().isTraceRootSpans());
    }

    @Test
    void testFromEnvironment() {
        Map<String, String> env = Map.of(
                RedisInstrumentationConfig.ENV_DB_STATEMENT, "raw",
                RedisInstrumentationConfig.ENV_RECORD_VALUE_SIZE, "true",
                RedisInstrumentationConfig.ENV_PEER_SERVICE, "session-cache",
                RedisInstrumentationConfig.ENV_TRACE_ROOT_SPANS, "false");

        RedisInstrumentationConfig config = RedisInstrumentationConfig.fromEnvironment(env::get);

        assertEquals(StatementPolicy.RAW, config.getDbStatement());
        assertTrue(config.isRecordValueSize());
        assertEquals("session-cache", config.getPeerService());
        assertFalse(config.isTraceRootSpans());
    }

    @Test
    void testUnknownStatementPolicyFallsBackToDefault() {
        Map<String, String> env = Map.of(RedisInstrumentationConfig.ENV_DB_STATEMENT, "verbose");

        RedisInstrumentationConfig config = RedisInstrumentationConfig.fromEnvironment(env::get);

        assertEquals(StatementPolicy.OBFUSCATE, config.getDbStatement());
    }

    @Test
    void testEmptyEnvironmentKeepsDefaults() {
        RedisInstrumentationConfig config = RedisInstrumentationConfig.fromEnvironment(name -> null);

        assertEquals(StatementPolicy.OBFUSCATE, config.getDbStatement());
        assertTrue(config.isTraceRootSpans());
    }

    @Test
    void testTrackedCommandsAreUppercased() {
        RedisInstrumentationConfig config = RedisInstrumentationConfig.builder()
                .retrievedValueSizeCommands("get", "hget")
                .build();

        assertEquals(Set.of("GET", "HGET"), config.getRetrievedValueSizeCommands());
    }

    @Test
    void testInvalidStatementLength() {
        assertThrows(IllegalArgumentException.class,
                () -> RedisInstrumentationConfig.builder().maxStatementLength(0));
    }
}
