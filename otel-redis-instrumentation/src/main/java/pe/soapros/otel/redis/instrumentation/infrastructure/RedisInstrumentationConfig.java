package pe.soapros.otel.redis.instrumentation.infrastructure;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pe.soapros.otel.redis.core.domain.StatementPolicy;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Getter
public class RedisInstrumentationConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisInstrumentationConfig.class);

    public static final String ENV_DB_STATEMENT = "OTEL_REDIS_DB_STATEMENT";
    public static final String ENV_RECORD_VALUE_SIZE = "OTEL_REDIS_RECORD_VALUE_SIZE";
    public static final String ENV_PEER_SERVICE = "OTEL_REDIS_PEER_SERVICE";
    public static final String ENV_TRACE_ROOT_SPANS = "OTEL_REDIS_TRACE_ROOT_SPANS";

    public static final int DEFAULT_MAX_STATEMENT_LENGTH = 500;

    private final StatementPolicy dbStatement;
    private final boolean recordValueSize;
    private final String peerService;
    private final boolean traceRootSpans;
    private final Map<String, String> staticAttributes;
    private final Set<String> setValueSizeCommands;
    private final Set<String> retrievedValueSizeCommands;
    private final int maxStatementLength;

    private RedisInstrumentationConfig(Builder builder) {
        this.dbStatement = builder.dbStatement;
        this.recordValueSize = builder.recordValueSize;
        this.peerService = builder.peerService;
        this.traceRootSpans = builder.traceRootSpans;
        this.staticAttributes = Map.copyOf(builder.staticAttributes);
        this.setValueSizeCommands = Set.copyOf(builder.setValueSizeCommands);
        this.retrievedValueSizeCommands = Set.copyOf(builder.retrievedValueSizeCommands);
        this.maxStatementLength = builder.maxStatementLength;
    }

    /**
     * Configuración por defecto: statements ofuscados, sin medición de tamaños
     */
    public static RedisInstrumentationConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Configuración para desarrollo: statements completos y tamaños de valores
     */
    public static RedisInstrumentationConfig developmentConfig() {
        return builder()
                .dbStatement(StatementPolicy.RAW)
                .recordValueSize(true)
                .build();
    }

    /**
     * Configuración mínima para alto volumen: sin statement y solo spans con padre
     */
    public static RedisInstrumentationConfig performanceOptimized() {
        return builder()
                .dbStatement(StatementPolicy.OMIT)
                .recordValueSize(false)
                .traceRootSpans(false)
                .build();
    }

    public static RedisInstrumentationConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Lee la configuración desde variables de entorno. Los valores ausentes conservan el default.
     *
     * @param lookup función que resuelve el valor de una variable, o null si no existe
     */
    public static RedisInstrumentationConfig fromEnvironment(Function<String, String> lookup) {
        Builder builder = builder();

        Optional.ofNullable(lookup.apply(ENV_DB_STATEMENT))
                .filter(value -> !value.isBlank())
                .ifPresent(value -> {
                    try {
                        builder.dbStatement(StatementPolicy.fromString(value));
                    } catch (IllegalArgumentException e) {
                        logger.warn("Unknown {} value '{}', using {}", ENV_DB_STATEMENT, value, builder.dbStatement);
                    }
                });
        Optional.ofNullable(lookup.apply(ENV_RECORD_VALUE_SIZE))
                .filter(value -> !value.isBlank())
                .ifPresent(value -> builder.recordValueSize(Boolean.parseBoolean(value.trim())));
        Optional.ofNullable(lookup.apply(ENV_PEER_SERVICE))
                .filter(value -> !value.isBlank())
                .ifPresent(builder::peerService);
        Optional.ofNullable(lookup.apply(ENV_TRACE_ROOT_SPANS))
                .filter(value -> !value.isBlank())
                .ifPresent(value -> builder.traceRootSpans(Boolean.parseBoolean(value.trim())));

        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StatementPolicy dbStatement = StatementPolicy.OBFUSCATE;
        private boolean recordValueSize = false;
        private String peerService;
        private boolean traceRootSpans = true;
        private Map<String, String> staticAttributes = new LinkedHashMap<>();
        private Set<String> setValueSizeCommands = Set.of("SET");
        private Set<String> retrievedValueSizeCommands = Set.of("GET", "MGET");
        private int maxStatementLength = DEFAULT_MAX_STATEMENT_LENGTH;

        public Builder dbStatement(StatementPolicy dbStatement) {
            this.dbStatement = dbStatement == null ? StatementPolicy.OBFUSCATE : dbStatement;
            return this;
        }

        public Builder recordValueSize(boolean enabled) {
            this.recordValueSize = enabled;
            return this;
        }

        public Builder peerService(String peerService) {
            this.peerService = peerService;
            return this;
        }

        public Builder traceRootSpans(boolean enabled) {
            this.traceRootSpans = enabled;
            return this;
        }

        public Builder staticAttribute(String key, String value) {
            this.staticAttributes.put(key, value);
            return this;
        }

        public Builder staticAttributes(Map<String, String> attributes) {
            this.staticAttributes = new LinkedHashMap<>(attributes);
            return this;
        }

        public Builder setValueSizeCommands(String... commands) {
            this.setValueSizeCommands = toOperationSet(commands);
            return this;
        }

        public Builder retrievedValueSizeCommands(String... commands) {
            this.retrievedValueSizeCommands = toOperationSet(commands);
            return this;
        }

        public Builder maxStatementLength(int maxLength) {
            if (maxLength <= 0) {
                throw new IllegalArgumentException("maxStatementLength must be positive, got " + maxLength);
            }
            this.maxStatementLength = maxLength;
            return this;
        }

        public RedisInstrumentationConfig build() {
            return new RedisInstrumentationConfig(this);
        }

        private static Set<String> toOperationSet(String... commands) {
            return Arrays.stream(commands)
                    .map(command -> command.toUpperCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
        }
    }
}
