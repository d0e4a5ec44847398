package pe.soapros.otel.redis.instrumentation.infrastructure;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import pe.soapros.otel.redis.core.domain.CommandBatch;
import pe.soapros.otel.redis.core.domain.StatementPolicy;
import pe.soapros.otel.redis.core.infrastructure.StatementRenderer;
import pe.soapros.otel.redis.core.infrastructure.TextSanitizer;
import pe.soapros.otel.redis.core.infrastructure.ValueSizeCalculator;

import java.util.Map;
import java.util.Objects;

import static pe.soapros.otel.redis.instrumentation.infrastructure.RedisObservabilityConstants.*;

/**
 * Arma los atributos iniciales de un span de Redis a partir de la conexión, la configuración
 * y el lote de comandos. No guarda estado entre llamadas.
 */
public class RedisSpanAttributesBuilder {

    private final RedisInstrumentationConfig config;
    private final StatementRenderer statementRenderer;
    private final ValueSizeCalculator valueSizeCalculator;

    public RedisSpanAttributesBuilder(RedisInstrumentationConfig config) {
        this(config, new StatementRenderer(), new ValueSizeCalculator());
    }

    public RedisSpanAttributesBuilder(RedisInstrumentationConfig config,
                                      StatementRenderer statementRenderer,
                                      ValueSizeCalculator valueSizeCalculator) {
        this.config = Objects.requireNonNull(config, "Redis instrumentation config cannot be null");
        this.statementRenderer = Objects.requireNonNull(statementRenderer, "StatementRenderer cannot be null");
        this.valueSizeCalculator = Objects.requireNonNull(valueSizeCalculator, "ValueSizeCalculator cannot be null");
    }

    public Attributes build(CommandBatch batch, RedisConnectionOptions options) {
        return build(batch, options, RedisContextAttributes.current());
    }

    /**
     * @param batch             lote normalizado
     * @param options           host, puerto y base de datos de la conexión
     * @param contextAttributes atributos del bloque {@link RedisContextAttributes} activo
     */
    public Attributes build(CommandBatch batch, RedisConnectionOptions options, Map<String, String> contextAttributes) {
        AttributesBuilder attributes = Attributes.builder()
                .put(DB_SYSTEM, DB_SYSTEM_REDIS)
                .put(NET_PEER_NAME, options.host())
                .put(NET_PEER_PORT, (long) options.port());

        if (options.database() != 0) {
            attributes.put(DB_REDIS_DATABASE_INDEX, (long) options.database());
        }
        if (config.getPeerService() != null) {
            attributes.put(PEER_SERVICE, config.getPeerService());
        }
        config.getStaticAttributes().forEach((key, value) -> attributes.put(AttributeKey.stringKey(key), value));
        contextAttributes.forEach((key, value) -> attributes.put(AttributeKey.stringKey(key), value));

        if (config.getDbStatement() != StatementPolicy.OMIT) {
            String statement = statementRenderer.render(batch, config.getDbStatement());
            statement = TextSanitizer.truncate(statement, config.getMaxStatementLength());
            attributes.put(DB_STATEMENT, TextSanitizer.utf8Encode(statement));
        }

        if (config.isRecordValueSize()) {
            attributes.put(DB_SET_VALUE_SIZE_BYTES,
                    valueSizeCalculator.sentSize(batch, config.getSetValueSizeCommands()));
        }

        return attributes.build();
    }

    public long retrievedValueSize(Object reply, CommandBatch batch) {
        return valueSizeCalculator.retrievedSize(reply, batch, config.getRetrievedValueSizeCommands());
    }
}
