package pe.soapros.otel.redis.instrumentation.infrastructure;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pe.soapros.otel.redis.core.domain.CommandBatch;
import pe.soapros.otel.redis.core.domain.CommandError;
import pe.soapros.otel.redis.core.infrastructure.CommandNormalizer;
import pe.soapros.otel.redis.instrumentation.domain.RedisConnection;

import java.util.List;
import java.util.Objects;

import static pe.soapros.otel.redis.instrumentation.infrastructure.RedisObservabilityConstants.*;

/**
 * Decorador de {@link RedisConnection} que crea un span {@link SpanKind#CLIENT} por comando
 * o por pipeline, sin alterar la ejecución ni la respuesta.
 */
public class TracingRedisConnection implements RedisConnection {

    private static final Logger logger = LoggerFactory.getLogger(TracingRedisConnection.class);

    private static final String INSTRUMENTATION_VERSION = "1.0.0";

    private final RedisConnection delegate;
    private final RedisConnectionOptions options;
    private final RedisInstrumentationConfig config;
    private final RedisSpanAttributesBuilder attributesBuilder;
    private final Tracer tracer;

    public TracingRedisConnection(RedisConnection delegate,
                                  RedisConnectionOptions options,
                                  OpenTelemetry openTelemetry,
                                  RedisInstrumentationConfig config) {
        Objects.requireNonNull(openTelemetry, "OpenTelemetry instance cannot be null");
        this.delegate = Objects.requireNonNull(delegate, "Delegate RedisConnection cannot be null");
        this.options = Objects.requireNonNull(options, "RedisConnectionOptions cannot be null");
        this.config = Objects.requireNonNull(config, "Redis instrumentation config cannot be null");
        this.attributesBuilder = new RedisSpanAttributesBuilder(config);
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME, INSTRUMENTATION_VERSION);
    }

    @Override
    public Object process(List<?> commands) {
        // Los lotes de varios comandos ya tienen su span desde pipelined()
        if (commands.size() != 1 || !shouldTrace()) {
            return delegate.process(commands);
        }

        CommandBatch batch = normalize(commands);
        if (batch == null) {
            return delegate.process(commands);
        }

        Span span = startSpan(batch.get(0).name(), batch);
        try (Scope ignored = span.makeCurrent()) {
            Object reply = delegate.process(commands);

            if (reply instanceof CommandError error) {
                RedisSpanManager.recordCommandError(span, error);
            }
            recordRetrievedSize(span, reply, batch);
            return reply;
        } catch (RuntimeException e) {
            RedisSpanManager.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public List<Object> pipelined(List<?> commands) {
        if (!shouldTrace()) {
            return delegate.pipelined(commands);
        }

        CommandBatch batch = normalize(commands);
        if (batch == null) {
            return delegate.pipelined(commands);
        }

        Span span = startSpan(PIPELINED_SPAN_NAME, batch);
        try (Scope ignored = span.makeCurrent()) {
            List<Object> replies = delegate.pipelined(commands);
            recordRetrievedSize(span, replies, batch);
            return replies;
        } catch (RuntimeException e) {
            RedisSpanManager.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    private boolean shouldTrace() {
        return config.isTraceRootSpans() || Span.current().getSpanContext().isValid();
    }

    private CommandBatch normalize(List<?> commands) {
        try {
            return CommandNormalizer.normalizeBatch(commands);
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping Redis span, unrecognized command batch: {}", e.getMessage());
            return null;
        }
    }

    private Span startSpan(String spanName, CommandBatch batch) {
        Attributes attributes = attributesBuilder.build(batch, options);

        logger.debug("Starting Redis span {} for {} on {}:{}", spanName, batch, options.host(), options.port());

        return tracer.spanBuilder(spanName)
                .setSpanKind(SpanKind.CLIENT)
                .setAllAttributes(attributes)
                .startSpan();
    }

    private void recordRetrievedSize(Span span, Object reply, CommandBatch batch) {
        if (config.isRecordValueSize()) {
            long size = attributesBuilder.retrievedValueSize(reply, batch);
            RedisSpanManager.recordSize(span, DB_RETRIEVED_VALUE_SIZE_BYTES, size);
        }
    }
}
