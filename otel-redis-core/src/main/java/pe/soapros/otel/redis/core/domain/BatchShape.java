package pe.soapros.otel.redis.core.domain;

/**
 * Las tres formas estructurales en las que llega un lote de comandos.
 */
public enum BatchShape {
    /** Un único comando: {@code [[:set, "k", "v"]]}. */
    SINGLETON,
    /** Comandos en pipeline: {@code [[:set, "v1", "0"], [:incr, "v1"]]}. */
    PIPELINED,
    /** Comandos encolados en una transacción: {@code [[[:set, "v1", "0"]], [[:incr, "v1"]]]}. */
    QUEUED
}
