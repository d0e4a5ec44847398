package pe.soapros.otel.redis.instrumentation.domain;

import java.util.List;

/**
 * Punto de ejecución real de comandos Redis.
 *
 * <p>Los errores de comando ({@code -ERR ...}) se devuelven como
 * {@link pe.soapros.otel.redis.core.domain.CommandError} dentro de la respuesta; solo las
 * fallas de transporte se lanzan como excepción.
 */
public interface RedisConnection {

    /**
     * Ejecuta un único comando, o un lote que el cliente envía fuera de un pipeline.
     *
     * @param commands entradas crudas, p. ej. {@code [["SET", "k", "v"]]}
     * @return la respuesta del servidor
     */
    Object process(List<?> commands);

    /**
     * Ejecuta un pipeline o una transacción encolada.
     *
     * @param commands entradas crudas en forma de pipeline o encoladas
     * @return una respuesta por comando, en el mismo orden
     */
    List<Object> pipelined(List<?> commands);
}
