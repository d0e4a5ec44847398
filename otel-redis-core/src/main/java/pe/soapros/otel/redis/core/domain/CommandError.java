package pe.soapros.otel.redis.core.domain;

/**
 * Respuesta de error de Redis ({@code -ERR ...}). Viaja como un valor dentro de la respuesta,
 * en la posición del comando que falló; nunca se lanza desde esta librería.
 */
public class CommandError extends RuntimeException {

    public CommandError(String message) {
        super(message);
    }
}
