package pe.soapros.otel.redis.core.infrastructure;

import pe.soapros.otel.redis.core.domain.Command;
import pe.soapros.otel.redis.core.domain.CommandBatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lleva cualquier entrada de un lote a la forma canónica {@code [operation, arg1, arg2, ...]}.
 *
 * <p>Ejemplos de entradas que llegan desde el cliente:
 * <pre>
 * queue     [[[:set, "v1", "0"]], [[:incr, "v1"]], [[:get, "v1"]]]
 * pipeline  [[:set, "v1", "0"], [:incr, "v1"], [:get, "v1"]]
 * hmset     [[:hmset, "hash", "f1", 1234567890.0987654]]
 * set       [[:set, "K", "x"]]
 * </pre>
 */
public final class CommandNormalizer {

    private CommandNormalizer() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Quita el nivel extra de anidamiento que agregan los comandos encolados
     * ({@code [[:set, "k", "v"]]}) y devuelve el comando.
     *
     * @param entry un {@link Command}, una lista de tokens o una lista que envuelve a cualquiera de los dos
     * @return el comando normalizado
     * @throws IllegalArgumentException si la entrada no tiene ninguna de las formas reconocidas
     */
    public static Command normalize(Object entry) {
        if (entry instanceof Command command) {
            return command;
        }
        if (entry instanceof List<?> tokens && !tokens.isEmpty()) {
            Object first = tokens.get(0);
            if (first instanceof Command command) {
                return command;
            }
            if (first instanceof List<?> queuedTokens) {
                return Command.fromTokens(queuedTokens);
            }
            return Command.fromTokens(tokens);
        }
        throw new IllegalArgumentException("Unrecognized command entry: " + entry);
    }

    /**
     * Una entrada está encolada si es una secuencia cuyo primer elemento también lo es.
     */
    public static boolean isQueued(Object entry) {
        if (entry instanceof List<?> tokens && !tokens.isEmpty()) {
            Object first = tokens.get(0);
            return first instanceof List<?> || first instanceof Command;
        }
        return false;
    }

    /**
     * Normaliza todas las entradas de un lote y determina su forma.
     *
     * @param entries entradas tal como las entrega el cliente Redis
     * @return el lote normalizado
     */
    public static CommandBatch normalizeBatch(List<?> entries) {
        Objects.requireNonNull(entries, "Command entries cannot be null");

        List<Command> commands = new ArrayList<>(entries.size());
        boolean queued = false;
        for (Object entry : entries) {
            queued |= isQueued(entry);
            commands.add(normalize(entry));
        }

        return queued ? CommandBatch.queued(commands) : CommandBatch.pipelined(commands);
    }
}
