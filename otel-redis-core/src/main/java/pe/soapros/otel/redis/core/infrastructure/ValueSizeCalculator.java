package pe.soapros.otel.redis.core.infrastructure;

import pe.soapros.otel.redis.core.domain.Command;
import pe.soapros.otel.redis.core.domain.CommandBatch;
import pe.soapros.otel.redis.core.domain.CommandError;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Calcula el tamaño en bytes de los valores enviados en comandos de escritura y de los
 * valores devueltos por comandos de lectura.
 *
 * <p>Los tamaños siguen la representación en el cable, no el almacenamiento en Redis:
 * un entero cuenta sus dígitos decimales y un flotante los bytes de su texto.
 */
public class ValueSizeCalculator {

    /**
     * Tamaño estructural de un valor. Las respuestas de error cuentan como cero.
     */
    public long byteSize(Object value) {
        if (value == null || value instanceof CommandError) {
            return 0;
        }
        if (value instanceof CharSequence text) {
            return text.toString().getBytes(StandardCharsets.UTF_8).length;
        }
        if (value instanceof byte[] raw) {
            return raw.length;
        }
        if (value instanceof List<?> values) {
            long total = 0;
            for (Object element : values) {
                total += byteSize(element);
            }
            return total;
        }
        if (value instanceof Object[] values) {
            long total = 0;
            for (Object element : values) {
                total += byteSize(element);
            }
            return total;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return String.valueOf(value).getBytes(StandardCharsets.UTF_8).length;
        }
        if (value instanceof BigInteger integer) {
            return integer.abs().toString().length();
        }
        if (value instanceof Number number) {
            return digitCount(number.longValue());
        }
        return String.valueOf(value).getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Suma el tamaño del último argumento de cada comando cuya operación está en
     * {@code trackedOperations}. Un {@code AUTH} en el lote hace que el resultado sea cero.
     *
     * @param batch             lote normalizado
     * @param trackedOperations operaciones cuyo último argumento es el valor escrito (p. ej. SET)
     * @return tamaño total en bytes de los valores enviados
     */
    public long sentSize(CommandBatch batch, Set<String> trackedOperations) {
        if (batch.containsAuth()) {
            return 0;
        }
        Set<String> tracked = normalizeOperations(trackedOperations);

        long total = 0;
        for (Command command : batch.getCommands()) {
            // Solo el último argumento cuenta como valor; en HSET/HMSET eso es el último campo
            if (tracked.contains(command.name()) && command.hasArguments()) {
                total += byteSize(command.lastArgument());
            }
        }
        return total;
    }

    /**
     * Tamaño de los valores devueltos por los comandos cuya operación está en
     * {@code trackedOperations}.
     *
     * <p>Un lote de varios comandos (pipeline o transacción) se reduce a un problema de un solo
     * comando por posición: {@code reply[i]} contra {@code batch[i]}.
     *
     * @param reply             respuesta del servidor: un valor para un solo comando, una lista
     *                          alineada por posición para varios
     * @param batch             lote normalizado
     * @param trackedOperations operaciones de lectura a medir (p. ej. GET, MGET)
     * @return tamaño total en bytes de los valores recuperados
     */
    public long retrievedSize(Object reply, CommandBatch batch, Set<String> trackedOperations) {
        return measureRetrieved(reply, batch, normalizeOperations(trackedOperations));
    }

    private long measureRetrieved(Object reply, CommandBatch batch, Set<String> tracked) {
        if (batch.isEmpty()) {
            return 0;
        }
        if (batch.size() == 1) {
            return tracked.contains(batch.get(0).name()) ? byteSize(reply) : 0;
        }

        long total = 0;
        for (int i = 0; i < batch.size(); i++) {
            total += measureRetrieved(replyAt(reply, i), CommandBatch.singleton(batch.get(i)), tracked);
        }
        return total;
    }

    private static Object replyAt(Object reply, int index) {
        if (reply instanceof List<?> replies && index < replies.size()) {
            return replies.get(index);
        }
        if (reply instanceof Object[] replies && index < replies.length) {
            return replies[index];
        }
        return null;
    }

    private static Set<String> normalizeOperations(Set<String> operations) {
        return operations.stream()
                .map(operation -> operation.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private static long digitCount(long value) {
        if (value == Long.MIN_VALUE) {
            return 19;
        }
        return Long.toString(Math.abs(value)).length();
    }
}
