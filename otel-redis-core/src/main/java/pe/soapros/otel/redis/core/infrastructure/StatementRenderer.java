package pe.soapros.otel.redis.core.infrastructure;

import pe.soapros.otel.redis.core.domain.Command;
import pe.soapros.otel.redis.core.domain.CommandBatch;
import pe.soapros.otel.redis.core.domain.StatementPolicy;

import java.util.List;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Convierte un lote de comandos en el texto de {@code db.statement}, una línea por comando.
 *
 * <p>Si cualquier comando del lote es {@code AUTH} el resultado es siempre {@code "AUTH ?"}
 * para todo el lote, sin importar la política.
 */
public class StatementRenderer {

    public static final String REDACTED_AUTH = "AUTH ?";

    private static final String PLACEHOLDER = " ?";

    /**
     * @param batch  lote normalizado
     * @param policy {@link StatementPolicy#RAW} o {@link StatementPolicy#OBFUSCATE}; con
     *               {@link StatementPolicy#OMIT} no se renderiza nada
     * @return el statement completo, sin recortar
     */
    public String render(CommandBatch batch, StatementPolicy policy) {
        if (policy == StatementPolicy.OMIT) {
            return "";
        }
        if (batch.containsAuth()) {
            return REDACTED_AUTH;
        }
        if (policy == StatementPolicy.OBFUSCATE) {
            return batch.getCommands().stream()
                    .map(this::renderObfuscated)
                    .collect(Collectors.joining("\n"));
        }
        return batch.getCommands().stream()
                .map(this::renderRaw)
                .collect(Collectors.joining("\n"));
    }

    private String renderObfuscated(Command command) {
        return command.name() + PLACEHOLDER.repeat(command.argumentCount());
    }

    private String renderRaw(Command command) {
        StringJoiner line = new StringJoiner(" ");
        line.add(command.name());
        command.arguments().forEach(argument -> appendArgument(line, argument));
        return line.toString();
    }

    // Las listas anidadas se aplanan dentro de la misma línea
    private void appendArgument(StringJoiner line, Object argument) {
        if (argument instanceof List<?> nested) {
            nested.forEach(element -> appendArgument(line, element));
        } else if (argument instanceof Object[] nested) {
            for (Object element : nested) {
                appendArgument(line, element);
            }
        } else if (argument instanceof byte[] raw) {
            line.add(TextSanitizer.decode(raw));
        } else {
            line.add(argument == null ? "" : argument.toString());
        }
    }
}
