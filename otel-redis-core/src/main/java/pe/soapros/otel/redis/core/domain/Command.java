package pe.soapros.otel.redis.core.domain;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Un comando Redis ya normalizado: el identificador de la operación y sus argumentos.
 * Los argumentos pueden ser String, byte[], números, listas anidadas o null.
 */
public record Command(String operation, List<Object> arguments) {

    public static final String AUTH = "AUTH";

    public Command {
        Objects.requireNonNull(operation, "Command operation cannot be null");
        arguments = arguments == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static Command of(Object operation, Object... arguments) {
        return new Command(operationName(operation), Arrays.asList(arguments));
    }

    /**
     * Construye un comando a partir de la forma cruda {@code [operation, arg1, arg2, ...]}.
     */
    public static Command fromTokens(List<?> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("Command tokens cannot be empty");
        }
        return new Command(operationName(tokens.get(0)), new ArrayList<>(tokens.subList(1, tokens.size())));
    }

    /**
     * Nombre de la operación en mayúsculas, tal como se usa en spans y statements.
     */
    public String name() {
        return operation.toUpperCase(Locale.ROOT);
    }

    public boolean is(String operationName) {
        return operation.equalsIgnoreCase(operationName);
    }

    public boolean isAuth() {
        return is(AUTH);
    }

    public int argumentCount() {
        return arguments.size();
    }

    public boolean hasArguments() {
        return !arguments.isEmpty();
    }

    public Object lastArgument() {
        return arguments.isEmpty() ? null : arguments.get(arguments.size() - 1);
    }

    private static String operationName(Object operation) {
        if (operation == null || operation instanceof List<?> || operation instanceof Command) {
            throw new IllegalArgumentException("Invalid command operation: " + operation);
        }
        if (operation instanceof Enum<?> constant) {
            return constant.name();
        }
        if (operation instanceof byte[] raw) {
            return new String(raw, StandardCharsets.UTF_8);
        }
        return operation.toString();
    }
}
