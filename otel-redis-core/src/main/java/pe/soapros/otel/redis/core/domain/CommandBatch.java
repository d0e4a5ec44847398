package pe.soapros.otel.redis.core.domain;

import java.util.List;
import java.util.Objects;

/**
 * Lote de comandos normalizados junto con la forma en la que fue enviado.
 *
 * <p>La forma se detecta una sola vez al normalizar las entradas crudas; a partir de ahí
 * todos los componentes trabajan sobre {@link Command} ya normalizados.
 */
public final class CommandBatch {

    private final BatchShape shape;
    private final List<Command> commands;

    private CommandBatch(BatchShape shape, List<Command> commands) {
        this.shape = shape;
        this.commands = List.copyOf(commands);
    }

    public static CommandBatch singleton(Command command) {
        return new CommandBatch(BatchShape.SINGLETON, List.of(command));
    }

    /**
     * Un lote de un solo comando siempre es {@link BatchShape#SINGLETON}, sin importar cómo llegó.
     */
    public static CommandBatch pipelined(List<Command> commands) {
        return new CommandBatch(shapeFor(commands, BatchShape.PIPELINED), commands);
    }

    public static CommandBatch queued(List<Command> commands) {
        return new CommandBatch(shapeFor(commands, BatchShape.QUEUED), commands);
    }

    private static BatchShape shapeFor(List<Command> commands, BatchShape multiCommandShape) {
        Objects.requireNonNull(commands, "Commands cannot be null");
        return commands.size() == 1 ? BatchShape.SINGLETON : multiCommandShape;
    }

    public BatchShape getShape() {
        return shape;
    }

    public List<Command> getCommands() {
        return commands;
    }

    public int size() {
        return commands.size();
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    public boolean isSingleton() {
        return shape == BatchShape.SINGLETON;
    }

    public Command get(int index) {
        return commands.get(index);
    }

    public boolean containsAuth() {
        return commands.stream().anyMatch(Command::isAuth);
    }

    @Override
    public String toString() {
        return "CommandBatch{shape=" + shape + ", size=" + commands.size() + "}";
    }
}
