package ember.server;

import ember.commands.CommandContainer;
import ember.commands.CommandRegistry;
import ember.commands.Errors;
import ember.db.Keyspace;
import ember.db.WrongTypeException;
import ember.protocol.Resp;
import ember.protocol.RespProtocolException;
import ember.utils.Log;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Runs commands against one keyspace, one at a time.
 *
 * <p>Every keyspace read and write happens under a single lock, so a command's
 * dispatch, mutation, reply and log hand-off finish before the next command starts,
 * whatever thread delivered it.
 */
public class CommandEngine {
    private static final Log log = Log.named("core");

    private final Keyspace keyspace;
    private final CommandRegistry registry;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile CommandListener listener = CommandListener.NONE;

    public CommandEngine(Keyspace keyspace) {
        this(keyspace, CommandRegistry.withDefaults());
    }

    public CommandEngine(Keyspace keyspace, CommandRegistry registry) {
        this.keyspace = keyspace;
        this.registry = registry;
    }

    public void setCommandListener(CommandListener listener) {
        this.listener = listener != null ? listener : CommandListener.NONE;
    }

    /**
     * Decodes one client message and executes it. Never throws: framing problems and
     * unexpected faults come back as error replies so the connection can keep going.
     */
    public String handle(String frame) {
        Resp.Request request;
        try {
            request = Resp.decode(frame);
        } catch (RespProtocolException e) {
            log.debug("Rejected frame: " + e.getMessage());
            return Resp.error("ERR unknown command");
        }

        try {
            return execute(request.command, request.args, false);
        } catch (RuntimeException e) {
            log.error("Command " + request.command + " failed", e);
            return Resp.error("ERR");
        }
    }

    /**
     * Executes a command by name.
     *
     * @param replay true when the command comes from the append-only log; such commands are
     *               not handed to the listener again
     */
    public String execute(String command, List<String> args, boolean replay) {
        String name = command.toUpperCase(Locale.ROOT);
        if (log.isDebug()) {
            log.debug("Received command: " + name + " with args: " + args);
        }

        CommandContainer container = registry.get(name);
        if (container == null) {
            return Errors.unknownCommand(name);
        }

        lock.lock();
        try {
            String reply;
            try {
                reply = container.getCommand().execute(keyspace, args);
            } catch (WrongTypeException e) {
                reply = Errors.WRONG_TYPE;
            }

            if (!replay && container.getMetadata().isWrite() && !Resp.isError(reply)) {
                listener.commandExecuted(name, args);
            }
            return reply;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} with exclusive access to the keyspace. Used by persistence to take
     * consistent copies and to merge loaded state.
     */
    public <T> T withKeyspace(Function<Keyspace, T> action) {
        lock.lock();
        try {
            return action.apply(keyspace);
        } finally {
            lock.unlock();
        }
    }

    public CommandRegistry getRegistry() {
        return registry;
    }
}
