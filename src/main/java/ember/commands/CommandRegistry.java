package ember.commands;

import ember.commands.generic.CommandCommand;
import ember.commands.generic.DeleteCommand;
import ember.commands.generic.ExpireCommand;
import ember.commands.generic.TtlCommand;
import ember.commands.list.LPopCommand;
import ember.commands.list.LPushCommand;
import ember.commands.list.LRangeCommand;
import ember.commands.list.RPopCommand;
import ember.commands.list.RPushCommand;
import ember.commands.string.DecrCommand;
import ember.commands.string.GetCommand;
import ember.commands.string.IncrCommand;
import ember.commands.string.SetCommand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Dispatch table from upper-cased command name to handler. One registry per engine.
 */
public class CommandRegistry {
    private final Map<String, CommandContainer> commands = new LinkedHashMap<>();

    public static CommandRegistry withDefaults() {
        CommandRegistry registry = new CommandRegistry();

        // String
        registry.register("SET", new SetCommand(), CommandMetadata.WRITE);
        registry.register("GET", new GetCommand(), CommandMetadata.READONLY);
        registry.register("INCR", new IncrCommand(), CommandMetadata.WRITE);
        registry.register("DECR", new DecrCommand(), CommandMetadata.WRITE);

        // List
        registry.register("LPUSH", new LPushCommand(), CommandMetadata.WRITE);
        registry.register("RPUSH", new RPushCommand(), CommandMetadata.WRITE);
        registry.register("LPOP", new LPopCommand(), CommandMetadata.WRITE);
        registry.register("RPOP", new RPopCommand(), CommandMetadata.WRITE);
        registry.register("LRANGE", new LRangeCommand(), CommandMetadata.READONLY);

        // Generic
        registry.register("DELETE", new DeleteCommand(), CommandMetadata.WRITE);
        registry.register("EXPIRE", new ExpireCommand(), CommandMetadata.WRITE);
        registry.register("TTL", new TtlCommand(), CommandMetadata.READONLY);
        registry.register("COMMAND", new CommandCommand(), CommandMetadata.READONLY);

        return registry;
    }

    public void register(String name, Command command, CommandMetadata metadata) {
        String key = name.toUpperCase(Locale.ROOT);
        commands.put(key, new CommandContainer(command, metadata));
    }

    public CommandContainer get(String name) {
        return commands.get(name.toUpperCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(commands.keySet());
    }
}
