package ember.commands;

import java.util.Collections;
import java.util.Set;

public class CommandMetadata {
    public static final String FLAG_WRITE = "write";
    public static final String FLAG_READONLY = "readonly";

    public static final CommandMetadata WRITE = new CommandMetadata(Collections.singleton(FLAG_WRITE));
    public static final CommandMetadata READONLY = new CommandMetadata(Collections.singleton(FLAG_READONLY));

    private final Set<String> flags;

    public CommandMetadata(Set<String> flags) {
        this.flags = flags != null ? flags : Collections.emptySet();
    }

    public Set<String> getFlags() {
        return flags;
    }

    // Only write commands are candidates for the append-only log.
    public boolean isWrite() {
        return flags.contains(FLAG_WRITE);
    }
}
