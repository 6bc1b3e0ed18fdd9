package ember.server;

import java.util.List;

/**
 * Notified after a write command has been applied. Called with the engine lock held, so
 * implementations must hand slow work off to another thread.
 */
public interface CommandListener {
    CommandListener NONE = (command, args) -> { };

    void commandExecuted(String command, List<String> args);
}
