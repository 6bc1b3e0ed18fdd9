package ember.persistence;

import ember.Config;
import ember.server.CommandEngine;
import ember.server.CommandListener;
import ember.utils.Log;

import java.io.Closeable;
import java.nio.file.Paths;
import java.util.List;

/**
 * Wires the configured persistence mode to the engine: recovery at startup, ongoing
 * persistence while running, and a final flush on shutdown.
 */
public class DurabilityManager implements CommandListener, Closeable {
    private static final Log log = Log.named("persistence");

    private final Config config;
    private final CommandEngine engine;
    private final PersistenceMode mode;
    private final SnapshotPersistence snapshots;
    private final AofHandler aof;

    public DurabilityManager(Config config, CommandEngine engine) {
        this(config, engine,
                config.persistenceMode() == PersistenceMode.SNAPSHOT
                        ? new SnapshotPersistence(Paths.get(config.snapshotFile)) : null,
                config.persistenceMode() == PersistenceMode.APPEND_ONLY
                        ? new AofHandler(Paths.get(config.appendOnlyFile)) : null);
    }

    DurabilityManager(Config config, CommandEngine engine, SnapshotPersistence snapshots, AofHandler aof) {
        this.config = config;
        this.engine = engine;
        this.mode = config.persistenceMode();
        this.snapshots = snapshots;
        this.aof = aof;
    }

    public PersistenceMode getMode() {
        return mode;
    }

    /**
     * Restores persisted state into the keyspace and starts persisting. Runs synchronously,
     * before the server accepts connections.
     */
    public void start() {
        switch (mode) {
            case SNAPSHOT:
                log.info("Persistence: snapshot every " + config.snapshotIntervalMs + "ms to " + snapshots.getPath());
                snapshots.load(engine);
                snapshots.schedule(engine, config.snapshotIntervalMs);
                break;
            case APPEND_ONLY:
                log.info("Persistence: append-only log at " + aof.getPath());
                aof.replay(engine);
                engine.setCommandListener(this);
                break;
            default:
                log.info("Persistence: disabled, state is kept in memory only.");
                break;
        }
    }

    @Override
    public void commandExecuted(String command, List<String> args) {
        if (aof != null && config.isAppendable(command)) {
            aof.append(command, args);
        }
    }

    @Override
    public void close() {
        engine.setCommandListener(CommandListener.NONE);
        if (snapshots != null) {
            snapshots.close();
            if (snapshots.saveNow(engine)) {
                log.info("Final snapshot saved.");
            }
        }
        if (aof != null) {
            aof.close();
        }
    }
}
