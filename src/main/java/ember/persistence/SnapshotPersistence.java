package ember.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import ember.server.CommandEngine;
import ember.utils.Clock;
import ember.utils.Log;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Point-in-time snapshots of the whole keyspace as one JSON file.
 *
 * <p>A save copies the keyspace under the engine lock, then serializes and writes it on a
 * background thread. The file is written to a sibling temp file and renamed into place, so
 * readers never see a half-written snapshot. At most one save runs at a time; a save
 * requested while another is in flight is skipped.
 */
public class SnapshotPersistence implements Closeable {
    private static final Log log = Log.named("persistence");

    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean saving = new AtomicBoolean(false);
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> timer;

    public SnapshotPersistence(Path path) {
        this(path, Clock.SYSTEM);
    }

    public SnapshotPersistence(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Snapshot-Writer");
            t.setDaemon(true);
            return t;
        });
    }

    public Path getPath() {
        return path;
    }

    /**
     * Reads the snapshot file. A missing or empty file yields null.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public SnapshotDocument read() throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        byte[] data = Files.readAllBytes(path);
        if (new String(data, StandardCharsets.UTF_8).trim().isEmpty()) {
            log.warn("Snapshot file is empty.");
            return null;
        }
        return mapper.readValue(data, SnapshotDocument.class);
    }

    /**
     * Loads the snapshot, if any, and union-merges it into the engine's keyspace.
     * Failures are logged and leave the keyspace untouched.
     *
     * @return number of keys loaded
     */
    public int load(CommandEngine engine) {
        SnapshotDocument doc;
        try {
            doc = read();
        } catch (IOException e) {
            log.error("Error loading snapshot " + path + ": " + e.getMessage());
            return 0;
        }
        if (doc == null) {
            return 0;
        }

        engine.withKeyspace(ks -> {
            ks.merge(doc.store, doc.expirationTimes);
            return null;
        });
        int loaded = doc.store == null ? 0 : doc.store.size();
        log.info("Snapshot loaded successfully (" + loaded + " keys, saved at " + doc.savedAt + ").");
        return loaded;
    }

    public void write(SnapshotDocument doc) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writeValue(temp.toFile(), doc);
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Starts a background save. The future completes with true once the file is replaced,
     * false if the save failed or was skipped because another one is running.
     */
    public CompletableFuture<Boolean> saveAsync(CommandEngine engine) {
        if (!saving.compareAndSet(false, true)) {
            log.debug("Snapshot already in progress, skipping.");
            return CompletableFuture.completedFuture(false);
        }

        SnapshotDocument doc;
        try {
            doc = engine.withKeyspace(ks -> SnapshotDocument.of(ks, clock.currentTimeMillis()));
        } catch (RuntimeException e) {
            saving.set(false);
            throw e;
        }

        try {
            return CompletableFuture.supplyAsync(() -> writeQuietly(doc), scheduler);
        } catch (RuntimeException e) {
            saving.set(false);
            log.error("Could not schedule snapshot write: " + e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
    }

    /**
     * Saves on the calling thread. Used at shutdown, after the timer has been stopped.
     */
    public boolean saveNow(CommandEngine engine) {
        if (!saving.compareAndSet(false, true)) {
            return false;
        }
        SnapshotDocument doc = engine.withKeyspace(ks -> SnapshotDocument.of(ks, clock.currentTimeMillis()));
        return writeQuietly(doc);
    }

    private boolean writeQuietly(SnapshotDocument doc) {
        try {
            write(doc);
            log.debug("Snapshot saved (" + doc.store.size() + " keys).");
            return true;
        } catch (IOException e) {
            log.error("Error saving snapshot " + path + ": " + e.getMessage());
            return false;
        } finally {
            saving.set(false);
        }
    }

    /**
     * Saves every {@code intervalMs}, whether or not anything changed. A failing tick does
     * not cancel the following ones.
     */
    public synchronized void schedule(CommandEngine engine, long intervalMs) {
        if (timer != null) {
            timer.cancel(false);
        }
        timer = scheduler.scheduleAtFixedRate(() -> {
            try {
                saveAsync(engine);
            } catch (RuntimeException e) {
                log.error("Snapshot tick failed", e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops the timer and waits for an in-flight write to finish.
     */
    @Override
    public synchronized void close() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
