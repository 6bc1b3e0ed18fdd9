package ember.persistence;

import ember.protocol.Resp;
import ember.server.CommandEngine;
import ember.utils.Log;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Append-only command log: one {@code COMMAND arg1 arg2 ...} line per write command.
 *
 * <p>Appends happen on a single background thread after the command has already been
 * applied and answered, in submission order. The in-memory state is authoritative: if the
 * process dies before a line reaches the file, that command is missing on the next replay.
 * Arguments are joined with single spaces, so an argument containing a space does not
 * survive a replay intact.
 */
public class AofHandler implements Closeable {
    private static final Log log = Log.named("persistence");
    private static final String LINE_END = "\r\n";

    private final Path path;
    private final ExecutorService writer;
    private Writer out; // Only touched from the writer thread

    public AofHandler(Path path) {
        this.path = path;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "AOF-Writer");
            t.setDaemon(true);
            return t;
        });
    }

    public Path getPath() {
        return path;
    }

    public static String format(String command, List<String> args) {
        StringBuilder sb = new StringBuilder(command);
        for (String arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.append(LINE_END).toString();
    }

    /**
     * Queues one command for appending. The returned future completes once the line has been
     * written and flushed, or once the failure has been logged.
     */
    public CompletableFuture<Void> append(String command, List<String> args) {
        String line = format(command, new ArrayList<>(args));
        try {
            return CompletableFuture.runAsync(() -> write(line), writer);
        } catch (RejectedExecutionException e) {
            log.error("AOF is closed, dropping: " + line.trim());
            return CompletableFuture.completedFuture(null);
        }
    }

    private void write(String line) {
        try {
            if (out == null) {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                out = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
            out.write(line);
            out.flush();
            log.debug("AOF log appended: " + line.trim());
        } catch (IOException e) {
            log.error("Error appending to AOF file: " + e.getMessage());
            closeWriter();
        }
    }

    /**
     * Waits until every append queued so far has been attempted.
     */
    public void flush() {
        try {
            CompletableFuture.runAsync(() -> { }, writer).get(5, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("AOF already closed, nothing to flush.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("AOF flush did not complete: " + e.getMessage());
        }
    }

    /**
     * Re-executes every logged command, in file order, with logging suppressed. Entries are
     * separated by CRLF; blank ones are skipped. An entry that fails is logged and replay
     * carries on with the next one.
     *
     * @return number of commands replayed
     */
    public int replay(CommandEngine engine) {
        if (!Files.exists(path)) return 0;

        log.info("Replaying AOF " + path + "...");
        String data;
        try {
            data = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Error loading AOF file: " + e.getMessage());
            return 0;
        }

        // Entries end with CRLF only; a bare LF inside a value is part of that value.
        int replayed = 0;
        for (String line : data.split(LINE_END)) {
            if (line.trim().isEmpty()) continue;

            List<String> parts = Arrays.asList(line.split(" ", -1));
            String command = parts.get(0);
            List<String> args = parts.subList(1, parts.size());
            try {
                String reply = engine.execute(command, args, true);
                if (Resp.isError(reply)) {
                    log.warn("AOF command " + command + " replied " + reply.trim());
                }
                replayed++;
            } catch (RuntimeException e) {
                log.error("Error executing AOF command: " + command, e);
            }
        }
        log.info("Replayed " + replayed + " command(s) from AOF.");
        return replayed;
    }

    private void closeWriter() {
        if (out != null) {
            try {
                out.close();
            } catch (IOException e) {
                log.warn("Error closing AOF file: " + e.getMessage());
            }
            out = null;
        }
    }

    /**
     * Drains pending appends and closes the file.
     */
    @Override
    public void close() {
        try {
            writer.submit(this::closeWriter);
        } catch (RejectedExecutionException e) {
            return; // Already closed
        }
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
