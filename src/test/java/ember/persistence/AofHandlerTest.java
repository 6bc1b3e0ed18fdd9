package ember.persistence;

import ember.db.Keyspace;
import ember.protocol.Resp;
import ember.server.CommandEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class AofHandlerTest {

    @TempDir
    Path dir;

    private Path file;
    private AofHandler aof;

    @BeforeEach
    public void setup() {
        file = dir.resolve("appendonly.aof");
        aof = new AofHandler(file);
    }

    @AfterEach
    public void teardown() {
        aof.close();
    }

    private String contents() throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Test
    public void testFormat() {
        assertEquals("SET k v\r\n", AofHandler.format("SET", Arrays.asList("k", "v")));
        assertEquals("COMMAND\r\n", AofHandler.format("COMMAND", Collections.emptyList()));
    }

    @Test
    public void testAppendsInOrder() throws Exception {
        aof.append("SET", Arrays.asList("k", "v"));
        aof.append("RPUSH", Arrays.asList("l", "a", "b"));
        aof.append("DELETE", Arrays.asList("k")).get(5, TimeUnit.SECONDS);

        assertEquals("SET k v\r\nRPUSH l a b\r\nDELETE k\r\n", contents());
    }

    @Test
    public void testArgumentListIsCopied() throws Exception {
        List<String> args = new ArrayList<>(Arrays.asList("k", "v"));
        aof.append("SET", args);
        args.set(1, "changed");
        aof.flush();

        assertEquals("SET k v\r\n", contents());
    }

    @Test
    public void testReplayRebuildsState() throws Exception {
        CommandEngine live = new CommandEngine(new Keyspace());
        live.setCommandListener(aof::append);
        live.handle(Resp.request("SET", "a", "1"));
        live.handle(Resp.request("INCR", "a"));
        live.handle(Resp.request("LPUSH", "l", "x", "y"));
        live.handle(Resp.request("RPOP", "l"));
        live.handle(Resp.request("SET", "gone", "soon"));
        live.handle(Resp.request("DELETE", "gone"));
        aof.flush();

        CommandEngine restored = new CommandEngine(new Keyspace());
        assertEquals(6, aof.replay(restored));

        assertEquals("$1\r\n2\r\n", restored.handle(Resp.request("GET", "a")));
        assertEquals("*1\r\n$1\r\nx\r\n", restored.handle(Resp.request("LRANGE", "l", "0", "5")));
        assertEquals("$-1\r\n", restored.handle(Resp.request("GET", "gone")));
    }

    @Test
    public void testReplaySkipsBlankLines() throws IOException {
        Files.write(file, "SET a 1\r\n\r\n   \r\nset b 2\r\n".getBytes(StandardCharsets.UTF_8));

        CommandEngine engine = new CommandEngine(new Keyspace());
        assertEquals(2, aof.replay(engine));
        assertEquals("$1\r\n2\r\n", engine.handle(Resp.request("GET", "b")));
    }

    @Test
    public void testReplayDoesNotAppendAgain() throws Exception {
        Files.write(file, "SET a 1\r\n".getBytes(StandardCharsets.UTF_8));

        CommandEngine engine = new CommandEngine(new Keyspace());
        engine.setCommandListener(aof::append);
        aof.replay(engine);
        aof.flush();

        assertEquals("SET a 1\r\n", contents());
    }

    @Test
    public void testReplayContinuesPastBadLines() throws IOException {
        Files.write(file, "BOGUS x\r\nSET a\r\nSET b 2\r\n".getBytes(StandardCharsets.UTF_8));

        CommandEngine engine = new CommandEngine(new Keyspace());
        aof.replay(engine);
        assertEquals("$1\r\n2\r\n", engine.handle(Resp.request("GET", "b")));
    }

    @Test
    public void testValueWithBareNewlineReplaysAsOneCommand() throws Exception {
        CommandEngine live = new CommandEngine(new Keyspace());
        live.setCommandListener(aof::append);
        live.handle(Resp.request("SET", "important", "keep"));
        live.handle(Resp.request("SET", "k", "a\nb"));
        live.handle(Resp.request("SET", "trap", "x\nDELETE important"));
        aof.flush();

        CommandEngine restored = new CommandEngine(new Keyspace());
        assertEquals(3, aof.replay(restored));
        assertEquals("$4\r\nkeep\r\n", restored.handle(Resp.request("GET", "important")));
        assertEquals("$3\r\na\nb\r\n", restored.handle(Resp.request("GET", "k")));
    }

    @Test
    public void testAcknowledgedWriteIsLostWhenAppendNeverLands() {
        CommandEngine live = new CommandEngine(new Keyspace());
        live.setCommandListener(aof::append);
        live.handle(Resp.request("SET", "before", "1"));
        aof.flush();

        // The writer goes away between the reply and the append, like a crash would.
        aof.close();
        assertEquals("+OK\r\n", live.handle(Resp.request("SET", "after", "2")));
        assertEquals("$1\r\n2\r\n", live.handle(Resp.request("GET", "after")));

        AofHandler reopened = new AofHandler(file);
        try {
            CommandEngine restored = new CommandEngine(new Keyspace());
            assertEquals(1, reopened.replay(restored));
            assertEquals("$1\r\n1\r\n", restored.handle(Resp.request("GET", "before")));
            assertEquals("$-1\r\n", restored.handle(Resp.request("GET", "after")),
                    "In-memory state is authoritative; the unlogged write is gone after a restart");
        } finally {
            reopened.close();
        }
    }

    @Test
    public void testReplayMissingFile() {
        assertEquals(0, aof.replay(new CommandEngine(new Keyspace())));
    }

    @Test
    public void testAppendsToExistingFile() throws Exception {
        Files.write(file, "SET old 1\r\n".getBytes(StandardCharsets.UTF_8), StandardOpenOption.CREATE);
        aof.append("SET", Arrays.asList("new", "2")).get(5, TimeUnit.SECONDS);

        assertEquals("SET old 1\r\nSET new 2\r\n", contents());
    }

    @Test
    public void testAppendAfterCloseIsDropped() throws Exception {
        aof.close();
        aof.append("SET", Arrays.asList("k", "v")).get(5, TimeUnit.SECONDS);
        assertFalse(Files.exists(file));
    }
}
