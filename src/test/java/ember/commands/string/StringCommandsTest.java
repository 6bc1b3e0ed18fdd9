package ember.commands.string;

import ember.db.Keyspace;
import ember.db.ListValue;
import ember.db.StringValue;
import ember.db.WrongTypeException;
import ember.utils.MockClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StringCommandsTest {

    private MockClock clock;
    private Keyspace db;

    @BeforeEach
    public void setup() {
        clock = new MockClock();
        db = new Keyspace(clock);
    }

    private static List<String> args(String... a) {
        return Arrays.asList(a);
    }

    @Test
    public void testSetThenGet() {
        assertEquals("+OK\r\n", new SetCommand().execute(db, args("k", "hello")));
        assertEquals("$5\r\nhello\r\n", new GetCommand().execute(db, args("k")));
    }

    @Test
    public void testGetMissingKey() {
        assertEquals("$-1\r\n", new GetCommand().execute(db, args("nope")));
    }

    @Test
    public void testArityErrors() {
        assertEquals("-ERR wrong number of arguments for 'set' command\r\n", new SetCommand().execute(db, args("k")));
        assertEquals("-ERR missing argument for 'get' command\r\n", new GetCommand().execute(db, Collections.emptyList()));
        assertEquals("-ERR wrong number of arguments for 'incr' command\r\n", new IncrCommand().execute(db, Collections.emptyList()));
        assertEquals("-ERR wrong number of arguments for 'decr' command\r\n", new DecrCommand().execute(db, Collections.emptyList()));
    }

    @Test
    public void testSetOverwritesList() {
        db.put("k", new ListValue(args("a")));
        new SetCommand().execute(db, args("k", "v"));
        assertEquals(new StringValue("v"), db.get("k"));
    }

    @Test
    public void testGetOnListIsNullBulk() {
        db.put("k", new ListValue(args("a")));
        assertEquals("$-1\r\n", new GetCommand().execute(db, args("k")));
    }

    @Test
    public void testGetAfterExpiry() {
        new SetCommand().execute(db, args("k", "v"));
        db.expireAt("k", clock.currentTimeMillis() + 1000);

        clock.advance(1001);
        assertEquals("$-1\r\n", new GetCommand().execute(db, args("k")));
        assertFalse(db.containsKey("k"));
    }

    @Test
    public void testIncrFromAbsent() {
        IncrCommand incr = new IncrCommand();
        for (int i = 1; i <= 5; i++) {
            assertEquals(":" + i + "\r\n", incr.execute(db, args("counter")));
        }
        assertEquals(new StringValue("5"), db.get("counter"));
    }

    @Test
    public void testDecrFromAbsent() {
        assertEquals(":-1\r\n", new DecrCommand().execute(db, args("counter")));
        assertEquals(":-2\r\n", new DecrCommand().execute(db, args("counter")));
    }

    @Test
    public void testIncrNonInteger() {
        new SetCommand().execute(db, args("k", "abc"));
        assertEquals("-ERR value is not an integer or out of range\r\n", new IncrCommand().execute(db, args("k")));
        assertEquals("-ERR value is not an integer or out of range\r\n", new DecrCommand().execute(db, args("k")));
        assertEquals(new StringValue("abc"), db.get("k"));
    }

    @Test
    public void testIncrOverflow() {
        new SetCommand().execute(db, args("k", Long.toString(Long.MAX_VALUE)));
        assertEquals("-ERR value is not an integer or out of range\r\n", new IncrCommand().execute(db, args("k")));
    }

    @Test
    public void testIncrKeepsTtl() {
        new SetCommand().execute(db, args("k", "10"));
        db.expireAt("k", clock.currentTimeMillis() + 5000);

        assertEquals(":11\r\n", new IncrCommand().execute(db, args("k")));
        assertNotNull(db.expirationOf("k"));
    }

    @Test
    public void testIncrOnListThrowsWrongType() {
        db.put("k", new ListValue(args("a")));
        assertThrows(WrongTypeException.class, () -> new IncrCommand().execute(db, args("k")));
    }
}
