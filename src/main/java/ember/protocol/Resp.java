package ember.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public class Resp {
    public static final char ARRAY = '*';
    public static final char BULK_STRING = '$';
    public static final char SIMPLE_STRING = '+';
    public static final char ERROR = '-';
    public static final char INTEGER = ':';

    public static final String CRLF = "\r\n";
    public static final String NULL_BULK = "$-1\r\n";

    public static class Request {
        public final String command;
        public final List<String> args;

        public Request(String command, List<String> args) {
            this.command = command;
            this.args = Collections.unmodifiableList(args);
        }
    }

    // --- SERIALIZATION ---
    public static String simpleString(String s) {
        return SIMPLE_STRING + s + CRLF;
    }

    public static String error(String s) {
        return ERROR + s + CRLF;
    }

    public static String integer(long i) {
        return INTEGER + Long.toString(i) + CRLF;
    }

    // Length is the UTF-8 byte count, which is what clients read off the socket.
    public static String bulkString(String s) {
        if (s == null) return NULL_BULK;
        return BULK_STRING + Integer.toString(s.getBytes(StandardCharsets.UTF_8).length) + CRLF + s + CRLF;
    }

    // A missing collection is answered with the null bulk, not the null array.
    public static String array(List<String> list) {
        if (list == null) return NULL_BULK;
        StringBuilder sb = new StringBuilder();
        sb.append(ARRAY).append(list.size()).append(CRLF);
        for (String item : list) {
            sb.append(bulkString(item));
        }
        return sb.toString();
    }

    /**
     * Builds a well-formed multi-bulk request frame, the way a client would send it.
     */
    public static String request(String... parts) {
        StringBuilder sb = new StringBuilder();
        sb.append(ARRAY).append(parts.length).append(CRLF);
        for (String part : parts) {
            sb.append(bulkString(part));
        }
        return sb.toString();
    }

    public static boolean isError(String reply) {
        return reply != null && reply.startsWith(ERROR + "ERR");
    }

    // --- PARSING ---

    /**
     * Extracts the command and its arguments from a multi-bulk frame.
     *
     * <p>This is a line-oriented reader, not a strict validator: the frame is split on CRLF,
     * empty lines are dropped, the third line is the command and every second line after it
     * is an argument. Declared lengths are never checked against the data.
     *
     * @throws RespProtocolException if the frame is too short to carry a command
     */
    public static Request decode(String data) {
        if (data == null) throw new RespProtocolException("Empty request");

        List<String> lines = new ArrayList<>();
        for (String line : data.split(CRLF)) {
            if (!line.isEmpty()) lines.add(line);
        }
        if (lines.size() < 3) {
            throw new RespProtocolException("Malformed request frame: " + lines.size() + " line(s)");
        }

        String command = lines.get(2).toUpperCase(Locale.ROOT);
        List<String> args = new ArrayList<>();
        for (int i = 4; i < lines.size(); i += 2) {
            args.add(lines.get(i));
        }
        return new Request(command, args);
    }
}
