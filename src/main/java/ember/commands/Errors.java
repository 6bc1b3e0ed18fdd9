package ember.commands;

import ember.protocol.Resp;

/**
 * Encoded error replies shared by several commands. The wording is what clients match on.
 */
public final class Errors {
    public static final String NOT_AN_INTEGER = Resp.error("ERR value is not an integer or out of range");
    public static final String WRONG_TYPE = Resp.error("ERR wrong type of key");

    private Errors() {
    }

    public static String wrongArity(String command) {
        return Resp.error("ERR wrong number of arguments for '" + command + "' command");
    }

    public static String unknownCommand(String command) {
        return Resp.error("ERR unknown command " + command);
    }
}
