package ember.commands.list;

import ember.commands.Command;
import ember.commands.Errors;
import ember.db.DataType;
import ember.db.Keyspace;
import ember.db.ListValue;
import ember.db.Value;
import ember.protocol.Resp;

import java.util.List;

/**
 * Removes one element from an end of a list. A missing key or a string key gives the null
 * bulk reply. Popping the last element deletes the key together with its TTL.
 */
public abstract class PopCommand implements Command {
    private final String name;

    protected PopCommand(String name) {
        this.name = name;
    }

    protected abstract String pop(ListValue list);

    @Override
    public String execute(Keyspace db, List<String> args) {
        if (args.isEmpty()) {
            return Errors.wrongArity(name);
        }

        String key = args.get(0);
        Value entry = db.get(key);
        if (entry == null || entry.type() != DataType.LIST) {
            return Resp.NULL_BULK;
        }

        ListValue list = entry.asList();
        String popped = pop(list);
        if (popped == null) {
            return Resp.NULL_BULK;
        }
        if (list.isEmpty()) {
            db.remove(key);
        }
        return Resp.bulkString(popped);
    }
}
