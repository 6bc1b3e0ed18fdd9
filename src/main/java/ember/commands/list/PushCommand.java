package ember.commands.list;

import ember.commands.Command;
import ember.commands.Errors;
import ember.db.Keyspace;
import ember.db.ListValue;
import ember.db.Value;
import ember.protocol.Resp;

import java.util.List;

public abstract class PushCommand implements Command {
    private final String name;

    protected PushCommand(String name) {
        this.name = name;
    }

    protected abstract int push(ListValue list, List<String> values);

    @Override
    public String execute(Keyspace db, List<String> args) {
        if (args.size() < 2) {
            return Errors.wrongArity(name);
        }

        String key = args.get(0);
        Value entry = db.get(key);
        // asList() rejects a string key before anything is touched.
        ListValue list = entry == null ? new ListValue() : entry.asList();
        int length = push(list, args.subList(1, args.size()));
        if (entry == null) {
            db.put(key, list);
        }
        return Resp.integer(length);
    }
}
