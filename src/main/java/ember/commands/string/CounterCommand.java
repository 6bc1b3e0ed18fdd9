package ember.commands.string;

import ember.commands.Command;
import ember.commands.Errors;
import ember.db.Keyspace;
import ember.db.StringValue;
import ember.db.Value;
import ember.protocol.Resp;

import java.util.List;

/**
 * Adds a fixed delta to a string holding a base-10 64-bit integer. An absent key counts as
 * zero. A list key raises the wrong-type error.
 */
public abstract class CounterCommand implements Command {
    private final String name;
    private final long delta;

    protected CounterCommand(String name, long delta) {
        this.name = name;
        this.delta = delta;
    }

    @Override
    public String execute(Keyspace db, List<String> args) {
        if (args.isEmpty()) {
            return Errors.wrongArity(name);
        }

        String key = args.get(0);
        Value entry = db.get(key);
        if (entry == null) {
            db.put(key, new StringValue(Long.toString(delta)));
            return Resp.integer(delta);
        }

        long next;
        try {
            long current = Long.parseLong(entry.asString().text());
            next = Math.addExact(current, delta);
        } catch (NumberFormatException | ArithmeticException e) {
            return Errors.NOT_AN_INTEGER;
        }

        db.put(key, new StringValue(Long.toString(next)));
        return Resp.integer(next);
    }
}
