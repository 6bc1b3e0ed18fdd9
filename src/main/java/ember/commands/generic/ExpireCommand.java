package ember.commands.generic;

import ember.commands.Command;
import ember.commands.Errors;
import ember.db.Keyspace;
import ember.protocol.Resp;

import java.util.List;

public class ExpireCommand implements Command {
    @Override
    public String execute(Keyspace db, List<String> args) {
        if (args.size() < 2) {
            return Errors.wrongArity("expire");
        }

        String key = args.get(0);
        long expireAt;
        try {
            long seconds = Long.parseLong(args.get(1));
            expireAt = Math.addExact(db.now(), Math.multiplyExact(seconds, 1000L));
        } catch (NumberFormatException | ArithmeticException e) {
            return Errors.NOT_AN_INTEGER;
        }

        // The key does not have to exist yet; a later SET keeps this deadline.
        db.expireAt(key, expireAt);
        return Resp.simpleString("OK");
    }
}
