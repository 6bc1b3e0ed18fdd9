package ember.commands.string;

import ember.commands.Command;
import ember.commands.Errors;
import ember.db.Keyspace;
import ember.db.StringValue;
import ember.protocol.Resp;

import java.util.List;

public class SetCommand implements Command {
    @Override
    public String execute(Keyspace db, List<String> args) {
        if (args.size() < 2) {
            return Errors.wrongArity("set");
        }
        // Replaces whatever the key held, lists included.
        db.put(args.get(0), new StringValue(args.get(1)));
        return Resp.simpleString("OK");
    }
}
