package ember.commands.generic;

import ember.commands.Command;
import ember.commands.Errors;
import ember.db.Keyspace;
import ember.protocol.Resp;

import java.util.List;

public class DeleteCommand implements Command {
    @Override
    public String execute(Keyspace db, List<String> args) {
        if (args.isEmpty()) {
            return Errors.wrongArity("delete");
        }
        return Resp.integer(db.remove(args.get(0)) ? 1 : 0);
    }
}
