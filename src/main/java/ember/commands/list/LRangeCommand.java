package ember.commands.list;

import ember.commands.Command;
import ember.commands.Errors;
import ember.db.DataType;
import ember.db.Keyspace;
import ember.db.Value;
import ember.protocol.Resp;

import java.util.List;

public class LRangeCommand implements Command {
    @Override
    public String execute(Keyspace db, List<String> args) {
        if (args.size() < 3) {
            return Errors.wrongArity("lrange");
        }

        Value entry = db.get(args.get(0));
        if (entry == null || entry.type() != DataType.LIST) {
            return Resp.NULL_BULK;
        }

        int start;
        int end;
        try {
            start = Integer.parseInt(args.get(1));
            end = Integer.parseInt(args.get(2));
        } catch (NumberFormatException e) {
            return Errors.NOT_AN_INTEGER;
        }
        return Resp.array(entry.asList().range(start, end));
    }
}
