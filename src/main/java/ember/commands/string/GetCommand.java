package ember.commands.string;

import ember.commands.Command;
import ember.db.DataType;
import ember.db.Keyspace;
import ember.db.Value;
import ember.protocol.Resp;

import java.util.List;

public class GetCommand implements Command {
    @Override
    public String execute(Keyspace db, List<String> args) {
        if (args.isEmpty()) {
            return Resp.error("ERR missing argument for 'get' command");
        }

        Value entry = db.get(args.get(0));
        if (entry == null || entry.type() != DataType.STRING) {
            return Resp.NULL_BULK;
        }
        return Resp.bulkString(entry.asString().text());
    }
}
