package ember.commands.generic;

import ember.commands.Command;
import ember.db.Keyspace;
import ember.protocol.Resp;

import java.util.List;

/**
 * Clients probe COMMAND (or COMMAND DOCS) on connect; acknowledge it without introspection.
 */
public class CommandCommand implements Command {
    @Override
    public String execute(Keyspace db, List<String> args) {
        return Resp.simpleString("OK");
    }
}
