package ember.commands.generic;

import ember.commands.Command;
import ember.commands.Errors;
import ember.db.Keyspace;
import ember.protocol.Resp;

import java.util.List;

public class TtlCommand implements Command {
    // Bare sentinels without the integer prefix; existing clients compare these bytes.
    static final String NO_TTL = "-1" + Resp.CRLF;
    static final String NO_KEY = "-2" + Resp.CRLF;

    @Override
    public String execute(Keyspace db, List<String> args) {
        if (args.isEmpty()) {
            return Errors.wrongArity("ttl");
        }

        String key = args.get(0);
        if (db.checkExpiry(key)) {
            return NO_TTL;
        }
        if (db.get(key) == null) {
            return NO_KEY;
        }

        Long expireAt = db.expirationOf(key);
        if (expireAt == null) {
            return NO_TTL;
        }
        long remaining = expireAt - db.now();
        if (remaining < 0) {
            return NO_TTL;
        }
        return Resp.integer(remaining / 1000);
    }
}
