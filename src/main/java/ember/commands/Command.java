package ember.commands;

import ember.db.Keyspace;
import java.util.List;

public interface Command {
    // Runs the command and returns the fully encoded reply.
    // Arguments do not include the command name. A WrongTypeException escaping from here is
    // answered by the engine with the generic wrong-type error.
    String execute(Keyspace db, List<String> args);
}
