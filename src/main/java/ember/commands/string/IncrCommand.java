package ember.commands.string;

public class IncrCommand extends CounterCommand {
    public IncrCommand() {
        super("incr", 1);
    }
}
