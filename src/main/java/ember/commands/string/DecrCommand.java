package ember.commands.string;

public class DecrCommand extends CounterCommand {
    public DecrCommand() {
        super("decr", -1);
    }
}
