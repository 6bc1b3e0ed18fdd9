package ember.commands.list;

import ember.db.ListValue;

public class RPopCommand extends PopCommand {
    public RPopCommand() {
        super("rpop");
    }

    @Override
    protected String pop(ListValue list) {
        return list.popBack();
    }
}
