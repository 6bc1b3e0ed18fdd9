package ember.commands.list;

import ember.db.ListValue;

public class LPopCommand extends PopCommand {
    public LPopCommand() {
        super("lpop");
    }

    @Override
    protected String pop(ListValue list) {
        return list.popFront();
    }
}
