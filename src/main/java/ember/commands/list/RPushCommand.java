package ember.commands.list;

import ember.db.ListValue;

import java.util.List;

public class RPushCommand extends PushCommand {
    public RPushCommand() {
        super("rpush");
    }

    @Override
    protected int push(ListValue list, List<String> values) {
        return list.pushBack(values);
    }
}
