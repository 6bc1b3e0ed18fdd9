package ember.commands.list;

import ember.db.ListValue;

import java.util.List;

public class LPushCommand extends PushCommand {
    public LPushCommand() {
        super("lpush");
    }

    @Override
    protected int push(ListValue list, List<String> values) {
        return list.pushFront(values);
    }
}
