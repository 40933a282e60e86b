package telesim.core;

import telesim.core.model.Message;

import java.util.List;

/**
 * Outcome of one flush: the retained messages in send order and the dropped remainder.
 */
public record FlushResult(List<Message> retained, List<Message> dropped) {

    public static final FlushResult EMPTY = new FlushResult(List.of(), List.of());

    public FlushResult {
        retained = List.copyOf(retained);
        dropped = List.copyOf(dropped);
    }

    public int total() {
        return retained.size() + dropped.size();
    }

    public boolean isEmpty() {
        return retained.isEmpty() && dropped.isEmpty();
    }
}
