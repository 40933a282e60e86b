package telesim.core.priority;

import telesim.core.model.Message;
import telesim.core.model.MessageKind;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ranks messages by kind alone, following an explicit ordering from most to least important.
 */
public final class KindOrderPolicy implements PriorityPolicy {

    private final List<MessageKind> order;
    private final Map<MessageKind, Integer> ranks = new EnumMap<>(MessageKind.class);

    /**
     * @param order Every kind exactly once, most important first
     */
    public KindOrderPolicy(List<MessageKind> order) {
        if (order.size() != MessageKind.values().length || !EnumSet.copyOf(order).equals(EnumSet.allOf(MessageKind.class))) {
            throw new IllegalArgumentException("Priority order must list every message kind exactly once: " + order);
        }
        this.order = List.copyOf(order);
        for (int i = 0; i < order.size(); i++) {
            ranks.put(order.get(i), order.size() - i);
        }
    }

    @Override
    public int priorityOf(Message message) {
        return ranks.get(message.kind());
    }

    @Override
    public String describe() {
        return order.stream().map(MessageKind::getWireName).collect(Collectors.joining(">"));
    }

    @Override
    public String toString() {
        return "KindOrderPolicy[" + describe() + "]";
    }
}
