package telesim.core.priority;

import telesim.core.model.MessageKind;

import java.util.ArrayList;
import java.util.List;

public final class PriorityPolicies {

    public static final String ERRORS_FIRST = "errors-first";

    private PriorityPolicies() {
    }

    public static PriorityPolicy logFirst() {
        return new KindOrderPolicy(List.of(MessageKind.LOG, MessageKind.SENSOR_DATA));
    }

    public static PriorityPolicy sensorFirst() {
        return new KindOrderPolicy(List.of(MessageKind.SENSOR_DATA, MessageKind.LOG));
    }

    public static PriorityPolicy errorsFirst() {
        return new ErrorsFirstPolicy();
    }

    /**
     * Parses a policy expression. Accepted forms are {@code errors-first} and a {@code >}-separated
     * kind ordering such as {@code log>sensorData}.
     *
     * @throws IllegalArgumentException if the expression names an unknown kind or omits one
     */
    public static PriorityPolicy parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Priority expression must not be empty");
        }
        String trimmed = expression.trim();
        if (ERRORS_FIRST.equalsIgnoreCase(trimmed)) {
            return errorsFirst();
        }
        List<MessageKind> order = new ArrayList<>();
        for (String part : trimmed.split(">")) {
            order.add(MessageKind.fromName(part.trim()));
        }
        return new KindOrderPolicy(order);
    }
}
