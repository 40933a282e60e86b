package telesim.core.priority;

import telesim.core.model.Message;

/**
 * Error logs outrank sensor data, which outranks every other log.
 */
public final class ErrorsFirstPolicy implements PriorityPolicy {

    static final int ERROR_LOG = 3;
    static final int SENSOR_DATA = 2;
    static final int OTHER_LOG = 1;

    @Override
    public int priorityOf(Message message) {
        return switch (message.kind()) {
            case LOG -> message.logEntry().isError() ? ERROR_LOG : OTHER_LOG;
            case SENSOR_DATA -> SENSOR_DATA;
        };
    }

    @Override
    public String describe() {
        return "errors-first";
    }

    @Override
    public String toString() {
        return "ErrorsFirstPolicy";
    }
}
