package telesim.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import telesim.core.model.MessageKind;

/**
 * Writes simulation events to the log.
 */
public class LoggingSimulationEvents implements SimulationEvents {
    private static final Logger logger = LoggerFactory.getLogger(LoggingSimulationEvents.class);

    @Override
    public void messageDropped(String deviceId, MessageKind kind, DropReason reason) {
        logger.warn("message_dropped device={} kind={} reason={}", deviceId, kind.getWireName(), reason.getTag());
    }

    @Override
    public void messageSendFailed(String deviceId, MessageKind kind, Throwable cause) {
        logger.error("message_send_failed device={} kind={} cause={}", deviceId, kind.getWireName(), cause.toString());
    }

    @Override
    public void flushCompleted(String deviceId, int retained, int dropped) {
        if (dropped > 0) {
            logger.info("Device {} flushed {} messages, dropped {}", deviceId, retained, dropped);
        } else {
            logger.debug("Device {} flushed {} messages", deviceId, retained);
        }
    }
}
