package telesim.core.generator;

import telesim.core.model.Message;

import java.time.Instant;

/**
 * Builds the payload of one message for a device. Called once per generator tick.
 */
@FunctionalInterface
public interface MessageFactory {

    Message create(String deviceId, String firmwareVersion, Instant timestamp);
}
