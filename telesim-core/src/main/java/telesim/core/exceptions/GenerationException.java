package telesim.core.exceptions;

/**
 * Raised when a generator cannot produce a well-formed message. Fatal to the owning device.
 */
public class GenerationException extends TelesimException {

    public static final String ERROR_CODE = "GENERATION_FAULT";

    public GenerationException(String message, Throwable cause, String deviceId) {
        super(message, cause, ERROR_CODE, deviceId);
    }
}
