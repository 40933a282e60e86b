package telesim.client.codec;

import telesim.core.exceptions.TelesimException;

/**
 * Raised when a JSON document is not a well-formed message.
 */
public class MalformedMessageException extends TelesimException {

    public static final String ERROR_CODE = "MALFORMED_MESSAGE";

    public MalformedMessageException(String message) {
        super(message, null, ERROR_CODE, null);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause, ERROR_CODE, null);
    }
}
