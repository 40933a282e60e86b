package telesim.core.exceptions;

/**
 * Raised when a single message could not be delivered. Never retried.
 */
public class TransportException extends TelesimException {

    public static final String ERROR_CODE = "TRANSPORT_FAILURE";

    private final int statusCode;

    public TransportException(String message, Throwable cause, String deviceId) {
        this(message, cause, deviceId, -1);
    }

    public TransportException(String message, Throwable cause, String deviceId, int statusCode) {
        super(message, cause, ERROR_CODE, deviceId);
        this.statusCode = statusCode;
    }

    /**
     * @return The HTTP status returned by the server, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
