package telesim.core.exceptions;

/**
 * Base exception class for all simulator exceptions.
 */
public class TelesimException extends Exception {

    private final String errorCode;
    private final String context;

    /**
     * Creates a new TelesimException with a message.
     *
     * @param message The error message
     */
    public TelesimException(String message) {
        this(message, null, "TELESIM_ERROR", null);
    }

    /**
     * Creates a new TelesimException with a message and cause.
     *
     * @param message The error message
     * @param cause The underlying cause
     */
    public TelesimException(String message, Throwable cause) {
        this(message, cause, "TELESIM_ERROR", null);
    }

    /**
     * Creates a new TelesimException with a message, cause, error code, and context.
     *
     * @param message The error message
     * @param cause The underlying cause, may be null
     * @param errorCode The specific error code
     * @param context Additional context information, typically the device id
     */
    public TelesimException(String message, Throwable cause, String errorCode, String context) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return The context information, or null if none was provided
     */
    public String getContext() {
        return context;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        sb.append(" [").append(errorCode).append("]");
        if (context != null) {
            sb.append(" (").append(context).append(")");
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
