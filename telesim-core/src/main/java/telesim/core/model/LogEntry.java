package telesim.core.model;

import java.util.Objects;

public record LogEntry(Severity severity, String message) {

    public LogEntry {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
