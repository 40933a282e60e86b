package telesim.core.model;

import java.util.Locale;

public enum Severity {
    DEBUG("Debug"),
    INFO("Info"),
    WARNING("Warning"),
    ERROR("Error");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Severity fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        return Severity.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
