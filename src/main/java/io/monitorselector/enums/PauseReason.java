package io.monitorselector.enums;

/**
 * Why an assignment was moved to the paused status.
 */
public enum PauseReason {
    CONSTRAINT_VIOLATION("constraint_violation"),
    MONITOR_PAUSED("monitor_paused"),
    MANUAL("manual");

    private final String value;

    PauseReason(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PauseReason fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (PauseReason reason : PauseReason.values()) {
            if (reason.value.equalsIgnoreCase(trimmed)) {
                return reason;
            }
        }

        return null;
    }
}
