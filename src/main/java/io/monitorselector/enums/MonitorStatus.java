package io.monitorselector.enums;

/**
 * Global lifecycle status of a monitor, independent of any server assignment.
 */
public enum MonitorStatus {
    PENDING("pending"),
    TESTING("testing"),
    ACTIVE("active"),
    PAUSED("paused"),
    DELETED("deleted");

    private final String value;

    MonitorStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MonitorStatus fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (MonitorStatus status : MonitorStatus.values()) {
            if (status.value.equalsIgnoreCase(trimmed)) {
                return status;
            }
        }

        return null; // unknown statuses are classified as blocked by the caller
    }
}
