package io.monitorselector.enums;

/**
 * Status of a (server, monitor) assignment row.
 */
public enum ServerScoreStatus {
    NEW("new"),
    CANDIDATE("candidate"),
    TESTING("testing"),
    ACTIVE("active"),
    PAUSED("paused");

    private final String value;

    ServerScoreStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Active and testing assignments count towards per-account limits and diversity checks.
     */
    public boolean isCounted() {
        return this == ACTIVE || this == TESTING;
    }

    public static ServerScoreStatus fromString(String value) {
        if (value == null) return NEW;

        String trimmed = value.trim();
        for (ServerScoreStatus status : ServerScoreStatus.values()) {
            if (status.value.equalsIgnoreCase(trimmed)) {
                return status;
            }
        }

        return NEW;
    }
}
