package io.monitorselector.enums;

/**
 * Kinds of constraint violation an assignment can carry.
 *
 * Same-subnet and same-account violations are unchangeable: they cannot be resolved by
 * moving other monitors around, so they are never grandfathered and lead to a pause.
 */
public enum ViolationType {
    NONE(""),
    NETWORK_SAME_SUBNET("network_same_subnet"),
    ACCOUNT("account"),
    LIMIT("limit"),
    NETWORK_DIVERSITY("network_diversity");

    private final String value;

    ViolationType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isUnchangeable() {
        return this == NETWORK_SAME_SUBNET || this == ACCOUNT;
    }

    public static ViolationType fromString(String value) {
        if (value == null || value.trim().isEmpty()) return NONE;

        String trimmed = value.trim();
        for (ViolationType type : ViolationType.values()) {
            if (type.value.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }

        return null;
    }
}
