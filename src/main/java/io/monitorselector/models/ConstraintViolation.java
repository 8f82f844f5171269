package io.monitorselector.models;

import io.monitorselector.enums.ViolationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Result of a constraint check. A passing check is represented by {@link #none()}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@AllArgsConstructor
public class ConstraintViolation {

    private static final ConstraintViolation NONE = new ConstraintViolation(ViolationType.NONE, "", null, false);

    private final ViolationType type;

    private final String details;

    private final Instant since;

    private final boolean grandfathered;

    public static ConstraintViolation none() {
        return NONE;
    }

    public static ConstraintViolation of(ViolationType type, String details) {
        return new ConstraintViolation(type, details, null, false);
    }

    public boolean isNone() {
        return type == ViolationType.NONE;
    }

    public boolean isPresent() {
        return type != ViolationType.NONE;
    }

    public ConstraintViolation withSince(Instant since) {
        return toBuilder().since(since).build();
    }

    public ConstraintViolation withGrandfathered(boolean grandfathered) {
        return toBuilder().grandfathered(grandfathered).build();
    }
}
