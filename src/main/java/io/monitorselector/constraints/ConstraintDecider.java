package io.monitorselector.constraints;

import io.monitorselector.models.ConstraintViolation;

/**
 * One fairness rule an assignment must satisfy.
 */
public interface ConstraintDecider {

    /**
     * Check the request against this rule.
     *
     * @return {@link ConstraintViolation#none()} when the rule passes
     */
    ConstraintViolation check(ConstraintRequest request);

    String getName();

    boolean isEnabled();

    void setEnabled(boolean enabled);
}
