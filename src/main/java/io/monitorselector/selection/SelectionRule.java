package io.monitorselector.selection;

import io.monitorselector.models.StatusChange;

import java.util.List;

/**
 * One step of a selection pass. Rules run in a fixed order against a shared
 * {@link RuleContext} and record their changes into it.
 */
public interface SelectionRule {

    /**
     * Name used in logs.
     */
    String getName();

    /**
     * Apply the rule.
     *
     * @return the changes this rule recorded
     */
    List<StatusChange> apply(RuleContext context);
}
