package io.monitorselector.enums;

/**
 * Recommended disposition of a monitor for one selection pass.
 *
 * IN: eligible to keep or promote, OUT: drain gradually, BLOCK: remove now,
 * PENDING: stay where it is (cannot be promoted to active).
 */
public enum CandidateState {
    UNKNOWN, IN, OUT, BLOCK, PENDING
}
