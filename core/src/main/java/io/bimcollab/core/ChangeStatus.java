package io.bimcollab.core;

/**
 * Processing state of a journaled change.
 * <p>
 * Transitions: PENDING -> APPLIED, or PENDING -> CONFLICTED.
 * A CONFLICTED change may later become APPLIED when its conflict is resolved
 * in its favour, or leave the journal entirely.
 */
public enum ChangeStatus {
    PENDING, APPLIED, CONFLICTED
}
