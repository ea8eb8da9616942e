package com.softpower.backend.events.service;

/**
 * What happens to a single child mention when it is folded into its master.
 * The choice depends only on whether the master already owns the mention's date, so the
 * final state is the same whatever order children and mentions are drained in.
 */
public enum MentionTransition {

    /** Master already has the date: add the article count onto the master's row and drop the child's row. */
    ADDITIVE_MERGE,

    /** Master has no row for the date: move the child's row over unchanged. */
    REASSIGNMENT;

    public static MentionTransition classify(boolean masterOwnsDate) {
        return masterOwnsDate ? ADDITIVE_MERGE : REASSIGNMENT;
    }
}
