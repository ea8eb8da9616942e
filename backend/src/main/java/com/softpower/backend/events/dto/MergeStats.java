package com.softpower.backend.events.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters accumulated while folding children into their masters.
 * {@code mentionsReassigned} counts every drained child mention, whichever branch it took;
 * {@code conflictsMerged} is the subset that was added onto an existing master mention.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeStats {
    private int masterCount;
    private int childCount;
    private int mentionsReassigned;
    private int eventsDeleted;
    private int conflictsMerged;

    public static MergeStats empty() {
        return new MergeStats();
    }

    public void add(MergeStats other) {
        masterCount += other.masterCount;
        childCount += other.childCount;
        mentionsReassigned += other.mentionsReassigned;
        eventsDeleted += other.eventsDeleted;
        conflictsMerged += other.conflictsMerged;
    }

    public boolean hasActivity() {
        return mentionsReassigned > 0 || eventsDeleted > 0;
    }
}
