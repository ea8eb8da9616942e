package com.softpower.backend.events.exception;

import java.util.UUID;
import lombok.Getter;

/**
 * A child still owns mentions at the moment it was about to be deleted. Aborts the country's run.
 */
@Getter
public class NonEmptyChildException extends RuntimeException {

    private final UUID childId;
    private final long remainingMentions;

    public NonEmptyChildException(UUID childId, long remainingMentions) {
        super(String.format("Child event %s still owns %d mention(s) after drain; refusing to delete",
                childId, remainingMentions));
        this.childId = childId;
        this.remainingMentions = remainingMentions;
    }
}
