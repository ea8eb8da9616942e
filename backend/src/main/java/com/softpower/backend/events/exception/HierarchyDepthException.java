package com.softpower.backend.events.exception;

/**
 * An edge would make the canonical event hierarchy deeper than one level, or points nowhere.
 */
public class HierarchyDepthException extends RuntimeException {
    public HierarchyDepthException(String message) {
        super(message);
    }
}
