package com.traceforge.database.repository;

import java.util.UUID;

/**
 * Another writer appended a version (or changed the latest version) of the same entity first.
 * Callers may reload the latest version and retry.
 */
public class VersionConflictException extends RuntimeException {

    private final UUID entityId;

    public VersionConflictException(UUID entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public UUID entityId() {
        return entityId;
    }
}
