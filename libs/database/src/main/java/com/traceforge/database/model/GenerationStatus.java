package com.traceforge.database.model;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Progress of downstream test case generation for a requirement version.
 * <p>
 * Lifecycle: {@code NOT_STARTED -> IN_PROGRESS -> (COMPLETED | FAILED) -> SYNCHED}. A failed
 * generation may be retried, which moves it back to {@code IN_PROGRESS}. {@code SYNCHED} is
 * terminal.
 */
public enum GenerationStatus {

    NOT_STARTED("NOT_STARTED"),
    IN_PROGRESS("IN_PROGRESS"),
    COMPLETED("COMPLETED"),
    FAILED("FAILED"),
    SYNCHED("SYNCHED");

    private final String value;

    GenerationStatus(String value) {
        this.value = value;
    }

    /** The value stored in {@code requirements.testcase_generation_status}. */
    public String value() {
        return value;
    }

    /** Statuses reachable from this one in a single step. */
    public Set<GenerationStatus> successors() {
        return switch (this) {
            case NOT_STARTED -> EnumSet.of(IN_PROGRESS);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED -> EnumSet.of(SYNCHED);
            case FAILED -> EnumSet.of(IN_PROGRESS, SYNCHED);
            case SYNCHED -> EnumSet.noneOf(GenerationStatus.class);
        };
    }

    public boolean canTransitionTo(GenerationStatus next) {
        return successors().contains(next);
    }

    /**
     * Validates a transition.
     *
     * @throws IllegalStateException if {@code next} is not a successor of this status
     */
    public GenerationStatus transitionTo(GenerationStatus next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal generation status transition: %s -> %s".formatted(this, next));
        }
        return next;
    }

    public static Optional<GenerationStatus> fromString(String value) {
        for (GenerationStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
