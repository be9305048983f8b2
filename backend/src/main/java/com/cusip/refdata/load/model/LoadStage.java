package com.cusip.refdata.load.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per record type pipeline state. Transitions are forward-only; a terminal stage has no successors.
 */
public enum LoadStage {
    PENDING,
    FETCHING,
    PARSING,
    STAGING,
    MERGING,
    SUCCEEDED,
    SKIPPED,
    FAILED;

    public Set<LoadStage> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(FETCHING, FAILED);
            case FETCHING -> EnumSet.of(PARSING, SKIPPED, FAILED);
            case PARSING -> EnumSet.of(STAGING, FAILED);
            case STAGING -> EnumSet.of(MERGING, FAILED);
            case MERGING -> EnumSet.of(SUCCEEDED, FAILED);
            case SUCCEEDED, SKIPPED, FAILED -> EnumSet.noneOf(LoadStage.class);
        };
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    public LoadStage advanceTo(LoadStage next) {
        if (!successors().contains(next)) {
            throw new IllegalStateException("Illegal load stage transition " + this + " -> " + next);
        }
        return next;
    }
}
