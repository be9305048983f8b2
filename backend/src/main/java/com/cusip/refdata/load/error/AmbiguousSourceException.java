package com.cusip.refdata.load.error;

import java.util.List;

/**
 * More than one file matched the name template for a single record type and date.
 */
public class AmbiguousSourceException extends LoadFailureException {
    private final List<String> candidates;

    public AmbiguousSourceException(String pattern, List<String> candidates) {
        super(
            FailureKind.SOURCE_AMBIGUOUS,
            "Expected one file matching " + pattern + " but found " + candidates.size() + ": " + candidates
        );
        this.candidates = List.copyOf(candidates);
    }

    public List<String> candidates() {
        return candidates;
    }
}
