package com.topostat.core.model;

import java.util.List;

/**
 * Maps the polymorphic upstream result representation onto {@link Outcome}.
 */
public final class OutcomeClassifier {

    private OutcomeClassifier() {
        // utility class
    }

    /**
     * Classifies a raw result that is either absent, a single {@link CaseResult},
     * or a list whose first element carries the tag. Any other shape is a pass.
     */
    public static Outcome classify(Object raw) {
        if (raw instanceof CaseResult single) {
            return fromTag(single);
        }
        if (raw instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof CaseResult first) {
            return fromTag(first);
        }
        return Outcome.PASSED;
    }

    private static Outcome fromTag(CaseResult result) {
        if (result.tag() == null) {
            return Outcome.PASSED;
        }
        return switch (result.tag()) {
            case FAILURE, ERROR -> Outcome.FAILED;
            case SKIPPED -> Outcome.SKIPPED;
        };
    }
}
