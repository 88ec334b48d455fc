package com.topostat.core.stats;

import com.topostat.core.model.ResultRecord;

import java.util.List;

/**
 * Recent failures of one module, bounded per leaf test name.
 *
 * @param shown      failures to display individually, oldest first
 * @param suppressed older failures not displayed, one entry per leaf test name
 */
public record FailureSample(List<ResultRecord> shown, List<Suppression> suppressed) {

    public static final FailureSample NONE = new FailureSample(List.of(), List.of());

    public FailureSample {
        shown = List.copyOf(shown);
        suppressed = List.copyOf(suppressed);
    }

    public boolean isEmpty() {
        return shown.isEmpty() && suppressed.isEmpty();
    }

    /**
     * @param testName leaf test name (last segment of the composed name)
     * @param count    failures beyond the displayed ones
     */
    public record Suppression(String testName, int count) {
    }
}
