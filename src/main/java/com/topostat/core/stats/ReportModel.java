package com.topostat.core.stats;

import java.time.Instant;
import java.util.List;

/**
 * Structured statistics report for one plan and window, ready for rendering.
 *
 * @param storedTotal number of results in the store, all plans and times
 * @param windowTotal number of results of the plan inside the window
 */
public record ReportModel(
        String plan,
        Instant from,
        Instant to,
        long storedTotal,
        int windowTotal,
        int moduleCount,
        int agentCount,
        int jobCount,
        List<Statistics> modulesByFailures,
        List<Statistics> modulesByQuality,
        List<ModuleEntry> modulesByQualityExtended,
        List<Statistics> modulesByDuration,
        List<Statistics> agentsByQuality,
        List<Statistics> jobsByQuality
) {

    public ReportModel {
        modulesByFailures = List.copyOf(modulesByFailures);
        modulesByQuality = List.copyOf(modulesByQuality);
        modulesByQualityExtended = List.copyOf(modulesByQualityExtended);
        modulesByDuration = List.copyOf(modulesByDuration);
        agentsByQuality = List.copyOf(agentsByQuality);
        jobsByQuality = List.copyOf(jobsByQuality);
    }

    /** A module of the extended quality ranking with its recent failures. */
    public record ModuleEntry(Statistics statistics, FailureSample failures) {
    }
}
