package com.topostat.core.stats;

import com.topostat.config.TopostatProperties;

/**
 * Ranking cut-offs of the statistics report.
 *
 * @param worstByQuality    modules listed in the short failure-rate view
 * @param extendedByQuality modules listed, with failure samples, in the extended failure-rate view
 * @param worstByFailures   modules listed by absolute failure count
 * @param worstByDuration   modules listed by average passed duration
 * @param worstAgents       agents listed by quality
 * @param worstJobs         jobs listed by quality
 * @param failuresPerTest   most recent failures shown per leaf test name
 */
public record ReportPolicy(
        int worstByQuality,
        int extendedByQuality,
        int worstByFailures,
        int worstByDuration,
        int worstAgents,
        int worstJobs,
        int failuresPerTest
) {

    public static final ReportPolicy DEFAULTS = new ReportPolicy(20, 100, 20, 10, 10, 10, 3);

    public ReportPolicy {
        if (worstByQuality < 0 || extendedByQuality < 0 || worstByFailures < 0
                || worstByDuration < 0 || worstAgents < 0 || worstJobs < 0 || failuresPerTest < 1) {
            throw new IllegalArgumentException("Invalid report policy");
        }
    }

    public static ReportPolicy from(TopostatProperties.Report report) {
        return new ReportPolicy(
                report.worstByQuality(),
                report.extendedByQuality(),
                report.worstByFailures(),
                report.worstByDuration(),
                report.worstAgents(),
                report.worstJobs(),
                report.failuresPerTest());
    }
}
