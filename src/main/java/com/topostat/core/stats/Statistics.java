package com.topostat.core.stats;

import com.topostat.core.check.Checks;

/**
 * Pass/fail tally of one module, agent or job over a report window.
 * Skipped results create the entry but are counted in neither bucket.
 */
public final class Statistics {

    private final String name;
    private int total;
    private int passed;
    private int failed;
    private double totalDuration;

    public Statistics(String name) {
        this.name = name;
    }

    void recordPassed(double durationSeconds) {
        total++;
        passed++;
        if (Checks.isFloatMin(durationSeconds, 0.0)) {
            totalDuration += durationSeconds;
        }
    }

    void recordFailed() {
        total++;
        failed++;
    }

    public String getName() {
        return name;
    }

    public int getTotal() {
        return total;
    }

    public int getPassed() {
        return passed;
    }

    public int getFailed() {
        return failed;
    }

    /** Passed over total, {@code 0.0} when nothing was counted. */
    public double getQuality() {
        return total > 0 ? (double) passed / total : 0.0;
    }

    public double getFailureRate() {
        return 1.0 - getQuality();
    }

    /** Cumulative duration of passed results only. */
    public double getTotalDuration() {
        return totalDuration;
    }

    /** Average duration of passed results, {@code 0.0} when none passed. */
    public double getAverageDuration() {
        return passed > 0 ? totalDuration / passed : 0.0;
    }

    @Override
    public String toString() {
        return "Statistics[" + name + ": total=" + total + ", passed=" + passed + ", failed=" + failed + "]";
    }
}
