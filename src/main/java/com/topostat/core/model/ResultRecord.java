package com.topostat.core.model;

import com.topostat.core.check.Checks;

import java.time.Instant;
import java.util.Set;

/**
 * One test outcome as exchanged between agent and collector.
 * <p>
 * Instances may hold invalid values; {@link #validate()} decides whether the record
 * is usable. Version 1 records carry no platform, version 2 records must carry a
 * complete {@link PlatformInfo}.
 */
public record ResultRecord(
        int schemaVersion,
        String name,
        Outcome outcome,
        double durationSeconds,
        String agentName,
        Instant timestamp,
        String planName,
        int buildNumber,
        String jobName,
        PlatformInfo platform
) {

    public static final int VERSION_1 = 1;
    public static final int VERSION_2 = 2;

    /** Schema versions this build understands. */
    public static final Set<Integer> SUPPORTED_VERSIONS = Set.of(VERSION_1, VERSION_2);

    /** Composed name emitted by CI servers for skipped build jobs. */
    public static final String SKIPPED_SENTINEL = "skipped.skipped";

    /**
     * Builds a record from a parsed test case. A non-null {@code platform} produces a
     * version 2 record.
     */
    public static ResultRecord fromCase(TestCase testCase, BuildContext context,
                                        Instant timestamp, PlatformInfo platform) {
        return new ResultRecord(
                platform != null ? VERSION_2 : VERSION_1,
                testCase.qualifiedName(),
                OutcomeClassifier.classify(testCase.result()),
                testCase.time(),
                context.agentName(),
                timestamp,
                context.planName(),
                context.buildNumber(),
                context.jobName(),
                platform);
    }

    public boolean validate() {
        if (!SUPPORTED_VERSIONS.contains(schemaVersion)) {
            return false;
        }
        if (!Checks.isNonBlank(name) || SKIPPED_SENTINEL.equals(name.strip())) {
            return false;
        }
        if (outcome == null || !Checks.isFloatMin(durationSeconds, 0.0)) {
            return false;
        }
        if (!Checks.isNonEmpty(agentName)
                || !Checks.isTimestamp(timestamp)
                || !Checks.isNonEmpty(planName)
                || !Checks.isIntMin(buildNumber, 1)
                || !Checks.isNonEmpty(jobName)) {
            return false;
        }
        if (schemaVersion == VERSION_2) {
            return platform != null && platform.isValid();
        }
        return platform == null;
    }

    public boolean passed() {
        return outcome == Outcome.PASSED;
    }

    public boolean failed() {
        return outcome == Outcome.FAILED;
    }

    public boolean skipped() {
        return outcome == Outcome.SKIPPED;
    }

    /** First dot-separated segment of the name. */
    public String leadingSegment() {
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    /** Last dot-separated segment of the name. */
    public String leafSegment() {
        return name.substring(name.lastIndexOf('.') + 1);
    }
}
