package com.topostat.core.persistence;

import com.topostat.core.check.Checks;
import com.topostat.core.model.Outcome;
import com.topostat.core.model.PlatformInfo;
import com.topostat.core.model.ResultRecord;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Fact row: one test outcome linked to its full set of dimensions.
 * There is no uniqueness constraint on facts; resubmitting a result stores it again.
 * Besides {@code passed} the row keeps whether the outcome was a skip, so the read
 * side can restore the three-valued {@link Outcome}.
 */
public class ResultFact {

    private Long id;
    private final DirectoryRow directory;
    private final ModuleRow module;
    private final TestRow test;
    private final AgentRow agent;
    private final PlanRow plan;
    private final BuildRow build;
    private final JobRow job;
    private final Outcome outcome;
    private final double durationSeconds;
    private final Instant timestamp;
    private final PlatformInfo platform;

    public ResultFact(DirectoryRow directory, ModuleRow module, TestRow test, AgentRow agent,
                      PlanRow plan, BuildRow build, JobRow job,
                      Outcome outcome, double durationSeconds, Instant timestamp, PlatformInfo platform) {
        this.directory = directory;
        this.module = module;
        this.test = test;
        this.agent = agent;
        this.plan = plan;
        this.build = build;
        this.job = job;
        this.outcome = outcome;
        this.durationSeconds = durationSeconds;
        this.timestamp = timestamp;
        this.platform = platform;
    }

    public boolean isValid() {
        return directory != null && directory.isValid()
                && module != null && module.isValid()
                && test != null && test.isValid()
                && agent != null && agent.isValid()
                && plan != null && plan.isValid()
                && build != null && build.isValid()
                && job != null && job.isValid()
                && outcome != null
                && Checks.isFloatMin(durationSeconds, 0.0)
                && Checks.isTimestamp(timestamp)
                && (platform == null || platform.isValid());
    }

    public Long getId() {
        return id;
    }

    void assignId(long id) {
        this.id = id;
    }

    void clearId() {
        this.id = null;
    }

    public DirectoryRow getDirectory() { return directory; }
    public ModuleRow getModule() { return module; }
    public TestRow getTest() { return test; }
    public AgentRow getAgent() { return agent; }
    public PlanRow getPlan() { return plan; }
    public BuildRow getBuild() { return build; }
    public JobRow getJob() { return job; }
    public Outcome getOutcome() { return outcome; }
    public boolean isPassed() { return outcome == Outcome.PASSED; }
    public boolean isSkipped() { return outcome == Outcome.SKIPPED; }
    public double getDurationSeconds() { return durationSeconds; }
    public Instant getTimestamp() { return timestamp; }
    public PlatformInfo getPlatform() { return platform; }

    /** Dimensions referenced by this fact, in resolution order. */
    public List<Dimension> dimensions() {
        return Arrays.asList(directory, module, test, agent, plan, build, job);
    }

    /** Rebuilds the wire-level record this fact was normalized from. */
    public ResultRecord toRecord() {
        return new ResultRecord(
                platform != null ? ResultRecord.VERSION_2 : ResultRecord.VERSION_1,
                directory.getName() + "." + module.getName() + "." + test.getName(),
                outcome,
                durationSeconds,
                agent.getName(),
                timestamp,
                plan.getName(),
                build.getNumber(),
                job.getName(),
                platform);
    }
}
