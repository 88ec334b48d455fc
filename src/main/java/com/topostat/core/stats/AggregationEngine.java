package com.topostat.core.stats;

import com.topostat.core.model.ResultRecord;
import com.topostat.core.stats.FailureSample.Suppression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Computes module, agent and job statistics and rankings over a window of results.
 * <p>
 * A single pass over an ascending, completed snapshot; the engine holds no state between
 * calls. All rankings are stable: ties keep first-seen order.
 */
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private static final Comparator<Statistics> BY_QUALITY = Comparator.comparingDouble(Statistics::getQuality);
    private static final Comparator<Statistics> BY_FAILURES =
            Comparator.comparingInt(Statistics::getFailed).reversed();
    private static final Comparator<Statistics> BY_DURATION =
            Comparator.comparingDouble(Statistics::getAverageDuration).reversed();

    private final ReportPolicy policy;

    public AggregationEngine(ReportPolicy policy) {
        this.policy = policy;
    }

    public ReportModel computeReport(String plan, Instant from, Instant to, List<ResultRecord> records) {
        return computeReport(plan, from, to, records, records.size());
    }

    /**
     * @param records     results ordered by ascending timestamp; entries of other plans, outside
     *                    the window or failing validation are ignored
     * @param storedTotal size of the whole store, reported in the header
     */
    public ReportModel computeReport(String plan, Instant from, Instant to,
                                     List<ResultRecord> records, long storedTotal) {
        List<ResultRecord> window = new ArrayList<>();
        for (ResultRecord record : records) {
            if (record != null && record.validate() && record.planName().equals(plan)
                    && !record.timestamp().isBefore(from) && !record.timestamp().isAfter(to)) {
                window.add(record);
            }
        }

        Map<String, Statistics> modules = tally(window, ResultRecord::leadingSegment, true);
        Map<String, Statistics> agents = tally(window, ResultRecord::agentName, false);
        Map<String, Statistics> jobs = tally(window, ResultRecord::jobName, false);

        List<Statistics> byQuality = ranked(modules.values(), BY_QUALITY, policy.extendedByQuality());
        List<ReportModel.ModuleEntry> extended = new ArrayList<>(byQuality.size());
        for (Statistics module : byQuality) {
            extended.add(new ReportModel.ModuleEntry(module, sampleFailures(window, module.getName())));
        }

        log.debug("Aggregated {} result(s) of plan '{}' into {} module(s), {} agent(s), {} job(s)",
                window.size(), plan, modules.size(), agents.size(), jobs.size());

        return new ReportModel(
                plan, from, to, storedTotal, window.size(),
                modules.size(), agents.size(), jobs.size(),
                ranked(modules.values(), BY_FAILURES, policy.worstByFailures()),
                ranked(modules.values(), BY_QUALITY, policy.worstByQuality()),
                extended,
                ranked(modules.values(), BY_DURATION, policy.worstByDuration()),
                ranked(agents.values(), BY_QUALITY, policy.worstAgents()),
                ranked(jobs.values(), BY_QUALITY, policy.worstJobs()));
    }

    private static Map<String, Statistics> tally(List<ResultRecord> window,
                                                 Function<ResultRecord, String> key,
                                                 boolean withDuration) {
        Map<String, Statistics> stats = new LinkedHashMap<>();
        for (ResultRecord record : window) {
            Statistics entry = stats.computeIfAbsent(key.apply(record), Statistics::new);
            if (record.passed()) {
                entry.recordPassed(withDuration ? record.durationSeconds() : 0.0);
            } else if (record.failed()) {
                entry.recordFailed();
            }
        }
        return stats;
    }

    private static List<Statistics> ranked(Iterable<Statistics> stats, Comparator<Statistics> order, int limit) {
        List<Statistics> sorted = new ArrayList<>();
        stats.forEach(sorted::add);
        sorted.sort(order);
        return sorted.subList(0, Math.min(limit, sorted.size()));
    }

    /**
     * Walks the module's failures newest first, keeping at most
     * {@link ReportPolicy#failuresPerTest()} per leaf test name and counting the rest.
     */
    FailureSample sampleFailures(List<ResultRecord> window, String module) {
        int limit = policy.failuresPerTest();
        Map<String, Integer> perLeaf = new LinkedHashMap<>();
        List<ResultRecord> shown = new ArrayList<>();
        for (int i = window.size() - 1; i >= 0; i--) {
            ResultRecord record = window.get(i);
            if (!record.failed() || !record.leadingSegment().equals(module)) {
                continue;
            }
            int seen = perLeaf.merge(record.leafSegment(), 1, Integer::sum);
            if (seen <= limit) {
                shown.add(record);
            }
        }
        if (perLeaf.isEmpty()) {
            return FailureSample.NONE;
        }

        List<Suppression> suppressed = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : perLeaf.entrySet()) {
            if (entry.getValue() > limit) {
                suppressed.add(new Suppression(entry.getKey(), entry.getValue() - limit));
            }
        }
        // leaf names ordered by their latest failure, oldest first, like the shown list
        Collections.reverse(suppressed);
        Collections.reverse(shown);
        return new FailureSample(shown, suppressed);
    }
}
