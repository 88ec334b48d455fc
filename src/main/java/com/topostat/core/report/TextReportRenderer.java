package com.topostat.core.report;

import com.topostat.config.TopostatProperties;
import com.topostat.core.model.ResultRecord;
import com.topostat.core.stats.FailureSample;
import com.topostat.core.stats.ReportModel;
import com.topostat.core.stats.Statistics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link ReportModel} as the plain-text statistics report.
 * Pure formatting; the model is expected to be consistent.
 */
@Component
public class TextReportRenderer {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final String ciBrowseUrl;

    @Autowired
    public TextReportRenderer(TopostatProperties properties) {
        this(properties.report().ciBrowseUrl());
    }

    public TextReportRenderer(String ciBrowseUrl) {
        this.ciBrowseUrl = ciBrowseUrl.endsWith("/")
                ? ciBrowseUrl.substring(0, ciBrowseUrl.length() - 1) : ciBrowseUrl;
    }

    public String render(ReportModel model) {
        StringBuilder txt = new StringBuilder();
        txt.append(format("===== RESULTS STORED (%d) =====%n", model.storedTotal()));
        txt.append(format("===== WINDOW FROM %s TO %s (%d) %s =====%n",
                DAY.format(model.from()), DAY.format(model.to()), model.windowTotal(), model.plan()));

        txt.append(format("%n===== TESTS BY FAILURES [rank: name (total, passed, failed, failure rate)] (%d) =====",
                model.moduleCount()));
        int rank = 0;
        for (Statistics test : model.modulesByFailures()) {
            txt.append(format("%n%2d: %s", ++rank, counts(test)));
        }

        txt.append(format("%n%n===== TESTS BY FAILURE RATE [rank: name (total, passed, failed, failure rate)] (%d) =====",
                model.moduleCount()));
        rank = 0;
        for (ReportModel.ModuleEntry entry : model.modulesByQualityExtended()) {
            txt.append(format("%n%3d: %s", ++rank, counts(entry.statistics())));
            appendFailures(txt, entry.failures());
        }

        txt.append(format("%n%n===== WORST TEST TIMES [rank: name (total-time, passed, avg-time)] (%d) =====",
                model.moduleCount()));
        rank = 0;
        for (Statistics time : model.modulesByDuration()) {
            txt.append(format("%n%2d: %s (%.3f, %d, %.3f)",
                    ++rank, time.getName(), time.getTotalDuration(), time.getPassed(), time.getAverageDuration()));
        }

        appendQuality(txt, "WORST AGENTS", model.agentCount(), model.agentsByQuality());
        appendQuality(txt, "WORST JOBS", model.jobCount(), model.jobsByQuality());
        txt.append(System.lineSeparator());
        return txt.toString();
    }

    private void appendFailures(StringBuilder txt, FailureSample failures) {
        for (FailureSample.Suppression suppression : failures.suppressed()) {
            txt.append(format("%n       [ %s: suppressed %d additional failures ]",
                    suppression.testName(), suppression.count()));
        }
        for (ResultRecord failure : failures.shown()) {
            txt.append(format("%n     * %s (%s)", failure.leafSegment(), buildLink(failure)));
        }
    }

    private static void appendQuality(StringBuilder txt, String title, int count, List<Statistics> stats) {
        txt.append(format("%n%n===== %s [rank: name (total, passed, failed, quality)] (%d) =====", title, count));
        int rank = 0;
        for (Statistics stat : stats) {
            txt.append(format("%n%2d: %s (%d, %d, %d, %5.3f)",
                    ++rank, stat.getName(), stat.getTotal(), stat.getPassed(), stat.getFailed(), stat.getQuality()));
        }
    }

    private static String counts(Statistics stat) {
        return format("%s (%d, %d, %d, %5.2f%%)",
                stat.getName(), stat.getTotal(), stat.getPassed(), stat.getFailed(), stat.getFailureRate() * 100.0);
    }

    /** CI server page of the build that produced {@code record}. */
    public String buildLink(ResultRecord record) {
        return ciBrowseUrl + "/" + record.planName() + "-" + record.buildNumber();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
