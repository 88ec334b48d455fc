package com.topostat.dispatch.cli;

import com.topostat.core.report.TextReportRenderer;
import com.topostat.core.stats.ReportModel;
import com.topostat.core.stats.StatisticsService;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.Callable;

/**
 * CLI command: topostat stats
 * <p>
 * Computes the statistics report of a plan over the last days (default from
 * {@code topostat.report.default-days}) or an explicit UTC date range, and prints it
 * or writes it to a file.
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Render the test statistics report")
@Component
public class StatsCommand implements Callable<Integer> {

    @Option(names = {"--plan", "-p"}, required = true, description = "CI plan")
    private String plan;

    @Option(names = "--days", description = "Window length in days, ending now")
    private Integer days;

    @Option(names = "--from", description = "First day of the window (yyyy-MM-dd, UTC)")
    private LocalDate from;

    @Option(names = "--to", description = "Last day of the window (yyyy-MM-dd, UTC, default today)")
    private LocalDate to;

    @Option(names = {"--output", "-o"}, description = "Write the report to this file instead of stdout")
    private Path output;

    private final StatisticsService statisticsService;
    private final TextReportRenderer renderer;

    public StatsCommand(StatisticsService statisticsService, TextReportRenderer renderer) {
        this.statisticsService = statisticsService;
        this.renderer = renderer;
    }

    @Override
    public Integer call() {
        ReportModel model;
        try {
            if (from != null) {
                LocalDate last = to != null ? to : LocalDate.now(ZoneOffset.UTC);
                if (last.isBefore(from)) {
                    ConsoleOutput.error("--to " + last + " is before --from " + from);
                    return SubmitCommand.EXIT_USAGE;
                }
                Instant start = from.atStartOfDay(ZoneOffset.UTC).toInstant();
                Instant end = last.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1000);
                model = statisticsService.compute(plan, start, end);
            } else {
                model = statisticsService.lastDays(plan, days != null ? days : statisticsService.getDefaultDays());
            }
        } catch (DataAccessException e) {
            ConsoleOutput.error("Failed to read results: " + e.getMessage());
            return SubmitCommand.EXIT_FAILED;
        }

        String text = renderer.render(model);
        if (output == null) {
            System.out.print(text);
            return 0;
        }
        try {
            Files.writeString(output, text, StandardCharsets.UTF_8);
            ConsoleOutput.success("Wrote report of " + model.windowTotal() + " result(s) to " + output);
            return 0;
        } catch (IOException e) {
            ConsoleOutput.error("Failed to write report to " + output + ": " + e.getMessage());
            return 1;
        }
    }
}
