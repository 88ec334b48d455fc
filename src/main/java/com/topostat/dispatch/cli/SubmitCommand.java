package com.topostat.dispatch.cli;

import com.topostat.agent.EnvelopeSink;
import com.topostat.agent.HttpEnvelopeSink;
import com.topostat.agent.JUnitReportParser;
import com.topostat.agent.PlatformProbe;
import com.topostat.agent.ResultGatherer;
import com.topostat.agent.UploadService;
import com.topostat.config.TopostatProperties;
import com.topostat.core.model.BuildContext;
import com.topostat.core.model.PlatformInfo;
import com.topostat.core.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: topostat submit
 * <p>
 * Agent side: parses a JUnit XML report, gathers the results and uploads them to the
 * collector in one authenticated envelope. Plan, build and job default to the Bamboo
 * variables {@code bamboo_planKey}, {@code bamboo_buildNumber} and {@code bamboo_shortJobName}.
 */
@Command(name = "submit", mixinStandardHelpOptions = true,
        description = "Upload JUnit test results to the collector")
@Component
public class SubmitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SubmitCommand.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Option(names = {"--file", "-f"}, required = true, description = "JUnit XML report")
    private Path file;

    @Option(names = "--plan", defaultValue = "${env:bamboo_planKey}", description = "CI plan (default: $bamboo_planKey)")
    private String plan;

    @Option(names = "--build", defaultValue = "${env:bamboo_buildNumber}",
            description = "CI build number (default: $bamboo_buildNumber)")
    private String build;

    @Option(names = "--job", defaultValue = "${env:bamboo_shortJobName}",
            description = "CI job (default: $bamboo_shortJobName)")
    private String job;

    @Option(names = "--agent", description = "Agent name (default: topostat.agent.name or host name)")
    private String agent;

    @Option(names = "--server", description = "Collector base URL (default: topostat.agent.server-url)")
    private String server;

    @Option(names = "--key", description = "Shared secret (default: topostat.agent.auth-key)")
    private String key;

    @Option(names = "--platform", description = "Attach platform information (schema version 2)")
    private boolean platform;

    private final JUnitReportParser parser;
    private final ResultGatherer gatherer;
    private final PlatformProbe probe;
    private final UploadService uploadService;
    private final EnvelopeSink sink;
    private final TopostatProperties properties;

    public SubmitCommand(JUnitReportParser parser, ResultGatherer gatherer, PlatformProbe probe,
                         UploadService uploadService, EnvelopeSink sink, TopostatProperties properties) {
        this.parser = parser;
        this.gatherer = gatherer;
        this.probe = probe;
        this.uploadService = uploadService;
        this.sink = sink;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        BuildContext context = buildContext();
        if (!context.isValid()) {
            ConsoleOutput.error("Missing or invalid CI context " + context
                    + "; pass --plan/--build/--job or set the bamboo_* variables");
            return EXIT_USAGE;
        }

        List<TestCase> cases;
        try {
            cases = parser.parse(file);
            log.info("Parsed JUnit XML file {}", file);
        } catch (IOException e) {
            ConsoleOutput.error("Failed to parse JUnit XML file " + file + ": " + e.getMessage());
            return EXIT_FAILED;
        }

        PlatformInfo platformInfo = null;
        if (platform) {
            platformInfo = probe.probe().orElse(null);
            if (platformInfo == null) {
                ConsoleOutput.warn("Platform information unavailable; sending version 1 records");
            }
        }

        ResultGatherer.Gathered gathered = gatherer.gather(cases, context, platformInfo);
        ConsoleOutput.gathered(gathered);

        EnvelopeSink target = server != null
                ? new HttpEnvelopeSink(server, properties.agent().connectionTimeout()) : sink;
        String secret = key != null ? key : properties.agent().authKey();
        UploadService.Outcome outcome = uploadService.upload(gathered.records(), target, secret);
        switch (outcome) {
            case SENT -> ConsoleOutput.success("Sent " + gathered.valid() + " result(s)");
            case NOTHING_TO_SEND -> ConsoleOutput.info("No results to send");
            case TIMED_OUT -> ConsoleOutput.error("Upload watchdog expired; results not sent");
            case FAILED -> ConsoleOutput.error("Failed to send results");
        }
        return outcome == UploadService.Outcome.SENT || outcome == UploadService.Outcome.NOTHING_TO_SEND
                ? 0 : EXIT_FAILED;
    }

    BuildContext buildContext() {
        String agentName = agent != null ? agent
                : properties.agent().name() != null ? properties.agent().name() : probe.hostName();
        return new BuildContext(agentName, plan, parseBuild(build), job);
    }

    private static int parseBuild(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
