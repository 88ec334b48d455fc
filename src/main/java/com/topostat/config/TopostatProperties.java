package com.topostat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Immutable configuration bound once at startup from {@code topostat.*}.
 * <p>
 * Secrets are never rendered by {@code toString()}.
 */
@ConfigurationProperties(prefix = "topostat")
public record TopostatProperties(
        @DefaultValue Collector collector,
        @DefaultValue Agent agent,
        @DefaultValue Report report
) {

    static final String MASK = "***";

    public TopostatProperties {
        collector = collector != null ? collector : new Collector(null, 0, null);
        agent = agent != null ? agent : new Agent(null, null, null, null);
        report = report != null ? report : new Report(null, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Collector side: envelope authentication and the in-process ingestion queue.
     */
    public record Collector(
            String authKey,
            @DefaultValue("1000") int queueCapacity,
            @DefaultValue("1s") Duration pollTimeout
    ) {
        public Collector {
            queueCapacity = queueCapacity > 0 ? queueCapacity : 1000;
            pollTimeout = pollTimeout != null ? pollTimeout : Duration.ofSeconds(1);
        }

        public boolean hasAuthKey() {
            return authKey != null && !authKey.isEmpty();
        }

        @Override
        public String toString() {
            return "Collector[authKey=" + (hasAuthKey() ? MASK : "<unset>")
                    + ", queueCapacity=" + queueCapacity + ", pollTimeout=" + pollTimeout + "]";
        }
    }

    /**
     * Agent side: where and how results are uploaded.
     */
    public record Agent(
            @DefaultValue("http://localhost:8080") String serverUrl,
            String authKey,
            @DefaultValue("15s") Duration connectionTimeout,
            String name
    ) {
        public Agent {
            serverUrl = serverUrl != null ? serverUrl : "http://localhost:8080";
            connectionTimeout = connectionTimeout != null ? connectionTimeout : Duration.ofSeconds(15);
        }

        public boolean hasAuthKey() {
            return authKey != null && !authKey.isEmpty();
        }

        @Override
        public String toString() {
            return "Agent[serverUrl=" + serverUrl + ", authKey=" + (hasAuthKey() ? MASK : "<unset>")
                    + ", connectionTimeout=" + connectionTimeout + ", name=" + name + "]";
        }
    }

    /**
     * Statistics report: CI links, default window and ranking cut-offs.
     */
    public record Report(
            @DefaultValue("https://ci1.netdef.org/browse") String ciBrowseUrl,
            @DefaultValue("7") int defaultDays,
            @DefaultValue("20") int worstByQuality,
            @DefaultValue("100") int extendedByQuality,
            @DefaultValue("20") int worstByFailures,
            @DefaultValue("10") int worstByDuration,
            @DefaultValue("10") int worstAgents,
            @DefaultValue("10") int worstJobs,
            @DefaultValue("3") int failuresPerTest
    ) {
        public Report {
            ciBrowseUrl = ciBrowseUrl != null ? ciBrowseUrl : "https://ci1.netdef.org/browse";
            defaultDays = defaultDays > 0 ? defaultDays : 7;
            worstByQuality = worstByQuality > 0 ? worstByQuality : 20;
            extendedByQuality = extendedByQuality > 0 ? extendedByQuality : 100;
            worstByFailures = worstByFailures > 0 ? worstByFailures : 20;
            worstByDuration = worstByDuration > 0 ? worstByDuration : 10;
            worstAgents = worstAgents > 0 ? worstAgents : 10;
            worstJobs = worstJobs > 0 ? worstJobs : 10;
            failuresPerTest = failuresPerTest > 0 ? failuresPerTest : 3;
        }
    }
}
