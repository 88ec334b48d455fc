package com.topostat.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TopostatPropertiesTest {

    private static TopostatProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bindOrCreate("topostat", TopostatProperties.class);
    }

    @Test
    @DisplayName("defaults apply when nothing is configured")
    void defaults() {
        var props = bind(Map.of());

        assertFalse(props.collector().hasAuthKey());
        assertEquals(1000, props.collector().queueCapacity());
        assertEquals(Duration.ofSeconds(1), props.collector().pollTimeout());
        assertEquals("http://localhost:8080", props.agent().serverUrl());
        assertEquals(Duration.ofSeconds(15), props.agent().connectionTimeout());
        assertEquals("https://ci1.netdef.org/browse", props.report().ciBrowseUrl());
        assertEquals(7, props.report().defaultDays());
        assertEquals(100, props.report().extendedByQuality());
        assertEquals(3, props.report().failuresPerTest());
    }

    @Test
    @DisplayName("binds kebab-case keys including durations")
    void binds() {
        var props = bind(Map.of(
                "topostat.collector.auth-key", "s3cret",
                "topostat.collector.queue-capacity", "5",
                "topostat.agent.connection-timeout", "30s",
                "topostat.agent.name", "ci-agent-1",
                "topostat.report.worst-agents", "4"));

        assertEquals("s3cret", props.collector().authKey());
        assertEquals(5, props.collector().queueCapacity());
        assertEquals(Duration.ofSeconds(30), props.agent().connectionTimeout());
        assertEquals("ci-agent-1", props.agent().name());
        assertEquals(4, props.report().worstAgents());
    }

    @Test
    @DisplayName("direct construction fills missing sections and non-positive limits")
    void constructorDefaults() {
        var props = new TopostatProperties(null, null, new TopostatProperties.Report(null, 0, -1, 0, 0, 0, 0, 0, 0));
        assertNotNull(props.collector());
        assertNotNull(props.agent());
        assertEquals(20, props.report().worstByQuality());
        assertEquals(10, props.report().worstJobs());
    }

    @Test
    @DisplayName("toString never renders auth keys")
    void masksSecrets() {
        var props = bind(Map.of(
                "topostat.collector.auth-key", "collector-secret",
                "topostat.agent.auth-key", "agent-secret"));

        String rendered = props.toString();
        assertFalse(rendered.contains("collector-secret"));
        assertFalse(rendered.contains("agent-secret"));
        assertTrue(rendered.contains(TopostatProperties.MASK));
    }
}
