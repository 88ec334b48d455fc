package com.topostat.core.stats;

import com.topostat.SampleRecords;
import com.topostat.core.model.Outcome;
import com.topostat.core.model.ResultRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.topostat.SampleRecords.T0;
import static org.junit.jupiter.api.Assertions.*;

class AggregationEngineTest {

    private static final Instant TO = T0.plusSeconds(3600);

    private final AggregationEngine engine = new AggregationEngine(ReportPolicy.DEFAULTS);

    private static ResultRecord at(String name, Outcome outcome, int second) {
        return SampleRecords.record(name, outcome, T0.plusSeconds(second));
    }

    private static List<String> names(List<Statistics> stats) {
        return stats.stream().map(Statistics::getName).toList();
    }

    @Nested
    @DisplayName("statistics")
    class Tallies {

        @Test
        @DisplayName("modules are keyed by the leading name segment")
        void modulesByLeadingSegment() {
            ReportModel model = engine.computeReport("P", T0, TO, List.of(
                    at("bgpd.test_a.t1", Outcome.PASSED, 0),
                    at("bgpd.test_b.t1", Outcome.FAILED, 1),
                    at("ospfd.test_a.t1", Outcome.PASSED, 2)));

            assertEquals(2, model.moduleCount());
            Statistics bgpd = model.modulesByQuality().get(0);
            assertEquals("bgpd", bgpd.getName());
            assertEquals(2, bgpd.getTotal());
            assertEquals(0.5, bgpd.getQuality());
        }

        @Test
        @DisplayName("a module with only skipped results is listed with quality 0.0")
        void onlySkipped() {
            ReportModel model = engine.computeReport("P", T0, TO, List.of(
                    at("bgpd.test_a.t1", Outcome.SKIPPED, 0),
                    at("ospfd.test_a.t1", Outcome.PASSED, 1)));

            Statistics bgpd = model.modulesByQuality().get(0);
            assertEquals("bgpd", bgpd.getName());
            assertEquals(0, bgpd.getTotal());
            assertEquals(0.0, bgpd.getQuality());
            assertEquals(2, model.windowTotal());
        }

        @Test
        @DisplayName("average duration uses passed results only")
        void averageDuration() {
            List<ResultRecord> records = List.of(
                    SampleRecords.record("bgpd.a.t1", Outcome.PASSED, T0, 2.0, "h1", 1, "J"),
                    SampleRecords.record("bgpd.a.t2", Outcome.PASSED, T0, 4.0, "h1", 1, "J"),
                    SampleRecords.record("bgpd.a.t3", Outcome.FAILED, T0, 100.0, "h1", 1, "J"),
                    SampleRecords.record("ospfd.a.t1", Outcome.PASSED, T0, 10.0, "h1", 1, "J"));

            ReportModel model = engine.computeReport("P", T0, TO, records);

            assertEquals(List.of("ospfd", "bgpd"), names(model.modulesByDuration()));
            Statistics bgpd = model.modulesByDuration().get(1);
            assertEquals(6.0, bgpd.getTotalDuration());
            assertEquals(3.0, bgpd.getAverageDuration());
        }

        @Test
        @DisplayName("agents and jobs are tallied independently of modules")
        void agentsAndJobs() {
            List<ResultRecord> records = List.of(
                    SampleRecords.record("bgpd.a.t1", Outcome.FAILED, T0, 1.0, "h1", 1, "J1"),
                    SampleRecords.record("bgpd.a.t1", Outcome.PASSED, T0, 1.0, "h2", 1, "J2"),
                    SampleRecords.record("bgpd.a.t1", Outcome.PASSED, T0, 1.0, "h2", 2, "J1"));

            ReportModel model = engine.computeReport("P", T0, TO, records);

            assertEquals(2, model.agentCount());
            assertEquals(List.of("h1", "h2"), names(model.agentsByQuality()));
            assertEquals(2, model.jobCount());
            assertEquals(List.of("J1", "J2"), names(model.jobsByQuality()));
            assertEquals(0.5, model.jobsByQuality().get(0).getQuality());
        }

        @Test
        @DisplayName("records of other plans, outside the window or invalid are ignored")
        void filtersWindow() {
            List<ResultRecord> records = List.of(
                    at("bgpd.a.t1", Outcome.PASSED, 0),
                    SampleRecords.record("bgpd.a.t1", Outcome.PASSED, T0.minusSeconds(1)),
                    SampleRecords.record("bgpd.a.t1", Outcome.PASSED, TO.plusSeconds(1)),
                    new ResultRecord(1, "bgpd.a.t1", Outcome.FAILED, 1.0, "h1", T0, "Q", 1, "J", null),
                    at("skipped.skipped", Outcome.FAILED, 0));

            ReportModel model = engine.computeReport("P", T0, TO, records, 42);

            assertEquals(1, model.windowTotal());
            assertEquals(42, model.storedTotal());
            assertEquals(1.0, model.modulesByQuality().get(0).getQuality());
        }

        @Test
        @DisplayName("an empty window yields empty rankings")
        void emptyWindow() {
            ReportModel model = engine.computeReport("P", T0, TO, List.of());
            assertEquals(0, model.moduleCount());
            assertTrue(model.modulesByFailures().isEmpty());
            assertTrue(model.modulesByQualityExtended().isEmpty());
        }
    }

    @Nested
    @DisplayName("rankings")
    class Rankings {

        @Test
        @DisplayName("ties keep first-seen order")
        void stableTies() {
            ReportModel model = engine.computeReport("P", T0, TO, List.of(
                    at("zebra.a.t1", Outcome.PASSED, 0),
                    at("zebra.a.t1", Outcome.FAILED, 1),
                    at("alpha.a.t1", Outcome.PASSED, 2),
                    at("alpha.a.t1", Outcome.FAILED, 3)));

            assertEquals(List.of("zebra", "alpha"), names(model.modulesByQuality()));
            assertEquals(List.of("zebra", "alpha"), names(model.modulesByFailures()));
        }

        @Test
        @DisplayName("failure ranking is descending, quality ranking ascending")
        void orderDirections() {
            List<ResultRecord> records = new ArrayList<>();
            records.add(at("good.a.t1", Outcome.PASSED, 0));
            records.add(at("bad.a.t1", Outcome.FAILED, 1));
            records.add(at("bad.a.t1", Outcome.FAILED, 2));
            records.add(at("mixed.a.t1", Outcome.FAILED, 3));
            records.add(at("mixed.a.t1", Outcome.PASSED, 4));

            ReportModel model = engine.computeReport("P", T0, TO, records);

            assertEquals(List.of("bad", "mixed", "good"), names(model.modulesByFailures()));
            assertEquals(List.of("bad", "mixed", "good"), names(model.modulesByQuality()));
        }

        @Test
        @DisplayName("rankings are cut at the policy limits")
        void limits() {
            var tight = new AggregationEngine(new ReportPolicy(1, 2, 1, 1, 1, 1, 3));
            ReportModel model = tight.computeReport("P", T0, TO, List.of(
                    at("a.x.t", Outcome.FAILED, 0),
                    at("b.x.t", Outcome.FAILED, 1),
                    at("c.x.t", Outcome.FAILED, 2)));

            assertEquals(3, model.moduleCount());
            assertEquals(1, model.modulesByQuality().size());
            assertEquals(2, model.modulesByQualityExtended().size());
            assertEquals(1, model.modulesByFailures().size());
        }
    }

    @Nested
    @DisplayName("failure sampling")
    class Sampling {

        @Test
        @DisplayName("five failures of one test show the three most recent and suppress two")
        void suppressesOlderFailures() {
            List<ResultRecord> window = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                window.add(at("bgpd.test_basic.test_x", Outcome.FAILED, i));
            }

            FailureSample sample = engine.sampleFailures(window, "bgpd");

            assertEquals(3, sample.shown().size());
            assertEquals(T0.plusSeconds(2), sample.shown().get(0).timestamp());
            assertEquals(T0.plusSeconds(4), sample.shown().get(2).timestamp());
            assertEquals(List.of(new FailureSample.Suppression("test_x", 2)), sample.suppressed());
        }

        @Test
        @DisplayName("limits apply per leaf test name and ignore other modules and passes")
        void perLeaf() {
            List<ResultRecord> window = List.of(
                    at("bgpd.m.test_x", Outcome.FAILED, 0),
                    at("bgpd.m.test_y", Outcome.FAILED, 1),
                    at("bgpd.m.test_y", Outcome.PASSED, 2),
                    at("ospfd.m.test_x", Outcome.FAILED, 3));

            FailureSample sample = engine.sampleFailures(window, "bgpd");

            assertEquals(List.of("bgpd.m.test_x", "bgpd.m.test_y"),
                    sample.shown().stream().map(ResultRecord::name).toList());
            assertTrue(sample.suppressed().isEmpty());
        }

        @Test
        @DisplayName("a module without failures has an empty sample")
        void noFailures() {
            assertSame(FailureSample.NONE,
                    engine.sampleFailures(List.of(at("bgpd.m.t", Outcome.PASSED, 0)), "bgpd"));
        }

        @Test
        @DisplayName("the extended quality view carries the samples")
        void extendedViewCarriesSamples() {
            List<ResultRecord> records = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                records.add(at("bgpd.m.test_x", Outcome.FAILED, i));
            }
            ReportModel model = engine.computeReport("P", T0, TO, records);

            FailureSample sample = model.modulesByQualityExtended().get(0).failures();
            assertEquals(3, sample.shown().size());
            assertEquals(1, sample.suppressed().get(0).count());
        }
    }

    @Test
    @DisplayName("report policy rejects a zero failure sample size")
    void policyValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ReportPolicy(1, 1, 1, 1, 1, 1, 0));
    }
}
