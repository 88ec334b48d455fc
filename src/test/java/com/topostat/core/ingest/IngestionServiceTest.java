package com.topostat.core.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.topostat.SampleRecords;
import com.topostat.core.error.ErrorKind;
import com.topostat.core.logging.MdcContext;
import com.topostat.core.message.EnvelopeCodec;
import com.topostat.core.message.MessageEnvelope;
import com.topostat.core.message.ResultRecordCodec;
import com.topostat.core.metrics.TopostatMetrics;
import com.topostat.core.model.Outcome;
import com.topostat.core.model.ResultRecord;
import com.topostat.core.normalize.Normalizer;
import com.topostat.core.persistence.DimensionType;
import com.topostat.core.persistence.InMemoryResultStore;
import com.topostat.core.persistence.PersistenceException;
import com.topostat.core.persistence.ResultStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

import static com.topostat.SampleRecords.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class IngestionServiceTest {

    private static final String CONVERGENCE = """
            {"version": 1, "name": "bgpd.test_basic.test_convergence", "result": "failed", "time": "1.5",
             "host": "h1", "timestamp": "2024-01-01 00:00:00.000000", "plan": "P", "build": "3", "job": "J"}
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final EnvelopeCodec envelopeCodec = new EnvelopeCodec(mapper);
    private final ResultRecordCodec recordCodec = new ResultRecordCodec(mapper);

    private SimpleMeterRegistry registry;
    private InMemoryResultStore store;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new InMemoryResultStore();
        service = serviceFor(store, "k");
    }

    private IngestionService serviceFor(ResultStore resultStore, String secret) {
        return new IngestionService(envelopeCodec, recordCodec, new Normalizer(resultStore), resultStore,
                SampleRecords.properties(secret, null), new TopostatMetrics(registry));
    }

    private String signed(String secret, String... records) throws Exception {
        List<JsonNode> payload = new ArrayList<>();
        for (String record : records) {
            payload.add(mapper.readTree(record));
        }
        var envelope = new MessageEnvelope(payload);
        envelope.generateAuth(secret);
        return envelopeCodec.encode(envelope);
    }

    private static String record(String name, String result) {
        return """
                {"version": 1, "name": "%s", "result": "%s", "time": "0.5", "host": "h1",
                 "timestamp": "2024-01-01 00:00:00.000000", "plan": "P", "build": "3", "job": "J"}
                """.formatted(name, result);
    }

    private double counter(String name, String status) {
        var counter = registry.find(name).tag("status", status).counter();
        return counter != null ? counter.count() : 0.0;
    }

    @Nested
    @DisplayName("accepted envelopes")
    class Accepted {

        @Test
        @DisplayName("one failed record creates one row per dimension and one fact")
        void singleRecord() throws Exception {
            IngestReport report = service.ingest(signed("k", CONVERGENCE));

            assertTrue(report.accepted());
            assertEquals(1, report.received());
            assertEquals(1, report.stored());
            assertEquals("2024-01-01 00:00:00.000000".length(), report.envelope().length());
            for (DimensionType type : DimensionType.values()) {
                assertEquals(1, store.countDimensions(type), type.name());
            }
            assertEquals(1, store.countResults());

            List<ResultRecord> stored = store.findResults("P", T0, T0);
            assertEquals(1, stored.size());
            assertEquals(Outcome.FAILED, stored.get(0).outcome());
            assertEquals("bgpd.test_basic.test_convergence", stored.get(0).name());
            assertEquals(1.0, counter("topostat.envelopes.total", "accepted"));
            assertEquals(1.0, counter("topostat.records.total", "stored"));
        }

        @Test
        @DisplayName("resubmitting the same envelope adds a fact but no dimension rows")
        void resubmission() throws Exception {
            String envelope = signed("k", CONVERGENCE);
            service.ingest(envelope);
            service.ingest(envelope);

            for (DimensionType type : DimensionType.values()) {
                assertEquals(1, store.countDimensions(type), type.name());
            }
            assertEquals(2, store.countResults());
        }

        @Test
        @DisplayName("records sharing dimensions in one batch create them once")
        void sharedDimensionsInBatch() throws Exception {
            IngestReport report = service.ingest(signed("k",
                    record("bgpd.test_basic.test_a", "passed"),
                    record("bgpd.test_basic.test_b", "failed"),
                    record("bgpd.test_other.test_a", "skipped")));

            assertEquals(3, report.stored());
            assertEquals(1, store.countDimensions(DimensionType.DIRECTORY));
            assertEquals(2, store.countDimensions(DimensionType.MODULE));
            assertEquals(3, store.countDimensions(DimensionType.TEST));
            assertEquals(1, store.countDimensions(DimensionType.AGENT));
        }

        @Test
        @DisplayName("bad records are discarded one by one while the rest of the batch is stored")
        void mixedBatch() throws Exception {
            IngestReport report = service.ingest(signed("k",
                    record("bgpd.test_basic.test_a", "passed"),
                    record("bgpd.test_basic.test_b", "broken"),
                    record("bgpd.test_convergence", "failed"),
                    record("bgpd.test_basic.test_c", "failed")));

            assertTrue(report.accepted());
            assertEquals(4, report.received());
            assertEquals(2, report.stored());
            assertEquals(1, report.invalidCount(ErrorKind.STRUCTURAL));
            assertEquals(1, report.invalidCount(ErrorKind.NORMALIZATION));
            assertEquals(2, report.invalidCount());
            assertEquals(2, store.countResults());
            assertEquals(1.0, registry.find("topostat.records.total")
                    .tag("status", "invalid").tag("reason", "normalization").counter().count());
        }

        @Test
        @DisplayName("an empty payload is accepted and stores nothing")
        void emptyPayload() throws Exception {
            IngestReport report = service.ingest(signed("k"));
            assertTrue(report.accepted());
            assertEquals(0, report.received());
            assertEquals(0, store.countResults());
        }

        @Test
        @DisplayName("a failed commit discards only its record and later records recreate its rows")
        void persistenceFailureIsolated() throws Exception {
            InMemoryResultStore failing = spy(new InMemoryResultStore());
            doThrow(new PersistenceException("connection lost"))
                    .doCallRealMethod()
                    .when(failing).commit(any());
            IngestionService isolated = serviceFor(failing, "k");

            IngestReport report = isolated.ingest(signed("k",
                    record("bgpd.test_basic.test_a", "failed"),
                    record("bgpd.test_basic.test_b", "passed")));

            assertEquals(1, report.stored());
            assertEquals(1, report.invalidCount(ErrorKind.PERSISTENCE));
            assertEquals(1, failing.countResults());
            assertEquals(1, failing.countDimensions(DimensionType.DIRECTORY));
            assertEquals(1, failing.countDimensions(DimensionType.TEST));
            assertEquals("bgpd.test_basic.test_b", failing.findResults("P", T0, T0).get(0).name());
        }
    }

    @Nested
    @DisplayName("rejected envelopes")
    class Rejected {

        @Test
        @DisplayName("a wrong secret discards the whole envelope")
        void wrongSecret() throws Exception {
            IngestReport report = service.ingest(signed("other", CONVERGENCE, record("a.b.c", "passed")));

            assertFalse(report.accepted());
            assertEquals(ErrorKind.AUTH, report.rejection());
            assertEquals(0, report.stored());
            assertEquals(0, store.countResults());
            assertEquals(0, store.countDimensions(DimensionType.DIRECTORY));
            assertEquals(1.0, registry.find("topostat.envelopes.total")
                    .tag("status", "rejected").tag("reason", "auth").counter().count());
        }

        @Test
        @DisplayName("without a configured secret nothing authenticates")
        void noSecretConfigured() throws Exception {
            IngestReport report = serviceFor(store, null).ingest(signed("k", CONVERGENCE));
            assertEquals(ErrorKind.AUTH, report.rejection());
            assertEquals(0, store.countResults());
        }

        @Test
        @DisplayName("an empty configured secret rejects envelopes signed with the empty secret")
        void emptySecretConfigured() throws Exception {
            IngestReport report = serviceFor(store, "").ingest(signed("", CONVERGENCE));

            assertFalse(report.accepted());
            assertEquals(ErrorKind.AUTH, report.rejection());
            assertEquals(0, store.countResults());
            assertEquals(0, store.countDimensions(DimensionType.DIRECTORY));
        }

        @Test
        @DisplayName("malformed JSON is a structural rejection")
        void malformed() {
            IngestReport report = service.ingest("{\"version\": 1, ");
            assertEquals(ErrorKind.STRUCTURAL, report.rejection());
            assertNull(report.envelope());
        }

        @Test
        @DisplayName("an unknown protocol version is a structural rejection")
        void unknownVersion() {
            String json = "{\"version\": 2, \"auth\": \"%s\", \"timestamp\": \"2024-01-01 00:00:00.000000\", \"payload\": []}"
                    .formatted("ab");
            IngestReport report = service.ingest(json);
            assertEquals(ErrorKind.STRUCTURAL, report.rejection());
            assertEquals("2024-01-01 00:00:00.000000", report.envelope());
        }
    }

    @Test
    @DisplayName("MDC keys are cleared after every envelope")
    void clearsMdc() throws Exception {
        service.ingest(signed("k", CONVERGENCE));
        assertNull(MDC.get(MdcContext.ENVELOPE));
        assertNull(MDC.get(MdcContext.AGENT));
        assertNull(MDC.get(MdcContext.PLAN));
    }

    @Test
    @DisplayName("records the ingest duration for every envelope, accepted or not")
    void recordsDuration() throws Exception {
        service.ingest(signed("k", CONVERGENCE));
        service.ingest("garbage");
        assertEquals(2, registry.find("topostat.ingest.duration").timer().count());
    }

    @Test
    @DisplayName("a store failing every commit stores nothing but keeps the envelope accepted")
    void allCommitsFail() throws Exception {
        ResultStore broken = mock(ResultStore.class);
        doThrow(new PersistenceException("read-only")).when(broken).commit(any());

        IngestReport report = serviceFor(broken, "k").ingest(signed("k", CONVERGENCE, CONVERGENCE));

        assertTrue(report.accepted());
        assertEquals(0, report.stored());
        assertEquals(2, report.invalidCount(ErrorKind.PERSISTENCE));
        verify(broken, times(2)).commit(any());
    }
}
