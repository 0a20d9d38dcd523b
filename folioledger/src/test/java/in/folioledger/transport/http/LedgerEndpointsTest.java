package in.folioledger.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.folioledger.bootstrap.LedgerStore;
import in.folioledger.config.LedgerConfig;
import in.folioledger.infrastructure.metrics.PrometheusLedgerMetrics;
import in.folioledger.service.audit.IntegrityEngine;
import in.folioledger.service.fx.FxResolver;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ops endpoints served by a real Undertow listener over an in-memory ledger.
 */
public class LedgerEndpointsTest {

    private static final int TEST_PORT = 19090;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Undertow server;
    private PrometheusLedgerMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        LedgerConfig config = LedgerConfig.defaults();
        LedgerStore store = LedgerStore.memory();
        metrics = new PrometheusLedgerMetrics(new CollectorRegistry());
        IntegrityEngine engine = IntegrityEngine.standard(config, store::view,
            FxResolver.standard(config, store.snapshots(), store.fxRates(), null), metrics);
        LedgerApiHandlers api = new LedgerApiHandlers(engine, store.kind());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/health", api::health)
                .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
                .get("/api/audit", api::audit)
                .get("/api/audit/last", api::lastAudit))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testHealthReportsStore() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("ok", body.get("status").asText());
        assertEquals("memory", body.get("store").asText());
        assertFalse(body.has("lastAudit"), "No audit has run yet");
    }

    @Test
    public void testLastAuditBeforeFirstRunIsNotFound() throws Exception {
        HttpResponse<String> response = get("/api/audit/last");

        assertEquals(404, response.statusCode());
        assertEquals("No audit has run yet", response.body());
    }

    @Test
    public void testAuditRunsChecksAndIsRemembered() throws Exception {
        HttpResponse<String> response = get("/api/audit");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertTrue(body.get("report").get("checksRun").size() > 0);
        JsonNode findings = body.get("report").get("findings");
        assertEquals(1, findings.size(), "Empty ledger only reports the skipped balance check");
        assertEquals("balance", findings.get(0).get("checkId").asText());
        assertEquals("INFO", findings.get(0).get("severity").asText());
        assertTrue(body.has("diff"));

        HttpResponse<String> last = get("/api/audit/last");
        assertEquals(200, last.statusCode());
        assertEquals(body.get("report").get("runAt").asText(), MAPPER.readTree(last.body()).get("runAt").asText());

        assertTrue(MAPPER.readTree(get("/health").body()).has("lastAudit"));
    }

    @Test
    public void testMetricsExposeImportAndAuditSeries() throws Exception {
        metrics.recordRecords("DIVIDEND_REPORT", "created", 42);
        metrics.recordFile("DIVIDEND_REPORT", "ok", Duration.ofMillis(120));
        get("/api/audit");

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"));
        String body = response.body();
        assertTrue(body.contains("# TYPE folioledger_import_records_total counter"));
        assertTrue(body.contains("folioledger_import_records_total{format=\"DIVIDEND_REPORT\",outcome=\"created\",} 42.0"));
        assertTrue(body.contains("folioledger_import_files_total{format=\"DIVIDEND_REPORT\",status=\"ok\",} 1.0"));
        assertTrue(body.contains("folioledger_audit_findings{check=\"orphans\",severity=\"WARNING\",} 0.0"));
    }
}
