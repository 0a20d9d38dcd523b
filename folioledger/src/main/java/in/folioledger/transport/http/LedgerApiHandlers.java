package in.folioledger.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.folioledger.service.audit.AuditDiff;
import in.folioledger.service.audit.AuditReport;
import in.folioledger.service.audit.IntegrityEngine;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * HTTP handlers for the ops endpoints.
 *
 * - GET /health - liveness and store type
 * - GET /api/audit - run the integrity checks now, with the diff against the previous run
 * - GET /api/audit/last - most recent report without running anything
 */
public final class LedgerApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(LedgerApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final IntegrityEngine engine;
    private final String store;

    public LedgerApiHandlers(IntegrityEngine engine, String store) {
        this.engine = engine;
        this.store = store;
    }

    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        health.put("store", store);
        AuditReport last = engine.lastReport();
        if (last != null) {
            health.put("lastAudit", last.runAt().toString());
        }
        sendJson(exchange, health);
    }

    public void audit(HttpServerExchange exchange) {
        try {
            AuditReport previous = engine.lastReport();
            AuditReport report = engine.run();
            AuditDiff diff = report.diff(previous);

            ObjectNode body = MAPPER.createObjectNode();
            body.set("report", MAPPER.valueToTree(report));
            body.set("diff", MAPPER.valueToTree(diff));
            sendJson(exchange, body);
        } catch (RuntimeException e) {
            log.error("[API] Audit failed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Audit failed: " + e.getMessage());
        }
    }

    public void lastAudit(HttpServerExchange exchange) {
        AuditReport last = engine.lastReport();
        if (last == null) {
            sendError(exchange, StatusCodes.NOT_FOUND, "No audit has run yet");
            return;
        }
        sendJson(exchange, MAPPER.valueToTree(last));
    }

    private void sendJson(HttpServerExchange exchange, Object data) {
        try {
            String json = MAPPER.writeValueAsString(data);
            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("[API] Failed to serialize response: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Serialization failed");
        }
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
