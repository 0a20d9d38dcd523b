package in.folioledger.service.fx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Daily reference rates over HTTP.
 *
 * Requests {@code {baseUrl}/{date}?from={currency}&to={base}} and reads
 * {@code rates.{base}} from the JSON body (the format served by ECB-backed rate APIs such as
 * Frankfurter). Timeouts, non-200 answers and unreadable bodies are logged and reported as
 * "no rate".
 */
public final class HttpFxRateSource implements ExternalRateSource {
    private static final Logger log = LoggerFactory.getLogger(HttpFxRateSource.class);

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HttpFxRateSource(String baseUrl, Duration timeout) {
        this(baseUrl, timeout, HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    HttpFxRateSource(String baseUrl, Duration timeout, HttpClient httpClient) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.httpClient = httpClient;
    }

    @Override
    public Optional<BigDecimal> fetch(String currency, LocalDate date, String baseCurrency) {
        URI uri = URI.create(baseUrl + "/" + date + "?from=" + currency + "&to=" + baseCurrency);
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("[FX] Rate lookup {} returned HTTP {}", uri, response.statusCode());
                return Optional.empty();
            }
            return parseRate(response.body(), baseCurrency);

        } catch (IOException e) {
            log.warn("[FX] Rate lookup {} failed: {}", uri, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[FX] Rate lookup {} interrupted", uri);
            return Optional.empty();
        }
    }

    Optional<BigDecimal> parseRate(String body, String baseCurrency) throws IOException {
        JsonNode json = objectMapper.readTree(body);
        JsonNode rate = json.path("rates").path(baseCurrency);
        if (!rate.isNumber() && !rate.isTextual()) {
            log.warn("[FX] Rate response without rates.{}: {}", baseCurrency, body);
            return Optional.empty();
        }
        try {
            BigDecimal value = new BigDecimal(rate.asText());
            return value.signum() > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            log.warn("[FX] Unreadable rate '{}' for {}", rate.asText(), baseCurrency);
            return Optional.empty();
        }
    }
}
