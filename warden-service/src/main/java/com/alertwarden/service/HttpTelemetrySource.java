package com.alertwarden.service;

import com.alertwarden.core.evaluation.EvaluationException;
import com.alertwarden.core.evaluation.EvaluationException.Reason;
import com.alertwarden.core.evaluation.TelemetrySource;
import com.alertwarden.core.model.Aggregation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * HTTP client for the telemetry backend's aggregate endpoint.
 *
 * <pre>
 *   GET {baseUrl}/aggregate?query=...&amp;aggregation=p95&amp;window=PT5M
 *   200 {"value": 123.4}
 * </pre>
 *
 * <p>
 * A missing or {@code null} value, or status 204, means the backend has no
 * data for the window. Any other non-2xx status or I/O failure means the
 * backend is unavailable.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpTelemetrySource implements TelemetrySource {

    private static final Logger LOG = LoggerFactory.getLogger(HttpTelemetrySource.class);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpTelemetrySource(String baseUrl, Duration requestTimeout) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(requestTimeout).build(), new ObjectMapper(),
                requestTimeout);
    }

    public HttpTelemetrySource(String baseUrl, HttpClient httpClient, ObjectMapper objectMapper,
            Duration requestTimeout) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    @Override
    public double queryAggregate(String conditionQuery, Aggregation aggregation, Duration window)
            throws EvaluationException {
        URI uri = buildUri(conditionQuery, aggregation, window);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EvaluationException(Reason.UNAVAILABLE,
                    "Telemetry request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EvaluationException(Reason.UNAVAILABLE, "Telemetry request interrupted", e);
        }

        int status = response.statusCode();
        if (status == 204) {
            throw new EvaluationException(Reason.NO_DATA, "No data for '" + conditionQuery + "'");
        }
        if (status < 200 || status >= 300) {
            throw new EvaluationException(Reason.UNAVAILABLE,
                    String.format("Telemetry query failed: HTTP %d - %s", status, response.body()));
        }
        return parseValue(conditionQuery, response.body());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    URI buildUri(String conditionQuery, Aggregation aggregation, Duration window) {
        return URI.create(baseUrl + "/aggregate"
                + "?query=" + URLEncoder.encode(conditionQuery, StandardCharsets.UTF_8)
                + "&aggregation=" + URLEncoder.encode(aggregation.toString(), StandardCharsets.UTF_8)
                + "&window=" + window);
    }

    private double parseValue(String conditionQuery, String body) throws EvaluationException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EvaluationException(Reason.MALFORMED_RESULT,
                    "Failed to parse telemetry response: " + e.getOriginalMessage(), e);
        }
        JsonNode value = root == null ? null : root.get("value");
        if (value == null || value.isNull()) {
            throw new EvaluationException(Reason.NO_DATA, "No data for '" + conditionQuery + "'");
        }
        if (!value.isNumber()) {
            throw new EvaluationException(Reason.MALFORMED_RESULT,
                    "Telemetry value is not a number: " + value);
        }
        LOG.trace("Telemetry '{}' = {}", conditionQuery, value);
        return value.doubleValue();
    }
}
