package com.phillippitts.autoremediation.service.snapshot;

import com.phillippitts.autoremediation.config.properties.MetricsSourceProperties;
import com.phillippitts.autoremediation.config.properties.MonitorProperties;
import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.exception.SnapshotUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Polls {@code GET {base-url}{health-path}} and maps the JSON report onto a {@link MetricsSnapshot}.
 *
 * <p>Expected body (extra fields ignored, missing ones read as zero or absent):
 * <pre>
 * {"status": "ok", "metrics": {"total_requests": 1234, "total_errors": 5, "error_rate": 0.0041,
 *   "cpu_usage_percent": 12.5, "memory_usage_mb": 256.0, "response_time_p50_ms": 40,
 *   "response_time_p95_ms": 120, "response_time_p99_ms": 300}}
 * </pre>
 * A non-200 answer yields a reachable snapshot with that status and no metrics.
 */
@Component
public class HttpHealthSnapshotProvider implements MetricsSnapshotProvider {

    private static final Logger LOG = LogManager.getLogger(HttpHealthSnapshotProvider.class);

    private final MetricsSourceProperties props;
    private final HttpClient client;
    private final Duration requestTimeout;
    private final Clock clock;

    @Autowired
    public HttpHealthSnapshotProvider(MetricsSourceProperties props, MonitorProperties monitor, Clock clock) {
        this(props,
                HttpClient.newBuilder().connectTimeout(Duration.ofMillis(monitor.getSnapshotTimeoutMs())).build(),
                Duration.ofMillis(monitor.getSnapshotTimeoutMs()),
                clock);
    }

    HttpHealthSnapshotProvider(MetricsSourceProperties props, HttpClient client, Duration requestTimeout,
                               Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public MetricsSnapshot fetch(String service) {
        URI uri = healthUri(service);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new SnapshotUnavailableException("timeout", service, e);
        } catch (ConnectException e) {
            throw new SnapshotUnavailableException("connection_refused", service, e);
        } catch (IOException e) {
            throw new SnapshotUnavailableException(e.toString(), service, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SnapshotUnavailableException("interrupted", service, e);
        }

        Instant now = clock.instant();
        if (response.statusCode() != 200) {
            LOG.debug("Health endpoint for {} returned HTTP {}", service, response.statusCode());
            return new MetricsSnapshot(service, now, true, response.statusCode(), 0.0, 0.0, 0.0, 0L, 0L,
                    null, null, null, null);
        }
        try {
            return parse(service, response.body(), now);
        } catch (JSONException e) {
            throw new SnapshotUnavailableException("invalid health report: " + e.getMessage(), service, e);
        }
    }

    static MetricsSnapshot parse(String service, String body, Instant observedAt) {
        JSONObject root = new JSONObject(body);
        JSONObject metrics = root.optJSONObject("metrics");
        if (metrics == null) {
            metrics = new JSONObject();
        }
        return new MetricsSnapshot(
                service,
                observedAt,
                true,
                200,
                metrics.optDouble("cpu_usage_percent", 0.0),
                metrics.optDouble("memory_usage_mb", 0.0),
                metrics.optDouble("error_rate", 0.0),
                metrics.optLong("total_requests", 0L),
                metrics.optLong("total_errors", 0L),
                optionalDouble(metrics, "response_time_p50_ms"),
                optionalDouble(metrics, "response_time_p95_ms"),
                optionalDouble(metrics, "response_time_p99_ms"),
                null);
    }

    private static Double optionalDouble(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        double value = json.optDouble(key);
        return Double.isNaN(value) ? null : value;
    }

    private URI healthUri(String service) {
        String base = props.getBaseUrls().get(service);
        if (base == null || base.isBlank()) {
            throw new SnapshotUnavailableException("no base URL configured", service);
        }
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        try {
            return URI.create(trimmed + props.getHealthPath());
        } catch (IllegalArgumentException e) {
            throw new SnapshotUnavailableException("invalid base URL: " + base, service, e);
        }
    }
}
