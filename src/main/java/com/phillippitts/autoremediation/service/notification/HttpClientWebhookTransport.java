package com.phillippitts.autoremediation.service.notification;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * JDK {@link HttpClient} transport. Runs on the notification pool, so it sends synchronously and
 * reports failures as {@link IOException}.
 */
public final class HttpClientWebhookTransport implements WebhookTransport {

    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpClientWebhookTransport(Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), requestTimeout);
    }

    public HttpClientWebhookTransport(HttpClient client, Duration requestTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public void post(URI uri, String jsonPayload) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(jsonPayload, StandardCharsets.UTF_8))
                .build();
        HttpResponse<Void> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while posting webhook", e);
        }
        int status = response.statusCode();
        if (status < 200 || status > 299) {
            throw new IOException("Webhook returned HTTP " + status);
        }
    }
}
