package com.phillippitts.autoremediation.service.notification;

import java.io.IOException;
import java.net.URI;

/**
 * Transport hook for webhook delivery.
 */
@FunctionalInterface
public interface WebhookTransport {

    /**
     * Posts a JSON payload and waits for the response.
     *
     * @throws IOException on connection failure or a non-2xx response
     */
    void post(URI uri, String jsonPayload) throws IOException;
}
