package com.routemind.core.registry;

import com.routemind.core.model.BackendDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Probes a backend with HTTP GET against its health endpoints in order,
 * stopping at the first one that answers 200.
 */
@Component
public class HttpHealthProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private final HttpClient httpClient;

    public HttpHealthProbe() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    HttpHealthProbe(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ProbeResult probe(BackendDescriptor backend, Duration timeout) {
        String lastFailure = "no health endpoints";
        for (String path : backend.healthEndpoints()) {
            String url = backend.endpoint() + (path.startsWith("/") ? path : "/" + path);
            try {
                var request = HttpRequest.newBuilder(URI.create(url))
                        .timeout(timeout)
                        .GET()
                        .build();
                var response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
                if (response.statusCode() == 200) {
                    return ProbeResult.up(path);
                }
                lastFailure = path + " returned HTTP " + response.statusCode();
            } catch (HttpTimeoutException e) {
                lastFailure = path + " timed out after " + timeout.toMillis() + "ms";
            } catch (IOException | IllegalArgumentException e) {
                lastFailure = path + " failed: " + e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ProbeResult.down("probe interrupted");
            }
            log.debug("Probe of {} at {}: {}", backend.name(), url, lastFailure);
        }
        return ProbeResult.down(lastFailure);
    }
}
