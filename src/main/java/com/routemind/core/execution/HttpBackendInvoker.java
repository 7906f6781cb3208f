package com.routemind.core.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.routemind.core.model.BackendDescriptor;
import com.routemind.core.model.WireFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Calls a backend over HTTP in the request format it declares.
 * <p>
 * OpenAI-compatible servers get a single-message chat completion; REST backends get
 * {@code {"prompt", "context"}} at {@code /api/completion}; custom backends get the same
 * body at their configured path and their raw response body is returned.
 */
@Component
public class HttpBackendInvoker implements BackendInvoker {

    private static final Logger log = LoggerFactory.getLogger(HttpBackendInvoker.class);

    static final String CHAT_COMPLETIONS_PATH = "/v1/chat/completions";
    static final String REST_COMPLETION_PATH = "/api/completion";
    static final int MAX_TOKENS = 512;
    static final double TEMPERATURE = 0.7;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public HttpBackendInvoker(ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build(), objectMapper);
    }

    HttpBackendInvoker(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String invoke(InvocationRequest request) throws BackendInvocationException {
        BackendDescriptor backend = request.backend();
        String path = switch (backend.wireFormat()) {
            case OPENAI_COMPATIBLE -> CHAT_COMPLETIONS_PATH;
            case REST -> REST_COMPLETION_PATH;
            case CUSTOM -> backend.invocationPath();
        };
        String url = backend.endpoint() + (path.startsWith("/") ? path : "/" + path);
        String body = requestBody(request);

        HttpResponse<String> response;
        try {
            var httpRequest = HttpRequest.newBuilder(URI.create(url))
                    .timeout(request.timeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            log.debug("POST {} ({} chars)", url, body.length());
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new BackendTimeoutException(backend.name(),
                    "no answer within " + request.timeout().toMillis() + "ms", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new BackendErrorException(backend.name(), "request to " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendErrorException(backend.name(), "interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new BackendErrorException(backend.name(),
                    "HTTP " + status + " from " + url + ": " + abbreviate(response.body()), status, null);
        }
        return extractOutput(backend, response.body());
    }

    String requestBody(InvocationRequest request) throws BackendErrorException {
        ObjectNode body = objectMapper.createObjectNode();
        if (request.backend().wireFormat() == WireFormat.OPENAI_COMPATIBLE) {
            String model = request.backend().model();
            body.put("model", model == null || model.isBlank() ? request.backend().name() : model);
            var message = body.putArray("messages").addObject();
            message.put("role", "user");
            message.put("content", request.prompt());
            body.put("max_tokens", MAX_TOKENS);
            body.put("temperature", TEMPERATURE);
        } else {
            body.put("prompt", request.prompt());
            body.set("context", objectMapper.valueToTree(request.context() == null ? Map.of() : request.context()));
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new BackendErrorException(request.backend().name(), "request not serializable: " + e.getMessage(), e);
        }
    }

    String extractOutput(BackendDescriptor backend, String responseBody) throws BackendErrorException {
        switch (backend.wireFormat()) {
            case OPENAI_COMPATIBLE -> {
                JsonNode content = parse(backend, responseBody).path("choices").path(0).path("message").path("content");
                if (!content.isTextual()) {
                    throw new BackendErrorException(backend.name(), "response has no choices[0].message.content");
                }
                return content.asText();
            }
            case REST -> {
                JsonNode root;
                try {
                    root = objectMapper.readTree(responseBody);
                } catch (JsonProcessingException e) {
                    return responseBody;
                }
                for (String field : new String[] {"response", "text", "output"}) {
                    if (root != null && root.path(field).isTextual()) {
                        return root.path(field).asText();
                    }
                }
                return responseBody;
            }
            default -> {
                return responseBody;
            }
        }
    }

    private JsonNode parse(BackendDescriptor backend, String responseBody) throws BackendErrorException {
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new BackendErrorException(backend.name(), "malformed JSON response: " + e.getOriginalMessage(), e);
        }
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
