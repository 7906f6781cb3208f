package com.routemind.core.model;

import java.util.List;

/**
 * Static description of a model-serving backend, loaded once from configuration.
 * Health and the adaptive latency live in {@link BackendHealth}, not here.
 *
 * @param name                  unique registry key (e.g. "reasoning")
 * @param endpoint              base URL, without trailing slash
 * @param wireFormat            request format the backend speaks
 * @param specialties           specialty tags used for scoring and capability lookup
 * @param costPerToken          price per token, used only by the cost term
 * @param performanceScore      seed quality score in [0,1]
 * @param averageLatencySeconds seed latency; replaced by observed traffic at runtime
 * @param maxComplexity         capability ceiling
 * @param fallbackChain         ordered alternates, validated acyclic at load time
 * @param healthEndpoints       ordered probe paths, first HTTP 200 wins
 * @param backendType           free-text category ("llm", "agent", "search", ...)
 * @param description           human-readable summary
 * @param invocationPath        request path for {@link WireFormat#CUSTOM} backends
 * @param model                 model id sent to openai-compatible servers (optional)
 */
public record BackendDescriptor(
    String name,
    String endpoint,
    WireFormat wireFormat,
    List<String> specialties,
    double costPerToken,
    double performanceScore,
    double averageLatencySeconds,
    ComplexityLevel maxComplexity,
    List<String> fallbackChain,
    List<String> healthEndpoints,
    String backendType,
    String description,
    String invocationPath,
    String model
) {

    public static final List<String> DEFAULT_HEALTH_ENDPOINTS = List.of("/health", "/v1/models", "/");

    public BackendDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Backend name must not be blank");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Backend '" + name + "' has no endpoint");
        }
        if (wireFormat == null) {
            throw new IllegalArgumentException("Backend '" + name + "' has no wire format");
        }
        if (maxComplexity == null) {
            throw new IllegalArgumentException("Backend '" + name + "' has no complexity ceiling");
        }
        if (performanceScore < 0.0 || performanceScore > 1.0) {
            throw new IllegalArgumentException("Backend '" + name + "' performance score must be in [0,1]: "
                    + performanceScore);
        }
        if (costPerToken < 0.0) {
            throw new IllegalArgumentException("Backend '" + name + "' cost per token must be >= 0");
        }
        if (averageLatencySeconds < 0.0) {
            throw new IllegalArgumentException("Backend '" + name + "' latency must be >= 0");
        }
        if (wireFormat == WireFormat.CUSTOM && (invocationPath == null || invocationPath.isBlank())) {
            throw new IllegalArgumentException("Custom backend '" + name + "' requires an invocation path");
        }
        endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        specialties = specialties == null ? List.of() : List.copyOf(specialties);
        fallbackChain = fallbackChain == null ? List.of() : List.copyOf(fallbackChain);
        healthEndpoints = healthEndpoints == null || healthEndpoints.isEmpty()
                ? DEFAULT_HEALTH_ENDPOINTS : List.copyOf(healthEndpoints);
        backendType = backendType == null ? "llm" : backendType;
        description = description == null ? "" : description;
    }

    /**
     * True when {@code specialty} is one of this backend's specialties, ignoring case.
     */
    public boolean hasSpecialty(String specialty) {
        if (specialty == null) return false;
        for (String s : specialties) {
            if (s.equalsIgnoreCase(specialty)) return true;
        }
        return false;
    }
}
