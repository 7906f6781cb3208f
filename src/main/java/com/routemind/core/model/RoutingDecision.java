package com.routemind.core.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of routing one request.
 *
 * @param available               false when no routable backend was found
 * @param backend                 chosen backend name, null when unavailable
 * @param endpoint                chosen backend base URL, null when unavailable
 * @param wireFormat              chosen backend wire format, null when unavailable
 * @param score                   score of the chosen backend
 * @param reason                  human-readable reason naming the dominant scoring term
 * @param fallbacks               ordered alternates the caller may try next
 * @param estimatedCost           cost per token of the chosen backend
 * @param estimatedLatencySeconds cached average latency of the chosen backend
 * @param taskType                requested task type
 * @param complexity              requested complexity
 * @param scores                  score of every registered backend, in registration order
 */
public record RoutingDecision(
    boolean available,
    String backend,
    String endpoint,
    WireFormat wireFormat,
    double score,
    String reason,
    List<String> fallbacks,
    double estimatedCost,
    double estimatedLatencySeconds,
    TaskType taskType,
    ComplexityLevel complexity,
    Map<String, Double> scores
) {

    public RoutingDecision {
        fallbacks = fallbacks == null ? List.of() : List.copyOf(fallbacks);
        scores = scores == null ? Map.of() : scores;
    }

    public static RoutingDecision unavailable(String reason, TaskType taskType, ComplexityLevel complexity,
                                              Map<String, Double> scores) {
        return new RoutingDecision(false, null, null, null, 0.0, reason, List.of(), 0.0, 0.0,
                taskType, complexity, scores);
    }
}
