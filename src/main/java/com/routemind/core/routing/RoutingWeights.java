package com.routemind.core.routing;

/**
 * Coefficients of the routing score. {@link #defaults()} reproduces the tuned values;
 * every field can be overridden under {@code routemind.routing.weights}.
 */
public record RoutingWeights(
    double performance,
    double specialtyExact,
    double specialtyPartial,
    double complexityPenalty,
    double expertMatch,
    double complexMatch,
    double compliantMatch,
    double simpleCostBonus,
    double simpleCostCeiling,
    double moderateCostBaseline,
    double moderateCostScale,
    double latencyPivotSeconds,
    double latencyFactor,
    double latencyCap
) {

    public static RoutingWeights defaults() {
        return new RoutingWeights(0.5, 0.4, 0.2, 0.5, 0.3, 0.25, 0.15,
                0.1, 0.0003, 0.0002, 5.0, 2.0, 0.02, 0.04);
    }
}
