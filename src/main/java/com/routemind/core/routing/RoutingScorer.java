package com.routemind.core.routing;

import com.routemind.core.model.BackendDescriptor;
import com.routemind.core.model.ComplexityLevel;
import com.routemind.core.model.TaskType;

import java.util.Locale;

/**
 * Pure scoring function ranking a backend for a (task type, complexity) request.
 */
public class RoutingScorer {

    private final RoutingWeights weights;

    public RoutingScorer(RoutingWeights weights) {
        this.weights = weights;
    }

    public RoutingWeights weights() {
        return weights;
    }

    /**
     * @param averageLatencySeconds the backend's current cached latency, not the seed value
     * @param budgetFactor          scales the cost term; 0 ignores cost entirely
     */
    public ScoreBreakdown score(BackendDescriptor backend, double averageLatencySeconds, TaskType taskType,
                                ComplexityLevel required, double budgetFactor) {
        double performance = weights.performance() * backend.performanceScore();
        double specialty = specialtyTerm(backend, taskType);
        double fit = complexityTerm(backend.maxComplexity(), required);
        double cost = costTerm(backend.costPerToken(), required) * budgetFactor;
        double latency = Math.min(weights.latencyCap(),
                Math.max(0.0, (weights.latencyPivotSeconds() - averageLatencySeconds) * weights.latencyFactor()));
        double total = Math.max(0.0, performance + specialty + fit + cost + latency);
        return new ScoreBreakdown(performance, specialty, fit, cost, latency, total);
    }

    private double specialtyTerm(BackendDescriptor backend, TaskType taskType) {
        String wanted = taskType.tag();
        if (backend.hasSpecialty(wanted)) {
            return weights.specialtyExact();
        }
        for (String specialty : backend.specialties()) {
            String s = specialty.toLowerCase(Locale.ROOT);
            if (!s.isEmpty() && (s.contains(wanted) || wanted.contains(s))) {
                return weights.specialtyPartial();
            }
        }
        return 0.0;
    }

    private double complexityTerm(ComplexityLevel ceiling, ComplexityLevel required) {
        if (!ceiling.meets(required)) {
            return -weights.complexityPenalty();
        }
        if (required == ComplexityLevel.EXPERT && ceiling == ComplexityLevel.EXPERT) {
            return weights.expertMatch();
        }
        if (required == ComplexityLevel.COMPLEX) {
            return weights.complexMatch();
        }
        return weights.compliantMatch();
    }

    private double costTerm(double costPerToken, ComplexityLevel required) {
        return switch (required) {
            case SIMPLE -> costPerToken < weights.simpleCostCeiling() ? weights.simpleCostBonus() : 0.0;
            // signed: cheaper than the baseline earns a small bonus
            case MODERATE -> -(costPerToken - weights.moderateCostBaseline()) * weights.moderateCostScale();
            case COMPLEX, EXPERT -> 0.0;
        };
    }
}
