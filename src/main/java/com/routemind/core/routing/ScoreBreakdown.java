package com.routemind.core.routing;

/**
 * Individual terms of one backend's routing score. {@code total} is the clamped sum.
 */
public record ScoreBreakdown(
    double performance,
    double specialty,
    double complexityFit,
    double cost,
    double latency,
    double total
) {

    /**
     * Name of the largest positive term, used in routing reasons.
     */
    public String dominantTerm() {
        String name = "best overall match";
        double best = 0.0;
        if (performance > best) { best = performance; name = "performance"; }
        if (specialty > best) { best = specialty; name = "specialty match"; }
        if (complexityFit > best) { best = complexityFit; name = "complexity fit"; }
        if (cost > best) { best = cost; name = "cost efficiency"; }
        if (latency > best) { name = "low latency"; }
        return name;
    }
}
