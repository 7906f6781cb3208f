package com.routemind.core.routing;

import com.routemind.core.classifier.PromptClassifier;
import com.routemind.core.metrics.RoutemindMetrics;
import com.routemind.core.model.BackendSnapshot;
import com.routemind.core.model.Classification;
import com.routemind.core.model.ComplexityLevel;
import com.routemind.core.model.RoutingDecision;
import com.routemind.core.model.TaskType;
import com.routemind.core.registry.BackendRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores every registered backend for a request and selects one, walking the preferred
 * backend's fallback chain when it is not routable and falling back to the best routable
 * backend when the chain has nothing to offer.
 * <p>
 * Routing is synchronous and performs no I/O: it reads the health snapshots the
 * monitor last stored in the registry.
 */
public class BackendRouter {

    private static final Logger log = LoggerFactory.getLogger(BackendRouter.class);

    private final BackendRegistry registry;
    private final RoutingScorer scorer;
    private final PerformanceTracker tracker;
    private final PromptClassifier classifier;
    private final boolean optimisticUnknown;
    private final RoutemindMetrics metrics;

    public BackendRouter(BackendRegistry registry, RoutingScorer scorer, PerformanceTracker tracker,
                         PromptClassifier classifier, boolean optimisticUnknown, RoutemindMetrics metrics) {
        this.registry = registry;
        this.scorer = scorer;
        this.tracker = tracker;
        this.classifier = classifier;
        this.optimisticUnknown = optimisticUnknown;
        this.metrics = metrics;
    }

    private record Ranked(BackendSnapshot backend, ScoreBreakdown score, int order) {}

    /**
     * Classifies {@code prompt} and routes on the result.
     */
    public RoutingDecision route(String prompt, double budgetFactor) {
        Classification c = classifier.classify(prompt);
        return route(c.taskType(), c.complexity(), budgetFactor);
    }

    /**
     * @throws IllegalArgumentException if {@code budgetFactor} is negative or not a number
     */
    public RoutingDecision route(TaskType taskType, ComplexityLevel complexity, double budgetFactor) {
        if (Double.isNaN(budgetFactor) || budgetFactor < 0) {
            throw new IllegalArgumentException("Budget factor must be >= 0: " + budgetFactor);
        }
        var ranked = rank(taskType, complexity, budgetFactor);
        var scores = new LinkedHashMap<String, Double>();
        ranked.stream()
                .sorted(Comparator.comparingInt(Ranked::order))
                .forEach(r -> scores.put(r.backend().name(), r.score().total()));
        Map<String, Double> scoreView = Collections.unmodifiableMap(scores);

        if (ranked.isEmpty()) {
            recordUnavailable(taskType);
            return RoutingDecision.unavailable("No backends registered", taskType, complexity, scoreView);
        }

        Ranked preferred = ranked.stream()
                .filter(r -> r.backend().descriptor().maxComplexity().meets(complexity))
                .findFirst()
                .orElse(ranked.get(0));

        if (isRoutable(preferred.backend())) {
            var chain = preferred.backend().descriptor().fallbackChain();
            return select(preferred, chain, null, taskType, complexity, scoreView);
        }

        boolean compliantAvailable = ranked.stream().anyMatch(r ->
                r.backend().descriptor().maxComplexity().meets(complexity) && isRoutable(r.backend()));
        var chain = preferred.backend().descriptor().fallbackChain();
        for (int i = 0; i < chain.size(); i++) {
            Optional<Ranked> candidate = find(ranked, chain.get(i));
            if (candidate.isEmpty() || !isRoutable(candidate.get().backend())) {
                continue;
            }
            boolean compliant = candidate.get().backend().descriptor().maxComplexity().meets(complexity);
            if (!compliant && compliantAvailable) {
                log.debug("Skipping fallback {} for {}: ceiling below {}", chain.get(i),
                        preferred.backend().name(), complexity);
                continue;
            }
            return select(candidate.get(), chain.subList(i + 1, chain.size()), preferred.backend(),
                    taskType, complexity, scoreView);
        }

        // chain exhausted: best routable backend anywhere, compliant ones first
        Optional<Ranked> healthy = ranked.stream()
                .filter(r -> r.backend().descriptor().maxComplexity().meets(complexity) && isRoutable(r.backend()))
                .findFirst()
                .or(() -> ranked.stream().filter(r -> isRoutable(r.backend())).findFirst());
        if (healthy.isPresent()) {
            log.debug("Fallback chain of {} exhausted, using best routable backend {}",
                    preferred.backend().name(), healthy.get().backend().name());
            return select(healthy.get(), healthy.get().backend().descriptor().fallbackChain(), preferred.backend(),
                    taskType, complexity, scoreView);
        }

        recordUnavailable(taskType);
        String reason = "No routable backend: preferred '" + preferred.backend().name() + "' is "
                + preferred.backend().health().status() + " and no other backend is routable";
        log.warn("{} ({} / {})", reason, taskType, complexity);
        return RoutingDecision.unavailable(reason, taskType, complexity, scoreView);
    }

    /**
     * Feeds one execution outcome into the rolling window and the registry's cached latency.
     */
    public void reportOutcome(String backend, double latencySeconds, boolean success) {
        if (registry.get(backend).isEmpty()) {
            log.warn("Outcome reported for unknown backend {}", backend);
            return;
        }
        double average = tracker.record(backend, latencySeconds, success);
        registry.updateAverageLatency(backend, average);
        log.debug("Backend {} outcome: {}s success={} (rolling avg {}s)", backend, latencySeconds, success, average);
    }

    public BackendAnalytics analytics() {
        var stats = new ArrayList<BackendAnalytics.BackendStats>();
        for (BackendSnapshot snapshot : registry.listAll()) {
            var s = tracker.stats(snapshot.name());
            stats.add(new BackendAnalytics.BackendStats(snapshot.name(), s.routed(), s.reported(),
                    s.successRate(), snapshot.averageLatencySeconds(), snapshot.health().status(),
                    snapshot.health().consecutiveFailures()));
        }
        return new BackendAnalytics(registry.size(), stats);
    }

    public boolean isRoutable(BackendSnapshot backend) {
        return backend.health().isRoutable(optimisticUnknown);
    }

    public BackendRegistry registry() {
        return registry;
    }

    private List<Ranked> rank(TaskType taskType, ComplexityLevel complexity, double budgetFactor) {
        var all = registry.listAll();
        var ranked = new ArrayList<Ranked>(all.size());
        for (int i = 0; i < all.size(); i++) {
            var backend = all.get(i);
            ranked.add(new Ranked(backend, scorer.score(backend.descriptor(), backend.averageLatencySeconds(),
                    taskType, complexity, budgetFactor), i));
        }
        // stable sort keeps registration order among equal scores
        ranked.sort(Comparator.comparingDouble((Ranked r) -> r.score().total()).reversed());
        return ranked;
    }

    private static Optional<Ranked> find(List<Ranked> ranked, String name) {
        return ranked.stream().filter(r -> r.backend().name().equals(name)).findFirst();
    }

    private RoutingDecision select(Ranked chosen, List<String> remaining, BackendSnapshot fallbackFrom,
                                   TaskType taskType, ComplexityLevel complexity, Map<String, Double> scores) {
        var descriptor = chosen.backend().descriptor();
        String reason = "Selected " + descriptor.name() + ": strongest term " + chosen.score().dominantTerm()
                + String.format(" (score %.3f)", chosen.score().total());
        if (fallbackFrom != null) {
            reason += "; fallback from " + fallbackFrom.name() + " (" + fallbackFrom.health().status() + ")";
        }
        tracker.recordRouted(descriptor.name());
        if (metrics != null) {
            metrics.recordRouteDecision(descriptor.name(), taskType.tag(), fallbackFrom != null);
        }
        log.debug("Routed {}/{} to {}", taskType, complexity, descriptor.name());
        return new RoutingDecision(true, descriptor.name(), descriptor.endpoint(), descriptor.wireFormat(),
                chosen.score().total(), reason, remaining, descriptor.costPerToken(),
                chosen.backend().averageLatencySeconds(), taskType, complexity, scores);
    }

    private void recordUnavailable(TaskType taskType) {
        if (metrics != null) {
            metrics.recordRouteUnavailable(taskType.tag());
        }
    }
}
