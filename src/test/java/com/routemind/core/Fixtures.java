package com.routemind.core;

import com.routemind.core.classifier.ClassifierRules;
import com.routemind.core.classifier.PromptClassifier;
import com.routemind.core.model.BackendDescriptor;
import com.routemind.core.model.ComplexityLevel;
import com.routemind.core.model.TaskType;
import com.routemind.core.model.WireFormat;
import com.routemind.core.model.WorkflowTemplate;
import com.routemind.core.registry.BackendRegistry;
import com.routemind.core.routing.BackendRouter;
import com.routemind.core.routing.PerformanceTracker;
import com.routemind.core.routing.RoutingScorer;
import com.routemind.core.routing.RoutingWeights;
import com.routemind.core.workflow.WorkflowTemplateCatalog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for tests.
 */
public final class Fixtures {

    private static ClassifierRules rules;

    private Fixtures() {
    }

    public static BackendDescriptor backend(String name, ComplexityLevel ceiling, List<String> specialties,
                                            double performance, double cost, double latency,
                                            String... fallbacks) {
        return new BackendDescriptor(name, "http://localhost:9/" + name, WireFormat.OPENAI_COMPATIBLE,
                specialties, cost, performance, latency, ceiling, List.of(fallbacks), null,
                "llm", "", null, null);
    }

    public static BackendDescriptor backend(String name, ComplexityLevel ceiling, String... fallbacks) {
        return backend(name, ceiling, List.of(name), 0.8, 0.0002, 1.0, fallbacks);
    }

    public static BackendDescriptor atEndpoint(String name, String endpoint, WireFormat format, String invocationPath) {
        return new BackendDescriptor(name, endpoint, format, List.of(name), 0.0002, 0.8, 1.0,
                ComplexityLevel.EXPERT, List.of(), List.of("/health"), "llm", "", invocationPath, "test-model");
    }

    public static synchronized ClassifierRules rules() {
        if (rules == null) {
            try (var in = Fixtures.class.getResourceAsStream("/classifier-rules.yml")) {
                rules = ClassifierRules.fromYaml(in);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return rules;
    }

    public static PromptClassifier classifier() {
        return new PromptClassifier(rules());
    }

    public static BackendRouter router(BackendRegistry registry) {
        return router(registry, true);
    }

    public static BackendRouter router(BackendRegistry registry, boolean optimisticUnknown) {
        return new BackendRouter(registry, new RoutingScorer(RoutingWeights.defaults()),
                new PerformanceTracker(100), classifier(), optimisticUnknown, null);
    }

    /**
     * The five backends shipped in application.yml.
     */
    public static List<BackendDescriptor> seedBackends() {
        return List.of(
                backend("reasoning", ComplexityLevel.EXPERT,
                        List.of("math", "logic", "analysis", "problem-solving", "reasoning"), 0.95, 0.001, 2.5, "general"),
                backend("general", ComplexityLevel.MODERATE,
                        List.of("conversation", "general", "summary", "chat"), 0.85, 0.0002, 1.2),
                backend("coding", ComplexityLevel.COMPLEX,
                        List.of("programming", "debug", "algorithm", "code", "development", "coding"),
                        0.92, 0.0003, 1.8, "reasoning", "general"),
                backend("creative", ComplexityLevel.MODERATE,
                        List.of("story", "creative", "writing", "narrative", "roleplay"), 0.80, 0.0001, 1.0, "general"),
                backend("advanced", ComplexityLevel.EXPERT,
                        List.of("multimodal", "advanced", "research", "complex-reasoning"), 0.88, 0.0005, 2.0,
                        "reasoning", "general"));
    }

    public static WorkflowTemplate template(String key, List<TaskType> types, Map<TaskType, List<TaskType>> dependencies,
                                            List<List<TaskType>> sections, String... keywords) {
        return new WorkflowTemplate(key, key, "", types, dependencies, sections, List.of(), List.of(keywords), 60);
    }

    /**
     * A subset of the templates shipped in application.yml.
     */
    public static List<WorkflowTemplate> seedTemplates() {
        var research = TaskType.RESEARCH;
        var reasoning = TaskType.REASONING;
        var coding = TaskType.CODING;
        var creative = TaskType.CREATIVE;
        var general = TaskType.GENERAL;
        return List.of(
                template("research_analysis", List.of(research, reasoning, general),
                        Map.of(reasoning, List.of(research), general, List.of(research, reasoning)), List.of(),
                        "research", "analyze", "study", "investigate", "examine"),
                template("code_development", List.of(research, coding, reasoning, general),
                        Map.of(coding, List.of(research), reasoning, List.of(coding), general, List.of(reasoning)),
                        List.of(), "code", "program", "develop", "implement", "function", "algorithm"),
                template("technical_docs", List.of(research, coding, reasoning, general),
                        Map.of(coding, List.of(research), reasoning, List.of(research),
                                general, List.of(coding, reasoning)),
                        List.of(List.of(research), List.of(coding, reasoning)),
                        "document", "documentation", "explain", "guide", "manual"),
                template("multi_domain", List.of(research, reasoning, coding, creative, general),
                        Map.of(general, List.of(research, reasoning, coding, creative)),
                        List.of(List.of(research, reasoning, coding, creative)),
                        "compare", "contrast", "multiple", "different", "various"));
    }

    public static WorkflowTemplateCatalog catalog() {
        return new WorkflowTemplateCatalog(seedTemplates(), "research_analysis");
    }
}
