package com.routemind.core.config;

import com.routemind.core.classifier.ClassifierRules;
import com.routemind.core.classifier.PromptClassifier;
import com.routemind.core.metrics.RoutemindMetrics;
import com.routemind.core.registry.BackendRegistry;
import com.routemind.core.routing.BackendRouter;
import com.routemind.core.routing.PerformanceTracker;
import com.routemind.core.routing.RoutingScorer;
import com.routemind.core.workflow.WorkflowGraphBuilder;
import com.routemind.core.workflow.WorkflowTemplateCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Wires the routing core from {@link RoutemindProperties}. Backend and template
 * definitions are validated here, so a bad configuration fails startup.
 */
@Configuration
public class RoutemindConfig {

    private static final Logger log = LoggerFactory.getLogger(RoutemindConfig.class);

    @Bean
    public ClassifierRules classifierRules(RoutemindProperties properties, ResourceLoader resourceLoader) {
        String location = properties.getClassifierRulesLocation();
        var resource = resourceLoader.getResource(location);
        try (var in = resource.getInputStream()) {
            log.info("Loading classifier rules from {}", location);
            return ClassifierRules.fromYaml(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read classifier rules from " + location, e);
        }
    }

    @Bean
    public BackendRegistry backendRegistry(RoutemindProperties properties) {
        var registry = new BackendRegistry(properties.backendDescriptors());
        registry.validateFallbackChains();
        return registry;
    }

    @Bean
    public PerformanceTracker performanceTracker(RoutemindProperties properties) {
        return new PerformanceTracker(properties.getWindowSize());
    }

    @Bean
    public RoutingScorer routingScorer(RoutemindProperties properties) {
        return new RoutingScorer(properties.getRouting().getWeights().toRoutingWeights());
    }

    @Bean
    public BackendRouter backendRouter(BackendRegistry registry, RoutingScorer scorer, PerformanceTracker tracker,
                                       PromptClassifier classifier, RoutemindProperties properties,
                                       @Autowired(required = false) RoutemindMetrics metrics) {
        return new BackendRouter(registry, scorer, tracker, classifier, properties.isOptimisticUnknown(), metrics);
    }

    @Bean
    public WorkflowTemplateCatalog workflowTemplateCatalog(RoutemindProperties properties) {
        return new WorkflowTemplateCatalog(properties.workflowTemplates(), properties.getDefaultTemplate());
    }

    @Bean
    public WorkflowGraphBuilder workflowGraphBuilder(WorkflowTemplateCatalog catalog) {
        return new WorkflowGraphBuilder(catalog);
    }
}
