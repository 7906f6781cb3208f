package com.routemind.core.config;

import com.routemind.core.model.BackendDescriptor;
import com.routemind.core.model.ComplexityLevel;
import com.routemind.core.model.TaskType;
import com.routemind.core.model.WireFormat;
import com.routemind.core.model.WorkflowTemplate;
import com.routemind.core.registry.InvalidBackendDefinitionException;
import com.routemind.core.routing.RoutingWeights;
import com.routemind.core.workflow.InvalidTemplateDefinitionException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "routemind")
public class RoutemindProperties {

    private List<Backend> backends = new ArrayList<>();
    private List<Template> templates = new ArrayList<>();
    private String defaultTemplate = "research_analysis";
    private Health health = new Health();
    private Routing routing = new Routing();
    private Executor executor = new Executor();
    private Classifier classifier = new Classifier();
    private Engine engine = new Engine();

    // -- delegate accessors --
    public boolean isHealthEnabled() { return health.enabled; }
    public int getHealthIntervalSeconds() { return health.intervalSeconds; }
    public int getProbeTimeoutSeconds() { return health.probeTimeoutSeconds; }
    public int getFailureThreshold() { return health.failureThreshold; }
    public int getMaxConcurrentProbes() { return health.maxConcurrentProbes; }
    public int getWindowSize() { return routing.windowSize; }
    public boolean isOptimisticUnknown() { return routing.optimisticUnknown; }
    public String getLearnedMetricsFile() { return routing.learnedMetricsFile; }
    public int getMaxParallel() { return executor.maxParallel; }
    public int getMaxAttempts() { return executor.maxAttempts; }
    public double getTimeoutMultiplier() { return executor.timeoutMultiplier; }
    public int getMinTimeoutSeconds() { return executor.minTimeoutSeconds; }
    public int getMaxTimeoutSeconds() { return executor.maxTimeoutSeconds; }
    public String getClassifierRulesLocation() { return classifier.rulesLocation; }
    public int getMaxHistory() { return engine.maxHistory; }
    public int getMaxConcurrentWorkflows() { return engine.maxConcurrentWorkflows; }

    public List<BackendDescriptor> backendDescriptors() {
        return backends.stream().map(Backend::toDescriptor).toList();
    }

    public List<WorkflowTemplate> workflowTemplates() {
        return templates.stream().map(Template::toTemplate).toList();
    }

    public List<Backend> getBackends() { return backends; }
    public void setBackends(List<Backend> backends) { this.backends = backends; }
    public List<Template> getTemplates() { return templates; }
    public void setTemplates(List<Template> templates) { this.templates = templates; }
    public String getDefaultTemplate() { return defaultTemplate; }
    public void setDefaultTemplate(String defaultTemplate) { this.defaultTemplate = defaultTemplate; }
    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }
    public Routing getRouting() { return routing; }
    public void setRouting(Routing routing) { this.routing = routing; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }
    public Classifier getClassifier() { return classifier; }
    public void setClassifier(Classifier classifier) { this.classifier = classifier; }
    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }

    /**
     * One {@code routemind.backends[]} entry. Enum-valued fields are bound as strings
     * and converted in {@link #toDescriptor()} so a bad tag names the backend it came from.
     */
    public static class Backend {
        private String name;
        private String endpoint;
        private String wireFormat = "openai-compatible";
        private List<String> specialties = new ArrayList<>();
        private double costPerToken;
        private double performanceScore = 0.5;
        private double averageLatencySeconds = 1.0;
        private String maxComplexity = "moderate";
        private List<String> fallbackChain = new ArrayList<>();
        private List<String> healthEndpoints = new ArrayList<>();
        private String backendType = "llm";
        private String description = "";
        private String invocationPath;
        private String model;

        public BackendDescriptor toDescriptor() {
            try {
                return new BackendDescriptor(name, endpoint, WireFormat.fromTag(wireFormat), specialties,
                        costPerToken, performanceScore, averageLatencySeconds,
                        ComplexityLevel.fromTag(maxComplexity), fallbackChain, healthEndpoints,
                        backendType, description, invocationPath, model);
            } catch (IllegalArgumentException e) {
                throw new InvalidBackendDefinitionException(
                        "Invalid backend '" + name + "': " + e.getMessage(), e);
            }
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public String getWireFormat() { return wireFormat; }
        public void setWireFormat(String wireFormat) { this.wireFormat = wireFormat; }
        public List<String> getSpecialties() { return specialties; }
        public void setSpecialties(List<String> specialties) { this.specialties = specialties; }
        public double getCostPerToken() { return costPerToken; }
        public void setCostPerToken(double costPerToken) { this.costPerToken = costPerToken; }
        public double getPerformanceScore() { return performanceScore; }
        public void setPerformanceScore(double performanceScore) { this.performanceScore = performanceScore; }
        public double getAverageLatencySeconds() { return averageLatencySeconds; }
        public void setAverageLatencySeconds(double averageLatencySeconds) { this.averageLatencySeconds = averageLatencySeconds; }
        public String getMaxComplexity() { return maxComplexity; }
        public void setMaxComplexity(String maxComplexity) { this.maxComplexity = maxComplexity; }
        public List<String> getFallbackChain() { return fallbackChain; }
        public void setFallbackChain(List<String> fallbackChain) { this.fallbackChain = fallbackChain; }
        public List<String> getHealthEndpoints() { return healthEndpoints; }
        public void setHealthEndpoints(List<String> healthEndpoints) { this.healthEndpoints = healthEndpoints; }
        public String getBackendType() { return backendType; }
        public void setBackendType(String backendType) { this.backendType = backendType; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public String getInvocationPath() { return invocationPath; }
        public void setInvocationPath(String invocationPath) { this.invocationPath = invocationPath; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    /**
     * One {@code routemind.templates[]} entry. Parallel sections are written as
     * comma-separated task types, one string per section.
     */
    public static class Template {
        private String key;
        private String name;
        private String description = "";
        private List<String> taskTypes = new ArrayList<>();
        private Map<String, List<String>> dependencies = new LinkedHashMap<>();
        private List<String> parallelSections = new ArrayList<>();
        private List<String> requiredCapabilities = new ArrayList<>();
        private List<String> keywords = new ArrayList<>();
        private int estimatedDurationSeconds = 120;

        public WorkflowTemplate toTemplate() {
            try {
                var deps = new LinkedHashMap<TaskType, List<TaskType>>();
                dependencies.forEach((type, prereqs) ->
                        deps.put(TaskType.fromTag(type), prereqs.stream().map(TaskType::fromTag).toList()));
                var sections = parallelSections.stream()
                        .map(s -> Arrays.stream(s.split(","))
                                .map(String::trim)
                                .filter(t -> !t.isEmpty())
                                .map(TaskType::fromTag)
                                .toList())
                        .toList();
                return new WorkflowTemplate(key, name, description,
                        taskTypes.stream().map(TaskType::fromTag).toList(), deps, sections,
                        requiredCapabilities, keywords, estimatedDurationSeconds);
            } catch (IllegalArgumentException e) {
                throw new InvalidTemplateDefinitionException(
                        "Invalid template '" + key + "': " + e.getMessage(), e);
            }
        }

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public List<String> getTaskTypes() { return taskTypes; }
        public void setTaskTypes(List<String> taskTypes) { this.taskTypes = taskTypes; }
        public Map<String, List<String>> getDependencies() { return dependencies; }
        public void setDependencies(Map<String, List<String>> dependencies) { this.dependencies = dependencies; }
        public List<String> getParallelSections() { return parallelSections; }
        public void setParallelSections(List<String> parallelSections) { this.parallelSections = parallelSections; }
        public List<String> getRequiredCapabilities() { return requiredCapabilities; }
        public void setRequiredCapabilities(List<String> requiredCapabilities) { this.requiredCapabilities = requiredCapabilities; }
        public List<String> getKeywords() { return keywords; }
        public void setKeywords(List<String> keywords) { this.keywords = keywords; }
        public int getEstimatedDurationSeconds() { return estimatedDurationSeconds; }
        public void setEstimatedDurationSeconds(int estimatedDurationSeconds) { this.estimatedDurationSeconds = estimatedDurationSeconds; }
    }

    public static class Health {
        private boolean enabled = true;
        private int intervalSeconds = 30;
        private int probeTimeoutSeconds = 5;
        private int failureThreshold = 3;
        private int maxConcurrentProbes = 4;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getIntervalSeconds() { return intervalSeconds; }
        public void setIntervalSeconds(int intervalSeconds) { this.intervalSeconds = intervalSeconds; }
        public int getProbeTimeoutSeconds() { return probeTimeoutSeconds; }
        public void setProbeTimeoutSeconds(int probeTimeoutSeconds) { this.probeTimeoutSeconds = probeTimeoutSeconds; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public int getMaxConcurrentProbes() { return maxConcurrentProbes; }
        public void setMaxConcurrentProbes(int maxConcurrentProbes) { this.maxConcurrentProbes = maxConcurrentProbes; }
    }

    public static class Routing {
        private int windowSize = 100;
        private boolean optimisticUnknown = true;
        private String learnedMetricsFile = "";
        private Weights weights = new Weights();

        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }
        public boolean isOptimisticUnknown() { return optimisticUnknown; }
        public void setOptimisticUnknown(boolean optimisticUnknown) { this.optimisticUnknown = optimisticUnknown; }
        public String getLearnedMetricsFile() { return learnedMetricsFile; }
        public void setLearnedMetricsFile(String learnedMetricsFile) { this.learnedMetricsFile = learnedMetricsFile; }
        public Weights getWeights() { return weights; }
        public void setWeights(Weights weights) { this.weights = weights; }
    }

    public static class Weights {
        private static final RoutingWeights DEFAULTS = RoutingWeights.defaults();

        private double performance = DEFAULTS.performance();
        private double specialtyExact = DEFAULTS.specialtyExact();
        private double specialtyPartial = DEFAULTS.specialtyPartial();
        private double complexityPenalty = DEFAULTS.complexityPenalty();
        private double expertMatch = DEFAULTS.expertMatch();
        private double complexMatch = DEFAULTS.complexMatch();
        private double compliantMatch = DEFAULTS.compliantMatch();
        private double simpleCostBonus = DEFAULTS.simpleCostBonus();
        private double simpleCostCeiling = DEFAULTS.simpleCostCeiling();
        private double moderateCostBaseline = DEFAULTS.moderateCostBaseline();
        private double moderateCostScale = DEFAULTS.moderateCostScale();
        private double latencyPivotSeconds = DEFAULTS.latencyPivotSeconds();
        private double latencyFactor = DEFAULTS.latencyFactor();
        private double latencyCap = DEFAULTS.latencyCap();

        public RoutingWeights toRoutingWeights() {
            return new RoutingWeights(performance, specialtyExact, specialtyPartial, complexityPenalty,
                    expertMatch, complexMatch, compliantMatch, simpleCostBonus, simpleCostCeiling,
                    moderateCostBaseline, moderateCostScale, latencyPivotSeconds, latencyFactor, latencyCap);
        }

        public double getPerformance() { return performance; }
        public void setPerformance(double performance) { this.performance = performance; }
        public double getSpecialtyExact() { return specialtyExact; }
        public void setSpecialtyExact(double specialtyExact) { this.specialtyExact = specialtyExact; }
        public double getSpecialtyPartial() { return specialtyPartial; }
        public void setSpecialtyPartial(double specialtyPartial) { this.specialtyPartial = specialtyPartial; }
        public double getComplexityPenalty() { return complexityPenalty; }
        public void setComplexityPenalty(double complexityPenalty) { this.complexityPenalty = complexityPenalty; }
        public double getExpertMatch() { return expertMatch; }
        public void setExpertMatch(double expertMatch) { this.expertMatch = expertMatch; }
        public double getComplexMatch() { return complexMatch; }
        public void setComplexMatch(double complexMatch) { this.complexMatch = complexMatch; }
        public double getCompliantMatch() { return compliantMatch; }
        public void setCompliantMatch(double compliantMatch) { this.compliantMatch = compliantMatch; }
        public double getSimpleCostBonus() { return simpleCostBonus; }
        public void setSimpleCostBonus(double simpleCostBonus) { this.simpleCostBonus = simpleCostBonus; }
        public double getSimpleCostCeiling() { return simpleCostCeiling; }
        public void setSimpleCostCeiling(double simpleCostCeiling) { this.simpleCostCeiling = simpleCostCeiling; }
        public double getModerateCostBaseline() { return moderateCostBaseline; }
        public void setModerateCostBaseline(double moderateCostBaseline) { this.moderateCostBaseline = moderateCostBaseline; }
        public double getModerateCostScale() { return moderateCostScale; }
        public void setModerateCostScale(double moderateCostScale) { this.moderateCostScale = moderateCostScale; }
        public double getLatencyPivotSeconds() { return latencyPivotSeconds; }
        public void setLatencyPivotSeconds(double latencyPivotSeconds) { this.latencyPivotSeconds = latencyPivotSeconds; }
        public double getLatencyFactor() { return latencyFactor; }
        public void setLatencyFactor(double latencyFactor) { this.latencyFactor = latencyFactor; }
        public double getLatencyCap() { return latencyCap; }
        public void setLatencyCap(double latencyCap) { this.latencyCap = latencyCap; }
    }

    public static class Executor {
        private int maxParallel = 4;
        private int maxAttempts = 3;
        private double timeoutMultiplier = 3.0;
        private int minTimeoutSeconds = 5;
        private int maxTimeoutSeconds = 120;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public double getTimeoutMultiplier() { return timeoutMultiplier; }
        public void setTimeoutMultiplier(double timeoutMultiplier) { this.timeoutMultiplier = timeoutMultiplier; }
        public int getMinTimeoutSeconds() { return minTimeoutSeconds; }
        public void setMinTimeoutSeconds(int minTimeoutSeconds) { this.minTimeoutSeconds = minTimeoutSeconds; }
        public int getMaxTimeoutSeconds() { return maxTimeoutSeconds; }
        public void setMaxTimeoutSeconds(int maxTimeoutSeconds) { this.maxTimeoutSeconds = maxTimeoutSeconds; }
    }

    public static class Classifier {
        private String rulesLocation = "classpath:classifier-rules.yml";

        public String getRulesLocation() { return rulesLocation; }
        public void setRulesLocation(String rulesLocation) { this.rulesLocation = rulesLocation; }
    }

    public static class Engine {
        private int maxHistory = 200;
        /** Submitted workflows beyond this many wait for a free runner. */
        private int maxConcurrentWorkflows = 8;

        public int getMaxHistory() { return maxHistory; }
        public void setMaxHistory(int maxHistory) { this.maxHistory = maxHistory; }
        public int getMaxConcurrentWorkflows() { return maxConcurrentWorkflows; }
        public void setMaxConcurrentWorkflows(int maxConcurrentWorkflows) {
            this.maxConcurrentWorkflows = maxConcurrentWorkflows;
        }
    }
}
