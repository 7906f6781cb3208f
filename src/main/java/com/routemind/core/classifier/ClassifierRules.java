package com.routemind.core.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.routemind.core.model.ComplexityLevel;
import com.routemind.core.model.TaskType;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable pattern tables driving {@link PromptClassifier}.
 * <p>
 * Loaded from a YAML document of the shape:
 * <pre>
 * complexity:
 *   max-lines-for-simple: 10
 *   long-prompt-chars: 240
 *   tiers:
 *     - level: expert
 *       min-score: 2.0
 *       patterns:
 *         - { regex: '\b(proof|prove)\b', weight: 1.0 }
 * categories:
 *   priority: [reasoning, coding, creative, research, general]
 *   keywords:
 *     reasoning: [solve, prove]
 * </pre>
 * Any malformed entry fails the load with {@link IllegalArgumentException}.
 */
public final class ClassifierRules {

    /**
     * A compiled regex with the weight it adds to its tier score when found.
     */
    public record WeightedPattern(Pattern pattern, double weight) {}

    /**
     * One complexity tier. {@code structuralWeight} is added for each structural
     * signal (code fence, line count, prompt length) when non-zero.
     */
    public record Tier(ComplexityLevel level, double minScore, List<WeightedPattern> patterns,
                       double structuralWeight) {

        public Tier {
            patterns = List.copyOf(patterns);
        }
    }

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final List<Tier> tiers;
    private final Map<TaskType, List<String>> categoryKeywords;
    private final List<TaskType> categoryPriority;
    private final int maxLinesForSimple;
    private final int longPromptChars;

    public ClassifierRules(List<Tier> tiers, Map<TaskType, List<String>> categoryKeywords,
                           List<TaskType> categoryPriority, int maxLinesForSimple, int longPromptChars) {
        var sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparing(Tier::level).reversed());
        this.tiers = List.copyOf(sorted);
        var keywords = new LinkedHashMap<TaskType, List<String>>();
        categoryKeywords.forEach((type, words) -> keywords.put(type, words.stream()
                .map(w -> w.toLowerCase(Locale.ROOT)).toList()));
        this.categoryKeywords = java.util.Collections.unmodifiableMap(keywords);
        this.categoryPriority = List.copyOf(categoryPriority);
        this.maxLinesForSimple = maxLinesForSimple;
        this.longPromptChars = longPromptChars;
        for (TaskType type : this.categoryKeywords.keySet()) {
            if (!this.categoryPriority.contains(type)) {
                throw new IllegalArgumentException("Category '" + type.tag() + "' has keywords but no priority");
            }
        }
    }

    /** Tiers ordered from the highest level down. */
    public List<Tier> tiers() { return tiers; }
    public Map<TaskType, List<String>> categoryKeywords() { return categoryKeywords; }
    public List<TaskType> categoryPriority() { return categoryPriority; }
    public int maxLinesForSimple() { return maxLinesForSimple; }
    public int longPromptChars() { return longPromptChars; }

    public static ClassifierRules fromYaml(InputStream in) throws IOException {
        JsonNode root = YAML.readTree(in);
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IllegalArgumentException("Classifier rules document is empty");
        }
        JsonNode complexity = required(root, "complexity");
        int maxLines = complexity.path("max-lines-for-simple").asInt(10);
        int longChars = complexity.path("long-prompt-chars").asInt(240);

        var tiers = new ArrayList<Tier>();
        for (JsonNode tierNode : required(complexity, "tiers")) {
            ComplexityLevel level = ComplexityLevel.fromTag(required(tierNode, "level").asText());
            if (level == ComplexityLevel.SIMPLE) {
                throw new IllegalArgumentException("SIMPLE is the fallback level and cannot be a tier");
            }
            if (tiers.stream().anyMatch(t -> t.level() == level)) {
                throw new IllegalArgumentException("Duplicate complexity tier: " + level.tag());
            }
            var patterns = new ArrayList<WeightedPattern>();
            for (JsonNode p : tierNode.path("patterns")) {
                patterns.add(new WeightedPattern(compile(required(p, "regex").asText()),
                        p.path("weight").asDouble(1.0)));
            }
            tiers.add(new Tier(level, required(tierNode, "min-score").asDouble(), patterns,
                    tierNode.path("structural-weight").asDouble(0.0)));
        }

        JsonNode categories = required(root, "categories");
        var priority = new ArrayList<TaskType>();
        for (JsonNode p : required(categories, "priority")) {
            priority.add(TaskType.fromTag(p.asText()));
        }
        var keywords = new LinkedHashMap<TaskType, List<String>>();
        var fields = required(categories, "keywords").fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            var words = new ArrayList<String>();
            entry.getValue().forEach(w -> words.add(w.asText()));
            keywords.put(TaskType.fromTag(entry.getKey()), words);
        }
        return new ClassifierRules(tiers, keywords, priority, maxLines, longChars);
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Classifier rules missing '" + field + "'");
        }
        return value;
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid classifier pattern '" + regex + "': " + e.getDescription(), e);
        }
    }
}
