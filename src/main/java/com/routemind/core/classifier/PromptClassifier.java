package com.routemind.core.classifier;

import com.routemind.core.model.Classification;
import com.routemind.core.model.ComplexityLevel;
import com.routemind.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Classifies a prompt into a complexity level and a task type using the
 * weighted pattern tiers and keyword tables of {@link ClassifierRules}.
 * <p>
 * Stateless apart from the immutable rules, so it is safe to share across threads.
 */
@Service
public class PromptClassifier {

    private static final Logger log = LoggerFactory.getLogger(PromptClassifier.class);

    private final ClassifierRules rules;

    public PromptClassifier(ClassifierRules rules) {
        this.rules = rules;
    }

    public Classification classify(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return Classification.fallback();
        }
        ComplexityLevel complexity = estimateComplexity(prompt);
        TaskType taskType = detectTaskType(prompt);
        boolean defaulted = complexity == ComplexityLevel.SIMPLE && taskType == TaskType.GENERAL
                && !anyKeywordHit(prompt) && !anyComplexitySignal(prompt);
        log.debug("Classified prompt ({} chars) as {}/{}", prompt.length(), complexity, taskType);
        return new Classification(complexity, taskType, defaulted);
    }

    /**
     * Highest tier whose weighted score reaches its threshold, or SIMPLE.
     */
    public ComplexityLevel estimateComplexity(String prompt) {
        int structuralSignals = structuralSignals(prompt);
        for (var tier : rules.tiers()) {
            double score = structuralSignals * tier.structuralWeight();
            for (var p : tier.patterns()) {
                if (p.pattern().matcher(prompt).find()) {
                    score += p.weight();
                }
            }
            if (score >= tier.minScore()) {
                return tier.level();
            }
        }
        return ComplexityLevel.SIMPLE;
    }

    /**
     * Argmax of per-category keyword hits, ties resolved by the configured priority.
     */
    public TaskType detectTaskType(String prompt) {
        String lower = prompt.toLowerCase(Locale.ROOT);
        TaskType best = TaskType.GENERAL;
        int bestHits = 0;
        for (TaskType type : rules.categoryPriority()) {
            int hits = countHits(lower, rules.categoryKeywords().getOrDefault(type, List.of()));
            if (hits > bestHits) {
                best = type;
                bestHits = hits;
            }
        }
        return best;
    }

    private boolean anyKeywordHit(String prompt) {
        String lower = prompt.toLowerCase(Locale.ROOT);
        return rules.categoryKeywords().values().stream().anyMatch(words -> countHits(lower, words) > 0);
    }

    private boolean anyComplexitySignal(String prompt) {
        if (structuralSignals(prompt) > 0) return true;
        for (var tier : rules.tiers()) {
            for (var p : tier.patterns()) {
                if (p.pattern().matcher(prompt).find()) return true;
            }
        }
        return false;
    }

    private int structuralSignals(String prompt) {
        int signals = 0;
        if (prompt.contains("```")) signals++;
        if (prompt.split("\n", -1).length > rules.maxLinesForSimple()) signals++;
        if (prompt.length() > rules.longPromptChars()) signals++;
        return signals;
    }

    private static int countHits(String lowerPrompt, List<String> keywords) {
        int hits = 0;
        for (String keyword : keywords) {
            if (lowerPrompt.contains(keyword)) hits++;
        }
        return hits;
    }
}
