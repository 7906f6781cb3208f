package com.routemind.core.workflow;

import com.routemind.core.model.TaskType;
import com.routemind.core.model.WorkflowTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, immutable set of workflow templates in declaration order.
 * <p>
 * Every template is checked when the catalog is built: dependencies and parallel
 * sections may only name types in the template's sequence, and no parallel section
 * may hold two types where one depends on the other, directly or transitively. A parallel
 * group starts only once every member's dependencies are done, so groups whose members
 * wait on each other, directly or through other tasks, are rejected as well.
 */
public class WorkflowTemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(WorkflowTemplateCatalog.class);

    private final Map<String, WorkflowTemplate> templates;
    private final String defaultKey;

    /**
     * @throws InvalidTemplateDefinitionException if any template is malformed, keys repeat,
     *                                            or the default key is not in the catalog
     */
    public WorkflowTemplateCatalog(List<WorkflowTemplate> templates, String defaultKey) {
        var byKey = new LinkedHashMap<String, WorkflowTemplate>();
        for (WorkflowTemplate template : templates) {
            validate(template);
            if (byKey.putIfAbsent(template.key(), template) != null) {
                throw new InvalidTemplateDefinitionException("Duplicate template key: " + template.key());
            }
        }
        if (!byKey.isEmpty() && !byKey.containsKey(defaultKey)) {
            throw new InvalidTemplateDefinitionException("Default template '" + defaultKey + "' is not defined");
        }
        this.templates = Collections.unmodifiableMap(byKey);
        this.defaultKey = defaultKey;
        log.info("Loaded {} workflow template(s), default {}", byKey.size(), defaultKey);
    }

    /**
     * @throws UnknownTemplateException if no template has this key
     */
    public WorkflowTemplate get(String key) {
        WorkflowTemplate template = templates.get(key);
        if (template == null) {
            throw new UnknownTemplateException(key);
        }
        return template;
    }

    public Optional<WorkflowTemplate> find(String key) {
        return Optional.ofNullable(templates.get(key));
    }

    public Collection<WorkflowTemplate> list() {
        return templates.values();
    }

    public String defaultKey() {
        return defaultKey;
    }

    /**
     * Template whose keywords occur most often in the prompt; ties go to the earlier
     * template and no hit at all yields the default.
     */
    public String suggest(String prompt) {
        String lower = prompt == null ? "" : prompt.toLowerCase(Locale.ROOT);
        String best = defaultKey;
        int bestHits = 0;
        for (WorkflowTemplate template : templates.values()) {
            int hits = 0;
            for (String keyword : template.keywords()) {
                if (lower.contains(keyword.toLowerCase(Locale.ROOT))) hits++;
            }
            if (hits > bestHits) {
                best = template.key();
                bestHits = hits;
            }
        }
        return best;
    }

    static void validate(WorkflowTemplate template) {
        String key = template.key();
        if (key == null || key.isBlank()) {
            throw new InvalidTemplateDefinitionException("Template key must not be blank");
        }
        Set<TaskType> declared = new HashSet<>(template.taskTypes());
        template.dependencies().forEach((type, prereqs) -> {
            if (!declared.contains(type)) {
                throw new InvalidTemplateDefinitionException("Template '" + key
                        + "' declares dependencies for undeclared type " + type.tag());
            }
            for (TaskType prereq : prereqs) {
                if (!declared.contains(prereq)) {
                    throw new InvalidTemplateDefinitionException("Template '" + key + "': " + type.tag()
                            + " depends on undeclared type " + prereq.tag());
                }
            }
        });
        for (List<TaskType> section : template.parallelSections()) {
            for (TaskType type : section) {
                if (!declared.contains(type)) {
                    throw new InvalidTemplateDefinitionException("Template '" + key
                            + "' has undeclared type " + type.tag() + " in a parallel section");
                }
            }
            for (TaskType a : section) {
                for (TaskType b : section) {
                    if (a != b && dependsOn(template, a, b)) {
                        throw new InvalidTemplateDefinitionException("Template '" + key + "': parallel section "
                                + section + " contains " + a.tag() + " which depends on " + b.tag());
                    }
                }
            }
        }
        checkGroupWaits(template);
    }

    /**
     * Contracts each parallel group into one node of the dependency graph the builder will
     * produce and fails if that graph has a cycle.
     */
    private static void checkGroupWaits(WorkflowTemplate template) {
        var types = template.taskTypes();
        var groupOf = new HashMap<TaskType, Integer>();
        var sections = template.parallelSections();
        for (int i = 0; i < sections.size(); i++) {
            if (sections.get(i).size() < 2) continue;
            for (TaskType type : sections.get(i)) {
                groupOf.putIfAbsent(type, i);
            }
        }
        // node ids: positions for ungrouped tasks, types.size() + section index for groups
        var waits = new HashMap<Integer, Set<Integer>>();
        for (int i = 0; i < types.size(); i++) {
            int from = node(groupOf, types, i);
            for (TaskType prereq : template.prerequisitesOf(types.get(i))) {
                int j = types.indexOf(prereq);
                if (j < 0 || j >= i) continue;
                int to = node(groupOf, types, j);
                if (from != to) {
                    waits.computeIfAbsent(from, k -> new HashSet<>()).add(to);
                }
            }
        }
        var done = new HashSet<Integer>();
        for (Integer start : waits.keySet()) {
            if (hasCycle(start, waits, new HashSet<>(), done)) {
                throw new InvalidTemplateDefinitionException("Template '" + template.key()
                        + "': parallel sections wait on each other and could never start");
            }
        }
    }

    private static int node(Map<TaskType, Integer> groupOf, List<TaskType> types, int position) {
        Integer section = groupOf.get(types.get(position));
        return section == null ? position : types.size() + section;
    }

    private static boolean hasCycle(int node, Map<Integer, Set<Integer>> waits, Set<Integer> path, Set<Integer> done) {
        if (done.contains(node)) return false;
        if (!path.add(node)) return true;
        for (int next : waits.getOrDefault(node, Set.of())) {
            if (hasCycle(next, waits, path, done)) return true;
        }
        path.remove(node);
        done.add(node);
        return false;
    }

    private static boolean dependsOn(WorkflowTemplate template, TaskType from, TaskType target) {
        var seen = new HashSet<TaskType>();
        var queue = new ArrayDeque<>(template.prerequisitesOf(from));
        while (!queue.isEmpty()) {
            TaskType next = queue.poll();
            if (next == target) return true;
            if (seen.add(next)) {
                queue.addAll(template.prerequisitesOf(next));
            }
        }
        return false;
    }
}
