package com.routemind.core.workflow;

import com.routemind.core.model.Task;
import com.routemind.core.model.TaskState;
import com.routemind.core.model.TaskType;
import com.routemind.core.model.WorkflowPlan;
import com.routemind.core.model.WorkflowTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Expands a workflow template into an ordered list of tasks.
 * <p>
 * A task's dependencies are resolved only against tasks created before it, so the
 * result is acyclic by construction. A prerequisite type that has not been emitted
 * yet is simply left unresolved.
 */
public class WorkflowGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(WorkflowGraphBuilder.class);

    private final WorkflowTemplateCatalog catalog;
    private final Supplier<String> prefixSupplier;

    public WorkflowGraphBuilder(WorkflowTemplateCatalog catalog) {
        this(catalog, () -> UUID.randomUUID().toString().substring(0, 8));
    }

    WorkflowGraphBuilder(WorkflowTemplateCatalog catalog, Supplier<String> prefixSupplier) {
        this.catalog = catalog;
        this.prefixSupplier = prefixSupplier;
    }

    public List<Task> build(String templateKey, String prompt, Map<String, Object> context) {
        return plan(templateKey, prompt, context).tasks();
    }

    /**
     * Like {@link #build} but also reports which template was used.
     *
     * @param templateKey template to expand, or null/blank to infer one from the prompt
     * @throws UnknownTemplateException if {@code templateKey} is given but not in the catalog
     */
    public WorkflowPlan plan(String templateKey, String prompt, Map<String, Object> context) {
        String key = templateKey == null || templateKey.isBlank() ? catalog.suggest(prompt) : templateKey;
        WorkflowTemplate template = catalog.get(key);
        String prefix = prefixSupplier.get();

        var groupOf = new HashMap<TaskType, String>();
        var sections = template.parallelSections();
        for (int i = 0; i < sections.size(); i++) {
            if (sections.get(i).size() < 2) continue;
            for (TaskType type : sections.get(i)) {
                groupOf.putIfAbsent(type, prefix + "-pg" + i);
            }
        }

        var tasks = new ArrayList<Task>();
        var types = template.taskTypes();
        for (int i = 0; i < types.size(); i++) {
            TaskType type = types.get(i);
            var dependencies = new LinkedHashSet<String>();
            for (TaskType prereq : template.prerequisitesOf(type)) {
                tasks.stream()
                        .filter(t -> t.type() == prereq)
                        .findFirst()
                        .ifPresent(t -> dependencies.add(t.id()));
            }
            tasks.add(new Task(prefix + "-" + type.tag() + "-" + i, type, subPrompt(type, prompt),
                    context, new ArrayList<>(dependencies), groupOf.get(type), TaskState.PENDING));
        }
        log.info("Built {} task(s) from template {} ({} parallel group(s))", tasks.size(), key,
                groupOf.values().stream().distinct().count());
        return new WorkflowPlan(key, tasks);
    }

    public String suggestTemplate(String prompt) {
        return catalog.suggest(prompt);
    }

    public List<WorkflowTemplate> listTemplates() {
        return List.copyOf(catalog.list());
    }

    static String subPrompt(TaskType type, String prompt) {
        return switch (type) {
            case RESEARCH -> "Research and gather information about: " + prompt;
            case REASONING -> "Analyze and reason about: " + prompt
                    + ". Consider the research findings and provide logical conclusions.";
            case CODING -> "Develop code or technical solution for: " + prompt
                    + ". Use research insights to inform the implementation.";
            case CREATIVE -> "Create creative content related to: " + prompt
                    + ". Draw inspiration from research and analysis.";
            case GENERAL -> "Provide a comprehensive summary and final response for: " + prompt
                    + ". Integrate insights from all previous analyses.";
            case ANALYSIS -> "Perform detailed analysis of: " + prompt;
            case MULTIMODAL -> "Process and analyze multimodal content for: " + prompt;
        };
    }
}
