package com.routemind.core.workflow;

import com.routemind.core.Fixtures;
import com.routemind.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowTemplateCatalogTest {

    @Test
    @DisplayName("keeps declaration order")
    void declarationOrder() {
        assertEquals(List.of("research_analysis", "code_development", "technical_docs", "multi_domain"),
                Fixtures.catalog().list().stream().map(t -> t.key()).toList());
    }

    @Test
    @DisplayName("dependencies on undeclared types are rejected")
    void undeclaredDependency() {
        var bad = Fixtures.template("bad", List.of(TaskType.GENERAL),
                Map.of(TaskType.GENERAL, List.of(TaskType.RESEARCH)), List.of());
        var e = assertThrows(InvalidTemplateDefinitionException.class,
                () -> new WorkflowTemplateCatalog(List.of(bad), "bad"));
        assertTrue(e.getMessage().contains("research"));
    }

    @Test
    @DisplayName("parallel sections holding dependent types are rejected")
    void dependentParallelSection() {
        var bad = Fixtures.template("bad", List.of(TaskType.RESEARCH, TaskType.CODING, TaskType.GENERAL),
                Map.of(TaskType.CODING, List.of(TaskType.RESEARCH), TaskType.GENERAL, List.of(TaskType.CODING)),
                List.of(List.of(TaskType.RESEARCH, TaskType.GENERAL)));
        assertThrows(InvalidTemplateDefinitionException.class, () -> new WorkflowTemplateCatalog(List.of(bad), "bad"));
    }

    @Test
    @DisplayName("parallel groups waiting on each other are rejected")
    void groupsWaitingOnEachOther() {
        var research = TaskType.RESEARCH;
        var coding = TaskType.CODING;
        var reasoning = TaskType.REASONING;
        var creative = TaskType.CREATIVE;
        var bad = Fixtures.template("crossed", List.of(research, coding, reasoning, creative),
                Map.of(reasoning, List.of(research), creative, List.of(coding)),
                List.of(List.of(research, creative), List.of(coding, reasoning)));
        var e = assertThrows(InvalidTemplateDefinitionException.class,
                () -> new WorkflowTemplateCatalog(List.of(bad), "crossed"));
        assertTrue(e.getMessage().contains("crossed"));
    }

    @Test
    @DisplayName("groups waiting on each other through an ungrouped task are rejected")
    void groupsWaitingThroughSingleTask() {
        var research = TaskType.RESEARCH;
        var general = TaskType.GENERAL;
        var coding = TaskType.CODING;
        var reasoning = TaskType.REASONING;
        var creative = TaskType.CREATIVE;
        // [research, creative] waits on [coding, reasoning], which waits on general, which waits on research
        var bad = Fixtures.template("loop", List.of(research, general, coding, reasoning, creative),
                Map.of(general, List.of(research), coding, List.of(general), creative, List.of(reasoning)),
                List.of(List.of(research, creative), List.of(coding, reasoning)));
        var e = assertThrows(InvalidTemplateDefinitionException.class,
                () -> new WorkflowTemplateCatalog(List.of(bad), "loop"));
        assertTrue(e.getMessage().contains("wait on each other"));
    }

    @Test
    @DisplayName("groups that only wait in one direction are accepted")
    void groupsWaitingOneWay() {
        var research = TaskType.RESEARCH;
        var coding = TaskType.CODING;
        var reasoning = TaskType.REASONING;
        var creative = TaskType.CREATIVE;
        var ok = Fixtures.template("layered", List.of(research, creative, coding, reasoning),
                Map.of(coding, List.of(creative), reasoning, List.of(research)),
                List.of(List.of(research, creative), List.of(coding, reasoning)));
        assertDoesNotThrow(() -> new WorkflowTemplateCatalog(List.of(ok), "layered"));
    }

    @Test
    @DisplayName("a prerequisite listed later does not count as a wait")
    void unresolvedPrerequisiteIgnored() {
        var research = TaskType.RESEARCH;
        var coding = TaskType.CODING;
        var reasoning = TaskType.REASONING;
        var creative = TaskType.CREATIVE;
        // creative is built before coding, so its prerequisite on coding never resolves
        var ok = Fixtures.template("forward", List.of(research, creative, coding, reasoning),
                Map.of(reasoning, List.of(research), creative, List.of(coding)),
                List.of(List.of(research, creative), List.of(coding, reasoning)));
        assertDoesNotThrow(() -> new WorkflowTemplateCatalog(List.of(ok), "forward"));
    }

    @Test
    @DisplayName("parallel sections naming undeclared types are rejected")
    void undeclaredParallelType() {
        var bad = Fixtures.template("bad", List.of(TaskType.RESEARCH), Map.of(),
                List.of(List.of(TaskType.RESEARCH, TaskType.CREATIVE)));
        assertThrows(InvalidTemplateDefinitionException.class, () -> new WorkflowTemplateCatalog(List.of(bad), "bad"));
    }

    @Test
    @DisplayName("duplicate keys and a missing default are rejected")
    void duplicatesAndDefault() {
        var t = Fixtures.template("a", List.of(TaskType.GENERAL), Map.of(), List.of());
        assertThrows(InvalidTemplateDefinitionException.class, () -> new WorkflowTemplateCatalog(List.of(t, t), "a"));
        assertThrows(InvalidTemplateDefinitionException.class, () -> new WorkflowTemplateCatalog(List.of(t), "b"));
    }

    @Test
    @DisplayName("lookup by key")
    void lookup() {
        var catalog = Fixtures.catalog();
        assertEquals("technical_docs", catalog.get("technical_docs").key());
        assertTrue(catalog.find("missing").isEmpty());
        assertThrows(UnknownTemplateException.class, () -> catalog.get("missing"));
    }
}
