package com.routemind.core.scheduler;

import com.routemind.core.model.Task;
import com.routemind.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Computes the next wave of tasks eligible for dispatch from the current task states.
 *
 * <p>A task is eligible when it is PENDING and every dependency is DONE. Members of a
 * parallel group are released together: the group is held back until each of its
 * pending members is eligible, and a group is never split across waves.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /**
     * Compute the next wave of task IDs eligible for dispatch.
     *
     * @param tasks  all tasks of the workflow, in creation order
     * @param states current state per task id; missing ids count as PENDING
     * @param limit  maximum tasks per wave; a whole group may still exceed it when the wave is otherwise empty
     * @return task IDs to start now; empty when nothing is ready
     */
    public List<String> computeNextWave(List<Task> tasks, Map<String, TaskState> states, int limit) {
        var wave = new ArrayList<String>();
        var handledGroups = new HashSet<String>();

        for (var task : tasks) {
            if (wave.size() >= limit) break;
            if (stateOf(task, states) != TaskState.PENDING || !dependenciesDone(task, states)) {
                continue;
            }
            String group = task.parallelGroup();
            if (group == null) {
                wave.add(task.id());
                continue;
            }
            if (!handledGroups.add(group)) {
                continue;
            }
            var members = tasks.stream()
                    .filter(t -> group.equals(t.parallelGroup()))
                    .filter(t -> stateOf(t, states) == TaskState.PENDING)
                    .toList();
            if (!members.stream().allMatch(t -> dependenciesDone(t, states))) {
                log.debug("  group {} held back: not every member is ready", group);
                continue;
            }
            if (!wave.isEmpty() && wave.size() + members.size() > limit) {
                log.debug("  group {} deferred: {} members exceed remaining capacity", group, members.size());
                continue;
            }
            members.forEach(m -> wave.add(m.id()));
        }

        if (!wave.isEmpty()) {
            log.debug("computeNextWave: {} of {} tasks eligible: {}", wave.size(), tasks.size(), wave);
        }
        return wave;
    }

    /**
     * All tasks that depend on {@code taskId}, directly or transitively, in creation order.
     */
    public List<String> transitiveDependents(List<Task> tasks, String taskId) {
        var affected = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(taskId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (var task : tasks) {
                if (task.dependencies().contains(current) && affected.add(task.id())) {
                    queue.add(task.id());
                }
            }
        }
        return tasks.stream().map(Task::id).filter(affected::contains).toList();
    }

    /**
     * True when no task can make progress any more: every task is DONE or FAILED.
     */
    public boolean isSettled(List<Task> tasks, Map<String, TaskState> states) {
        return tasks.stream().allMatch(t -> stateOf(t, states).isTerminal());
    }

    private static boolean dependenciesDone(Task task, Map<String, TaskState> states) {
        for (var dep : task.dependencies()) {
            if (states.get(dep) != TaskState.DONE) {
                return false;
            }
        }
        return true;
    }

    private static TaskState stateOf(Task task, Map<String, TaskState> states) {
        return states.getOrDefault(task.id(), TaskState.PENDING);
    }
}
