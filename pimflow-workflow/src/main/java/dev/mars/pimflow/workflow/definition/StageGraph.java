/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.pimflow.workflow.definition;

import dev.mars.pimflow.core.RoleCatalog;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The directed graph formed by a definition's stages and their next-stage references.
 * Performs the structural checks that decide whether a definition may be registered.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class StageGraph {

    private final WorkflowDefinition definition;
    private final Map<String, Stage> stages;
    private final List<String> duplicateIds;

    public StageGraph(WorkflowDefinition definition) {
        this.definition = Objects.requireNonNull(definition, "Workflow definition cannot be null");
        this.stages = new LinkedHashMap<>();
        this.duplicateIds = new ArrayList<>();
        for (Stage stage : definition.getStages()) {
            if (stages.putIfAbsent(stage.getId(), stage) != null) {
                duplicateIds.add(stage.getId());
            }
        }
    }

    /**
     * Checks every registration rule and returns all problems found.
     *
     * @param roles the roles a human stage may require
     */
    public ValidationResult validate(RoleCatalog roles) {
        ValidationResult result = new ValidationResult();

        if (stages.isEmpty()) {
            result.addError("spec.stages", "Workflow defines no stages");
            return result;
        }

        for (String duplicate : duplicateIds) {
            result.addError("spec.stages", "Duplicate stage id: " + duplicate);
        }

        String initial = definition.getInitialStageId();
        if (!stages.containsKey(initial)) {
            result.addError("spec.initialStage", "Initial stage '" + initial + "' is not defined");
            return result;
        }

        for (Stage stage : stages.values()) {
            validateShape(stage, roles, result);
            for (String target : stage.successors()) {
                if (!stages.containsKey(target)) {
                    result.addError(path(stage), "Next stage '" + target + "' is not defined");
                }
            }
        }

        Set<String> reachable = reachableFrom(initial);
        for (String stageId : stages.keySet()) {
            if (!reachable.contains(stageId)) {
                result.addError(path(stages.get(stageId)), "Stage is unreachable from initial stage '" + initial + "'");
            }
        }

        Set<String> finishing = stagesReachingTerminal();
        if (finishing.isEmpty()) {
            result.addError("spec.stages", "Workflow has no terminal stage");
        } else {
            for (String stageId : reachable) {
                if (!finishing.contains(stageId)) {
                    result.addError(path(stages.get(stageId)), "Stage can never reach a terminal stage");
                }
            }
        }

        for (List<String> cycle : automaticCycles()) {
            result.addError("spec.stages", "Automatic stages loop without a human decision: "
                    + String.join(" -> ", cycle));
        }

        Set<String> reentered = new HashSet<>();
        for (String[] edge : backEdges(initial)) {
            Stage target = stages.get(edge[1]);
            reentered.add(target.getId());
            if (!target.isReentrant()) {
                result.addError(path(stages.get(edge[0])), "Stage loops back to '" + target.getId()
                        + "' which is not marked reentrant");
            }
        }
        for (Stage stage : stages.values()) {
            if (stage.isReentrant() && reachable.contains(stage.getId()) && !reentered.contains(stage.getId())) {
                result.addWarning(path(stage), "Stage is marked reentrant but nothing loops back to it");
            }
        }

        return result;
    }

    /**
     * Stage ids reachable from the given stage, including itself, following only defined stages.
     */
    public Set<String> reachableFrom(String stageId) {
        Set<String> visited = new LinkedHashSet<>();
        if (!stages.containsKey(stageId)) {
            return visited;
        }
        Deque<String> queue = new ArrayDeque<>();
        queue.add(stageId);
        visited.add(stageId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String target : successorsOf(current)) {
                if (visited.add(target)) {
                    queue.add(target);
                }
            }
        }
        return visited;
    }

    /**
     * Edges that close a cycle when the graph is walked depth-first from {@code initial},
     * as {@code [from, to]} pairs. Every cycle reachable from the initial stage contains one.
     */
    public List<String[]> backEdges(String initial) {
        List<String[]> result = new ArrayList<>();
        if (stages.containsKey(initial)) {
            findBackEdges(initial, new HashSet<>(), new LinkedHashSet<>(), result);
        }
        return result;
    }

    private void findBackEdges(String current, Set<String> done, Set<String> onPath, List<String[]> result) {
        onPath.add(current);
        for (String target : successorsOf(current)) {
            if (onPath.contains(target)) {
                result.add(new String[]{current, target});
            } else if (!done.contains(target)) {
                findBackEdges(target, done, onPath, result);
            }
        }
        onPath.remove(current);
        done.add(current);
    }

    /**
     * Cycles made only of automatic stages. The engine would pass through them forever.
     */
    public List<List<String>> automaticCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> done = new HashSet<>();
        for (Stage stage : stages.values()) {
            if (stage.isAutomatic() && !done.contains(stage.getId())) {
                List<String> path = new ArrayList<>();
                String current = stage.getId();
                // automatic stages have a single successor, so the walk is a simple chain
                while (current != null && stages.containsKey(current) && stages.get(current).isAutomatic()
                        && !done.contains(current)) {
                    int index = path.indexOf(current);
                    if (index >= 0) {
                        List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
                        cycle.add(current);
                        cycles.add(cycle);
                        break;
                    }
                    path.add(current);
                    current = stages.get(current).getNext();
                }
                done.addAll(path);
            }
        }
        return cycles;
    }

    private Set<String> stagesReachingTerminal() {
        Map<String, Set<String>> predecessors = new HashMap<>();
        for (Stage stage : stages.values()) {
            for (String target : successorsOf(stage.getId())) {
                predecessors.computeIfAbsent(target, k -> new HashSet<>()).add(stage.getId());
            }
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (Stage stage : stages.values()) {
            if (stage.isTerminal()) {
                visited.add(stage.getId());
                queue.add(stage.getId());
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String predecessor : predecessors.getOrDefault(current, Set.of())) {
                if (visited.add(predecessor)) {
                    queue.add(predecessor);
                }
            }
        }
        return visited;
    }

    private List<String> successorsOf(String stageId) {
        Stage stage = stages.get(stageId);
        if (stage == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String target : stage.successors()) {
            if (stages.containsKey(target)) {
                result.add(target);
            }
        }
        return result;
    }

    private void validateShape(Stage stage, RoleCatalog roles, ValidationResult result) {
        String path = path(stage);
        switch (stage.getKind()) {
            case HUMAN:
                if (stage.getRequiredRole() == null) {
                    result.addError(path, "Human stage must name a role");
                } else if (roles != null && !roles.contains(stage.getRequiredRole())) {
                    result.addError(path, "Role '" + stage.getRequiredRole() + "' is not in the role catalog");
                }
                if (stage.getTransitions().isEmpty()) {
                    result.addError(path, "Human stage must allow at least one outcome");
                }
                if (stage.getNext() != null) {
                    result.addError(path, "Human stage uses transitions, not 'next'");
                }
                break;
            case AUTOMATIC:
                if (stage.getNext() == null) {
                    result.addError(path, "Automatic stage must name its 'next' stage");
                }
                if (!stage.getTransitions().isEmpty()) {
                    result.addError(path, "Automatic stage cannot have outcome transitions");
                }
                if (stage.getRequiredRole() != null) {
                    result.addWarning(path, "Role is ignored on automatic stage");
                }
                break;
            case TERMINAL:
                if (stage.getNext() != null || !stage.getTransitions().isEmpty()) {
                    result.addError(path, "Terminal stage cannot lead anywhere");
                }
                if (stage.getRequiredRole() != null) {
                    result.addWarning(path, "Role is ignored on terminal stage");
                }
                break;
            default:
                result.addError(path, "Unsupported stage kind: " + stage.getKind());
        }
    }

    private static String path(Stage stage) {
        return "spec.stages." + stage.getId();
    }

    @Override
    public String toString() {
        return "StageGraph{" +
               "definition=" + definition.getId() +
               ", stages=" + stages.keySet() +
               '}';
    }
}
