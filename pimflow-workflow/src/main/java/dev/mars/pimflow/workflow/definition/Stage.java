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

import dev.mars.pimflow.core.Outcome;
import dev.mars.pimflow.core.Role;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One step of a workflow definition.
 * <p>
 * A stage is deliberately lenient about its own shape: a human stage without a role
 * or an automatic stage without a successor can be built, and is reported by
 * {@link StageGraph#validate} when the definition is registered.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class Stage {

    private final String id;
    private final StageKind kind;
    private final String description;
    private final Role requiredRole;
    private final Map<Outcome, String> transitions;
    private final String next;
    private final boolean reentrant;

    private Stage(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Stage ID cannot be null");
        this.kind = Objects.requireNonNull(builder.kind, "Stage kind cannot be null");
        this.description = builder.description;
        this.requiredRole = builder.requiredRole;
        EnumMap<Outcome, String> copy = new EnumMap<>(Outcome.class);
        copy.putAll(builder.transitions);
        this.transitions = Collections.unmodifiableMap(copy);
        this.next = builder.next;
        this.reentrant = builder.reentrant;
    }

    public static Builder builder(String id, StageKind kind) {
        return new Builder(id, kind);
    }

    public static Stage human(String id, Role role, Map<Outcome, String> transitions) {
        return builder(id, StageKind.HUMAN).requiredRole(role).transitions(transitions).build();
    }

    public static Stage automatic(String id, String next) {
        return builder(id, StageKind.AUTOMATIC).next(next).build();
    }

    public static Stage terminal(String id) {
        return builder(id, StageKind.TERMINAL).build();
    }

    public String getId() {
        return id;
    }

    public StageKind getKind() {
        return kind;
    }

    public String getDescription() {
        return description;
    }

    /**
     * The role allowed to resolve this stage's task; {@code null} unless the stage is human.
     */
    public Role getRequiredRole() {
        return requiredRole;
    }

    public Map<Outcome, String> getTransitions() {
        return transitions;
    }

    public Set<Outcome> getAllowedOutcomes() {
        return transitions.keySet();
    }

    public boolean allows(Outcome outcome) {
        return transitions.containsKey(outcome);
    }

    public Optional<String> nextStageFor(Outcome outcome) {
        return Optional.ofNullable(transitions.get(outcome));
    }

    /**
     * The successor of an automatic stage; {@code null} for other kinds.
     */
    public String getNext() {
        return next;
    }

    public boolean isReentrant() {
        return reentrant;
    }

    public boolean isHuman() {
        return kind == StageKind.HUMAN;
    }

    public boolean isAutomatic() {
        return kind == StageKind.AUTOMATIC;
    }

    public boolean isTerminal() {
        return kind == StageKind.TERMINAL;
    }

    /**
     * Every stage id this stage can move to, in outcome order, without duplicates.
     */
    public List<String> successors() {
        List<String> result = new ArrayList<>();
        if (next != null) {
            result.add(next);
        }
        for (String target : transitions.values()) {
            if (!result.contains(target)) {
                result.add(target);
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Stage stage = (Stage) o;
        return reentrant == stage.reentrant &&
               id.equals(stage.id) &&
               kind == stage.kind &&
               Objects.equals(description, stage.description) &&
               Objects.equals(requiredRole, stage.requiredRole) &&
               transitions.equals(stage.transitions) &&
               Objects.equals(next, stage.next);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, description, requiredRole, transitions, next, reentrant);
    }

    @Override
    public String toString() {
        return "Stage{" +
               "id='" + id + '\'' +
               ", kind=" + kind +
               (requiredRole != null ? ", role=" + requiredRole : "") +
               (transitions.isEmpty() ? "" : ", transitions=" + transitions) +
               (next != null ? ", next='" + next + '\'' : "") +
               (reentrant ? ", reentrant" : "") +
               '}';
    }

    public static class Builder {
        private final String id;
        private final StageKind kind;
        private String description;
        private Role requiredRole;
        private final Map<Outcome, String> transitions = new EnumMap<>(Outcome.class);
        private String next;
        private boolean reentrant;

        private Builder(String id, StageKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder requiredRole(Role requiredRole) {
            this.requiredRole = requiredRole;
            return this;
        }

        public Builder transition(Outcome outcome, String targetStageId) {
            this.transitions.put(Objects.requireNonNull(outcome, "Outcome cannot be null"),
                    Objects.requireNonNull(targetStageId, "Target stage cannot be null"));
            return this;
        }

        public Builder transitions(Map<Outcome, String> transitions) {
            if (transitions != null) {
                transitions.forEach(this::transition);
            }
            return this;
        }

        public Builder next(String next) {
            this.next = next;
            return this;
        }

        public Builder reentrant(boolean reentrant) {
            this.reentrant = reentrant;
            return this;
        }

        public Stage build() {
            return new Stage(this);
        }
    }
}
