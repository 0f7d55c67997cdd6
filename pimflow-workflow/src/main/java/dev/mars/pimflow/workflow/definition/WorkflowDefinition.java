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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable workflow template: a named graph of stages.
 * <p>
 * Laid out like the YAML documents it is parsed from ({@code apiVersion}, {@code kind},
 * {@code metadata}, {@code spec}). The definition id is {@code metadata.id}, which
 * defaults to the name.
 */
public class WorkflowDefinition {

    public static final String DEFAULT_API_VERSION = "v1";
    public static final String DEFAULT_KIND = "ApprovalWorkflow";

    private final String apiVersion;
    private final String kind;
    private final WorkflowMetadata metadata;
    private final WorkflowSpec spec;

    public WorkflowDefinition(String apiVersion, String kind, WorkflowMetadata metadata, WorkflowSpec spec) {
        this.apiVersion = Objects.requireNonNull(apiVersion, "API version cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null");
        this.spec = Objects.requireNonNull(spec, "Spec cannot be null");
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getKind() {
        return kind;
    }

    public WorkflowMetadata getMetadata() {
        return metadata;
    }

    public WorkflowSpec getSpec() {
        return spec;
    }

    public String getId() {
        return metadata.getId();
    }

    public String getName() {
        return metadata.getName();
    }

    public List<Stage> getStages() {
        return spec.getStages();
    }

    /**
     * The first stage a run enters: {@code spec.initialStage}, or the first declared stage.
     */
    public String getInitialStageId() {
        if (spec.getInitialStage() != null) {
            return spec.getInitialStage();
        }
        return spec.getStages().isEmpty() ? null : spec.getStages().get(0).getId();
    }

    /**
     * Finds a stage by id. With duplicate ids (only possible before validation) the first wins.
     */
    public Optional<Stage> getStage(String stageId) {
        if (stageId == null) {
            return Optional.empty();
        }
        return spec.getStages().stream().filter(s -> s.getId().equals(stageId)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(apiVersion, that.apiVersion) &&
               Objects.equals(kind, that.kind) &&
               Objects.equals(metadata, that.metadata) &&
               Objects.equals(spec, that.spec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiVersion, kind, metadata, spec);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "id='" + getId() + '\'' +
               ", version='" + metadata.getVersion() + '\'' +
               ", stages=" + spec.getStages().size() +
               '}';
    }

    public static class WorkflowMetadata {
        private final String id;
        private final String name;
        private final String version;
        private final String description;
        private final String author;
        private final Map<String, String> labels;

        public WorkflowMetadata(String id, String name, String version, String description,
                                String author, Map<String, String> labels) {
            this.name = Objects.requireNonNull(name, "Name cannot be null");
            this.id = id != null && !id.trim().isEmpty() ? id : name;
            this.version = version != null ? version : "1.0.0";
            this.description = description;
            this.author = author;
            this.labels = labels != null ? Map.copyOf(labels) : Map.of();
        }

        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public String getVersion() {
            return version;
        }

        public String getDescription() {
            return description;
        }

        public String getAuthor() {
            return author;
        }

        public Map<String, String> getLabels() {
            return labels;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            WorkflowMetadata that = (WorkflowMetadata) o;
            return Objects.equals(id, that.id) &&
                   Objects.equals(name, that.name) &&
                   Objects.equals(version, that.version) &&
                   Objects.equals(description, that.description) &&
                   Objects.equals(author, that.author) &&
                   Objects.equals(labels, that.labels);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, name, version, description, author, labels);
        }

        @Override
        public String toString() {
            return "WorkflowMetadata{" +
                   "id='" + id + '\'' +
                   ", name='" + name + '\'' +
                   ", version='" + version + '\'' +
                   '}';
        }
    }

    public static class WorkflowSpec {
        private final String initialStage;
        private final List<Stage> stages;

        public WorkflowSpec(String initialStage, List<Stage> stages) {
            this.initialStage = initialStage;
            this.stages = stages != null ? List.copyOf(stages) : List.of();
        }

        public String getInitialStage() {
            return initialStage;
        }

        public List<Stage> getStages() {
            return stages;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            WorkflowSpec that = (WorkflowSpec) o;
            return Objects.equals(initialStage, that.initialStage) &&
                   Objects.equals(stages, that.stages);
        }

        @Override
        public int hashCode() {
            return Objects.hash(initialStage, stages);
        }

        @Override
        public String toString() {
            return "WorkflowSpec{" +
                   "initialStage='" + initialStage + '\'' +
                   ", stages=" + stages +
                   '}';
        }
    }

    /**
     * Programmatic construction, mainly for embedding and tests.
     */
    public static class Builder {
        private final String id;
        private String name;
        private String version = "1.0.0";
        private String description;
        private String author;
        private final Map<String, String> labels = new LinkedHashMap<>();
        private String initialStage;
        private final List<Stage> stages = new ArrayList<>();

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "Definition ID cannot be null");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder label(String key, String value) {
            this.labels.put(key, value);
            return this;
        }

        public Builder initialStage(String initialStage) {
            this.initialStage = initialStage;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stages.add(Objects.requireNonNull(stage, "Stage cannot be null"));
            return this;
        }

        public WorkflowDefinition build() {
            WorkflowMetadata metadata = new WorkflowMetadata(id, name != null ? name : id,
                    version, description, author, labels);
            return new WorkflowDefinition(DEFAULT_API_VERSION, DEFAULT_KIND, metadata,
                    new WorkflowSpec(initialStage, stages));
        }
    }
}
