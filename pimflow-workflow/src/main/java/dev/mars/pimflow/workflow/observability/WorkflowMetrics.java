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

package dev.mars.pimflow.workflow.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Pimflow workflow engine.
 *
 * Provides the following metrics:
 * - pimflow.workflow.runs.active (gauge) - Runs currently ACTIVE
 * - pimflow.workflow.runs.started (counter) - Runs started
 * - pimflow.workflow.runs.completed (counter) - Runs that reached a terminal stage
 * - pimflow.workflow.runs.cancelled (counter) - Runs cancelled or expired
 * - pimflow.workflow.runs.duration.seconds (histogram) - Start to completion time
 * - pimflow.workflow.stages.entered (counter) - Stages entered, auto-advanced ones included
 * - pimflow.workflow.tasks.created (counter) - Human tasks created
 * - pimflow.workflow.tasks.resolved (counter) - Tasks resolved, by outcome
 * - pimflow.workflow.tasks.expired (counter) - Tasks expired
 * - pimflow.workflow.tasks.rejected_calls (counter) - Engine calls refused, by error
 *
 * The meter is supplied by the caller; {@link #noop()} records nothing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    public static final String METER_NAME = "pimflow-workflow";

    private final LongCounter runsStarted;
    private final LongCounter runsCompleted;
    private final LongCounter runsCancelled;
    private final LongCounter stagesEntered;
    private final LongCounter tasksCreated;
    private final LongCounter tasksResolved;
    private final LongCounter tasksExpired;
    private final LongCounter rejectedCalls;

    private final DoubleHistogram runDuration;

    private final AtomicLong activeRuns = new AtomicLong(0);

    private static final AttributeKey<String> DEFINITION_KEY = AttributeKey.stringKey("workflow.definition");
    private static final AttributeKey<String> STAGE_KEY = AttributeKey.stringKey("workflow.stage");
    private static final AttributeKey<String> ROLE_KEY = AttributeKey.stringKey("workflow.role");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("workflow.outcome");
    private static final AttributeKey<String> ERROR_KEY = AttributeKey.stringKey("error.type");

    public WorkflowMetrics(Meter meter) {
        Objects.requireNonNull(meter, "meter");

        runsStarted = meter.counterBuilder("pimflow.workflow.runs.started")
                .setDescription("Number of workflow runs started")
                .setUnit("1")
                .build();

        runsCompleted = meter.counterBuilder("pimflow.workflow.runs.completed")
                .setDescription("Number of workflow runs that reached a terminal stage")
                .setUnit("1")
                .build();

        runsCancelled = meter.counterBuilder("pimflow.workflow.runs.cancelled")
                .setDescription("Number of cancelled workflow runs")
                .setUnit("1")
                .build();

        stagesEntered = meter.counterBuilder("pimflow.workflow.stages.entered")
                .setDescription("Number of stages entered by workflow runs")
                .setUnit("1")
                .build();

        tasksCreated = meter.counterBuilder("pimflow.workflow.tasks.created")
                .setDescription("Number of human tasks created")
                .setUnit("1")
                .build();

        tasksResolved = meter.counterBuilder("pimflow.workflow.tasks.resolved")
                .setDescription("Number of human tasks resolved")
                .setUnit("1")
                .build();

        tasksExpired = meter.counterBuilder("pimflow.workflow.tasks.expired")
                .setDescription("Number of human tasks expired")
                .setUnit("1")
                .build();

        rejectedCalls = meter.counterBuilder("pimflow.workflow.tasks.rejected_calls")
                .setDescription("Number of engine calls rejected with an error")
                .setUnit("1")
                .build();

        runDuration = meter.histogramBuilder("pimflow.workflow.runs.duration.seconds")
                .setDescription("Workflow run duration from start to completion in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("pimflow.workflow.runs.active")
                .setDescription("Number of currently active workflow runs")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRuns.get()));

        logger.debug("WorkflowMetrics initialized");
    }

    /**
     * Metrics bound to a no-op meter.
     */
    public static WorkflowMetrics noop() {
        return new WorkflowMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public static WorkflowMetrics forOpenTelemetry(OpenTelemetry openTelemetry) {
        return new WorkflowMetrics(openTelemetry.getMeter(METER_NAME));
    }

    /**
     * Seeds the active-runs gauge, e.g. with the runs found in a store on startup.
     */
    public void setActiveRuns(long count) {
        activeRuns.set(count);
    }

    public void recordRunStarted(String definitionId) {
        runsStarted.add(1, Attributes.of(DEFINITION_KEY, definitionId));
        activeRuns.incrementAndGet();
    }

    public void recordRunCompleted(String definitionId, double durationSeconds) {
        activeRuns.decrementAndGet();
        Attributes attrs = Attributes.of(DEFINITION_KEY, definitionId);
        runsCompleted.add(1, attrs);
        runDuration.record(durationSeconds, attrs);
    }

    public void recordRunCancelled(String definitionId) {
        activeRuns.decrementAndGet();
        runsCancelled.add(1, Attributes.of(DEFINITION_KEY, definitionId));
    }

    public void recordStageEntered(String definitionId, String stageId) {
        stagesEntered.add(1, Attributes.of(DEFINITION_KEY, definitionId, STAGE_KEY, stageId));
    }

    public void recordTaskCreated(String stageId, String role) {
        tasksCreated.add(1, Attributes.of(STAGE_KEY, stageId, ROLE_KEY, role));
    }

    public void recordTaskResolved(String stageId, String outcome) {
        tasksResolved.add(1, Attributes.of(STAGE_KEY, stageId, OUTCOME_KEY, outcome));
    }

    public void recordTaskExpired(String stageId) {
        tasksExpired.add(1, Attributes.of(STAGE_KEY, stageId));
    }

    public void recordRejectedCall(String errorType) {
        rejectedCalls.add(1, Attributes.of(ERROR_KEY, errorType != null ? errorType : "unknown"));
    }

    public long getActiveRuns() {
        return activeRuns.get();
    }
}
