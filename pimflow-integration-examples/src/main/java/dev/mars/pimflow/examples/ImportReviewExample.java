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

package dev.mars.pimflow.examples;

import dev.mars.pimflow.config.PimflowConfiguration;
import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.EntityReference;
import dev.mars.pimflow.core.Outcome;
import dev.mars.pimflow.core.RoleCatalog;
import dev.mars.pimflow.entity.InMemoryEntityStore;
import dev.mars.pimflow.examples.util.ExampleLogger;
import dev.mars.pimflow.workflow.PimflowBootstrap;
import dev.mars.pimflow.workflow.WorkflowEngine;
import dev.mars.pimflow.workflow.audit.AuditEntry;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.task.Task;

import java.util.Properties;

/**
 * Product import review: an imported product is cleaned automatically, a data steward sends it
 * back once, and approves it on the second pass.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-08
 * @version 1.0
 */
public class ImportReviewExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(ImportReviewExample.class);

    private static final EntityReference PRODUCT = EntityReference.product("sku-10442");
    private static final Actor IMPORTER = Actor.of("csv-import", RoleCatalog.ADMIN);
    private static final Actor STEWARD = Actor.of("dana", RoleCatalog.DATA_STEWARD);

    public static void main(String[] args) {
        try {
            new ImportReviewExample().runExample();
            log.completed("Import Review Example");
        } catch (Exception e) {
            log.unexpected("Import Review Example", e);
            System.exit(1);
        }
    }

    public WorkflowRun runExample() throws Exception {
        log.header("Pimflow Import Review Example");

        log.step(1, "Registering the imported product...");
        InMemoryEntityStore entities = new InMemoryEntityStore();
        entities.put(PRODUCT, "Merino hiking sock, 3-pack");

        log.step(2, "Starting Pimflow with the built-in workflows...");
        Properties properties = new Properties();
        properties.setProperty(PimflowConfiguration.STORE_TYPE, PimflowBootstrap.STORE_MEMORY);
        properties.setProperty(PimflowConfiguration.NOTIFICATION_ASYNC, "false");
        properties.setProperty(PimflowConfiguration.METRICS_ENABLED, "false");

        try (PimflowBootstrap pimflow = PimflowBootstrap.builder()
                .configuration(new PimflowConfiguration(properties))
                .entityStore(entities)
                .startSweeper(false)
                .build()) {
            WorkflowEngine engine = pimflow.getEngine();

            log.step(3, "Starting the import-review run...");
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
            log.info("Run " + run.getRunId() + " waiting at '" + run.getCurrentStageId() + "'");

            log.step(4, "Data steward rejects the first cleaning pass...");
            Task first = engine.taskQueue().findOpenTask(run.getRunId()).orElseThrow();
            run = engine.resolveTask(first.getTaskId(), STEWARD, Outcome.REJECT, "dimensions missing");
            log.info("Run cleaned again and back at '" + run.getCurrentStageId() + "'");

            log.step(5, "Data steward approves the second pass...");
            Task second = engine.taskQueue().findOpenTask(run.getRunId()).orElseThrow();
            run = engine.resolveTask(second.getTaskId(), STEWARD, Outcome.APPROVE, "ready to publish");
            log.success("Run " + run.getStatus() + " at '" + run.getCurrentStageId() + "'");

            log.step(6, "Audit trail:");
            for (AuditEntry entry : engine.auditLog().query(run.getRunId())) {
                log.info(entry.getSequence() + " " + entry.getAction() + " " + entry.getStageId()
                        + " by " + entry.getActor().getUserId()
                        + (entry.getOutcome() != null ? " (" + entry.getOutcome().getKey() + ")" : ""));
            }
            return run;
        }
    }
}
