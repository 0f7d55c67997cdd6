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
import dev.mars.pimflow.core.exceptions.ForbiddenException;
import dev.mars.pimflow.entity.InMemoryEntityStore;
import dev.mars.pimflow.examples.util.ExampleLogger;
import dev.mars.pimflow.workflow.PimflowBootstrap;
import dev.mars.pimflow.workflow.WorkflowEngine;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.task.Task;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

/**
 * Digital asset approval on the file-backed store. Compliance approves, marketing asks for
 * changes, compliance approves again and marketing signs off. The store directory is reopened
 * halfway through to show that runs and open tasks survive a restart.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-08
 * @version 1.0
 */
public class AssetApprovalExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(AssetApprovalExample.class);

    private static final EntityReference ASSET = EntityReference.asset("hero-banner-spring");
    private static final Actor UPLOADER = Actor.of("dam-sync", RoleCatalog.ADMIN);
    private static final Actor COMPLIANCE = Actor.of("cleo", RoleCatalog.COMPLIANCE_OFFICER);
    private static final Actor MARKETER = Actor.of("mo", RoleCatalog.MARKETING);

    private final Path storeDirectory;

    public AssetApprovalExample(Path storeDirectory) {
        this.storeDirectory = storeDirectory;
    }

    public static void main(String[] args) {
        try {
            Path directory = args.length > 0 ? Path.of(args[0]) : Files.createTempDirectory("pimflow-assets");
            new AssetApprovalExample(directory).runExample();
            log.completed("Asset Approval Example");
        } catch (Exception e) {
            log.unexpected("Asset Approval Example", e);
            System.exit(1);
        }
    }

    public WorkflowRun runExample() throws Exception {
        log.header("Pimflow Asset Approval Example");
        log.info("Store directory: " + storeDirectory);

        InMemoryEntityStore entities = new InMemoryEntityStore();
        entities.put(ASSET, "Spring campaign hero banner");

        String runId;
        log.step(1, "Uploading the asset and starting asset-approval...");
        try (PimflowBootstrap pimflow = boot(entities)) {
            WorkflowEngine engine = pimflow.getEngine();
            WorkflowRun run = engine.start("asset-approval", ASSET, UPLOADER);
            runId = run.getRunId();
            log.info("Run " + runId + " waiting at '" + run.getCurrentStageId() + "'");

            log.step(2, "Marketing tries to act on the compliance task...");
            Task check = engine.taskQueue().findOpenTask(runId).orElseThrow();
            try {
                engine.resolveTask(check.getTaskId(), MARKETER, Outcome.APPROVE, null);
                log.failure("Marketing was allowed to resolve a compliance task");
            } catch (ForbiddenException e) {
                log.success("Refused: " + e.getMessage());
            }

            log.step(3, "Compliance approves...");
            run = engine.resolveTask(check.getTaskId(), COMPLIANCE, Outcome.APPROVE, "licence on file");
            log.info("Run at '" + run.getCurrentStageId() + "'");
        }

        log.step(4, "Restarting on the same store directory...");
        try (PimflowBootstrap pimflow = boot(entities)) {
            WorkflowEngine engine = pimflow.getEngine();
            log.info("Reconciliation: " + pimflow.getReconciliationReport());

            List<Task> inbox = engine.taskQueue().findActionable(MARKETER);
            log.info("Marketing inbox after restart: " + inbox.size() + " task(s)");

            log.step(5, "Marketing requests changes...");
            WorkflowRun run = engine.resolveTask(inbox.get(0).getTaskId(), MARKETER,
                    Outcome.REQUEST_CHANGES, "crop for mobile");
            log.info("Run back at '" + run.getCurrentStageId() + "'");

            log.step(6, "Compliance approves the revised asset and marketing signs off...");
            Task recheck = engine.taskQueue().findOpenTask(runId).orElseThrow();
            run = engine.resolveTask(recheck.getTaskId(), COMPLIANCE, Outcome.APPROVE, null);
            Task signOff = engine.taskQueue().findOpenTask(runId).orElseThrow();
            run = engine.resolveTask(signOff.getTaskId(), MARKETER, Outcome.APPROVE, "ship it");

            log.success("Run " + run.getStatus() + " at '" + run.getCurrentStageId() + "' after "
                    + run.getHistory().size() + " stage transitions");
            return run;
        }
    }

    private PimflowBootstrap boot(InMemoryEntityStore entities) throws Exception {
        Properties properties = new Properties();
        properties.setProperty(PimflowConfiguration.STORE_TYPE, PimflowBootstrap.STORE_FILE);
        properties.setProperty(PimflowConfiguration.STORE_DIR, storeDirectory.toString());
        properties.setProperty(PimflowConfiguration.NOTIFICATION_ASYNC, "false");
        properties.setProperty(PimflowConfiguration.METRICS_ENABLED, "false");
        return PimflowBootstrap.builder()
                .configuration(new PimflowConfiguration(properties))
                .entityStore(entities)
                .startSweeper(false)
                .build();
    }
}
