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

package dev.mars.pimflow.workflow;

import dev.mars.pimflow.config.PimflowConfiguration;
import dev.mars.pimflow.core.RoleCatalog;
import dev.mars.pimflow.core.exceptions.PimflowException;
import dev.mars.pimflow.entity.EntityStore;
import dev.mars.pimflow.workflow.definition.InMemoryWorkflowDefinitionRegistry;
import dev.mars.pimflow.workflow.definition.WorkflowDefinitionLoader;
import dev.mars.pimflow.workflow.definition.WorkflowDefinitionRegistry;
import dev.mars.pimflow.workflow.definition.YamlWorkflowDefinitionParser;
import dev.mars.pimflow.workflow.notification.AsyncTransitionDispatcher;
import dev.mars.pimflow.workflow.notification.CompositeTransitionListener;
import dev.mars.pimflow.workflow.notification.LoggingTransitionListener;
import dev.mars.pimflow.workflow.notification.TransitionListener;
import dev.mars.pimflow.workflow.observability.WorkflowMetrics;
import dev.mars.pimflow.workflow.store.FileWorkflowStore;
import dev.mars.pimflow.workflow.store.InMemoryWorkflowStore;
import dev.mars.pimflow.workflow.store.WorkflowStore;
import dev.mars.pimflow.workflow.task.OverdueTaskSweeper;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles a complete workflow runtime from a {@link PimflowConfiguration}.
 * <p>
 * Start-up order: role catalog, definition registry with built-in and directory definitions,
 * workflow store, reconciliation of stored runs, engine, notification dispatch and the overdue
 * task sweeper. Nothing is held in static state, so several runtimes can coexist in one JVM.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
public class PimflowBootstrap implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(PimflowBootstrap.class);

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_FILE = "file";

    private final PimflowConfiguration configuration;
    private final RoleCatalog roleCatalog;
    private final WorkflowDefinitionRegistry registry;
    private final WorkflowStore store;
    private final ReconciliationReport reconciliationReport;
    private final SimpleWorkflowEngine engine;
    private final AsyncTransitionDispatcher dispatcher;
    private final OverdueTaskSweeper sweeper;

    private PimflowBootstrap(Builder builder) throws PimflowException {
        this.configuration = builder.configuration != null ? builder.configuration : new PimflowConfiguration();
        EntityStore entityStore = Objects.requireNonNull(builder.entityStore, "Entity store cannot be null");
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        this.roleCatalog = configuration.getRoleCatalog();
        this.registry = new InMemoryWorkflowDefinitionRegistry(roleCatalog);
        loadDefinitions();

        this.store = builder.store != null ? builder.store : openStore();
        AsyncTransitionDispatcher asyncDispatcher = null;
        try {
            RunLockManager locks = new RunLockManager();
            this.reconciliationReport = new WorkflowReconciler(registry, store, locks, clock).reconcile();

            CompositeTransitionListener listeners = new CompositeTransitionListener(new LoggingTransitionListener());
            for (TransitionListener listener : builder.listeners) {
                listeners.addListener(listener);
            }
            TransitionListener listener = listeners;
            if (configuration.isNotificationAsync()) {
                asyncDispatcher = new AsyncTransitionDispatcher(listeners, configuration.getNotificationThreads());
                listener = asyncDispatcher;
            }
            this.dispatcher = asyncDispatcher;

            WorkflowMetrics metrics;
            if (configuration.isMetricsEnabled()) {
                OpenTelemetry openTelemetry = builder.openTelemetry != null ? builder.openTelemetry : GlobalOpenTelemetry.get();
                metrics = WorkflowMetrics.forOpenTelemetry(openTelemetry);
            } else {
                metrics = WorkflowMetrics.noop();
            }

            this.engine = SimpleWorkflowEngine.builder()
                    .registry(registry)
                    .entityStore(entityStore)
                    .store(store)
                    .locks(locks)
                    .listener(listener)
                    .metrics(metrics)
                    .clock(clock)
                    .build();

            this.sweeper = new OverdueTaskSweeper(engine.taskQueue(),
                    Duration.ofMillis(configuration.getTaskTimeoutMs()),
                    Duration.ofMillis(configuration.getTaskSweepIntervalMs()),
                    clock);
            if (builder.startSweeper) {
                sweeper.start();
            }
        } catch (PimflowException | RuntimeException e) {
            if (asyncDispatcher != null) {
                asyncDispatcher.close();
            }
            closeStore(e);
            throw e;
        }

        logger.info("Pimflow started: {} definitions, {} store, {} active runs",
                registry.list().size(), configuration.getStoreType(), engine.activeRuns().size());
    }

    public static Builder builder() {
        return new Builder();
    }

    private void loadDefinitions() throws PimflowException {
        WorkflowDefinitionLoader loader = new WorkflowDefinitionLoader(new YamlWorkflowDefinitionParser(), registry);
        loader.loadResources(configuration.getBuiltinWorkflows());
        Path directory = configuration.getDefinitionsDirectory();
        if (directory != null) {
            loader.loadDirectory(directory);
        }
    }

    private WorkflowStore openStore() throws PimflowException {
        String type = configuration.getStoreType();
        if (STORE_MEMORY.equals(type)) {
            return new InMemoryWorkflowStore();
        }
        if (STORE_FILE.equals(type)) {
            return new FileWorkflowStore(configuration.getStoreDirectory());
        }
        throw new PimflowException("Unknown store type '" + type + "' in " + PimflowConfiguration.STORE_TYPE
                + ", expected " + STORE_MEMORY + " or " + STORE_FILE);
    }

    private void closeStore(Exception cause) {
        if (!(store instanceof Closeable)) {
            return;
        }
        try {
            ((Closeable) store).close();
        } catch (IOException e) {
            cause.addSuppressed(e);
            logger.warn("Failed to close workflow store after start-up failure", e);
        }
    }

    public PimflowConfiguration getConfiguration() {
        return configuration;
    }

    public RoleCatalog getRoleCatalog() {
        return roleCatalog;
    }

    public WorkflowDefinitionRegistry getRegistry() {
        return registry;
    }

    public WorkflowStore getStore() {
        return store;
    }

    public WorkflowEngine getEngine() {
        return engine;
    }

    public OverdueTaskSweeper getSweeper() {
        return sweeper;
    }

    /**
     * The repairs made to stored state while starting up.
     */
    public ReconciliationReport getReconciliationReport() {
        return reconciliationReport;
    }

    @Override
    public void close() throws IOException {
        sweeper.close();
        if (dispatcher != null) {
            dispatcher.close();
        }
        if (store instanceof Closeable) {
            ((Closeable) store).close();
        }
        logger.info("Pimflow stopped");
    }

    public static class Builder {
        private PimflowConfiguration configuration;
        private EntityStore entityStore;
        private WorkflowStore store;
        private OpenTelemetry openTelemetry;
        private Clock clock;
        private boolean startSweeper = true;
        private final List<TransitionListener> listeners = new ArrayList<>();

        public Builder configuration(PimflowConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder entityStore(EntityStore entityStore) {
            this.entityStore = entityStore;
            return this;
        }

        /**
         * Uses an already opened store instead of the one named by {@code pimflow.store.type}.
         * The runtime owns it from then on and closes it on {@link PimflowBootstrap#close()},
         * or when start-up fails.
         */
        public Builder store(WorkflowStore store) {
            this.store = store;
            return this;
        }

        public Builder openTelemetry(OpenTelemetry openTelemetry) {
            this.openTelemetry = openTelemetry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder listener(TransitionListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Whether {@link #build()} starts periodic sweeping. Tests usually call
         * {@link OverdueTaskSweeper#sweep(java.time.Instant)} themselves instead.
         */
        public Builder startSweeper(boolean startSweeper) {
            this.startSweeper = startSweeper;
            return this;
        }

        public PimflowBootstrap build() throws PimflowException {
            return new PimflowBootstrap(this);
        }
    }
}
