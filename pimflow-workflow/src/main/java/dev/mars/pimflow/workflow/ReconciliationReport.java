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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a {@link WorkflowReconciler} pass found and repaired.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
public class ReconciliationReport {

    private int runsScanned;
    private final List<String> recreatedTasks = new ArrayList<>();
    private final List<String> expiredTasks = new ArrayList<>();
    private final List<String> recoveredAuditRuns = new ArrayList<>();
    private final Map<String, String> runsNeedingAttention = new LinkedHashMap<>();

    void runScanned() {
        runsScanned++;
    }

    void taskRecreated(String taskId) {
        recreatedTasks.add(taskId);
    }

    void taskExpired(String taskId) {
        expiredTasks.add(taskId);
    }

    void auditRecovered(String runId) {
        recoveredAuditRuns.add(runId);
    }

    void needsAttention(String runId, String reason) {
        runsNeedingAttention.put(runId, reason);
    }

    public int getRunsScanned() {
        return runsScanned;
    }

    public List<String> getRecreatedTasks() {
        return Collections.unmodifiableList(recreatedTasks);
    }

    public List<String> getExpiredTasks() {
        return Collections.unmodifiableList(expiredTasks);
    }

    public List<String> getRecoveredAuditRuns() {
        return Collections.unmodifiableList(recoveredAuditRuns);
    }

    /**
     * Runs that could not be repaired automatically, with the reason.
     */
    public Map<String, String> getRunsNeedingAttention() {
        return Collections.unmodifiableMap(runsNeedingAttention);
    }

    public boolean isClean() {
        return recreatedTasks.isEmpty() && expiredTasks.isEmpty()
                && recoveredAuditRuns.isEmpty() && runsNeedingAttention.isEmpty();
    }

    @Override
    public String toString() {
        return "ReconciliationReport{" +
                "runsScanned=" + runsScanned +
                ", recreatedTasks=" + recreatedTasks.size() +
                ", expiredTasks=" + expiredTasks.size() +
                ", recoveredAudit=" + recoveredAuditRuns.size() +
                ", needingAttention=" + runsNeedingAttention.keySet() +
                '}';
    }
}
