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
import dev.mars.pimflow.core.RoleCatalog;
import dev.mars.pimflow.workflow.TestWorkflows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StageGraph registration rules.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
class StageGraphTest {

    private static final RoleCatalog ROLES = RoleCatalog.defaults();

    private static ValidationResult validate(WorkflowDefinition definition) {
        return new StageGraph(definition).validate(ROLES);
    }

    private static boolean hasError(ValidationResult result, String fragment) {
        return result.getErrorMessages().stream().anyMatch(message -> message.contains(fragment));
    }

    @Nested
    @DisplayName("Valid definitions")
    class ValidDefinitions {

        @Test
        void testImportReviewIsValid() {
            ValidationResult result = validate(TestWorkflows.importReview());

            assertTrue(result.isValid(), result.getErrorMessages().toString());
            assertFalse(result.hasWarnings());
        }

        @Test
        void testAutomaticOnlyChainIsValid() {
            assertTrue(validate(TestWorkflows.autoPublish()).isValid());
        }

        @Test
        void testHumanLoopThroughReentrantStageIsValid() {
            assertTrue(validate(TestWorkflows.twoStepReview()).isValid());
        }

        @Test
        void testSelfLoopOnReentrantHumanStage() {
            WorkflowDefinition definition = WorkflowDefinition.builder("self-loop")
                    .stage(Stage.builder("review", StageKind.HUMAN)
                            .requiredRole(RoleCatalog.MARKETING)
                            .transition(Outcome.REQUEST_CHANGES, "review")
                            .transition(Outcome.APPROVE, "done")
                            .reentrant(true)
                            .build())
                    .stage(Stage.terminal("done"))
                    .build();

            assertTrue(validate(definition).isValid());
        }

        @Test
        void testReachability() {
            StageGraph graph = new StageGraph(TestWorkflows.importReview());

            assertEquals(Set.of("validate", "review", "publish"), graph.reachableFrom("validate"));
            assertEquals(Set.of("publish"), graph.reachableFrom("publish"));
            assertTrue(graph.reachableFrom("missing").isEmpty());
        }

        @Test
        void testBackEdgeDetected() {
            List<String[]> backEdges = new StageGraph(TestWorkflows.importReview()).backEdges("validate");

            assertEquals(1, backEdges.size());
            assertArrayEquals(new String[]{"review", "validate"}, backEdges.get(0));
        }
    }

    @Nested
    @DisplayName("Rejected definitions")
    class RejectedDefinitions {

        @Test
        void testEmptyDefinition() {
            WorkflowDefinition definition = WorkflowDefinition.builder("empty").build();
            assertTrue(hasError(validate(definition), "no stages"));
        }

        @Test
        void testDuplicateStageId() {
            WorkflowDefinition definition = WorkflowDefinition.builder("dup")
                    .stage(Stage.automatic("a", "done"))
                    .stage(Stage.automatic("a", "done"))
                    .stage(Stage.terminal("done"))
                    .build();

            assertTrue(hasError(validate(definition), "Duplicate stage id: a"));
        }

        @Test
        void testMissingInitialStage() {
            WorkflowDefinition definition = WorkflowDefinition.builder("bad-initial")
                    .initialStage("nowhere")
                    .stage(Stage.terminal("done"))
                    .build();

            assertTrue(hasError(validate(definition), "Initial stage 'nowhere' is not defined"));
        }

        @Test
        void testDanglingReference() {
            WorkflowDefinition definition = WorkflowDefinition.builder("dangling")
                    .stage(Stage.human("review", RoleCatalog.DATA_STEWARD,
                            Map.of(Outcome.APPROVE, "done", Outcome.REJECT, "archive")))
                    .stage(Stage.terminal("done"))
                    .build();

            assertTrue(hasError(validate(definition), "Next stage 'archive' is not defined"));
        }

        @Test
        void testUnreachableStage() {
            WorkflowDefinition definition = WorkflowDefinition.builder("unreachable")
                    .stage(Stage.automatic("start", "done"))
                    .stage(Stage.terminal("done"))
                    .stage(Stage.terminal("orphan"))
                    .build();

            ValidationResult result = validate(definition);

            assertFalse(result.isValid());
            assertTrue(result.getErrors().stream()
                    .anyMatch(issue -> issue.getFieldPath().equals("spec.stages.orphan")
                            && issue.getMessage().contains("unreachable")));
        }

        @Test
        void testUnknownRole() {
            WorkflowDefinition definition = WorkflowDefinition.builder("unknown-role")
                    .stage(Stage.human("review", Role.of("Photographer"), Map.of(Outcome.APPROVE, "done")))
                    .stage(Stage.terminal("done"))
                    .build();

            assertTrue(hasError(validate(definition), "Role 'Photographer' is not in the role catalog"));
        }

        @Test
        void testNoTerminalStage() {
            WorkflowDefinition definition = WorkflowDefinition.builder("endless")
                    .stage(Stage.builder("review", StageKind.HUMAN)
                            .requiredRole(RoleCatalog.MARKETING)
                            .transition(Outcome.REQUEST_CHANGES, "review")
                            .reentrant(true)
                            .build())
                    .build();

            assertTrue(hasError(validate(definition), "no terminal stage"));
        }

        @Test
        void testStageThatCannotReachTerminal() {
            WorkflowDefinition definition = WorkflowDefinition.builder("trap")
                    .stage(Stage.human("triage", RoleCatalog.ADMIN,
                            Map.of(Outcome.APPROVE, "done", Outcome.REJECT, "limbo")))
                    .stage(Stage.builder("limbo", StageKind.HUMAN)
                            .requiredRole(RoleCatalog.ADMIN)
                            .transition(Outcome.REQUEST_CHANGES, "limbo")
                            .reentrant(true)
                            .build())
                    .stage(Stage.terminal("done"))
                    .build();

            ValidationResult result = validate(definition);

            assertTrue(result.getErrors().stream()
                    .anyMatch(issue -> issue.getFieldPath().equals("spec.stages.limbo")
                            && issue.getMessage().contains("never reach a terminal")));
        }

        @Test
        void testAutomaticCycle() {
            WorkflowDefinition definition = WorkflowDefinition.builder("spin")
                    .stage(Stage.builder("a", StageKind.AUTOMATIC).next("b").reentrant(true).build())
                    .stage(Stage.builder("b", StageKind.AUTOMATIC).next("a").build())
                    .stage(Stage.terminal("done"))
                    .build();

            ValidationResult result = validate(definition);

            assertTrue(hasError(result, "Automatic stages loop without a human decision"));
            assertEquals(1, new StageGraph(definition).automaticCycles().size());
        }

        @Test
        void testUnmarkedReentry() {
            WorkflowDefinition definition = WorkflowDefinition.builder("unmarked")
                    .stage(Stage.automatic("validate", "review"))
                    .stage(Stage.human("review", RoleCatalog.DATA_STEWARD,
                            Map.of(Outcome.APPROVE, "publish", Outcome.REJECT, "validate")))
                    .stage(Stage.terminal("publish"))
                    .build();

            assertTrue(hasError(validate(definition), "loops back to 'validate' which is not marked reentrant"));
        }

        @Test
        void testHumanStageShape() {
            WorkflowDefinition definition = WorkflowDefinition.builder("shape")
                    .stage(Stage.builder("review", StageKind.HUMAN).next("done").build())
                    .stage(Stage.terminal("done"))
                    .build();

            ValidationResult result = validate(definition);

            assertTrue(hasError(result, "Human stage must name a role"));
            assertTrue(hasError(result, "Human stage must allow at least one outcome"));
            assertTrue(hasError(result, "Human stage uses transitions, not 'next'"));
        }

        @Test
        void testAllProblemsReportedTogether() {
            WorkflowDefinition definition = WorkflowDefinition.builder("many")
                    .stage(Stage.human("review", Role.of("Nobody"), Map.of(Outcome.APPROVE, "ghost")))
                    .stage(Stage.terminal("done"))
                    .build();

            assertTrue(validate(definition).getErrors().size() >= 3);
        }
    }

    @Test
    void testUnusedReentrantFlagWarns() {
        WorkflowDefinition definition = WorkflowDefinition.builder("warn")
                .stage(Stage.builder("start", StageKind.AUTOMATIC).next("done").reentrant(true).build())
                .stage(Stage.terminal("done"))
                .build();

        ValidationResult result = validate(definition);

        assertTrue(result.isValid());
        assertTrue(result.hasWarnings());
    }
}
