package com.eidos.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the EIDOS domain model: enums, lifecycle rules, derived values and map round-trips.
 */
class ModelTest {

    // ═══════════════════════════════════════════════════════════════════
    //  Enum tests
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Enums")
    class EnumTests {

        @Test
        @DisplayName("values serialize as lowercase tags")
        void lowercaseTags() {
            assertEquals("sharp_edge", DistillationType.SHARP_EDGE.value());
            assertEquals("in_progress", Outcome.IN_PROGRESS.value());
            assertEquals("tool_call", ActionType.TOOL_CALL.value());
            assertEquals("consolidate", Phase.CONSOLIDATE.value());
        }

        @Test
        @DisplayName("unknown tags decode to safe defaults")
        void unknownTagsFallBack() {
            assertEquals(Evaluation.UNKNOWN, Evaluation.fromValue("bogus"));
            assertEquals(Outcome.IN_PROGRESS, Outcome.fromValue(null));
            assertEquals(DistillationType.HEURISTIC, DistillationType.fromValue(""));
            assertEquals(PolicyScope.GLOBAL, PolicyScope.fromValue("nowhere"));
            assertEquals(PolicySource.INFERRED, PolicySource.fromValue(null));
        }

        @Test
        @DisplayName("only IN_PROGRESS is non-terminal")
        void terminalOutcomes() {
            assertFalse(Outcome.IN_PROGRESS.isTerminal());
            assertTrue(Outcome.SUCCESS.isTerminal());
            assertTrue(Outcome.FAILURE.isTerminal());
            assertTrue(Outcome.PARTIAL.isTerminal());
            assertTrue(Outcome.ESCALATED.isTerminal());
        }

        @Test
        @DisplayName("phases advance one at a time and ESCALATE is absorbing")
        void phaseTransitions() {
            assertTrue(Phase.EXPLORE.canTransitionTo(Phase.DIAGNOSE));
            assertFalse(Phase.EXPLORE.canTransitionTo(Phase.EXECUTE));
            assertTrue(Phase.EXECUTE.canTransitionTo(Phase.ESCALATE));
            assertFalse(Phase.ESCALATE.canTransitionTo(Phase.EXPLORE));
            assertTrue(Phase.DIAGNOSE.canTransitionTo(Phase.DIAGNOSE));
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Episode
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Episode")
    class EpisodeTests {

        @Test
        @DisplayName("budget is exceeded when step count reaches max steps")
        void budgetExceededBySteps() {
            Episode e = new Episode(null, "Fix login", "tests pass", new Budget(25, 720, 3), 1000.0);
            e.setStepCount(25);
            assertTrue(e.isBudgetExceeded(1001.0));
        }

        @Test
        @DisplayName("budget is exceeded when elapsed time reaches the limit")
        void budgetExceededByTime() {
            Episode e = new Episode(null, "Fix login", "", new Budget(25, 720, 3), 1000.0);
            assertFalse(e.isBudgetExceeded(1719.0));
            assertTrue(e.isBudgetExceeded(1720.0));
        }

        @Test
        @DisplayName("error limit is reached after max retries")
        void errorLimit() {
            Episode e = new Episode("Fix login", "");
            e.recordError("E1");
            e.recordError("E1");
            assertFalse(e.isErrorLimitExceeded("E1"));
            e.recordError("E1");
            assertTrue(e.isErrorLimitExceeded("E1"));
            assertFalse(e.isErrorLimitExceeded("E2"));
        }

        @Test
        @DisplayName("id is 12 hex characters and stable when supplied")
        void ids() {
            Episode generated = new Episode("goal", "");
            assertTrue(generated.getEpisodeId().matches("[0-9a-f]{12}"));
            Episode supplied = new Episode("abc", "goal", "", Budget.defaults(), 1.0);
            assertEquals("abc", supplied.getEpisodeId());
        }

        @Test
        @DisplayName("complete runs once and rejects IN_PROGRESS")
        void completeOnce() {
            Episode e = new Episode("goal", "");
            assertThrows(IllegalArgumentException.class, () -> e.complete(Outcome.IN_PROGRESS, ""));
            e.complete(Outcome.SUCCESS, "done", 2000.0);
            assertTrue(e.isComplete());
            assertEquals(2000.0, e.getEndTs());
            assertThrows(IllegalStateException.class, () -> e.complete(Outcome.FAILURE, ""));
        }

        @Test
        @DisplayName("illegal phase transition is rejected")
        void illegalTransition() {
            Episode e = new Episode("goal", "");
            e.transitionTo(Phase.DIAGNOSE);
            assertThrows(IllegalStateException.class, () -> e.transitionTo(Phase.CONSOLIDATE));
            e.transitionTo(Phase.ESCALATE);
            assertEquals(Phase.ESCALATE, e.getPhase());
        }

        @Test
        @DisplayName("toMap/fromMap round-trips every field")
        void roundTrip() {
            Episode e = new Episode(null, "Ship release", "green build", new Budget(10, 60, 2), 1234.5);
            e.setConstraints(List.of("no force push"));
            e.transitionTo(Phase.DIAGNOSE);
            e.recordError("timeout");
            e.recordStep();
            e.complete(Outcome.PARTIAL, "half done", 1300.0);

            Map<String, Object> map = e.toMap();
            assertEquals(map, Episode.fromMap(map).toMap());
            assertEquals("partial", map.get("outcome"));
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Step
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Step")
    class StepTests {

        @Test
        @DisplayName("validators list missing mandatory fields")
        void validators() {
            Step s = new Step("ep1", "Read config", "");
            assertEquals(List.of("decision", "prediction"), s.missingBeforeAction());
            assertEquals(List.of("result", "evaluation", "validation"), s.missingAfterAction());
            assertFalse(s.isComplete());
        }

        @Test
        @DisplayName("validation method substitutes for validated flag")
        void validationMethodAccepted() {
            Step s = completeStep(Evaluation.PASS);
            s.setValidated(false);
            s.setValidationMethod("ran tests");
            assertTrue(s.isValidAfterAction());
            s.setValidationMethod("");
            assertEquals(List.of("validation"), s.missingAfterAction());
        }

        @Test
        @DisplayName("surprise follows evaluation then word overlap")
        void surprise() {
            Step fail = completeStep(Evaluation.FAIL);
            assertEquals(0.8, fail.calculateSurprise());
            Step partial = completeStep(Evaluation.PARTIAL);
            assertEquals(0.5, partial.calculateSurprise());

            Step pass = completeStep(Evaluation.PASS);
            pass.setPrediction("tests pass");
            pass.setResult("tests pass");
            assertEquals(0.0, pass.calculateSurprise(), 1e-9);
            pass.setResult("build broke");
            assertEquals(1.0, pass.calculateSurprise(), 1e-9);

            pass.setResult("");
            assertEquals(0.0, pass.calculateSurprise());
        }

        @Test
        @DisplayName("toMap/fromMap round-trips every field")
        void roundTrip() {
            Step s = completeStep(Evaluation.PASS);
            s.setAlternatives(List.of("skip it"));
            s.setAssumptions(List.of("file exists"));
            s.setActionType(ActionType.TOOL_CALL);
            s.setActionDetails(Map.of("tool", "Read"));
            s.setRetrievedMemories(List.of("m1"));
            s.setMemoryCited(true);
            s.setMemoryUseful(Boolean.TRUE);
            Map<String, Object> map = s.toMap();
            assertEquals(map, Step.fromMap(map).toMap());
            assertEquals("tool_call", map.get("action_type"));
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Distillation and Policy
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Distillation")
    class DistillationTests {

        @Test
        @DisplayName("derived effectiveness and reliability")
        void derivedValues() {
            Distillation d = new Distillation(DistillationType.HEURISTIC, "Use retries");
            assertEquals(0.5, d.effectiveness());
            assertEquals(d.getConfidence(), d.reliability());
            d.recordUsage(true);
            d.recordUsage(false);
            assertEquals(0.5, d.effectiveness());
            assertEquals(0.5, d.reliability());
            assertEquals(2, d.getTimesUsed());
        }

        @Test
        @DisplayName("confidence stays within bounds under any usage sequence")
        void confidenceBounds() {
            Distillation d = new Distillation(DistillationType.HEURISTIC, "x");
            for (int i = 0; i < 30; i++) d.recordUsage(true);
            assertEquals(1.0, d.getConfidence(), 1e-9);
            for (int i = 0; i < 30; i++) d.recordUsage(false);
            assertEquals(0.1, d.getConfidence(), 1e-9);
        }

        @Test
        @DisplayName("revalidation defaults to seven days after creation")
        void revalidation() {
            Distillation d = new Distillation(null, DistillationType.POLICY, "x", 100.0);
            assertEquals(100.0 + 7 * 24 * 3600, d.getRevalidateBy());
            assertFalse(d.isDueForRevalidation(200.0));
            assertTrue(d.isDueForRevalidation(100.0 + 7 * 24 * 3600));
        }

        @Test
        @DisplayName("toMap/fromMap round-trips every field")
        void roundTrip() {
            Distillation d = new Distillation(DistillationType.ANTI_PATTERN, "Never retry blindly");
            d.setDomains(List.of("api"));
            d.setTriggers(List.of("retry"));
            d.setSourceSteps(List.of("s1", "s2"));
            d.recordRetrieval();
            d.recordUsage(true);
            d.setRefinedStatement("Never retry blindly because errors repeat");
            d.setAdvisoryQuality(Map.of("unified_score", 0.4));
            Map<String, Object> map = d.toMap();
            assertEquals(map, Distillation.fromMap(map).toMap());
            assertEquals("anti_pattern", map.get("type"));
        }

        @Test
        @DisplayName("policy round-trips with upper-case scope and source")
        void policyRoundTrip() {
            Policy p = Policy.of("Never delete prod data", PolicyScope.PROJECT, 90, PolicySource.USER);
            Map<String, Object> map = p.toMap();
            assertEquals("PROJECT", map.get("scope"));
            assertEquals(p, Policy.fromMap(map));
            assertTrue(p.policyId().matches("[0-9a-f]{12}"));
        }
    }

    static Step completeStep(Evaluation evaluation) {
        Step s = new Step("ep1", "Run tests", "mvn test");
        s.setPrediction("tests pass");
        s.setResult("tests fail");
        s.setEvaluation(evaluation);
        s.setValidated(true);
        return s;
    }
}
