package dev.flowbulk.engine;

import dev.flowbulk.model.ElementGraph;
import dev.flowbulk.model.LoopContext;
import dev.flowbulk.model.StepKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class LoopContextPropagatorTest {

    @Test
    void loopTargetIsInLoop() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [{"name": "L", "nextValueConnector": {"targetReference": "C"}}],
              "recordCreates": [{"name": "C", "object": "Account"}]
            }
            """);

        Map<String, LoopContext> contexts = LoopContextPropagator.propagate(graph);

        assertThat(contexts).containsOnlyKeys("C");
        assertThat(contexts.get("C"))
            .isEqualTo(new LoopContext(true, "L", 1, List.of("C"), List.of(StepKind.RECORD_CREATE)));
    }

    @Test
    void noLoopMeansNoContexts() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "decisions": [
                {"name": "D1", "defaultConnector": {"targetReference": "D2"}},
                {"name": "D2", "rules": [{"name": "Yes", "connector": {"targetReference": "S"}}]}
              ],
              "subflows": [{"name": "S", "flowName": "Child"}]
            }
            """);

        assertThat(LoopContextPropagator.propagate(graph)).isEmpty();
    }

    @Test
    void carriesContextAlongPath() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [{"name": "L", "nextValueConnector": {"targetReference": "A"}}],
              "assignments": [
                {"name": "A", "connector": {"targetReference": "D"}}
              ],
              "decisions": [
                {"name": "D", "rules": [{"name": "Match", "connector": {"targetReference": "U"}}]}
              ],
              "recordUpdates": [{"name": "U"}]
            }
            """);

        Map<String, LoopContext> contexts = LoopContextPropagator.propagate(graph);

        LoopContext update = contexts.get("U");
        assertThat(update.loopReferenceName()).isEqualTo("L");
        assertThat(update.depth()).isEqualTo(1);
        assertThat(update.path()).containsExactly("A", "D", "U");
        assertThat(update.pathKinds()).containsExactly(StepKind.ASSIGNMENT, StepKind.DECISION, StepKind.RECORD_UPDATE);
    }

    @Test
    void exitConnectorTargetIsSeededToo() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [{
                "name": "L",
                "nextValueConnector": {"targetReference": "Collect"},
                "noMoreValuesConnector": {"targetReference": "Save"}
              }],
              "assignments": [{"name": "Collect", "connector": {"targetReference": "L"}}],
              "recordUpdates": [{"name": "Save", "inputReference": "accountsToUpdate"}]
            }
            """);

        Map<String, LoopContext> contexts = LoopContextPropagator.propagate(graph);

        assertThat(contexts).containsOnlyKeys("Collect", "Save");
        assertThat(contexts.get("Save"))
            .isEqualTo(new LoopContext(true, "L", 1, List.of("Save"), List.of(StepKind.RECORD_UPDATE)));
    }

    @Test
    void loopWithOnlyExitConnectorSeedsItsTarget() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [{"name": "L", "noMoreValuesConnector": {"targetReference": "C"}}],
              "recordCreates": [{"name": "C", "object": "Account"}]
            }
            """);

        assertThat(LoopContextPropagator.propagate(graph)).containsExactly(
            entry("C", new LoopContext(true, "L", 1, List.of("C"), List.of(StepKind.RECORD_CREATE))));
    }

    @Test
    void backEdgeToLoopTerminates() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [{"name": "L", "nextValueConnector": {"targetReference": "U"}}],
              "recordUpdates": [{"name": "U", "connector": {"targetReference": "L"}}]
            }
            """);

        var propagator = new LoopContextPropagator(graph);
        Map<String, LoopContext> contexts = propagator.run();

        assertThat(contexts).containsOnlyKeys("U");
        assertThat(propagator.rounds()).isEqualTo(1);
    }

    @Test
    void firstLoopToClaimTargetWins() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [
                {"name": "L1", "nextValueConnector": {"targetReference": "X"}},
                {"name": "L2", "nextValueConnector": {"targetReference": "X"}}
              ],
              "recordLookups": [{"name": "X", "connector": {"targetReference": "Y"}}],
              "assignments": [{"name": "Y"}]
            }
            """);

        Map<String, LoopContext> contexts = LoopContextPropagator.propagate(graph);

        assertThat(contexts.get("X").loopReferenceName()).isEqualTo("L1");
        assertThat(contexts.get("Y").loopReferenceName()).isEqualTo("L1");
        assertThat(contexts.get("Y").path()).containsExactly("X", "Y");
    }

    @Test
    void nestedLoopBodyIsOneLevelDeeper() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [
                {"name": "Outer", "nextValueConnector": {"targetReference": "Inner"},
                 "noMoreValuesConnector": {"targetReference": "Done"}},
                {"name": "Inner", "nextValueConnector": {"targetReference": "C"},
                 "noMoreValuesConnector": {"targetReference": "After_Inner"}}
              ],
              "recordCreates": [{"name": "C", "connector": {"targetReference": "Inner"}}],
              "assignments": [{"name": "After_Inner", "connector": {"targetReference": "Outer"}}],
              "screens": [{"name": "Done"}]
            }
            """);

        Map<String, LoopContext> contexts = LoopContextPropagator.propagate(graph);

        assertThat(contexts).containsOnlyKeys("C", "Inner", "After_Inner", "Done");
        assertThat(contexts.get("Inner").loopReferenceName()).isEqualTo("Outer");
        assertThat(contexts.get("C").loopReferenceName()).isEqualTo("Inner");
        assertThat(contexts.get("C").depth()).isEqualTo(2);
        assertThat(contexts.get("C").path()).containsExactly("C");
        assertThat(contexts.get("After_Inner").loopReferenceName()).isEqualTo("Inner");
        assertThat(contexts.get("After_Inner").depth()).isEqualTo(2);
        assertThat(contexts.get("Done").loopReferenceName()).isEqualTo("Outer");
        assertThat(contexts.get("Done").depth()).isEqualTo(1);
    }

    @Test
    void subflowInsideLoopKeepsLoopWhenItReadsTheSameLoop() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [{"name": "MyLoop", "nextValueConnector": {"targetReference": "Decision1"}}],
              "decisions": [{"name": "Decision1", "defaultConnector": {"targetReference": "SubflowA"}}],
              "subflows": [{
                "name": "SubflowA",
                "flowName": "Child",
                "inputAssignments": [{"name": "recordId", "value": {"elementReference": "MyLoop.Id"}}]
              }]
            }
            """);

        Map<String, LoopContext> contexts = LoopContextPropagator.propagate(graph);

        assertThat(contexts.get("SubflowA")).isEqualTo(new LoopContext(true, "MyLoop", 1,
            List.of("Decision1", "SubflowA"), List.of(StepKind.DECISION, StepKind.SUBFLOW)));
    }

    @Test
    void subflowReadingAnotherLoopIsOneLevelDeeper() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [
                {"name": "L1", "nextValueConnector": {"targetReference": "D"}},
                {"name": "L2", "assignNextValueToReference": "currentContact"}
              ],
              "decisions": [{"name": "D", "defaultConnector": {"targetReference": "S"}}],
              "subflows": [{
                "name": "S",
                "flowName": "Child",
                "inputAssignments": [{"name": "contactId", "value": {"elementReference": "currentContact.Id"}}]
              }]
            }
            """);

        Map<String, LoopContext> contexts = LoopContextPropagator.propagate(graph);

        assertThat(contexts.get("S").loopReferenceName()).isEqualTo("L2");
        assertThat(contexts.get("S").depth()).isEqualTo(2);
        assertThat(contexts.get("S").path()).containsExactly("D", "S");
    }

    @Test
    void unreachableSubflowReadingLoopItemIsMarkedByReference() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [{"name": "Loop_over_Accounts", "nextValueConnector": {"targetReference": "A"}}],
              "assignments": [{"name": "A"}],
              "subflows": [{
                "name": "S",
                "flowName": "Child",
                "inputAssignments": [{"name": "accountId", "value": {"elementReference": "Loop_over_Accounts.Id"}}]
              }]
            }
            """);

        Map<String, LoopContext> contexts = LoopContextPropagator.propagate(graph);

        assertThat(contexts.get("S"))
            .isEqualTo(new LoopContext(true, "Loop_over_Accounts", 1, List.of("S"), List.of(StepKind.SUBFLOW)));
    }

    @Test
    void currentItemVariableCountsAsLoopReference() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [{"name": "L", "assignNextValueToReference": "currentAccount"}],
              "assignments": [{
                "name": "Rename",
                "assignmentItems": [{"assignToReference": "name", "value": {"elementReference": "currentAccount.Name"}}]
              }],
              "recordLookups": [{
                "name": "Unrelated",
                "filters": [{"field": "Name", "value": {"elementReference": "currentAccountOwner"}}]
              }]
            }
            """);

        Map<String, LoopContext> contexts = LoopContextPropagator.propagate(graph);

        assertThat(contexts).containsOnlyKeys("Rename");
        assertThat(contexts.get("Rename").loopReferenceName()).isEqualTo("L");
    }

    @Test
    void referenceMarkingDoesNotPropagateToSuccessors() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [{"name": "L"}],
              "recordUpdates": [{
                "name": "U",
                "inputAssignments": [{"field": "Name", "value": {"elementReference": "L.Name"}}],
                "connector": {"targetReference": "After"}
              }],
              "assignments": [{"name": "After"}]
            }
            """);

        Map<String, LoopContext> contexts = LoopContextPropagator.propagate(graph);

        assertThat(contexts).containsOnlyKeys("U");
    }

    @Test
    void directContextIsNotOverwrittenByReference() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [
                {"name": "L1", "nextValueConnector": {"targetReference": "A"}},
                {"name": "L2"}
              ],
              "assignments": [{
                "name": "A",
                "assignmentItems": [{"assignToReference": "x", "value": {"elementReference": "L2.Id"}}]
              }]
            }
            """);

        assertThat(LoopContextPropagator.propagate(graph).get("A").loopReferenceName()).isEqualTo("L1");
    }

    @Test
    void fanInFromTwoLoopsSettles() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [
                {"name": "L1", "nextValueConnector": {"targetReference": "A"}},
                {"name": "L2", "nextValueConnector": {"targetReference": "B"}}
              ],
              "assignments": [
                {"name": "A", "connector": {"targetReference": "X"}},
                {"name": "B", "connector": {"targetReference": "X"}},
                {"name": "X"}
              ]
            }
            """);

        var propagator = new LoopContextPropagator(graph);
        Map<String, LoopContext> contexts = propagator.run();

        assertThat(contexts.get("A").loopReferenceName()).isEqualTo("L1");
        assertThat(contexts.get("B").loopReferenceName()).isEqualTo("L2");
        assertThat(contexts.get("X").inLoop()).isTrue();
        assertThat(contexts.get("X").loopReferenceName()).isIn("L1", "L2");
        assertThat(propagator.rounds()).isLessThanOrEqualTo(3);
    }

    @Test
    void cyclicGraphWithSeveralLoopsTerminates() throws Exception {
        int size = 30;
        var json = new StringBuilder("{\"assignments\": [");
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"name\": \"R").append(i).append("\", \"connector\": {\"targetReference\": \"R")
                .append((i + 1) % size).append("\"}}");
        }
        json.append("], \"loops\": [");
        for (int j = 0; j < 3; j++) {
            if (j > 0) {
                json.append(',');
            }
            json.append("{\"name\": \"L").append(j).append("\", \"nextValueConnector\": {\"targetReference\": \"R")
                .append(j * 10).append("\"}}");
        }
        json.append("]}");
        ElementGraph graph = Flows.graph("Ring", json.toString());

        var propagator = new LoopContextPropagator(graph);
        Map<String, LoopContext> contexts = propagator.run();

        assertThat(contexts).hasSize(size);
        assertThat(contexts.values()).allMatch(LoopContext::inLoop);
        assertThat(contexts.get("R0").loopReferenceName()).isEqualTo("L0");
        assertThat(contexts.get("R10").loopReferenceName()).isEqualTo("L1");
        assertThat(contexts.get("R20").loopReferenceName()).isEqualTo("L2");
        assertThat(propagator.rounds()).isLessThanOrEqualTo(graph.size() * 3);
    }

    @Test
    void contextsFollowGraphOrder() throws Exception {
        ElementGraph graph = Flows.graph("F", """
            {
              "loops": [{"name": "L", "nextValueConnector": {"targetReference": "B"}}],
              "assignments": [{"name": "A"}, {"name": "B", "connector": {"targetReference": "A"}}]
            }
            """);

        assertThat(LoopContextPropagator.propagate(graph).keySet()).containsExactly("A", "B");
    }

    @Test
    void refersToMatchesWholeNameOrMemberAccess() {
        assertThat(LoopContextPropagator.refersTo("Loop_A", "Loop_A")).isTrue();
        assertThat(LoopContextPropagator.refersTo("Loop_A.Id", "Loop_A")).isTrue();
        assertThat(LoopContextPropagator.refersTo("Loop_AB.Id", "Loop_A")).isFalse();
        assertThat(LoopContextPropagator.refersTo("my.Loop_A", "Loop_A")).isFalse();
    }
}
