package dev.flowbulk.engine;

import dev.flowbulk.model.AnalyzerSettings;
import dev.flowbulk.model.ElementGraph;
import dev.flowbulk.model.FlowMetrics;
import dev.flowbulk.model.LoopMetrics;
import dev.flowbulk.model.StepKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class MetricsCalculatorTest {

    private static FlowMetrics metrics(String json, boolean subflow) throws Exception {
        ElementGraph graph = Flows.graph("F", json);
        return MetricsCalculator.calculate(graph, LoopContextPropagator.propagate(graph), subflow,
            AnalyzerSettings.defaults());
    }

    @Test
    void createInsideLoopCostsThirtyPoints() throws Exception {
        FlowMetrics metrics = metrics("""
            {
              "loops": [{"name": "L", "nextValueConnector": {"targetReference": "C"}}],
              "recordCreates": [{"name": "C", "object": "Account"}]
            }
            """, false);

        assertThat(metrics.dmlCount()).isEqualTo(1);
        assertThat(metrics.soqlCount()).isZero();
        assertThat(metrics.complexity()).isEqualTo(6);
        assertThat(metrics.bulkificationScore()).isEqualTo(70);
        assertThat(metrics.shouldBulkify()).isTrue();
        assertThat(metrics.loops()).containsExactly(new LoopMetrics("L", 1, 0, 0, 0));
        assertThat(metrics.dmlSources()).containsExactly("Record Creates");
        assertThat(metrics.reason()).isEqualTo("""
            - Contains 1 DML operation(s)
            - High complexity score: 6
            - Contains 1 loop(s)
            - Bulkification score 70 is below 80""");
    }

    @Test
    void simpleFlowNeedsNoBulkification() throws Exception {
        FlowMetrics metrics = metrics("""
            {"screens": [{"name": "Welcome"}]}
            """, false);

        assertThat(metrics.complexity()).isEqualTo(1);
        assertThat(metrics.bulkificationScore()).isEqualTo(100);
        assertThat(metrics.shouldBulkify()).isFalse();
        assertThat(metrics.reason()).isEqualTo("Simple flow - bulkification not required");
        assertThat(metrics.elementCounts()).containsExactly(entry(StepKind.SCREEN, 1));
    }

    @Test
    void subWorkflowWeightsAreHigher() throws Exception {
        String json = """
            {
              "decisions": [{"name": "D"}],
              "loops": [{"name": "L"}],
              "subflows": [{"name": "S", "flowName": "Child"}]
            }
            """;

        assertThat(metrics(json, false).complexity()).isEqualTo(1 + 2 + 3 + 2);
        assertThat(metrics(json, true).complexity()).isEqualTo(1 + 3 + 4 + 3);
    }

    @Test
    void countsQuerySourcesBeyondLookups() throws Exception {
        FlowMetrics metrics = metrics("""
            {
              "start": {"triggerType": "RecordBeforeSave"},
              "dynamicChoiceSets": [{"name": "Accounts"}, {"name": "Contacts"}],
              "formulas": [{"name": "OwnerEmail", "expression": "$Record.Owner.Email"}],
              "recordLookups": [{"name": "Get_Account"}]
            }
            """, false);

        assertThat(metrics.soqlCount()).isEqualTo(5);
        assertThat(metrics.soqlSources()).containsExactly(
            "Record Lookups", "Dynamic Choice Sets", "Record-Triggered Flow", "Cross-Object Formula References");
        // lookups and choice sets weigh 2 each, the formula 1, the trigger nothing
        assertThat(metrics.complexity()).isEqualTo(1 + 3 * 2 + 1);
        assertThat(metrics.bulkificationScore()).isEqualTo(100 - 5 * 4);
        assertThat(metrics.shouldBulkify()).isTrue();
    }

    @Test
    void busyLoopLosesExtraPoints() throws Exception {
        var creates = new StringBuilder();
        for (int i = 1; i <= 7; i++) {
            if (i > 1) {
                creates.append(',');
            }
            creates.append("{\"name\": \"C").append(i).append('"');
            if (i < 7) {
                creates.append(", \"connector\": {\"targetReference\": \"C").append(i + 1).append("\"}");
            }
            creates.append('}');
        }
        FlowMetrics metrics = metrics("""
            {
              "loops": [{"name": "L", "nextValueConnector": {"targetReference": "C1"}}],
              "recordCreates": [%s]
            }
            """.formatted(creates), false);

        assertThat(metrics.loops()).containsExactly(new LoopMetrics("L", 7, 0, 0, 0));
        // 100 - 10*6 extra DML - 30 DML in loop - min(20, (7-5)*2)
        assertThat(metrics.bulkificationScore()).isEqualTo(6);
    }

    @Test
    void scoreIsClampedAtZero() throws Exception {
        var loops = new StringBuilder();
        var deletes = new StringBuilder();
        for (int i = 0; i < 5; i++) {
            if (i > 0) {
                loops.append(',');
                deletes.append(',');
            }
            loops.append("{\"name\": \"L%d\", \"nextValueConnector\": {\"targetReference\": \"X%d\"}}".formatted(i, i));
            deletes.append("{\"name\": \"X%d\"}".formatted(i));
        }
        FlowMetrics metrics = metrics("{\"loops\": [%s], \"recordDeletes\": [%s]}".formatted(loops, deletes), false);

        assertThat(metrics.bulkificationScore()).isZero();
    }

    @Test
    void subflowInsideLoopIsPenalisedAndNamed() throws Exception {
        FlowMetrics metrics = metrics("""
            {
              "loops": [{"name": "L", "nextValueConnector": {"targetReference": "Call"}}],
              "subflows": [{"name": "Call", "flowName": "Enrich_Account"}],
              "actionCalls": [{"name": "Outside", "actionName": "Notify", "actionType": "flow"}]
            }
            """, false);

        assertThat(metrics.loops()).containsExactly(new LoopMetrics("L", 0, 0, 1, 0));
        assertThat(metrics.bulkificationScore()).isEqualTo(85);
        assertThat(metrics.reason())
            .contains("- Contains subflow calls inside loop: Enrich_Account")
            .doesNotContain("Notify");
    }

    @Test
    void lookupInsideLoopIsReported() throws Exception {
        FlowMetrics metrics = metrics("""
            {
              "loops": [{"name": "L", "nextValueConnector": {"targetReference": "Get"}}],
              "recordLookups": [{"name": "Get", "connector": {"targetReference": "Note"}}],
              "assignments": [{"name": "Note"}]
            }
            """, false);

        assertThat(metrics.loops()).containsExactly(new LoopMetrics("L", 0, 1, 0, 1));
        assertThat(metrics.bulkificationScore()).isEqualTo(80);
        assertThat(metrics.reason()).contains("- Contains 1 SOQL queries (found in loop)");
    }

    @Test
    void scoreStaysWithinBounds() {
        List<LoopMetrics> heavy = List.of(new LoopMetrics("L", 20, 20, 20, 20), new LoopMetrics("M", 1, 1, 1, 0));
        assertThat(MetricsCalculator.bulkificationScore(50, 50, heavy)).isZero();
        assertThat(MetricsCalculator.bulkificationScore(0, 0, List.of())).isEqualTo(100);
        assertThat(MetricsCalculator.bulkificationScore(1, 1, List.of(new LoopMetrics("L", 0, 0, 0, 9))))
            .isEqualTo(100);
    }

    @Test
    void elementCountsCoverEveryKindPresent() throws Exception {
        FlowMetrics metrics = metrics("""
            {
              "recordUpdates": [{"name": "U1"}, {"name": "U2"}],
              "decisions": [{"name": "D"}],
              "screens": [{"name": "S"}]
            }
            """, false);

        assertThat(metrics.elementCount()).isEqualTo(4);
        assertThat(metrics.elementCounts()).containsExactly(
            entry(StepKind.RECORD_UPDATE, 2), entry(StepKind.DECISION, 1), entry(StepKind.SCREEN, 1));
    }
}
