package dev.flowbulk.engine;

import dev.flowbulk.model.AnalyzerSettings;
import dev.flowbulk.model.FlowMetrics;
import dev.flowbulk.model.FlowVersion;
import dev.flowbulk.model.LoopMetrics;
import dev.flowbulk.model.Recommendation;
import dev.flowbulk.model.SecurityContext;
import dev.flowbulk.model.StepKind;
import dev.flowbulk.model.WorkflowAnalysis;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationGeneratorTest {

    private final AnalyzerSettings settings = AnalyzerSettings.defaults();

    private static WorkflowAnalysis child(String name, Map<StepKind, Integer> counts) {
        return new WorkflowAnalysis(name, 1, FlowVersion.unknown(), 0, counts, 0, 0, 0, List.of(), List.of(),
            0, 0, 0, 0, 100, false, "", Map.of(), List.of(), List.of(), SecurityContext.none(), List.of(), List.of(),
            List.of(), List.of());
    }

    @Test
    void simpleFlowStaysOneClass() {
        Recommendation recommendation = RecommendationGenerator.generate(5, 1, 1, List.of(), List.of("Root"), settings);

        assertThat(recommendation).isEqualTo(new Recommendation(false,
            "Simple flow structure - single class recommended", List.of("MainFlowProcessor")));
    }

    @Test
    void highComplexityAndOperationsAreBothCited() {
        Recommendation recommendation = RecommendationGenerator.generate(22, 4, 3, List.of(), List.of("Root"), settings);

        assertThat(recommendation.shouldSplit()).isTrue();
        assertThat(recommendation.reason())
            .isEqualTo("High cumulative complexity (22 > 15), High number of database operations (7 > 5)");
    }

    @Test
    void thresholdsAreExclusive() {
        assertThat(RecommendationGenerator.generate(15, 3, 2, List.of(), List.of(), settings).shouldSplit()).isFalse();
        assertThat(RecommendationGenerator.generate(16, 0, 0, List.of(), List.of(), settings).shouldSplit()).isTrue();
        assertThat(RecommendationGenerator.generate(1, 3, 3, List.of(), List.of(), settings).shouldSplit()).isTrue();
    }

    @Test
    void groupsChildrenByPriorityAndNamesAfterFirstMember() {
        List<WorkflowAnalysis> children = List.of(
            child("Route-Case", Map.of(StepKind.DECISION, 2)),
            child("Update Contacts", Map.of(StepKind.RECORD_UPDATE, 1, StepKind.DECISION, 1)),
            child("Get_Accounts", Map.of(StepKind.RECORD_LOOKUP, 1, StepKind.RECORD_CREATE, 1)),
            child("Find_Owner", Map.of(StepKind.RECORD_LOOKUP, 2)),
            child("Format", Map.of(StepKind.ASSIGNMENT, 3)));

        Recommendation recommendation = RecommendationGenerator.generate(30, 6, 3, children, List.of("Root"), settings);

        assertThat(recommendation.suggestedClassNames()).containsExactly(
            "GetAccountsDataService", "UpdateContactsDataManager", "RouteCaseBusinessService", "FormatProcessor");
    }

    @Test
    void skipsChildrenAlreadyOnCallChain() {
        List<WorkflowAnalysis> children = List.of(child("Root", Map.of(StepKind.RECORD_LOOKUP, 1)));

        Recommendation recommendation = RecommendationGenerator.generate(3, 0, 1, children, List.of("Root", "Child"),
            settings);

        assertThat(recommendation.suggestedClassNames()).containsExactly("MainFlowProcessor");
    }

    @Test
    void depthLimitedChildIsUtility() {
        List<WorkflowAnalysis> children = List.of(WorkflowAnalysis.depthLimit("Deep_Flow", 10));

        assertThat(RecommendationGenerator.suggestedClassNames(children, List.of()))
            .containsExactly("DeepFlowProcessor");
    }

    @Test
    void usesConfiguredThresholds() {
        var strict = new AnalyzerSettings(10, 5, 1, 80, 5);

        Recommendation recommendation = RecommendationGenerator.generate(6, 1, 1, List.of(), List.of(), strict);

        assertThat(recommendation.reason())
            .isEqualTo("High cumulative complexity (6 > 5), High number of database operations (2 > 1)");
    }

    @Test
    void loopAdviceNamesEachLoopWithDatabaseWork() {
        var metrics = new FlowMetrics(6, Map.of(), 2, 3, List.of(), List.of(), 20, 0, true, "",
            List.of(new LoopMetrics("Per_Account", 1, 1, 0, 0), new LoopMetrics("Per_Contact", 0, 2, 1, 0),
                new LoopMetrics("Idle", 0, 0, 0, 3)));

        assertThat(RecommendationGenerator.loopAdvice(metrics))
            .extracting(Recommendation::reason)
            .containsExactly(
                "Move DML operations outside of loop in element: Per_Account",
                "Move SOQL queries outside of loop in element: Per_Account",
                "Move SOQL queries outside of loop in element: Per_Contact",
                "Consider consolidating multiple DML operations",
                "Consider combining SOQL queries where possible");
        assertThat(RecommendationGenerator.loopAdvice(metrics))
            .allSatisfy(advice -> {
                assertThat(advice.shouldSplit()).isFalse();
                assertThat(advice.suggestedClassNames()).isEmpty();
            });
    }

    @Test
    void quietWorkflowGetsNoAdvice() {
        var metrics = new FlowMetrics(2, Map.of(), 1, 1, List.of(), List.of(), 5, 100, true, "",
            List.of(new LoopMetrics("L", 0, 0, 0, 1)));

        assertThat(RecommendationGenerator.loopAdvice(metrics)).isEmpty();
    }

    @Test
    void sanitizeKeepsLettersAndDigits() {
        assertThat(RecommendationGenerator.sanitize("Account_Sync-v2 (beta)")).isEqualTo("AccountSyncv2beta");
        assertThat(RecommendationGenerator.sanitize(null)).isEmpty();
    }
}
