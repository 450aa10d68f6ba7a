package dev.flowbulk.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.flowbulk.model.LoopMetrics;
import dev.flowbulk.model.Recommendation;
import dev.flowbulk.model.SecurityContext;
import dev.flowbulk.model.SubflowCall;
import dev.flowbulk.model.WorkflowAnalysis;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders a workflow analysis as JSON or as a human-readable summary.
 */
public final class AnalysisWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private AnalysisWriter() {}

    /**
     * Render the analysis, its children included, as indented JSON.
     */
    public static String toJson(WorkflowAnalysis analysis) {
        try {
            return MAPPER.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize analysis of " + analysis.name(), e);
        }
    }

    /**
     * Render a summary of the analysis and, indented, each of its sub-workflows.
     */
    public static String toText(WorkflowAnalysis analysis) {
        var sb = new StringBuilder();
        appendAnalysis(sb, analysis, "");
        return sb.toString();
    }

    private static void appendAnalysis(StringBuilder sb, WorkflowAnalysis analysis, String indent) {
        sb.append(indent).append("Flow: ").append(analysis.name());
        if (analysis.depth() > 0) {
            sb.append(" (sub-workflow, depth ").append(analysis.depth()).append(')');
        }
        sb.append('\n');
        if (analysis.isDepthLimit()) {
            sb.append(indent).append("  Not analysed: ").append(analysis.reason()).append('\n');
            return;
        }

        var version = analysis.version();
        sb.append(indent).append("  Version: ").append(version.version())
            .append(" (").append(version.status()).append(')');
        if (version.lastModified() != null && !version.lastModified().isEmpty()) {
            sb.append(", last modified ").append(version.lastModified());
        }
        sb.append('\n');

        sb.append(indent).append("  Elements: ").append(analysis.elementCount())
            .append(" (cumulative ").append(analysis.cumulativeElementCount()).append(")\n");
        if (!analysis.elementCounts().isEmpty()) {
            sb.append(indent).append("    ");
            var first = true;
            for (var entry : analysis.elementCounts().entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey().label()).append(": ").append(entry.getValue());
                first = false;
            }
            sb.append('\n');
        }

        sb.append(indent).append("  SOQL: ").append(analysis.directSoqlCount())
            .append(" direct, ").append(analysis.cumulativeSoqlCount()).append(" cumulative");
        appendSources(sb, analysis.soqlSources());
        sb.append(indent).append("  DML: ").append(analysis.directDmlCount())
            .append(" direct, ").append(analysis.cumulativeDmlCount()).append(" cumulative");
        appendSources(sb, analysis.dmlSources());

        if (!analysis.objectDependencies().isEmpty()) {
            sb.append(indent).append("  Objects: ").append(String.join(", ", analysis.objectDependencies()))
                .append('\n');
        }
        appendSecurity(sb, analysis.securityContext(), indent);

        sb.append(indent).append("  Complexity: ").append(analysis.complexity())
            .append(" (cumulative ").append(analysis.cumulativeComplexity()).append(")\n");

        for (LoopMetrics loop : analysis.loops()) {
            sb.append(indent).append("  Loop ").append(loop.loopName()).append(": ")
                .append(loop.nestedDml()).append(" DML, ")
                .append(loop.nestedSoql()).append(" SOQL, ")
                .append(loop.nestedSubflows()).append(" calls, ")
                .append(loop.nestedOther()).append(" other\n");
        }

        if (!analysis.subflowCalls().isEmpty()) {
            sb.append(indent).append("  Subflows:\n");
            for (SubflowCall call : analysis.subflowCalls()) {
                sb.append(indent).append("    ").append(call.elementName()).append(" -> ").append(call.flowName());
                if (call.inLoop()) {
                    sb.append(" [in loop ").append(call.loopReferenceName()).append(']');
                }
                sb.append('\n');
            }
        }

        sb.append(indent).append("  Bulkification: score ").append(analysis.bulkificationScore())
            .append(analysis.shouldBulkify() ? ", recommended" : ", not required").append('\n');
        for (String line : analysis.reason().split("\n")) {
            sb.append(indent).append("    ").append(line).append('\n');
        }

        for (Recommendation recommendation : analysis.recommendations()) {
            if (!recommendation.shouldSplit() && recommendation.suggestedClassNames().isEmpty()) {
                sb.append(indent).append("  Advice: ").append(recommendation.reason()).append('\n');
                continue;
            }
            sb.append(indent).append("  Split: ").append(recommendation.shouldSplit() ? "yes" : "no")
                .append(" - ").append(recommendation.reason()).append('\n');
            sb.append(indent).append("    Suggested classes: ")
                .append(String.join(", ", recommendation.suggestedClassNames())).append('\n');
        }

        for (String warning : analysis.warnings()) {
            sb.append(indent).append("  Warning: ").append(warning).append('\n');
        }

        for (WorkflowAnalysis child : analysis.childSubflows()) {
            appendAnalysis(sb, child, indent + "  ");
        }
    }

    private static void appendSecurity(StringBuilder sb, SecurityContext security, String indent) {
        if (security.runInMode() == null && security.requiredPermissions().isEmpty()) {
            return;
        }
        String mode = security.systemMode() ? "system mode"
            : security.runInMode() == null ? "default mode" : "user mode";
        sb.append(indent).append("  Security: ").append(mode);
        if (security.runInMode() != null) {
            sb.append(" (").append(security.runInMode()).append(')');
        }
        if (security.enforceSharingRules()) {
            sb.append(", sharing enforced");
        }
        if (!security.requiredPermissions().isEmpty()) {
            sb.append(", needs ").append(String.join(", ", security.requiredPermissions()));
        }
        sb.append('\n');
    }

    private static void appendSources(StringBuilder sb, List<String> sources) {
        if (!sources.isEmpty()) {
            sb.append(" (").append(String.join(", ", sources)).append(')');
        }
        sb.append('\n');
    }
}
