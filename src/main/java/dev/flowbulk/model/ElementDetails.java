package dev.flowbulk.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed properties of an element. Exactly one variant per family of step kinds,
 * produced once by the graph builder.
 */
public sealed interface ElementDetails {

    /**
     * Value expressions this element reads: input assignments, filter values and direct references.
     */
    List<String> valueExpressions();

    /** Create, update, delete and lookup steps. */
    record RecordOperation(
        String targetObject, // nullable
        List<String> fields,
        List<ValueAssignment> inputs,
        String inputReference // nullable
    ) implements ElementDetails {
        public RecordOperation {
            fields = List.copyOf(fields);
            inputs = List.copyOf(inputs);
        }

        @Override
        public List<String> valueExpressions() {
            var expressions = new ArrayList<String>();
            if (inputReference != null) {
                expressions.add(inputReference);
            }
            inputs.stream().map(ValueAssignment::expression).filter(Objects::nonNull).forEach(expressions::add);
            return expressions;
        }
    }

    /** An assignment step; each item assigns one expression to a variable. */
    record Assignment(List<ValueAssignment> items) implements ElementDetails {
        public Assignment {
            items = List.copyOf(items);
        }

        @Override
        public List<String> valueExpressions() {
            return items.stream().map(ValueAssignment::expression).filter(Objects::nonNull).toList();
        }
    }

    /** A decision; its rules are carried on the element's rule edges. */
    record Decision(List<String> ruleNames) implements ElementDetails {
        public Decision {
            ruleNames = List.copyOf(ruleNames);
        }

        @Override
        public List<String> valueExpressions() { return List.of(); }
    }

    /** A loop over a collection. */
    record Loop(
        String collectionReference, // nullable
        String iterationOrder, // nullable
        String assignNextValueToReference // nullable, legacy current-item variable
    ) implements ElementDetails {
        @Override
        public List<String> valueExpressions() {
            return collectionReference == null ? List.of() : List.of(collectionReference);
        }
    }

    /** A call into another workflow by name. */
    record Subflow(
        String flowName, // nullable
        List<ValueAssignment> inputs,
        List<ValueAssignment> outputs
    ) implements ElementDetails {
        public Subflow {
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
        }

        @Override
        public List<String> valueExpressions() {
            return inputs.stream().map(ValueAssignment::expression).filter(Objects::nonNull).toList();
        }
    }

    /** An invocable action; {@code actionType} "flow" makes it a workflow call. */
    record ActionCall(
        String actionName, // nullable
        String actionType, // nullable
        List<ValueAssignment> inputs
    ) implements ElementDetails {
        public ActionCall {
            inputs = List.copyOf(inputs);
        }

        public boolean invokesWorkflow() {
            return actionName != null && "flow".equalsIgnoreCase(actionType);
        }

        @Override
        public List<String> valueExpressions() {
            return inputs.stream().map(ValueAssignment::expression).filter(Objects::nonNull).toList();
        }
    }

    record Screen(List<String> fieldNames) implements ElementDetails {
        public Screen {
            fieldNames = List.copyOf(fieldNames);
        }

        @Override
        public List<String> valueExpressions() { return List.of(); }
    }

    record Rollback() implements ElementDetails {
        @Override
        public List<String> valueExpressions() { return List.of(); }
    }
}
