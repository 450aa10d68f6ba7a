package dev.flowbulk.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * The closed vocabulary of workflow steps, each bound to the metadata category that lists it.
 */
public enum StepKind {
    RECORD_CREATE("RecordCreate", "recordCreates"),
    RECORD_UPDATE("RecordUpdate", "recordUpdates"),
    RECORD_DELETE("RecordDelete", "recordDeletes"),
    RECORD_LOOKUP("RecordLookup", "recordLookups"),
    RECORD_ROLLBACK("RecordRollback", "recordRollbacks"),
    ASSIGNMENT("Assignment", "assignments"),
    DECISION("Decision", "decisions"),
    LOOP("Loop", "loops"),
    SUBFLOW("Subflow", "subflows"),
    ACTION_CALL("ActionCall", "actionCalls"),
    SCREEN("Screen", "screens");

    private static final Set<StepKind> DML = EnumSet.of(RECORD_CREATE, RECORD_UPDATE, RECORD_DELETE);
    private static final Set<StepKind> INVOCATIONS = EnumSet.of(SUBFLOW, ACTION_CALL);

    private final String label;
    private final String category;

    StepKind(String label, String category) {
        this.label = label;
        this.category = category;
    }

    @JsonValue
    public String label() { return label; }

    /** Name of the metadata category holding steps of this kind. */
    public String category() { return category; }

    public boolean isDml() { return DML.contains(this); }

    public boolean isSoql() { return this == RECORD_LOOKUP; }

    /** Subflow and action calls, the steps that hand control to another unit. */
    public boolean isInvocation() { return INVOCATIONS.contains(this); }
}
