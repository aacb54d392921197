package com.bbthechange.recurring.model;

/**
 * Outcome of checking one candidate range. {@code index} is the candidate's 0-based position in the request.
 */
public class ConflictCheckResult {

    private final int index;
    private final TimeRange range;
    private final boolean conflict;
    private final String conflictingRecordId;
    private final String conflictingLabel;

    public ConflictCheckResult(int index, TimeRange range, boolean conflict,
                               String conflictingRecordId, String conflictingLabel) {
        this.index = index;
        this.range = range;
        this.conflict = conflict;
        this.conflictingRecordId = conflictingRecordId;
        this.conflictingLabel = conflictingLabel;
    }

    public static ConflictCheckResult clear(int index, TimeRange range) {
        return new ConflictCheckResult(index, range, false, null, null);
    }

    public int getIndex() {
        return index;
    }

    public TimeRange getRange() {
        return range;
    }

    public boolean isConflict() {
        return conflict;
    }

    public String getConflictingRecordId() {
        return conflictingRecordId;
    }

    public String getConflictingLabel() {
        return conflictingLabel;
    }
}
