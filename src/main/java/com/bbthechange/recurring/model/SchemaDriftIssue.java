package com.bbthechange.recurring.model;

import java.util.Objects;

/**
 * One mismatch between a series template and the current fields of its record type.
 */
public final class SchemaDriftIssue {

    public static final String REQUIRED_FIELD_MISSING = "Required field missing from template";
    public static final String FIELD_REMOVED = "Field no longer exists in entity schema";

    private final String field;
    private final String issue;

    public SchemaDriftIssue(String field, String issue) {
        this.field = field;
        this.issue = issue;
    }

    public String getField() {
        return field;
    }

    public String getIssue() {
        return issue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaDriftIssue other)) return false;
        return Objects.equals(field, other.field) && Objects.equals(issue, other.issue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, issue);
    }

    @Override
    public String toString() {
        return field + ": " + issue;
    }
}
