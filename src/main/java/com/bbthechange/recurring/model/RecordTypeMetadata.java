package com.bbthechange.recurring.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Field metadata for one record type: which fields exist, which a user may edit,
 * which must be present, and optionally the scope field that makes bookings exclusive.
 */
public class RecordTypeMetadata {

    private final String recordType;
    private final Set<String> fields;
    private final Set<String> editableFields;
    private final Set<String> requiredFields;
    private final String exclusiveScopeField;
    private final String displayField;

    public RecordTypeMetadata(String recordType, Set<String> fields, Set<String> editableFields,
                              Set<String> requiredFields, String exclusiveScopeField, String displayField) {
        this.recordType = recordType;
        this.fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
        this.editableFields = Collections.unmodifiableSet(new LinkedHashSet<>(editableFields));
        this.requiredFields = Collections.unmodifiableSet(new LinkedHashSet<>(requiredFields));
        this.exclusiveScopeField = exclusiveScopeField;
        this.displayField = displayField;
    }

    public String getRecordType() {
        return recordType;
    }

    public Set<String> getFields() {
        return fields;
    }

    public Set<String> getEditableFields() {
        return editableFields;
    }

    public Set<String> getRequiredFields() {
        return requiredFields;
    }

    public String getExclusiveScopeField() {
        return exclusiveScopeField;
    }

    public String getDisplayField() {
        return displayField;
    }

    public boolean hasExclusiveScope() {
        return exclusiveScopeField != null && !exclusiveScopeField.isBlank();
    }
}
