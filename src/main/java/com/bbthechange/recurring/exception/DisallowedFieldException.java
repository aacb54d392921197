package com.bbthechange.recurring.exception;

import java.util.List;

/**
 * Thrown when a series template names a field that is not editable on the target record type.
 */
public class DisallowedFieldException extends RuntimeException {

    private final String field;
    private final String recordType;
    private final List<String> allowedFields;

    public DisallowedFieldException(String field, String recordType, List<String> allowedFields) {
        super(String.format("Template field \"%s\" is not allowed for entity %s. Allowed fields: %s",
            field, recordType, String.join(", ", allowedFields)));
        this.field = field;
        this.recordType = recordType;
        this.allowedFields = List.copyOf(allowedFields);
    }

    public String getField() {
        return field;
    }

    public String getRecordType() {
        return recordType;
    }

    public List<String> getAllowedFields() {
        return allowedFields;
    }
}
