package com.bbthechange.recurring.service;

import com.bbthechange.recurring.exception.DisallowedFieldException;
import com.bbthechange.recurring.exception.ValidationException;
import com.bbthechange.recurring.model.RecordTypeMetadata;
import com.bbthechange.recurring.model.SchemaDriftIssue;
import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.store.FieldMetadataSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks series templates against the editable fields of their record type.
 */
@Component
public class TemplateValidator {

    /** Identity and audit fields a template may never set. */
    static final Set<String> DENIED_FIELDS = Set.of("id", "created_at", "created_by", "updated_at", "updated_by");

    private final FieldMetadataSource metadataSource;

    @Autowired
    public TemplateValidator(FieldMetadataSource metadataSource) {
        this.metadataSource = metadataSource;
    }

    /**
     * Reject any template key the record type does not allow users to edit.
     * The occurrence time field is supplied by expansion and is always skipped.
     *
     * @throws ValidationException if the record type is unknown
     * @throws DisallowedFieldException naming the first offending key
     */
    public void validate(String recordType, Map<String, Object> template, String timeField) {
        RecordTypeMetadata metadata = metadataSource.getMetadata(recordType)
            .orElseThrow(() -> new ValidationException("Unknown record type: " + recordType));
        if (template == null || template.isEmpty()) {
            return;
        }

        Set<String> allowed = new TreeSet<>(metadata.getEditableFields());
        allowed.removeAll(DENIED_FIELDS);

        for (String key : template.keySet()) {
            if (isTimeField(key, timeField)) {
                continue;
            }
            if (!allowed.contains(key)) {
                throw new DisallowedFieldException(key, recordType, new ArrayList<>(allowed));
            }
        }
    }

    /**
     * Compare a template with the record type's current fields. Drift is returned, never thrown.
     * An unknown record type reports every template key as removed.
     */
    public List<SchemaDriftIssue> checkDrift(String recordType, Map<String, Object> template, String timeField) {
        Map<String, Object> fields = template == null ? Map.of() : template;
        Optional<RecordTypeMetadata> metadata = metadataSource.getMetadata(recordType);
        List<SchemaDriftIssue> issues = new ArrayList<>();

        if (metadata.isPresent()) {
            for (String required : metadata.get().getRequiredFields()) {
                if (DENIED_FIELDS.contains(required) || isTimeField(required, timeField)) {
                    continue;
                }
                if (!fields.containsKey(required)) {
                    issues.add(new SchemaDriftIssue(required, SchemaDriftIssue.REQUIRED_FIELD_MISSING));
                }
            }
        }

        Set<String> current = metadata.map(RecordTypeMetadata::getFields).orElse(Set.of());
        for (String key : fields.keySet()) {
            if (isTimeField(key, timeField)) {
                continue;
            }
            if (!current.contains(key)) {
                issues.add(new SchemaDriftIssue(key, SchemaDriftIssue.FIELD_REMOVED));
            }
        }
        return issues;
    }

    private static boolean isTimeField(String key, String timeField) {
        return Series.DEFAULT_TIME_FIELD.equals(key) || key.equals(timeField);
    }
}
