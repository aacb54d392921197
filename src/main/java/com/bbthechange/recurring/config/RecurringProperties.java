package com.bbthechange.recurring.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "recurring")
public class RecurringProperties {

    /**
     * How far ahead of "now" expansion is queued on create and schedule replacement.
     */
    @DurationUnit(ChronoUnit.DAYS)
    private Duration horizon = Duration.ofDays(90);

    private Map<String, RecordType> recordTypes = new LinkedHashMap<>();

    public Duration getHorizon() {
        return horizon;
    }

    public void setHorizon(Duration horizon) {
        this.horizon = horizon;
    }

    public Map<String, RecordType> getRecordTypes() {
        return recordTypes;
    }

    public void setRecordTypes(Map<String, RecordType> recordTypes) {
        this.recordTypes = recordTypes;
    }

    public static class RecordType {

        private List<String> fields = new ArrayList<>();
        private List<String> editableFields = new ArrayList<>();
        private List<String> requiredFields = new ArrayList<>();
        private String exclusiveScopeField;
        private String displayField;

        public List<String> getFields() {
            return fields;
        }

        public void setFields(List<String> fields) {
            this.fields = fields;
        }

        public List<String> getEditableFields() {
            return editableFields;
        }

        public void setEditableFields(List<String> editableFields) {
            this.editableFields = editableFields;
        }

        public List<String> getRequiredFields() {
            return requiredFields;
        }

        public void setRequiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields;
        }

        public String getExclusiveScopeField() {
            return exclusiveScopeField;
        }

        public void setExclusiveScopeField(String exclusiveScopeField) {
            this.exclusiveScopeField = exclusiveScopeField;
        }

        public String getDisplayField() {
            return displayField;
        }

        public void setDisplayField(String displayField) {
            this.displayField = displayField;
        }
    }
}
