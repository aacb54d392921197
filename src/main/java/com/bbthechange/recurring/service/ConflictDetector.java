package com.bbthechange.recurring.service;

import com.bbthechange.recurring.model.ConflictCheckResult;
import com.bbthechange.recurring.model.EntityRecord;
import com.bbthechange.recurring.model.TimeRange;
import com.bbthechange.recurring.store.EntityStore;
import com.bbthechange.recurring.store.FieldMetadataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks candidate ranges against existing records that share a scope, e.g. the same room.
 * Advisory only: the result is a snapshot and nothing is reserved.
 */
@Component
public class ConflictDetector {

    private static final Logger logger = LoggerFactory.getLogger(ConflictDetector.class);

    private final EntityStore entityStore;
    private final FieldMetadataSource metadataSource;

    @Autowired
    public ConflictDetector(EntityStore entityStore, FieldMetadataSource metadataSource) {
        this.entityStore = entityStore;
        this.metadataSource = metadataSource;
    }

    public List<ConflictCheckResult> detect(String recordType, String scopeField, Object scopeValue,
                                            String timeField, List<TimeRange> candidates) {
        List<ConflictCheckResult> results = new ArrayList<>(candidates.size());
        int conflicts = 0;
        for (int i = 0; i < candidates.size(); i++) {
            ConflictCheckResult result = check(i, recordType, scopeField, scopeValue, timeField, candidates.get(i));
            if (result.isConflict()) {
                conflicts++;
            }
            results.add(result);
        }
        logger.debug("Checked {} candidate ranges for {} {}={}: {} conflicts",
            candidates.size(), recordType, scopeField, scopeValue, conflicts);
        return results;
    }

    /**
     * Check a single range. Used by the expansion worker for its materialization-time re-check.
     */
    public ConflictCheckResult check(int index, String recordType, String scopeField, Object scopeValue,
                                     String timeField, TimeRange range) {
        Optional<EntityRecord> existing = entityStore.findOverlapping(recordType, scopeField, scopeValue, timeField, range);
        if (existing.isEmpty()) {
            return ConflictCheckResult.clear(index, range);
        }
        EntityRecord record = existing.get();
        return new ConflictCheckResult(index, range, true, record.getRecordId(), labelOf(record));
    }

    private String labelOf(EntityRecord record) {
        String displayField = metadataSource.getMetadata(record.getRecordType())
            .map(m -> m.getDisplayField())
            .orElse(null);
        if (displayField != null) {
            Object value = record.getField(displayField);
            if (value != null && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        return "#" + record.getRecordId();
    }
}
