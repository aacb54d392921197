package com.bbthechange.recurring.store;

import com.bbthechange.recurring.model.RecordTypeMetadata;

import java.util.Optional;

/**
 * Source of per-record-type field metadata used by template validation and drift checks.
 */
public interface FieldMetadataSource {

    /**
     * @return metadata for the record type, or empty if the type is unknown
     */
    Optional<RecordTypeMetadata> getMetadata(String recordType);
}
