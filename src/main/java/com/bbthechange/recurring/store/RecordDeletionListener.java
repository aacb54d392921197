package com.bbthechange.recurring.store;

/**
 * Hook invoked by the entity store before a record is removed.
 */
public interface RecordDeletionListener {

    void beforeRecordDelete(String recordType, String recordId);
}
