package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.model.ExceptionType;
import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.repository.SeriesInstanceRepository;
import com.bbthechange.recurring.store.RecordDeletionListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Marks an instance cancelled when its record is deleted through the entity store directly.
 * Failures never block the delete; they are logged and counted so a dangling instance is visible.
 */
@Component
public class OrphanedInstanceCleanup implements RecordDeletionListener {

    private static final Logger logger = LoggerFactory.getLogger(OrphanedInstanceCleanup.class);

    static final String REASON = "Entity record deleted directly";

    private final SeriesInstanceRepository instanceRepository;
    private final MeterRegistry meterRegistry;

    @Autowired
    public OrphanedInstanceCleanup(SeriesInstanceRepository instanceRepository, MeterRegistry meterRegistry) {
        this.instanceRepository = instanceRepository;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void beforeRecordDelete(String recordType, String recordId) {
        try {
            Optional<SeriesInstance> found = instanceRepository.findByRecord(recordType, recordId);
            if (found.isEmpty()) {
                return;
            }
            SeriesInstance instance = found.get();
            instance.unlinkRecord();
            instance.markException(ExceptionType.CANCELLED, REASON, ExpansionWorkerServiceImpl.SYSTEM_ACTOR);
            instanceRepository.update(instance);

            logger.info("Record {}/{} deleted directly, cancelled occurrence {} of series {}",
                recordType, recordId, instance.getOccurrenceDate(), instance.getSeriesId());
            meterRegistry.counter("recurring_orphan_cleanup_total", "status", "success").increment();
        } catch (RuntimeException e) {
            logger.error("Failed to cancel instance for deleted record {}/{}; instance is left dangling",
                recordType, recordId, e);
            meterRegistry.counter("recurring_orphan_cleanup_total", "status", "error").increment();
        }
    }
}
