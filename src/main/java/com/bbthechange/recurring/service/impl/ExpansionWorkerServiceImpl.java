package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.model.ConflictCheckResult;
import com.bbthechange.recurring.model.EntityRecord;
import com.bbthechange.recurring.model.ExceptionType;
import com.bbthechange.recurring.model.ExpansionJob;
import com.bbthechange.recurring.model.RecordTypeMetadata;
import com.bbthechange.recurring.model.SchemaDriftIssue;
import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.model.SeriesStatus;
import com.bbthechange.recurring.model.TimeRange;
import com.bbthechange.recurring.repository.SeriesInstanceRepository;
import com.bbthechange.recurring.repository.SeriesRepository;
import com.bbthechange.recurring.service.ConflictDetector;
import com.bbthechange.recurring.service.ExpansionWorkerService;
import com.bbthechange.recurring.service.RecurrenceExpander;
import com.bbthechange.recurring.service.TemplateValidator;
import com.bbthechange.recurring.store.EntityStore;
import com.bbthechange.recurring.store.FieldMetadataSource;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Expansion worker. Runs behind the job sink, never inside a request.
 */
@Service
public class ExpansionWorkerServiceImpl implements ExpansionWorkerService {

    private static final Logger logger = LoggerFactory.getLogger(ExpansionWorkerServiceImpl.class);

    static final String SYSTEM_ACTOR = "system";

    private final SeriesRepository seriesRepository;
    private final SeriesInstanceRepository instanceRepository;
    private final EntityStore entityStore;
    private final FieldMetadataSource metadataSource;
    private final RecurrenceExpander expander;
    private final TemplateValidator templateValidator;
    private final ConflictDetector conflictDetector;
    private final MeterRegistry meterRegistry;

    @Autowired
    public ExpansionWorkerServiceImpl(SeriesRepository seriesRepository,
                                      SeriesInstanceRepository instanceRepository,
                                      EntityStore entityStore,
                                      FieldMetadataSource metadataSource,
                                      RecurrenceExpander expander,
                                      TemplateValidator templateValidator,
                                      ConflictDetector conflictDetector,
                                      MeterRegistry meterRegistry) {
        this.seriesRepository = seriesRepository;
        this.instanceRepository = instanceRepository;
        this.entityStore = entityStore;
        this.metadataSource = metadataSource;
        this.expander = expander;
        this.templateValidator = templateValidator;
        this.conflictDetector = conflictDetector;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public int process(ExpansionJob job) {
        Optional<Series> found = seriesRepository.findById(job.getSeriesId());
        if (found.isEmpty()) {
            logger.warn("Expansion job {} refers to missing series {}, skipping", job.getJobId(), job.getSeriesId());
            meterRegistry.counter("recurring_expansion_total", "status", "missing_series").increment();
            return 0;
        }
        Series series = found.get();

        if (series.getStatus() != SeriesStatus.ACTIVE) {
            logger.info("Series {} is {}, not expanding", series.getSeriesId(), series.getStatus());
            meterRegistry.counter("recurring_expansion_total", "status", "skipped").increment();
            return 0;
        }

        List<SchemaDriftIssue> drift = templateValidator.checkDrift(
            series.getRecordType(), series.getTemplate(), series.getTimeField());
        if (!drift.isEmpty()) {
            logger.warn("Series {} template drifted from {} schema: {}", series.getSeriesId(), series.getRecordType(), drift);
            seriesRepository.updateStatus(series.getSeriesId(), SeriesStatus.NEEDS_ATTENTION);
            meterRegistry.counter("recurring_schema_drift_total").increment();
            meterRegistry.counter("recurring_expansion_total", "status", "drift").increment();
            return 0;
        }

        Instant windowEnd = clipToEffectiveUntil(series, job.getExpandUntil());
        List<TimeRange> occurrences = expander.expand(series.getRule(), series.getAnchor(), series.getDuration(),
            series.getTimezone(), job.getExpandFrom(), windowEnd);

        Set<LocalDate> tracked = instanceRepository.findBySeriesId(series.getSeriesId()).stream()
            .map(SeriesInstance::getOccurrenceDate)
            .collect(Collectors.toSet());

        Optional<RecordTypeMetadata> metadata = metadataSource.getMetadata(series.getRecordType());
        String scopeField = metadata.filter(RecordTypeMetadata::hasExclusiveScope)
            .map(RecordTypeMetadata::getExclusiveScopeField)
            .orElse(null);
        Object scopeValue = scopeField != null ? series.getTemplate().get(scopeField) : null;

        int created = 0;
        int skipped = 0;
        for (int i = 0; i < occurrences.size(); i++) {
            TimeRange range = occurrences.get(i);
            LocalDate date = expander.occurrenceDate(range, series.getTimezone());
            if (tracked.contains(date) || isBeforeEffectiveFrom(series, date)) {
                continue;
            }

            // The series index can lag behind a split; the instance item itself is read consistently
            Optional<SeriesInstance> existing = instanceRepository.findById(
                SeriesInstance.deriveInstanceId(series.lineageKey(), date));
            if (existing.isPresent()) {
                adoptFromEarlierVersion(series, existing.get());
                tracked.add(date);
                continue;
            }

            if (scopeValue != null) {
                ConflictCheckResult check = conflictDetector.check(i, series.getRecordType(), scopeField, scopeValue,
                    series.getTimeField(), range);
                if (check.isConflict()) {
                    recordConflictSkip(series, date, check);
                    tracked.add(date);
                    skipped++;
                    continue;
                }
            }

            if (materialize(series, date, range)) {
                created++;
            }
            tracked.add(date);
        }

        seriesRepository.advanceExpandedUntil(series.getSeriesId(), windowEnd);

        logger.info("Expanded series {} until {}: {} created, {} skipped for conflicts",
            series.getSeriesId(), windowEnd, created, skipped);
        meterRegistry.counter("recurring_expansion_total", "status", "success").increment();
        return created;
    }

    private boolean materialize(Series series, LocalDate date, TimeRange range) {
        Map<String, Object> fields = new LinkedHashMap<>(series.getTemplate());
        fields.remove(series.getTimeField());
        fields.remove(Series.DEFAULT_TIME_FIELD);

        EntityRecord record = entityStore.create(series.getRecordType(), fields, series.getTimeField(), range);

        SeriesInstance instance = SeriesInstance.forOccurrence(series, date);
        instance.linkRecord(record.getRecordId());
        if (instanceRepository.putIfAbsent(instance)) {
            return true;
        }

        // Another worker tracked this date first; its record is the one that counts
        logger.info("Occurrence {} of series {} already tracked, removing duplicate record {}",
            date, series.getSeriesId(), record.getRecordId());
        entityStore.delete(series.getRecordType(), record.getRecordId());
        instanceRepository.findById(instance.getInstanceId())
            .ifPresent(winner -> adoptFromEarlierVersion(series, winner));
        return false;
    }

    /**
     * An occurrence inside this version's range that is still tracked by an earlier version of the lineage
     * was left behind by a split. Move it onto this version.
     */
    private void adoptFromEarlierVersion(Series series, SeriesInstance instance) {
        if (series.getSeriesId().equals(instance.getSeriesId())) {
            return;
        }
        logger.info("Occurrence {} still tracked by series {}, moving it to series {}",
            instance.getOccurrenceDate(), instance.getSeriesId(), series.getSeriesId());
        instance.moveToSeries(series.getSeriesId());
        instanceRepository.update(instance);
    }

    private void recordConflictSkip(Series series, LocalDate date, ConflictCheckResult check) {
        SeriesInstance instance = SeriesInstance.forOccurrence(series, date);
        instance.markException(ExceptionType.CONFLICT_SKIPPED,
            "Conflicts with " + check.getConflictingLabel(), SYSTEM_ACTOR);
        instanceRepository.putIfAbsent(instance);
        logger.info("Skipped occurrence {} of series {}: overlaps record {}",
            date, series.getSeriesId(), check.getConflictingRecordId());
    }

    private Instant clipToEffectiveUntil(Series series, Instant until) {
        if (series.getEffectiveUntil() == null) {
            return until;
        }
        ZoneId zone = expander.resolveZone(series.getTimezone());
        Instant endOfLastDay = series.getEffectiveUntil().atTime(LocalTime.MAX).atZone(zone).toInstant();
        return endOfLastDay.isBefore(until) ? endOfLastDay : until;
    }

    private static boolean isBeforeEffectiveFrom(Series series, LocalDate date) {
        return series.getEffectiveFrom() != null && date.isBefore(series.getEffectiveFrom());
    }
}
