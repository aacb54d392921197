package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.config.RecurringProperties;
import com.bbthechange.recurring.dto.CreateSeriesRequest;
import com.bbthechange.recurring.dto.CreateSeriesResponse;
import com.bbthechange.recurring.dto.EntitiesDeletedResponse;
import com.bbthechange.recurring.dto.ExpandResponse;
import com.bbthechange.recurring.dto.PreviewConflictsRequest;
import com.bbthechange.recurring.dto.SeriesGroupDTO;
import com.bbthechange.recurring.dto.SplitSeriesRequest;
import com.bbthechange.recurring.dto.SplitSeriesResponse;
import com.bbthechange.recurring.dto.UpdateGroupInfoRequest;
import com.bbthechange.recurring.dto.UpdateScheduleRequest;
import com.bbthechange.recurring.dto.UpdateScheduleResponse;
import com.bbthechange.recurring.dto.UpdateTemplateRequest;
import com.bbthechange.recurring.dto.UpdateTemplateResponse;
import com.bbthechange.recurring.exception.MissingFieldException;
import com.bbthechange.recurring.exception.ResourceNotFoundException;
import com.bbthechange.recurring.exception.ValidationException;
import com.bbthechange.recurring.model.ConflictCheckResult;
import com.bbthechange.recurring.model.ExpansionJob;
import com.bbthechange.recurring.model.SchemaDriftIssue;
import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesGroup;
import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.model.SeriesStatus;
import com.bbthechange.recurring.repository.SeriesGroupRepository;
import com.bbthechange.recurring.repository.SeriesInstanceRepository;
import com.bbthechange.recurring.repository.SeriesRepository;
import com.bbthechange.recurring.repository.SeriesTransactionRepository;
import com.bbthechange.recurring.service.ConflictDetector;
import com.bbthechange.recurring.service.ExpansionJobSink;
import com.bbthechange.recurring.service.RecurrenceValidator;
import com.bbthechange.recurring.service.SeriesManagementService;
import com.bbthechange.recurring.service.TemplateValidator;
import com.bbthechange.recurring.util.RecurrenceRules;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Implementation of SeriesManagementService.
 * Multi-item writes go through {@link SeriesTransactionRepository}; read-modify-write operations are
 * wrapped in {@link OptimisticRetryService} and re-read their inputs on every attempt.
 */
@Service
public class SeriesManagementServiceImpl implements SeriesManagementService {

    private static final Logger logger = LoggerFactory.getLogger(SeriesManagementServiceImpl.class);

    private static final Pattern COLOR_PATTERN = Pattern.compile("^#[0-9A-Fa-f]{6}$");
    static final String DEFAULT_GROUP_NAME = "Recurring Schedule";

    private final SeriesRepository seriesRepository;
    private final SeriesGroupRepository groupRepository;
    private final SeriesInstanceRepository instanceRepository;
    private final SeriesTransactionRepository transactionRepository;
    private final RecurrenceValidator recurrenceValidator;
    private final TemplateValidator templateValidator;
    private final ConflictDetector conflictDetector;
    private final ExpansionJobSink jobSink;
    private final OptimisticRetryService retryService;
    private final RecurringProperties properties;

    @Autowired
    public SeriesManagementServiceImpl(SeriesRepository seriesRepository,
                                       SeriesGroupRepository groupRepository,
                                       SeriesInstanceRepository instanceRepository,
                                       SeriesTransactionRepository transactionRepository,
                                       RecurrenceValidator recurrenceValidator,
                                       TemplateValidator templateValidator,
                                       ConflictDetector conflictDetector,
                                       ExpansionJobSink jobSink,
                                       OptimisticRetryService retryService,
                                       RecurringProperties properties) {
        this.seriesRepository = seriesRepository;
        this.groupRepository = groupRepository;
        this.instanceRepository = instanceRepository;
        this.transactionRepository = transactionRepository;
        this.recurrenceValidator = recurrenceValidator;
        this.templateValidator = templateValidator;
        this.conflictDetector = conflictDetector;
        this.jobSink = jobSink;
        this.retryService = retryService;
        this.properties = properties;
    }

    @Override
    public CreateSeriesResponse createSeries(CreateSeriesRequest request, String userId) {
        requireField(request.getRecordType(), "recordType");
        requireField(request.getRule(), "rule");
        requireField(request.getAnchor(), "anchor");
        requireField(request.getDuration(), "duration");

        RecurringKeyFactory.validateRecordType(request.getRecordType());
        recurrenceValidator.validate(request.getRule());
        requirePositive(request.getDuration());
        validateTimezone(request.getTimezone());
        validateColor(request.getColor());

        String timeField = isBlank(request.getTimeField()) ? Series.DEFAULT_TIME_FIELD : request.getTimeField();
        Map<String, Object> template = request.getTemplate() != null
            ? new LinkedHashMap<>(request.getTemplate()) : new LinkedHashMap<>();
        templateValidator.validate(request.getRecordType(), template, timeField);

        String name = isBlank(request.getGroupName()) ? DEFAULT_GROUP_NAME : request.getGroupName().trim();
        SeriesGroup group = new SeriesGroup(name, request.getDescription(), request.getColor(), userId);

        Series series = new Series(group.getGroupId(), 1);
        series.setRecordType(request.getRecordType());
        series.setTemplate(template);
        series.setRule(RecurrenceRules.normalize(request.getRule()));
        series.setAnchor(request.getAnchor());
        series.setDuration(request.getDuration());
        series.setTimezone(request.getTimezone());
        series.setTimeField(timeField);
        series.setEffectiveFrom(series.getAnchor().atZone(series.zoneId()).toLocalDate());
        series.setCreatedBy(userId);

        transactionRepository.createSeries(group, series);
        logger.info("User {} created series {} in group {} ({} on {})",
            userId, series.getSeriesId(), group.getGroupId(), series.getRule(), series.getRecordType());

        if (request.isExpandNow()) {
            jobSink.enqueue(ExpansionJob.forSeries(series.getSeriesId(), horizonEnd()));
        }
        return new CreateSeriesResponse(group.getGroupId(), series.getSeriesId());
    }

    @Override
    public SplitSeriesResponse splitSeries(String seriesId, SplitSeriesRequest request, String userId) {
        requireField(request.getSplitDate(), "splitDate");
        requireField(request.getNewAnchor(), "newAnchor");
        if (request.getNewDuration() != null) {
            requirePositive(request.getNewDuration());
        }

        SplitSeriesResponse response = retryService.executeWithRetry("splitSeries",
            () -> split(seriesId, request, userId));

        jobSink.enqueue(ExpansionJob.forSeries(response.getNewSeriesId(), horizonEnd()));
        return response;
    }

    private SplitSeriesResponse split(String seriesId, SplitSeriesRequest request, String userId) {
        Series original = findSeries(seriesId);
        LocalDate splitDate = request.getSplitDate();

        if (!original.isCurrent()) {
            Optional<Series> successor = findSuccessor(original, splitDate);
            if (successor.isEmpty()) {
                throw new ValidationException("Series " + seriesId + " has already been closed and cannot be split");
            }
            return finishSplit(original, successor.get(), splitDate, userId);
        }
        if (original.getEffectiveFrom() != null && !splitDate.isAfter(original.getEffectiveFrom())) {
            throw new ValidationException("Split date must be after the series start date " + original.getEffectiveFrom());
        }

        Map<String, Object> template = new LinkedHashMap<>(original.getTemplate());
        if (request.getTemplateDelta() != null) {
            template.putAll(request.getTemplateDelta());
        }
        templateValidator.validate(original.getRecordType(), template, original.getTimeField());

        SeriesGroup newGroup = null;
        int nextVersion;
        if (original.getGroupId() == null) {
            newGroup = new SeriesGroup(groupNameFrom(original.getTemplate()), null, null,
                original.getCreatedBy() != null ? original.getCreatedBy() : userId);
            original.assignToGroup(newGroup.getGroupId(), 1);
            nextVersion = 2;
        } else {
            nextVersion = seriesRepository.findByGroupId(original.getGroupId()).stream()
                .map(Series::getVersionNumber)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .max()
                .orElse(0) + 1;
        }

        String rule = original.getRule();
        LocalDate lastDay = splitDate.minusDays(1);
        original.setEffectiveUntil(lastDay);
        original.setRule(RecurrenceRules.withUntil(rule, lastDay));

        Series next = new Series(Series.deriveSuccessorId(seriesId, splitDate), original.getGroupId(), nextVersion);
        next.continueLineage(original);
        next.setRecordType(original.getRecordType());
        next.setTemplate(template);
        next.setRule(rule);
        next.setAnchor(request.getNewAnchor());
        next.setDuration(request.getNewDuration() != null ? request.getNewDuration() : original.getDuration());
        next.setTimezone(original.getTimezone());
        next.setTimeField(original.getTimeField());
        next.setStatus(SeriesStatus.ACTIVE);
        next.setEffectiveFrom(splitDate);
        next.setCreatedBy(userId);

        List<SeriesInstance> future = instancesFrom(seriesId, splitDate);

        transactionRepository.splitSeries(original, newGroup, next, future);
        logger.info("User {} split series {} at {} into version {} ({})",
            userId, seriesId, splitDate, nextVersion, next.getSeriesId());

        return new SplitSeriesResponse(seriesId, next.getSeriesId(), original.getGroupId(), splitDate);
    }

    /**
     * The version a split at the given date created, when the original was closed by exactly that split.
     */
    private Optional<Series> findSuccessor(Series original, LocalDate splitDate) {
        if (!splitDate.minusDays(1).equals(original.getEffectiveUntil())) {
            return Optional.empty();
        }
        return seriesRepository.findById(Series.deriveSuccessorId(original.getSeriesId(), splitDate));
    }

    private SplitSeriesResponse finishSplit(Series original, Series successor, LocalDate splitDate, String userId) {
        List<SeriesInstance> remaining = instancesFrom(original.getSeriesId(), splitDate);
        transactionRepository.repointInstances(successor.getSeriesId(), remaining);
        logger.info("User {} completed split of series {} at {}: {} instances moved to {}",
            userId, original.getSeriesId(), splitDate, remaining.size(), successor.getSeriesId());
        return new SplitSeriesResponse(original.getSeriesId(), successor.getSeriesId(), successor.getGroupId(), splitDate);
    }

    private List<SeriesInstance> instancesFrom(String seriesId, LocalDate date) {
        return instanceRepository.findBySeriesId(seriesId).stream()
            .filter(instance -> !instance.getOccurrenceDate().isBefore(date))
            .collect(Collectors.toList());
    }

    @Override
    public UpdateTemplateResponse updateTemplate(String seriesId, UpdateTemplateRequest request, String userId) {
        requireField(request.getTemplateDelta(), "templateDelta");

        return retryService.executeWithRetry("updateTemplate", () -> {
            Series series = findSeries(seriesId);

            Map<String, Object> merged = new LinkedHashMap<>(series.getTemplate());
            merged.putAll(request.getTemplateDelta());
            templateValidator.validate(series.getRecordType(), merged, series.getTimeField());

            // Every merged key is pushed, not only the changed ones
            Map<String, Object> pushed = new LinkedHashMap<>(merged);
            pushed.remove(series.getTimeField());
            pushed.remove(Series.DEFAULT_TIME_FIELD);

            List<SeriesInstance> targets = pushed.isEmpty() ? List.of()
                : instanceRepository.findBySeriesId(seriesId).stream()
                    .filter(SeriesInstance::hasRecord)
                    .filter(instance -> !request.isSkipExceptions() || !instance.isExceptionInstance())
                    .collect(Collectors.toList());

            series.setTemplate(merged);
            series.setTemplateUpdatedAt(Instant.now());
            series.setTemplateUpdatedBy(userId);

            transactionRepository.updateTemplate(series, pushed, targets);
            logger.info("User {} updated template of series {}: fields {} pushed to {} records",
                userId, seriesId, pushed.keySet(), targets.size());
            return new UpdateTemplateResponse(targets.size());
        });
    }

    @Override
    public UpdateScheduleResponse updateSchedule(String seriesId, UpdateScheduleRequest request, String userId) {
        requireField(request.getAnchor(), "anchor");
        requireField(request.getDuration(), "duration");
        requireField(request.getRule(), "rule");
        recurrenceValidator.validate(request.getRule());
        requirePositive(request.getDuration());

        int deleted = retryService.executeWithRetry("updateSchedule", () -> {
            Series series = findSeries(seriesId);

            List<SeriesInstance> toDelete = instanceRepository.findBySeriesId(seriesId).stream()
                .filter(instance -> !instance.isExceptionInstance())
                .collect(Collectors.toList());
            int records = (int) toDelete.stream().filter(SeriesInstance::hasRecord).count();

            series.setAnchor(request.getAnchor());
            series.setDuration(request.getDuration());
            series.setRule(RecurrenceRules.normalize(request.getRule()));
            series.setExpandedUntil(null);
            series.setEffectiveFrom(request.getAnchor().atZone(series.zoneId()).toLocalDate());
            series.setStatus(SeriesStatus.ACTIVE);

            transactionRepository.replaceSchedule(series, toDelete);
            logger.info("User {} replaced schedule of series {}: {} instances and {} records removed",
                userId, seriesId, toDelete.size(), records);
            return records;
        });

        Instant now = Instant.now();
        Instant expandUntil = now.plus(properties.getHorizon());
        jobSink.enqueue(ExpansionJob.forSeries(seriesId, now, expandUntil));
        return new UpdateScheduleResponse(deleted, expandUntil);
    }

    @Override
    public EntitiesDeletedResponse deleteSeries(String seriesId, String userId) {
        int deleted = retryService.executeWithRetry("deleteSeries", () -> {
            Series series = findSeries(seriesId);
            String groupToDelete = null;
            if (series.getGroupId() != null) {
                boolean lastVersion = seriesRepository.findByGroupId(series.getGroupId()).stream()
                    .allMatch(s -> s.getSeriesId().equals(seriesId));
                groupToDelete = lastVersion ? series.getGroupId() : null;
            }
            return delete(series, groupToDelete);
        });
        logger.info("User {} deleted series {} ({} records)", userId, seriesId, deleted);
        return new EntitiesDeletedResponse(deleted);
    }

    @Override
    public EntitiesDeletedResponse deleteGroup(String groupId, String userId) {
        int deleted = retryService.executeWithRetry("deleteGroup", () -> {
            findGroup(groupId);
            List<Series> versions = seriesRepository.findByGroupId(groupId);
            if (versions.isEmpty()) {
                transactionRepository.deleteGroup(groupId);
                return 0;
            }
            int total = 0;
            for (int i = 0; i < versions.size(); i++) {
                boolean last = i == versions.size() - 1;
                total += delete(versions.get(i), last ? groupId : null);
            }
            return total;
        });
        logger.info("User {} deleted series group {} ({} records)", userId, groupId, deleted);
        return new EntitiesDeletedResponse(deleted);
    }

    private int delete(Series series, String groupToDelete) {
        List<SeriesInstance> instances = instanceRepository.findBySeriesId(series.getSeriesId());
        int records = (int) instances.stream().filter(SeriesInstance::hasRecord).count();
        transactionRepository.deleteSeries(series, instances, groupToDelete);
        return records;
    }

    @Override
    public SeriesGroupDTO updateGroupInfo(String groupId, UpdateGroupInfoRequest request, String userId) {
        validateColor(request.getColor());

        SeriesGroup saved = retryService.executeWithRetry("updateGroupInfo", () -> {
            SeriesGroup group = findGroup(groupId);
            if (!isBlank(request.getName())) {
                group.setName(request.getName().trim());
            }
            if (request.getDescription() != null) {
                group.setDescription(request.getDescription());
            }
            if (request.getColor() != null) {
                group.setColor(request.getColor());
            }
            group.touch();
            return groupRepository.update(group);
        });
        logger.info("User {} updated info of series group {}", userId, groupId);
        return new SeriesGroupDTO(saved);
    }

    @Override
    public ExpandResponse expandInstances(String seriesId, Instant until) {
        findSeries(seriesId);
        Instant expandUntil = until != null ? until : horizonEnd();
        jobSink.enqueue(ExpansionJob.forSeries(seriesId, expandUntil));
        logger.info("Queued expansion of series {} until {}", seriesId, expandUntil);
        return new ExpandResponse(true, seriesId, expandUntil);
    }

    @Override
    public List<ConflictCheckResult> previewConflicts(PreviewConflictsRequest request) {
        RecurringKeyFactory.validateRecordType(request.getRecordType());
        String timeField = isBlank(request.getTimeField()) ? Series.DEFAULT_TIME_FIELD : request.getTimeField();
        return conflictDetector.detect(request.getRecordType(), request.getScopeField(), request.getScopeValue(),
            timeField, request.getRanges());
    }

    @Override
    public List<SchemaDriftIssue> checkDrift(String seriesId) {
        Series series = findSeries(seriesId);
        return templateValidator.checkDrift(series.getRecordType(), series.getTemplate(), series.getTimeField());
    }

    private Series findSeries(String seriesId) {
        return seriesRepository.findById(seriesId)
            .orElseThrow(() -> new ResourceNotFoundException("Series not found: " + seriesId));
    }

    private SeriesGroup findGroup(String groupId) {
        return groupRepository.findById(groupId)
            .orElseThrow(() -> new ResourceNotFoundException("Series group not found: " + groupId));
    }

    private Instant horizonEnd() {
        return Instant.now().plus(properties.getHorizon());
    }

    /**
     * Name for a group created when a standalone series is split for the first time.
     */
    static String groupNameFrom(Map<String, Object> template) {
        for (String key : List.of("purpose", "name")) {
            Object value = template.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString().trim();
            }
        }
        return DEFAULT_GROUP_NAME;
    }

    private static void requireField(Object value, String field) {
        if (value == null || (value instanceof String s && s.isBlank())) {
            throw new MissingFieldException(field);
        }
    }

    private static void requirePositive(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            throw new ValidationException("Duration must be positive");
        }
    }

    private static void validateTimezone(String timezone) {
        if (isBlank(timezone)) {
            return;
        }
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid timezone: " + timezone);
        }
    }

    private static void validateColor(String color) {
        if (color != null && !COLOR_PATTERN.matcher(color).matches()) {
            throw new ValidationException("Color must be a hex color like #1A2B3C");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
