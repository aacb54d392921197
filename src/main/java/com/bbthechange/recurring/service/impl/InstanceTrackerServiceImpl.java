package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.dto.CancelOccurrenceResponse;
import com.bbthechange.recurring.dto.MembershipResponse;
import com.bbthechange.recurring.dto.RescheduleOccurrenceResponse;
import com.bbthechange.recurring.dto.SeriesInstanceDTO;
import com.bbthechange.recurring.exception.ResourceNotFoundException;
import com.bbthechange.recurring.model.EntityRecord;
import com.bbthechange.recurring.model.ExceptionType;
import com.bbthechange.recurring.model.InstanceFilter;
import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesGroup;
import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.model.TimeRange;
import com.bbthechange.recurring.repository.SeriesGroupRepository;
import com.bbthechange.recurring.repository.SeriesInstanceRepository;
import com.bbthechange.recurring.repository.SeriesRepository;
import com.bbthechange.recurring.repository.SeriesTransactionRepository;
import com.bbthechange.recurring.service.InstanceTrackerService;
import com.bbthechange.recurring.store.EntityStore;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Implementation of InstanceTrackerService.
 */
@Service
public class InstanceTrackerServiceImpl implements InstanceTrackerService {

    private static final Logger logger = LoggerFactory.getLogger(InstanceTrackerServiceImpl.class);

    static final String DEFAULT_CANCEL_REASON = "Cancelled";

    private final SeriesInstanceRepository instanceRepository;
    private final SeriesRepository seriesRepository;
    private final SeriesGroupRepository groupRepository;
    private final SeriesTransactionRepository transactionRepository;
    private final EntityStore entityStore;
    private final OptimisticRetryService retryService;

    @Autowired
    public InstanceTrackerServiceImpl(SeriesInstanceRepository instanceRepository,
                                      SeriesRepository seriesRepository,
                                      SeriesGroupRepository groupRepository,
                                      SeriesTransactionRepository transactionRepository,
                                      EntityStore entityStore,
                                      OptimisticRetryService retryService) {
        this.instanceRepository = instanceRepository;
        this.seriesRepository = seriesRepository;
        this.groupRepository = groupRepository;
        this.transactionRepository = transactionRepository;
        this.entityStore = entityStore;
        this.retryService = retryService;
    }

    @Override
    public CancelOccurrenceResponse cancelOccurrence(String recordType, String recordId, String reason, String userId) {
        RecurringKeyFactory.validateRecordType(recordType);

        return retryService.executeWithRetry("cancelOccurrence", () -> {
            Optional<SeriesInstance> found = instanceRepository.findByRecord(recordType, recordId);
            if (found.isEmpty()) {
                if (entityStore.find(recordType, recordId).isPresent()) {
                    entityStore.delete(recordType, recordId);
                    logger.info("User {} deleted record {}/{} (not part of a series)", userId, recordType, recordId);
                } else {
                    logger.debug("Cancel of {}/{}: record already gone", recordType, recordId);
                }
                return new CancelOccurrenceResponse(true, null, null);
            }

            SeriesInstance instance = found.get();
            instance.unlinkRecord();
            instance.markException(ExceptionType.CANCELLED,
                reason == null || reason.isBlank() ? DEFAULT_CANCEL_REASON : reason.trim(), userId);

            transactionRepository.cancelInstance(instance, recordType, recordId);
            logger.info("User {} cancelled occurrence {} of series {}", userId, instance.getOccurrenceDate(), instance.getSeriesId());
            return new CancelOccurrenceResponse(true, instance.getSeriesId(), instance.getOccurrenceDate());
        });
    }

    @Override
    public RescheduleOccurrenceResponse rescheduleOccurrence(String recordType, String recordId, TimeRange newRange,
                                                             String userId) {
        RecurringKeyFactory.validateRecordType(recordType);

        return retryService.executeWithRetry("rescheduleOccurrence", () -> {
            EntityRecord record = entityStore.find(recordType, recordId)
                .orElseThrow(() -> new ResourceNotFoundException("Record not found: " + recordType + "/" + recordId));
            TimeRange priorRange = record.getTimeRange();

            Optional<SeriesInstance> found = instanceRepository.findByRecord(recordType, recordId);
            if (found.isEmpty()) {
                entityStore.setTimeRange(recordType, recordId, newRange);
                logger.info("User {} moved record {}/{} to {} (not part of a series)", userId, recordType, recordId, newRange);
                return new RescheduleOccurrenceResponse(true, priorRange, null, newRange);
            }

            SeriesInstance instance = found.get();
            // Only the first reschedule captures the generated range
            if (instance.getExceptionType() != ExceptionType.RESCHEDULED || instance.getOriginalTimeRange() == null) {
                instance.setOriginalTimeRange(priorRange);
            }
            instance.markException(ExceptionType.RESCHEDULED, instance.getExceptionReason(), userId);

            transactionRepository.rescheduleInstance(instance, newRange);
            logger.info("User {} rescheduled occurrence {} of series {} from {} to {}",
                userId, instance.getOccurrenceDate(), instance.getSeriesId(), priorRange, newRange);
            return new RescheduleOccurrenceResponse(true, priorRange, instance.getOriginalTimeRange(), newRange);
        });
    }

    @Override
    public MembershipResponse getMembership(String recordType, String recordId) {
        RecurringKeyFactory.validateRecordType(recordType);

        Optional<SeriesInstance> found = instanceRepository.findByRecord(recordType, recordId);
        if (found.isEmpty()) {
            return MembershipResponse.notMember();
        }
        SeriesInstance instance = found.get();

        MembershipResponse response = new MembershipResponse();
        response.setMember(true);
        response.setSeriesId(instance.getSeriesId());
        response.setOccurrenceDate(instance.getOccurrenceDate());
        response.setException(instance.isExceptionInstance());
        response.setExceptionType(instance.getExceptionType());

        Optional<Series> series = seriesRepository.findById(instance.getSeriesId());
        if (series.isPresent()) {
            response.setOriginalTemplate(series.get().getTemplate());
            String groupId = series.get().getGroupId();
            response.setGroupId(groupId);
            if (groupId != null) {
                Optional<SeriesGroup> group = groupRepository.findById(groupId);
                group.ifPresent(g -> {
                    response.setGroupName(g.getName());
                    response.setGroupColor(g.getColor());
                });
            }
        } else {
            logger.warn("Instance {} refers to missing series {}", instance.getInstanceId(), instance.getSeriesId());
        }
        return response;
    }

    @Override
    public List<SeriesInstanceDTO> listInstances(String groupId, InstanceFilter filter) {
        groupRepository.findById(groupId)
            .orElseThrow(() -> new ResourceNotFoundException("Series group not found: " + groupId));
        InstanceFilter effectiveFilter = filter != null ? filter : InstanceFilter.ALL;

        List<SeriesInstance> instances = new ArrayList<>();
        for (Series series : seriesRepository.findByGroupId(groupId)) {
            LocalDate today = LocalDate.now(series.zoneId());
            for (SeriesInstance instance : instanceRepository.findBySeriesId(series.getSeriesId())) {
                if (matches(instance, effectiveFilter, today)) {
                    instances.add(instance);
                }
            }
        }

        instances.sort(Comparator.comparing(SeriesInstance::getOccurrenceDate));
        return instances.stream().map(SeriesInstanceDTO::new).toList();
    }

    private static boolean matches(SeriesInstance instance, InstanceFilter filter, LocalDate today) {
        return switch (filter) {
            case ALL -> true;
            case UPCOMING -> !instance.getOccurrenceDate().isBefore(today);
            case PAST -> instance.getOccurrenceDate().isBefore(today);
            case EXCEPTIONS -> instance.isExceptionInstance();
        };
    }
}
