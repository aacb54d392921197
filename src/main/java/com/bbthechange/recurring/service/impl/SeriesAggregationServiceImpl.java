package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.dto.GroupSummaryDTO;
import com.bbthechange.recurring.dto.SeriesGroupDTO;
import com.bbthechange.recurring.dto.SeriesInstanceDTO;
import com.bbthechange.recurring.dto.SeriesVersionDTO;
import com.bbthechange.recurring.exception.ResourceNotFoundException;
import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesGroup;
import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.model.SeriesStatus;
import com.bbthechange.recurring.repository.SeriesGroupRepository;
import com.bbthechange.recurring.repository.SeriesInstanceRepository;
import com.bbthechange.recurring.repository.SeriesRepository;
import com.bbthechange.recurring.service.RecurrenceDescriber;
import com.bbthechange.recurring.service.SeriesAggregationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Implementation of SeriesAggregationService. Computes everything on read; nothing is cached.
 */
@Service
public class SeriesAggregationServiceImpl implements SeriesAggregationService {

    static final int MAX_LISTED_INSTANCES = 100;

    private final SeriesGroupRepository groupRepository;
    private final SeriesRepository seriesRepository;
    private final SeriesInstanceRepository instanceRepository;
    private final RecurrenceDescriber describer;

    @Autowired
    public SeriesAggregationServiceImpl(SeriesGroupRepository groupRepository,
                                        SeriesRepository seriesRepository,
                                        SeriesInstanceRepository instanceRepository,
                                        RecurrenceDescriber describer) {
        this.groupRepository = groupRepository;
        this.seriesRepository = seriesRepository;
        this.instanceRepository = instanceRepository;
        this.describer = describer;
    }

    @Override
    public GroupSummaryDTO getGroupSummary(String groupId) {
        SeriesGroup group = groupRepository.findById(groupId)
            .orElseThrow(() -> new ResourceNotFoundException("Series group not found: " + groupId));
        List<Series> versions = seriesRepository.findByGroupId(groupId);

        GroupSummaryDTO summary = new GroupSummaryDTO();
        summary.setGroup(new SeriesGroupDTO(group));
        summary.setVersionCount(versions.size());
        summary.setStatus(deriveStatus(versions));
        versions.stream()
            .map(Series::getEffectiveFrom)
            .filter(Objects::nonNull)
            .min(Comparator.naturalOrder())
            .ifPresent(summary::setStartedOn);

        Optional<Series> current = versions.stream()
            .filter(Series::isCurrent)
            .max(Comparator.comparing(Series::getVersionNumber, Comparator.nullsFirst(Comparator.naturalOrder())));
        current.ifPresent(series -> {
            summary.setCurrentVersion(new SeriesVersionDTO(series));
            summary.setRuleDescription(describer.describe(series.getRule()));
        });
        if (!versions.isEmpty()) {
            summary.setRecordType(current.orElse(versions.get(versions.size() - 1)).getRecordType());
        }

        List<SeriesInstance> instances = new ArrayList<>();
        for (Series series : versions) {
            instances.addAll(instanceRepository.findBySeriesId(series.getSeriesId()));
        }
        instances.sort(Comparator.comparing(SeriesInstance::getOccurrenceDate));

        summary.setActiveInstanceCount((int) instances.stream().filter(SeriesInstance::hasRecord).count());
        summary.setExceptionCount((int) instances.stream().filter(SeriesInstance::isExceptionInstance).count());
        summary.setInstances(instances.stream()
            .limit(MAX_LISTED_INSTANCES)
            .map(SeriesInstanceDTO::new)
            .toList());
        return summary;
    }

    /**
     * ACTIVE if some version is current and active, NEEDS_ATTENTION if some version needs attention, else ENDED.
     */
    static SeriesStatus deriveStatus(List<Series> versions) {
        boolean active = versions.stream()
            .anyMatch(s -> s.isCurrent() && s.getStatus() == SeriesStatus.ACTIVE);
        if (active) {
            return SeriesStatus.ACTIVE;
        }
        boolean needsAttention = versions.stream()
            .anyMatch(s -> s.getStatus() == SeriesStatus.NEEDS_ATTENTION);
        return needsAttention ? SeriesStatus.NEEDS_ATTENTION : SeriesStatus.ENDED;
    }
}
