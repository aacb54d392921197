package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.dto.GroupSummaryDTO;
import com.bbthechange.recurring.dto.SeriesInstanceDTO;
import com.bbthechange.recurring.exception.ResourceNotFoundException;
import com.bbthechange.recurring.model.*;
import com.bbthechange.recurring.repository.SeriesGroupRepository;
import com.bbthechange.recurring.repository.SeriesInstanceRepository;
import com.bbthechange.recurring.repository.SeriesRepository;
import com.bbthechange.recurring.service.RecurrenceDescriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.bbthechange.recurring.testutil.SeriesInstanceTestBuilder.anInstance;
import static com.bbthechange.recurring.testutil.SeriesTestBuilder.aSeries;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeriesAggregationServiceImplTest {

    @Mock
    private SeriesGroupRepository groupRepository;

    @Mock
    private SeriesRepository seriesRepository;

    @Mock
    private SeriesInstanceRepository instanceRepository;

    private SeriesAggregationServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new SeriesAggregationServiceImpl(groupRepository, seriesRepository, instanceRepository,
            new RecurrenceDescriber());
    }

    @Test
    void getGroupSummary_AggregatesAcrossVersions() {
        // Given
        SeriesGroup group = new SeriesGroup("Standups", "Team sync", "#445566", "user-1");
        Series closed = aSeries().inGroup(group.getGroupId())
            .withEffectiveUntil(LocalDate.of(2025, 3, 9)).build();
        Series current = aSeries().inGroup(group.getGroupId()).withVersionNumber(2)
            .withRule("FREQ=WEEKLY;BYDAY=TU").withEffectiveFrom(LocalDate.of(2025, 3, 10)).build();

        SeriesInstance first = anInstance().forSeries(closed.getSeriesId()).on(LocalDate.of(2025, 3, 3)).build();
        SeriesInstance cancelled = anInstance().forSeries(closed.getSeriesId()).on(LocalDate.of(2025, 3, 5))
            .withoutRecord().asException(ExceptionType.CANCELLED).build();
        SeriesInstance later = anInstance().forSeries(current.getSeriesId()).on(LocalDate.of(2025, 3, 11)).build();

        when(groupRepository.findById(group.getGroupId())).thenReturn(Optional.of(group));
        when(seriesRepository.findByGroupId(group.getGroupId())).thenReturn(List.of(closed, current));
        when(instanceRepository.findBySeriesId(closed.getSeriesId())).thenReturn(List.of(cancelled, first));
        when(instanceRepository.findBySeriesId(current.getSeriesId())).thenReturn(List.of(later));

        // When
        GroupSummaryDTO summary = service.getGroupSummary(group.getGroupId());

        // Then
        assertThat(summary.getGroup().getName()).isEqualTo("Standups");
        assertThat(summary.getVersionCount()).isEqualTo(2);
        assertThat(summary.getStartedOn()).isEqualTo(LocalDate.of(2025, 3, 3));
        assertThat(summary.getCurrentVersion().getSeriesId()).isEqualTo(current.getSeriesId());
        assertThat(summary.getRuleDescription()).isEqualTo("Weekly on Tuesday");
        assertThat(summary.getRecordType()).isEqualTo("booking");
        assertThat(summary.getActiveInstanceCount()).isEqualTo(2);
        assertThat(summary.getExceptionCount()).isEqualTo(1);
        assertThat(summary.getStatus()).isEqualTo(SeriesStatus.ACTIVE);
        assertThat(summary.getInstances()).extracting(SeriesInstanceDTO::getOccurrenceDate).containsExactly(
            LocalDate.of(2025, 3, 3), LocalDate.of(2025, 3, 5), LocalDate.of(2025, 3, 11));
    }

    @Test
    void getGroupSummary_WithUnknownGroup_ThrowsNotFound() {
        // Given
        String groupId = UUID.randomUUID().toString();
        when(groupRepository.findById(groupId)).thenReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> service.getGroupSummary(groupId)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void deriveStatus_WithCurrentActiveVersion_IsActive() {
        Series closed = aSeries().withEffectiveUntil(LocalDate.of(2025, 3, 9)).withStatus(SeriesStatus.NEEDS_ATTENTION).build();
        Series current = aSeries().build();

        assertThat(SeriesAggregationServiceImpl.deriveStatus(List.of(closed, current))).isEqualTo(SeriesStatus.ACTIVE);
    }

    @Test
    void deriveStatus_WithDriftedCurrentVersion_NeedsAttention() {
        Series current = aSeries().withStatus(SeriesStatus.NEEDS_ATTENTION).build();

        assertThat(SeriesAggregationServiceImpl.deriveStatus(List.of(current))).isEqualTo(SeriesStatus.NEEDS_ATTENTION);
    }

    @Test
    void deriveStatus_WithOnlyClosedVersions_IsEnded() {
        Series closed = aSeries().withEffectiveUntil(LocalDate.of(2025, 3, 9)).build();

        assertThat(SeriesAggregationServiceImpl.deriveStatus(List.of(closed))).isEqualTo(SeriesStatus.ENDED);
        assertThat(SeriesAggregationServiceImpl.deriveStatus(List.of())).isEqualTo(SeriesStatus.ENDED);
    }
}
