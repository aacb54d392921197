package com.bbthechange.recurring.service;

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
import com.bbthechange.recurring.model.ConflictCheckResult;
import com.bbthechange.recurring.model.SchemaDriftIssue;

import java.time.Instant;
import java.util.List;

/**
 * Service interface for the lifecycle of series and series groups.
 * Every mutating operation is applied atomically; none leaves a partially written state behind.
 */
public interface SeriesManagementService {

    /**
     * Create a group with its first series version and optionally queue expansion.
     */
    CreateSeriesResponse createSeries(CreateSeriesRequest request, String userId);

    /**
     * Close a series the day before {@code splitDate} and continue it as a new version.
     */
    SplitSeriesResponse splitSeries(String seriesId, SplitSeriesRequest request, String userId);

    /**
     * Merge a template delta and push the changed fields to the series' records.
     */
    UpdateTemplateResponse updateTemplate(String seriesId, UpdateTemplateRequest request, String userId);

    /**
     * Replace rule, anchor and duration. Non-exception occurrences are deleted and regenerated from now.
     */
    UpdateScheduleResponse updateSchedule(String seriesId, UpdateScheduleRequest request, String userId);

    EntitiesDeletedResponse deleteSeries(String seriesId, String userId);

    EntitiesDeletedResponse deleteGroup(String groupId, String userId);

    SeriesGroupDTO updateGroupInfo(String groupId, UpdateGroupInfoRequest request, String userId);

    /**
     * Queue expansion of a series up to {@code until}, or the configured horizon when null.
     */
    ExpandResponse expandInstances(String seriesId, Instant until);

    List<ConflictCheckResult> previewConflicts(PreviewConflictsRequest request);

    List<SchemaDriftIssue> checkDrift(String seriesId);
}
