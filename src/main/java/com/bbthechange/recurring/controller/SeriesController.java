package com.bbthechange.recurring.controller;

import com.bbthechange.recurring.dto.*;
import com.bbthechange.recurring.model.ConflictCheckResult;
import com.bbthechange.recurring.model.SchemaDriftIssue;
import com.bbthechange.recurring.service.RecurrenceDescriber;
import com.bbthechange.recurring.service.RecurrenceValidator;
import com.bbthechange.recurring.service.SeriesManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;

/**
 * REST controller for recurring series.
 * Handles creation, splitting, template and schedule changes, expansion and deletion.
 */
@RestController
@RequestMapping("/series")
@Tag(name = "Series", description = "Recurring series lifecycle")
public class SeriesController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(SeriesController.class);

    private final SeriesManagementService seriesManagementService;
    private final RecurrenceValidator recurrenceValidator;
    private final RecurrenceDescriber recurrenceDescriber;

    @Autowired
    public SeriesController(SeriesManagementService seriesManagementService,
                            RecurrenceValidator recurrenceValidator,
                            RecurrenceDescriber recurrenceDescriber) {
        this.seriesManagementService = seriesManagementService;
        this.recurrenceValidator = recurrenceValidator;
        this.recurrenceDescriber = recurrenceDescriber;
    }

    @PostMapping
    @Operation(summary = "Create a series group with its first version")
    public ResponseEntity<CreateSeriesResponse> createSeries(@Valid @RequestBody CreateSeriesRequest request,
                                                             HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Creating {} series '{}' by user {}", request.getRecordType(), request.getGroupName(), userId);

        CreateSeriesResponse response = seriesManagementService.createSeries(request, userId);
        logger.info("Created series {} in group {}", response.getSeriesId(), response.getGroupId());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/conflicts/preview")
    @Operation(summary = "Check candidate time ranges against existing records")
    public ResponseEntity<List<ConflictCheckResult>> previewConflicts(@Valid @RequestBody PreviewConflictsRequest request,
                                                                      HttpServletRequest httpRequest) {
        extractUserId(httpRequest);

        List<ConflictCheckResult> results = seriesManagementService.previewConflicts(request);
        logger.debug("Checked {} ranges for {} conflicts", results.size(), request.getRecordType());

        return ResponseEntity.ok(results);
    }

    @PostMapping("/{seriesId}/expand")
    @Operation(summary = "Queue materialization of occurrences up to a date")
    public ResponseEntity<ExpandResponse> expandInstances(@PathVariable String seriesId,
                                                          @RequestBody(required = false) ExpandRequest request,
                                                          HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Expansion of series {} requested by user {}", seriesId, userId);

        ExpandResponse response = seriesManagementService.expandInstances(seriesId,
            request != null ? request.getUntil() : null);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @PostMapping("/{seriesId}/split")
    @Operation(summary = "End a series before a date and continue it as a new version")
    public ResponseEntity<SplitSeriesResponse> splitSeries(@PathVariable String seriesId,
                                                           @Valid @RequestBody SplitSeriesRequest request,
                                                           HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Splitting series {} at {} by user {}", seriesId, request.getSplitDate(), userId);

        SplitSeriesResponse response = seriesManagementService.splitSeries(seriesId, request, userId);
        logger.info("Split series {} into {}", seriesId, response.getNewSeriesId());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping("/{seriesId}/template")
    @Operation(summary = "Update the template and push changed fields to occurrences")
    public ResponseEntity<UpdateTemplateResponse> updateTemplate(@PathVariable String seriesId,
                                                                 @Valid @RequestBody UpdateTemplateRequest request,
                                                                 HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Updating template of series {} by user {}", seriesId, userId);

        UpdateTemplateResponse response = seriesManagementService.updateTemplate(seriesId, request, userId);
        logger.info("Template update of series {} touched {} occurrences", seriesId, response.getInstancesUpdated());

        return ResponseEntity.ok(response);
    }

    @PutMapping("/{seriesId}/schedule")
    @Operation(summary = "Replace the rule, anchor and duration of a series")
    public ResponseEntity<UpdateScheduleResponse> updateSchedule(@PathVariable String seriesId,
                                                                 @Valid @RequestBody UpdateScheduleRequest request,
                                                                 HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Replacing schedule of series {} by user {}", seriesId, userId);

        UpdateScheduleResponse response = seriesManagementService.updateSchedule(seriesId, request, userId);
        logger.info("Schedule replacement of series {} deleted {} records", seriesId, response.getEntitiesDeleted());

        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{seriesId}")
    @Operation(summary = "Delete a series with its occurrences")
    public ResponseEntity<EntitiesDeletedResponse> deleteSeries(@PathVariable String seriesId,
                                                                HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Deleting series {} by user {}", seriesId, userId);

        return ResponseEntity.ok(seriesManagementService.deleteSeries(seriesId, userId));
    }

    @GetMapping("/{seriesId}/drift")
    @Operation(summary = "Compare a series template with the current record schema")
    public ResponseEntity<List<SchemaDriftIssue>> checkDrift(@PathVariable String seriesId,
                                                             HttpServletRequest httpRequest) {
        extractUserId(httpRequest);
        return ResponseEntity.ok(seriesManagementService.checkDrift(seriesId));
    }

    @GetMapping("/describe")
    @Operation(summary = "Describe a recurrence rule in plain words")
    public ResponseEntity<DescribeRuleResponse> describeRule(@RequestParam String rule,
                                                             HttpServletRequest httpRequest) {
        extractUserId(httpRequest);
        recurrenceValidator.validate(rule);
        return ResponseEntity.ok(new DescribeRuleResponse(rule, recurrenceDescriber.describe(rule)));
    }
}
