package com.bbthechange.recurring.controller;

import com.bbthechange.recurring.dto.CancelOccurrenceRequest;
import com.bbthechange.recurring.dto.CancelOccurrenceResponse;
import com.bbthechange.recurring.dto.MembershipResponse;
import com.bbthechange.recurring.dto.RescheduleOccurrenceRequest;
import com.bbthechange.recurring.dto.RescheduleOccurrenceResponse;
import com.bbthechange.recurring.service.InstanceTrackerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

/**
 * Occurrence-level operations addressed by the record rather than the series.
 * Records that do not belong to any series are accepted.
 */
@RestController
@RequestMapping("/records/{recordType}/{recordId}")
@Tag(name = "Occurrences", description = "Cancel, reschedule and inspect single occurrences")
public class RecordOccurrenceController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(RecordOccurrenceController.class);

    private final InstanceTrackerService instanceTrackerService;

    @Autowired
    public RecordOccurrenceController(InstanceTrackerService instanceTrackerService) {
        this.instanceTrackerService = instanceTrackerService;
    }

    @PostMapping("/cancel")
    @Operation(summary = "Cancel one occurrence")
    public ResponseEntity<CancelOccurrenceResponse> cancelOccurrence(@PathVariable String recordType,
                                                                     @PathVariable String recordId,
                                                                     @Valid @RequestBody(required = false) CancelOccurrenceRequest request,
                                                                     HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Cancelling {} {} by user {}", recordType, recordId, userId);

        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(instanceTrackerService.cancelOccurrence(recordType, recordId, reason, userId));
    }

    @PostMapping("/reschedule")
    @Operation(summary = "Move one occurrence to a new time range")
    public ResponseEntity<RescheduleOccurrenceResponse> rescheduleOccurrence(@PathVariable String recordType,
                                                                             @PathVariable String recordId,
                                                                             @Valid @RequestBody RescheduleOccurrenceRequest request,
                                                                             HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Rescheduling {} {} to {} by user {}", recordType, recordId, request.getNewRange(), userId);

        return ResponseEntity.ok(instanceTrackerService.rescheduleOccurrence(recordType, recordId, request.getNewRange(), userId));
    }

    @GetMapping("/membership")
    @Operation(summary = "Tell whether a record is an occurrence of a series")
    public ResponseEntity<MembershipResponse> getMembership(@PathVariable String recordType,
                                                            @PathVariable String recordId,
                                                            HttpServletRequest httpRequest) {
        extractUserId(httpRequest);
        return ResponseEntity.ok(instanceTrackerService.getMembership(recordType, recordId));
    }
}
