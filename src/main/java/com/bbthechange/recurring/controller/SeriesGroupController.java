package com.bbthechange.recurring.controller;

import com.bbthechange.recurring.dto.EntitiesDeletedResponse;
import com.bbthechange.recurring.dto.GroupSummaryDTO;
import com.bbthechange.recurring.dto.SeriesGroupDTO;
import com.bbthechange.recurring.dto.SeriesInstanceDTO;
import com.bbthechange.recurring.dto.UpdateGroupInfoRequest;
import com.bbthechange.recurring.exception.ValidationException;
import com.bbthechange.recurring.model.InstanceFilter;
import com.bbthechange.recurring.service.InstanceTrackerService;
import com.bbthechange.recurring.service.SeriesAggregationService;
import com.bbthechange.recurring.service.SeriesManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/series-groups")
@Tag(name = "Series Groups", description = "Groups of series versions")
public class SeriesGroupController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(SeriesGroupController.class);

    private final SeriesAggregationService seriesAggregationService;
    private final SeriesManagementService seriesManagementService;
    private final InstanceTrackerService instanceTrackerService;

    @Autowired
    public SeriesGroupController(SeriesAggregationService seriesAggregationService,
                                 SeriesManagementService seriesManagementService,
                                 InstanceTrackerService instanceTrackerService) {
        this.seriesAggregationService = seriesAggregationService;
        this.seriesManagementService = seriesManagementService;
        this.instanceTrackerService = instanceTrackerService;
    }

    @GetMapping("/{groupId}")
    @Operation(summary = "Get a group with its versions, counts and status")
    public ResponseEntity<GroupSummaryDTO> getGroupSummary(@PathVariable String groupId,
                                                           HttpServletRequest httpRequest) {
        extractUserId(httpRequest);
        return ResponseEntity.ok(seriesAggregationService.getGroupSummary(groupId));
    }

    @PatchMapping("/{groupId}")
    @Operation(summary = "Update group name, description or color")
    public ResponseEntity<SeriesGroupDTO> updateGroupInfo(@PathVariable String groupId,
                                                          @Valid @RequestBody UpdateGroupInfoRequest request,
                                                          HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Updating group {} by user {}", groupId, userId);

        return ResponseEntity.ok(seriesManagementService.updateGroupInfo(groupId, request, userId));
    }

    @DeleteMapping("/{groupId}")
    @Operation(summary = "Delete a group with every version and occurrence")
    public ResponseEntity<EntitiesDeletedResponse> deleteGroup(@PathVariable String groupId,
                                                               HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Deleting group {} by user {}", groupId, userId);

        EntitiesDeletedResponse response = seriesManagementService.deleteGroup(groupId, userId);
        logger.info("Deleted group {} with {} records", groupId, response.getEntitiesDeleted());

        return ResponseEntity.ok(response);
    }

    @GetMapping("/{groupId}/instances")
    @Operation(summary = "List occurrences of a group, optionally filtered")
    public ResponseEntity<List<SeriesInstanceDTO>> listInstances(@PathVariable String groupId,
                                                                 @RequestParam(defaultValue = "all") String filter,
                                                                 HttpServletRequest httpRequest) {
        extractUserId(httpRequest);
        return ResponseEntity.ok(instanceTrackerService.listInstances(groupId, parseFilter(filter)));
    }

    private InstanceFilter parseFilter(String filter) {
        try {
            return InstanceFilter.valueOf(filter.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown filter: " + filter);
        }
    }
}
