package com.bbthechange.recurring.service;

import com.bbthechange.recurring.dto.CancelOccurrenceResponse;
import com.bbthechange.recurring.dto.MembershipResponse;
import com.bbthechange.recurring.dto.RescheduleOccurrenceResponse;
import com.bbthechange.recurring.dto.SeriesInstanceDTO;
import com.bbthechange.recurring.model.InstanceFilter;
import com.bbthechange.recurring.model.TimeRange;

import java.util.List;

/**
 * Service interface for single occurrences and their exception state.
 * Records outside any series are accepted and handled directly on the entity store.
 */
public interface InstanceTrackerService {

    CancelOccurrenceResponse cancelOccurrence(String recordType, String recordId, String reason, String userId);

    RescheduleOccurrenceResponse rescheduleOccurrence(String recordType, String recordId, TimeRange newRange, String userId);

    MembershipResponse getMembership(String recordType, String recordId);

    /**
     * Instances of every version in a group, ordered by occurrence date.
     */
    List<SeriesInstanceDTO> listInstances(String groupId, InstanceFilter filter);
}
