package com.bbthechange.recurring.service;

import com.bbthechange.recurring.dto.GroupSummaryDTO;

/**
 * Read-only summaries of series groups.
 */
public interface SeriesAggregationService {

    GroupSummaryDTO getGroupSummary(String groupId);
}
