package com.bbthechange.recurring.dto;

import com.bbthechange.recurring.model.SeriesStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a series group across all of its versions.
 */
@Data
@NoArgsConstructor
public class GroupSummaryDTO {

    private SeriesGroupDTO group;
    private String recordType;
    private int versionCount;
    private LocalDate startedOn;
    private SeriesVersionDTO currentVersion;
    private String ruleDescription;
    private int activeInstanceCount;
    private int exceptionCount;
    private SeriesStatus status;
    private List<SeriesInstanceDTO> instances = new ArrayList<>();
}
