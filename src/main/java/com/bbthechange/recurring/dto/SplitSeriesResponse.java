package com.bbthechange.recurring.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SplitSeriesResponse {
    private String originalSeriesId;
    private String newSeriesId;
    private String groupId;
    private LocalDate splitDate;
}
