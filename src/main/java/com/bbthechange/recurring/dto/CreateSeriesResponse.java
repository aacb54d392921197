package com.bbthechange.recurring.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateSeriesResponse {
    private String groupId;
    private String seriesId;
}
