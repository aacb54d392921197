package com.bbthechange.recurring.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExpandResponse {
    private boolean queued;
    private String seriesId;
    private Instant expandUntil;
}
