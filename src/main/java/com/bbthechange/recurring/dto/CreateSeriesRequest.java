package com.bbthechange.recurring.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request DTO for creating a recurring series with its group.
 * recordType, rule, anchor and duration are checked by the service so that a missing one
 * is reported as MISSING_FIELD.
 */
@Data
@NoArgsConstructor
public class CreateSeriesRequest {

    @NotBlank(message = "Group name is required")
    @Size(max = 200, message = "Group name must be 200 characters or less")
    private String groupName;

    @Size(max = 2000, message = "Description must be 2000 characters or less")
    private String description;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Color must be a hex color like #1A2B3C")
    private String color;

    private String recordType;

    private Map<String, Object> template = new LinkedHashMap<>();

    private String rule;

    private Instant anchor;

    private Duration duration;

    private String timezone;

    private String timeField;

    private boolean expandNow = true;
}
