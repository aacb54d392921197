package com.bbthechange.recurring.dto;

import com.bbthechange.recurring.model.TimeRange;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
public class PreviewConflictsRequest {

    @NotBlank(message = "Record type is required")
    private String recordType;

    @NotBlank(message = "Scope field is required")
    private String scopeField;

    @NotNull(message = "Scope value is required")
    private Object scopeValue;

    private String timeField;

    @NotEmpty(message = "At least one range is required")
    @Size(max = 500, message = "At most 500 ranges can be checked at once")
    private List<TimeRange> ranges;
}
