package com.bbthechange.recurring.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
public class UpdateTemplateRequest {

    @NotNull(message = "Template delta is required")
    private Map<String, Object> templateDelta;

    /** When true, records of exception instances keep their values. */
    private boolean skipExceptions = true;
}
