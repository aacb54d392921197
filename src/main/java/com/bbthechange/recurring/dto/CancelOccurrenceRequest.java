package com.bbthechange.recurring.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class CancelOccurrenceRequest {

    @Size(max = 500, message = "Reason must be 500 characters or less")
    private String reason;
}
