package com.bbthechange.recurring.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a group's display info. Null fields are left as they are.
 */
@Data
@NoArgsConstructor
public class UpdateGroupInfoRequest {

    @Size(max = 200, message = "Name must be 200 characters or less")
    private String name;

    @Size(max = 2000, message = "Description must be 2000 characters or less")
    private String description;

    private String color;
}
