package com.bbthechange.recurring.dto;

import com.bbthechange.recurring.model.SeriesGroup;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class SeriesGroupDTO {

    private String groupId;
    private String name;
    private String description;
    private String color;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    public SeriesGroupDTO(SeriesGroup group) {
        this.groupId = group.getGroupId();
        this.name = group.getName();
        this.description = group.getDescription();
        this.color = group.getColor();
        this.createdBy = group.getCreatedBy();
        this.createdAt = group.getCreatedAt();
        this.updatedAt = group.getUpdatedAt();
    }
}
