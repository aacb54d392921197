package com.bbthechange.recurring.model;

import com.bbthechange.recurring.util.RecurringKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.UUID;

/**
 * The user-visible identity of one recurring schedule, spanning every version created by splits.
 *
 * Key Pattern: PK = GROUP#{groupId}, SK = METADATA
 */
@DynamoDbBean
public class SeriesGroup extends BaseItem {

    private String groupId;
    private String name;
    private String description;
    private String color;
    private String createdBy;
    private Long version;

    // Default constructor for DynamoDB
    public SeriesGroup() {
        super();
        setItemType(RecurringKeyFactory.ITEM_TYPE_GROUP);
        this.version = 1L;
    }

    public SeriesGroup(String name, String description, String color, String createdBy) {
        this();
        this.groupId = UUID.randomUUID().toString();
        this.name = name;
        this.description = description;
        this.color = color;
        this.createdBy = createdBy;
        setPk(RecurringKeyFactory.getGroupPk(groupId));
        setSk(RecurringKeyFactory.getMetadataSk());
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
