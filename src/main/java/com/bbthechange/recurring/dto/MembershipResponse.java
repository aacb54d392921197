package com.bbthechange.recurring.dto;

import com.bbthechange.recurring.model.ExceptionType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

/**
 * Series membership of one record.
 */
@Data
@NoArgsConstructor
public class MembershipResponse {

    @JsonProperty("isMember")
    private boolean member;
    private String seriesId;
    private String groupId;
    private String groupName;
    private String groupColor;
    private LocalDate occurrenceDate;
    @JsonProperty("isException")
    private boolean exception;
    private ExceptionType exceptionType;
    private Map<String, Object> originalTemplate;

    public static MembershipResponse notMember() {
        return new MembershipResponse();
    }
}
