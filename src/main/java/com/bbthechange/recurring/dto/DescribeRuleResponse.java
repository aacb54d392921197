package com.bbthechange.recurring.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DescribeRuleResponse {
    private String rule;
    private String description;
}
