package com.bbthechange.recurring.util;

import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores a series template as a DynamoDB Map attribute.
 */
public class FieldMapAttributeConverter implements AttributeConverter<Map<String, Object>> {

    @Override
    public AttributeValue transformFrom(Map<String, Object> fields) {
        if (fields == null) {
            return AttributeValue.builder().nul(true).build();
        }
        return AttributeValue.builder().m(FieldValueMapper.toAttributeMap(fields)).build();
    }

    @Override
    public Map<String, Object> transformTo(AttributeValue attributeValue) {
        if (attributeValue == null || Boolean.TRUE.equals(attributeValue.nul()) || !attributeValue.hasM()) {
            return new LinkedHashMap<>();
        }
        return FieldValueMapper.fromAttributeMap(attributeValue.m());
    }

    @Override
    public EnhancedType<Map<String, Object>> type() {
        return EnhancedType.mapOf(String.class, Object.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.M;
    }
}
