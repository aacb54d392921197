package com.bbthechange.recurring.util;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the loosely typed field values of templates and records to DynamoDB attribute values and back.
 * Values arrive from JSON, so only the JSON shapes plus a few java.time types are supported.
 */
public final class FieldValueMapper {

    private FieldValueMapper() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static AttributeValue toAttributeValue(Object value) {
        if (value == null) {
            return AttributeValue.builder().nul(true).build();
        }
        if (value instanceof AttributeValue) {
            return (AttributeValue) value;
        }
        if (value instanceof String) {
            return AttributeValue.builder().s((String) value).build();
        }
        if (value instanceof Boolean) {
            return AttributeValue.builder().bool((Boolean) value).build();
        }
        if (value instanceof BigDecimal) {
            return AttributeValue.builder().n(((BigDecimal) value).toPlainString()).build();
        }
        if (value instanceof Number) {
            return AttributeValue.builder().n(value.toString()).build();
        }
        if (value instanceof Instant || value instanceof LocalDate) {
            return AttributeValue.builder().s(value.toString()).build();
        }
        if (value instanceof byte[]) {
            return AttributeValue.builder().b(SdkBytes.fromByteArray((byte[]) value)).build();
        }
        if (value instanceof Map) {
            Map<String, AttributeValue> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                nested.put(String.valueOf(entry.getKey()), toAttributeValue(entry.getValue()));
            }
            return AttributeValue.builder().m(nested).build();
        }
        if (value instanceof Collection) {
            List<AttributeValue> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(toAttributeValue(item));
            }
            return AttributeValue.builder().l(items).build();
        }
        return AttributeValue.builder().s(value.toString()).build();
    }

    public static Map<String, AttributeValue> toAttributeMap(Map<String, Object> fields) {
        Map<String, AttributeValue> result = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((key, value) -> result.put(key, toAttributeValue(value)));
        }
        return result;
    }

    public static Object fromAttributeValue(AttributeValue value) {
        if (value == null || Boolean.TRUE.equals(value.nul())) {
            return null;
        }
        if (value.s() != null) {
            return value.s();
        }
        if (value.n() != null) {
            return parseNumber(value.n());
        }
        if (value.bool() != null) {
            return value.bool();
        }
        if (value.b() != null) {
            return value.b().asByteArray();
        }
        if (value.hasM()) {
            return fromAttributeMap(value.m());
        }
        if (value.hasL()) {
            List<Object> items = new ArrayList<>();
            for (AttributeValue item : value.l()) {
                items.add(fromAttributeValue(item));
            }
            return items;
        }
        if (value.hasSs()) {
            return new ArrayList<>(value.ss());
        }
        if (value.hasNs()) {
            List<Object> numbers = new ArrayList<>();
            value.ns().forEach(n -> numbers.add(parseNumber(n)));
            return numbers;
        }
        return null;
    }

    public static Map<String, Object> fromAttributeMap(Map<String, AttributeValue> attributes) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((key, value) -> result.put(key, fromAttributeValue(value)));
        }
        return result;
    }

    private static Object parseNumber(String number) {
        try {
            return Long.parseLong(number);
        } catch (NumberFormatException e) {
            return new BigDecimal(number);
        }
    }
}
