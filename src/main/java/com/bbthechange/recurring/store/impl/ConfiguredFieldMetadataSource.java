package com.bbthechange.recurring.store.impl;

import com.bbthechange.recurring.config.RecurringProperties;
import com.bbthechange.recurring.model.RecordTypeMetadata;
import com.bbthechange.recurring.store.FieldMetadataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Field metadata read from {@code recurring.record-types.*} in application configuration.
 * Editable and required fields that are missing from the field list are added to it.
 */
@Service
public class ConfiguredFieldMetadataSource implements FieldMetadataSource {

    private static final Logger logger = LoggerFactory.getLogger(ConfiguredFieldMetadataSource.class);

    private final RecurringProperties properties;

    @Autowired
    public ConfiguredFieldMetadataSource(RecurringProperties properties) {
        this.properties = properties;
    }

    @Override
    @Cacheable(value = "fieldMetadata", key = "#recordType")
    public Optional<RecordTypeMetadata> getMetadata(String recordType) {
        RecurringProperties.RecordType config = properties.getRecordTypes().get(recordType);
        if (config == null) {
            logger.debug("No field metadata configured for record type {}", recordType);
            return Optional.empty();
        }

        Set<String> fields = new LinkedHashSet<>(config.getFields());
        fields.addAll(config.getEditableFields());
        fields.addAll(config.getRequiredFields());

        return Optional.of(new RecordTypeMetadata(
            recordType,
            fields,
            new LinkedHashSet<>(config.getEditableFields()),
            new LinkedHashSet<>(config.getRequiredFields()),
            config.getExclusiveScopeField(),
            config.getDisplayField()
        ));
    }
}
