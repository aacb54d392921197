package com.bbthechange.recurring.store.impl;

import com.bbthechange.recurring.config.RecurringProperties;
import com.bbthechange.recurring.model.RecordTypeMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ConfiguredFieldMetadataSourceTest {

    private ConfiguredFieldMetadataSource metadataSource;

    @BeforeEach
    void setUp() {
        RecurringProperties.RecordType booking = new RecurringProperties.RecordType();
        booking.setFields(List.of("title", "starts_at"));
        booking.setEditableFields(List.of("title", "roomId"));
        booking.setRequiredFields(List.of("title", "roomId"));
        booking.setExclusiveScopeField("roomId");
        booking.setDisplayField("title");

        RecurringProperties properties = new RecurringProperties();
        properties.getRecordTypes().put("booking", booking);
        metadataSource = new ConfiguredFieldMetadataSource(properties);
    }

    @Test
    void getMetadata_ForConfiguredType_MergesFieldLists() {
        // When
        Optional<RecordTypeMetadata> metadata = metadataSource.getMetadata("booking");

        // Then
        assertThat(metadata).isPresent();
        assertThat(metadata.get().getFields()).containsExactly("title", "starts_at", "roomId");
        assertThat(metadata.get().getRequiredFields()).containsExactlyInAnyOrder("title", "roomId");
        assertThat(metadata.get().hasExclusiveScope()).isTrue();
        assertThat(metadata.get().getDisplayField()).isEqualTo("title");
    }

    @Test
    void getMetadata_ForUnknownType_ReturnsEmpty() {
        // When
        Optional<RecordTypeMetadata> metadata = metadataSource.getMetadata("shift");

        // Then
        assertThat(metadata).isEmpty();
    }
}
