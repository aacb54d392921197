package com.bbthechange.recurring.controller;

import com.bbthechange.recurring.dto.EntitiesDeletedResponse;
import com.bbthechange.recurring.dto.GroupSummaryDTO;
import com.bbthechange.recurring.dto.SeriesInstanceDTO;
import com.bbthechange.recurring.exception.ValidationException;
import com.bbthechange.recurring.model.InstanceFilter;
import com.bbthechange.recurring.service.InstanceTrackerService;
import com.bbthechange.recurring.service.SeriesAggregationService;
import com.bbthechange.recurring.service.SeriesManagementService;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeriesGroupControllerTest {

    @Mock
    private SeriesAggregationService seriesAggregationService;

    @Mock
    private SeriesManagementService seriesManagementService;

    @Mock
    private InstanceTrackerService instanceTrackerService;

    @Mock
    private HttpServletRequest httpRequest;

    private SeriesGroupController controller;

    private final String userId = UUID.randomUUID().toString();
    private final String groupId = UUID.randomUUID().toString();

    @BeforeEach
    void setUp() {
        controller = new SeriesGroupController(seriesAggregationService, seriesManagementService, instanceTrackerService);
        when(httpRequest.getAttribute("userId")).thenReturn(userId);
    }

    @Test
    void getGroupSummary_ReturnsSummary() {
        // Given
        GroupSummaryDTO summary = new GroupSummaryDTO();
        summary.setVersionCount(2);
        when(seriesAggregationService.getGroupSummary(groupId)).thenReturn(summary);

        // When
        ResponseEntity<GroupSummaryDTO> response = controller.getGroupSummary(groupId, httpRequest);

        // Then
        assertThat(response.getBody().getVersionCount()).isEqualTo(2);
    }

    @Test
    void listInstances_WithLowerCaseFilter_ParsesFilter() {
        // Given
        when(instanceTrackerService.listInstances(groupId, InstanceFilter.EXCEPTIONS)).thenReturn(List.of(new SeriesInstanceDTO()));

        // When
        ResponseEntity<List<SeriesInstanceDTO>> response = controller.listInstances(groupId, "exceptions", httpRequest);

        // Then
        assertThat(response.getBody()).hasSize(1);
    }

    @Test
    void listInstances_WithUnknownFilter_ThrowsValidation() {
        // When / Then
        assertThatThrownBy(() -> controller.listInstances(groupId, "someday", httpRequest))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Unknown filter: someday");
        verifyNoInteractions(instanceTrackerService);
    }

    @Test
    void deleteGroup_ReturnsDeletedCount() {
        // Given
        when(seriesManagementService.deleteGroup(groupId, userId)).thenReturn(new EntitiesDeletedResponse(12));

        // When
        ResponseEntity<EntitiesDeletedResponse> response = controller.deleteGroup(groupId, httpRequest);

        // Then
        assertThat(response.getBody().getEntitiesDeleted()).isEqualTo(12);
    }
}
