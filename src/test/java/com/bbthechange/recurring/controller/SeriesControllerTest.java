package com.bbthechange.recurring.controller;

import com.bbthechange.recurring.dto.*;
import com.bbthechange.recurring.exception.InvalidRuleException;
import com.bbthechange.recurring.exception.UnauthorizedException;
import com.bbthechange.recurring.service.RecurrenceDescriber;
import com.bbthechange.recurring.service.RecurrenceValidator;
import com.bbthechange.recurring.service.SeriesManagementService;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeriesControllerTest {

    @Mock
    private SeriesManagementService seriesManagementService;

    @Mock
    private RecurrenceValidator recurrenceValidator;

    @Mock
    private RecurrenceDescriber recurrenceDescriber;

    @Mock
    private HttpServletRequest httpRequest;

    private SeriesController controller;

    private final String userId = UUID.randomUUID().toString();
    private final String seriesId = UUID.randomUUID().toString();

    @BeforeEach
    void setUp() {
        controller = new SeriesController(seriesManagementService, recurrenceValidator, recurrenceDescriber);
    }

    @Test
    void createSeries_WithAuthenticatedUser_ReturnsCreated() {
        // Given
        when(httpRequest.getAttribute("userId")).thenReturn(userId);
        CreateSeriesRequest request = new CreateSeriesRequest();
        request.setGroupName("Standup");
        request.setRecordType("booking");
        CreateSeriesResponse created = new CreateSeriesResponse(UUID.randomUUID().toString(), seriesId);
        when(seriesManagementService.createSeries(request, userId)).thenReturn(created);

        // When
        ResponseEntity<CreateSeriesResponse> response = controller.createSeries(request, httpRequest);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody()).isSameAs(created);
    }

    @Test
    void createSeries_WithoutUser_ThrowsUnauthorized() {
        // Given
        when(httpRequest.getAttribute("userId")).thenReturn(null);

        // When / Then
        assertThatThrownBy(() -> controller.createSeries(new CreateSeriesRequest(), httpRequest))
            .isInstanceOf(UnauthorizedException.class);
        verifyNoInteractions(seriesManagementService);
    }

    @Test
    void expandInstances_WithoutBody_UsesConfiguredHorizon() {
        // Given
        when(httpRequest.getAttribute("userId")).thenReturn(userId);
        ExpandResponse queued = new ExpandResponse(true, seriesId, Instant.parse("2025-06-01T00:00:00Z"));
        when(seriesManagementService.expandInstances(seriesId, null)).thenReturn(queued);

        // When
        ResponseEntity<ExpandResponse> response = controller.expandInstances(seriesId, null, httpRequest);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getBody().isQueued()).isTrue();
    }

    @Test
    void expandInstances_WithUntil_PassesItThrough() {
        // Given
        when(httpRequest.getAttribute("userId")).thenReturn(userId);
        Instant until = Instant.parse("2025-04-01T00:00:00Z");
        ExpandRequest request = new ExpandRequest();
        request.setUntil(until);
        when(seriesManagementService.expandInstances(seriesId, until))
            .thenReturn(new ExpandResponse(true, seriesId, until));

        // When
        controller.expandInstances(seriesId, request, httpRequest);

        // Then
        verify(seriesManagementService).expandInstances(seriesId, until);
    }

    @Test
    void deleteSeries_ReturnsDeletedCount() {
        // Given
        when(httpRequest.getAttribute("userId")).thenReturn(userId);
        when(seriesManagementService.deleteSeries(seriesId, userId)).thenReturn(new EntitiesDeletedResponse(7));

        // When
        ResponseEntity<EntitiesDeletedResponse> response = controller.deleteSeries(seriesId, httpRequest);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getEntitiesDeleted()).isEqualTo(7);
    }

    @Test
    void describeRule_WithValidRule_ReturnsDescription() {
        // Given
        when(httpRequest.getAttribute("userId")).thenReturn(userId);
        when(recurrenceDescriber.describe("FREQ=DAILY")).thenReturn("Every day");

        // When
        ResponseEntity<DescribeRuleResponse> response = controller.describeRule("FREQ=DAILY", httpRequest);

        // Then
        verify(recurrenceValidator).validate("FREQ=DAILY");
        assertThat(response.getBody().getDescription()).isEqualTo("Every day");
        assertThat(response.getBody().getRule()).isEqualTo("FREQ=DAILY");
    }

    @Test
    void describeRule_WithInvalidRule_DoesNotDescribe() {
        // Given
        when(httpRequest.getAttribute("userId")).thenReturn(userId);
        doThrow(new InvalidRuleException("FREQ is required")).when(recurrenceValidator).validate("BYDAY=MO");

        // When / Then
        assertThatThrownBy(() -> controller.describeRule("BYDAY=MO", httpRequest))
            .isInstanceOf(InvalidRuleException.class);
        verifyNoInteractions(recurrenceDescriber);
    }

    @Test
    void splitSeries_ReturnsCreated() {
        // Given
        when(httpRequest.getAttribute("userId")).thenReturn(userId);
        SplitSeriesRequest request = new SplitSeriesRequest();
        SplitSeriesResponse split = new SplitSeriesResponse();
        when(seriesManagementService.splitSeries(eq(seriesId), any(SplitSeriesRequest.class), eq(userId))).thenReturn(split);

        // When
        ResponseEntity<SplitSeriesResponse> response = controller.splitSeries(seriesId, request, httpRequest);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody()).isSameAs(split);
    }
}
