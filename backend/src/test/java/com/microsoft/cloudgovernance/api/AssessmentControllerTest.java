package com.microsoft.cloudgovernance.api;

import com.microsoft.cloudgovernance.assessment.*;
import com.microsoft.cloudgovernance.domain.model.AssessmentStatus;
import com.microsoft.cloudgovernance.domain.model.AssessmentType;
import com.microsoft.cloudgovernance.domain.model.FindingCategory;
import com.microsoft.cloudgovernance.domain.model.Severity;
import com.microsoft.cloudgovernance.security.AuthenticatedContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AssessmentControllerTest {

    private static final AuthenticatedContext CALLER =
            new AuthenticatedContext(UUID.randomUUID(), UUID.randomUUID(), Set.of("ROLE_USER"));

    @Mock
    private AssessmentOrchestrator orchestrator;

    @InjectMocks
    private AssessmentController controller;

    private static AssessmentStatusView pendingView(UUID id) {
        return new AssessmentStatusView(id, "Contoso", UUID.randomUUID(), AssessmentType.TAGGING,
                AssessmentStatus.PENDING, null, null, null, null, null, null, null, null);
    }

    @Test
    @DisplayName("Should accept a start request with 202")
    void shouldAcceptStart() {
        var request = new StartAssessmentRequest(UUID.randomUUID(), null, null, AssessmentType.TAGGING, null, false);
        UUID id = UUID.randomUUID();
        when(orchestrator.startAssessment(CALLER, request)).thenReturn(pendingView(id));

        var response = controller.startAssessment(CALLER, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getBody().id()).isEqualTo(id);
    }

    @Test
    @DisplayName("Should refuse requests without an authenticated caller")
    void shouldRequireCaller() {
        assertThatThrownBy(() -> controller.getStatus(null, UUID.randomUUID()))
                .isInstanceOf(AuthenticationCredentialsNotFoundException.class);
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("Should pass filters through and clamp the page size")
    void shouldClampFindingPageSize() {
        // Given
        UUID id = UUID.randomUUID();
        when(orchestrator.getFindings(eq(CALLER), eq(id), any(), any())).thenReturn(new PageImpl<>(List.of()));

        // When
        controller.getFindings(CALLER, id, FindingCategory.TAGGING, Severity.HIGH, -3, 10_000);

        // Then
        ArgumentCaptor<FindingFilter> filter = ArgumentCaptor.forClass(FindingFilter.class);
        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(orchestrator).getFindings(eq(CALLER), eq(id), filter.capture(), page.capture());
        assertThat(filter.getValue()).isEqualTo(new FindingFilter(FindingCategory.TAGGING, Severity.HIGH));
        assertThat(page.getValue().getPageNumber()).isZero();
        assertThat(page.getValue().getPageSize()).isEqualTo(500);
    }

    @Test
    @DisplayName("Should answer cancellation with 202 and whether it was issued")
    void shouldCancel() {
        UUID id = UUID.randomUUID();
        when(orchestrator.cancelAssessment(CALLER, id)).thenReturn(false);

        var response = controller.cancelAssessment(CALLER, id);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getBody().cancellationIssued()).isFalse();
    }

    @Test
    @DisplayName("Should delete with 204")
    void shouldDelete() {
        UUID id = UUID.randomUUID();

        var response = controller.deleteAssessment(CALLER, id);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        verify(orchestrator).deleteAssessment(CALLER, id);
    }
}
