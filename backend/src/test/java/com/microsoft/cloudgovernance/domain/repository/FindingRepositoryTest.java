package com.microsoft.cloudgovernance.domain.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.cloudgovernance.analysis.SkippedResource;
import com.microsoft.cloudgovernance.analysis.Violation;
import com.microsoft.cloudgovernance.assessment.FindingFilter;
import com.microsoft.cloudgovernance.assessment.FindingView;
import com.microsoft.cloudgovernance.assessment.FindingsStore;
import com.microsoft.cloudgovernance.domain.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DataJpaTest
class FindingRepositoryTest {

    private static final Pageable BY_ID = PageRequest.of(0, 50, Sort.by("id"));

    @Autowired
    private FindingRepository findingRepository;

    @Autowired
    private AssessmentResourceRepository resourceRepository;

    private FindingsStore findingsStore;

    @BeforeEach
    void setUp() {
        findingsStore = new FindingsStore(findingRepository, resourceRepository, new ObjectMapper(),
                Clock.fixed(Instant.parse("2026-03-15T12:00:00Z"), ZoneOffset.UTC));
    }

    private static Violation violation(ViolationRule rule, String name, String issue, String recommendation) {
        return new Violation(rule,
                "/subscriptions/sub-1/resourceGroups/rg/providers/Microsoft.Compute/virtualMachines/" + name,
                name, "Microsoft.Compute/virtualMachines", issue, recommendation, EffortLevel.LOW);
    }

    @Test
    @DisplayName("Should read back stored findings with the category, severity and text they were written with")
    void shouldRoundTripFindings() {
        // Given
        UUID assessmentId = UUID.randomUUID();
        UUID otherAssessmentId = UUID.randomUUID();
        findingsStore.storeFindings(assessmentId, List.of(
                violation(ViolationRule.MISSING_REQUIRED_TAGS, "vm-prod-001",
                        "Missing required tags: owner", "Add tags: owner"),
                violation(ViolationRule.MISSING_ENVIRONMENT_INDICATOR, "webserver",
                        "Name has no environment indicator", "Rename to vm-webserver-prod")
        ), List.of(new SkippedResource(null, null, "Resource is null")));
        findingsStore.storeFindings(otherAssessmentId, List.of(
                violation(ViolationRule.NO_TAGS, "vm-other", "Resource has no tags", "Add tags")), List.of());

        // When
        Page<FindingView> all = findingsStore.findFindings(assessmentId, FindingFilter.none(), BY_ID)
                .map(FindingView::from);

        // Then
        assertThat(all.getTotalElements()).isEqualTo(3);
        assertThat(all.getContent())
                .extracting(FindingView::category, FindingView::severity, FindingView::issue, FindingView::recommendation)
                .containsExactly(
                        tuple(FindingCategory.TAGGING, Severity.MEDIUM,
                                "Missing required tags: owner", "Add tags: owner"),
                        tuple(FindingCategory.NAMING, Severity.CRITICAL,
                                "Name has no environment indicator", "Rename to vm-webserver-prod"),
                        tuple(FindingCategory.DATA_QUALITY, Severity.LOW,
                                "Resource is null", "Check the resource definition in Azure Resource Graph"));
    }

    @Test
    @DisplayName("Should filter findings by category and severity")
    void shouldFilterFindings() {
        // Given
        UUID assessmentId = UUID.randomUUID();
        findingsStore.storeFindings(assessmentId, List.of(
                violation(ViolationRule.MISSING_REQUIRED_TAGS, "vm-a", "Missing required tags: owner", "Add tags"),
                violation(ViolationRule.NO_TAGS, "vm-b", "Resource has no tags", "Add tags"),
                violation(ViolationRule.INVALID_CHARACTERS, "vm c", "Name contains spaces", "Remove spaces")
        ), List.of());

        // When
        Page<Finding> tagging = findingsStore.findFindings(assessmentId,
                new FindingFilter(FindingCategory.TAGGING, null), BY_ID);
        Page<Finding> high = findingsStore.findFindings(assessmentId,
                new FindingFilter(null, Severity.HIGH), BY_ID);
        Page<Finding> highTagging = findingsStore.findFindings(assessmentId,
                new FindingFilter(FindingCategory.TAGGING, Severity.HIGH), BY_ID);

        // Then
        assertThat(tagging.getContent()).extracting(Finding::getResourceName).containsExactly("vm-a", "vm-b");
        assertThat(high.getContent()).extracting(Finding::getResourceName).containsExactly("vm-b", "vm c");
        assertThat(highTagging.getContent()).extracting(Finding::getResourceName).containsExactly("vm-b");
    }

    @Test
    @DisplayName("Should count findings per severity with zero for absent severities")
    void shouldCountBySeverity() {
        UUID assessmentId = UUID.randomUUID();
        findingsStore.storeFindings(assessmentId, List.of(
                violation(ViolationRule.MISSING_REQUIRED_TAGS, "vm-a", "Missing owner", "Add owner"),
                violation(ViolationRule.EMPTY_TAG_VALUES, "vm-b", "Empty env", "Fill env"),
                violation(ViolationRule.NO_TAGS, "vm-c", "No tags", "Add tags")
        ), List.of());

        Map<Severity, Long> counts = findingsStore.countBySeverity(assessmentId);

        assertThat(counts).containsExactly(
                Map.entry(Severity.LOW, 0L),
                Map.entry(Severity.MEDIUM, 2L),
                Map.entry(Severity.HIGH, 1L),
                Map.entry(Severity.CRITICAL, 0L));
        assertThat(findingsStore.countFindings(assessmentId)).isEqualTo(3);
    }

    @Test
    @DisplayName("Should read back captured inventory with its tags")
    void shouldRoundTripResources() {
        UUID assessmentId = UUID.randomUUID();
        ResourceSnapshot vm = new ResourceSnapshot(
                "/subscriptions/sub-1/resourceGroups/rg/providers/Microsoft.Compute/virtualMachines/vm-prod-001",
                "vm-prod-001", "Microsoft.Compute/virtualMachines", "rg", "eastus", "sub-1",
                Map.of("env", "prod"), "Standard_D2s_v3", null);
        findingsStore.storeResources(assessmentId, List.of(vm));

        Page<ResourceSnapshot> stored = findingsStore.findResources(assessmentId, BY_ID);

        assertThat(stored.getContent()).containsExactly(vm);
    }
}
