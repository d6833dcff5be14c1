package com.microsoft.cloudgovernance.assessment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.cloudgovernance.analysis.SkippedResource;
import com.microsoft.cloudgovernance.analysis.Violation;
import com.microsoft.cloudgovernance.domain.model.*;
import com.microsoft.cloudgovernance.domain.repository.AssessmentResourceRepository;
import com.microsoft.cloudgovernance.domain.repository.FindingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Persistence for assessment findings and inventory snapshots.
 *
 * Findings are write-once: the first successful write for an assessment is
 * final, a second write is rejected. Deletion only happens together with the
 * assessment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FindingsStore {

    private static final int TEXT_LIMIT = 1000;

    private final FindingRepository findingRepository;
    private final AssessmentResourceRepository resourceRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Store the analyzer violations plus one data-quality finding per skipped resource.
     *
     * @return number of findings written
     * @throws IllegalStateException if findings already exist for the assessment
     */
    @Transactional
    public int storeFindings(UUID assessmentId, List<Violation> violations, List<SkippedResource> skipped) {
        if (findingRepository.existsByAssessmentId(assessmentId)) {
            throw new IllegalStateException("Findings for assessment " + assessmentId + " were already written");
        }
        LocalDateTime now = LocalDateTime.now(clock);

        List<Finding> findings = new ArrayList<>(violations.size() + skipped.size());
        for (Violation violation : violations) {
            findings.add(Finding.builder()
                    .assessmentId(assessmentId)
                    .category(violation.category())
                    .rule(violation.rule())
                    .severity(violation.severity())
                    .resourceId(violation.resourceId())
                    .resourceName(violation.resourceName())
                    .resourceType(violation.resourceType())
                    .issue(truncate(violation.issue()))
                    .recommendation(truncate(violation.recommendation()))
                    .estimatedEffort(violation.effort())
                    .createdAt(now)
                    .build());
        }

        // Both analyzers may skip the same resource
        Set<String> seen = new HashSet<>();
        for (SkippedResource resource : skipped) {
            String key = resource.resourceId() + "|" + resource.resourceName();
            if (!seen.add(key)) {
                continue;
            }
            findings.add(Finding.builder()
                    .assessmentId(assessmentId)
                    .category(ViolationRule.MALFORMED_RESOURCE.getCategory())
                    .rule(ViolationRule.MALFORMED_RESOURCE)
                    .severity(ViolationRule.MALFORMED_RESOURCE.getSeverity())
                    .resourceId(resource.resourceId())
                    .resourceName(resource.resourceName())
                    .issue(truncate(resource.reason() != null ? resource.reason() : "Resource could not be analyzed"))
                    .recommendation("Check the resource definition in Azure Resource Graph")
                    .estimatedEffort(EffortLevel.LOW)
                    .createdAt(now)
                    .build());
        }

        findingRepository.saveAll(findings);
        log.info("Stored {} findings for assessment {}", findings.size(), assessmentId);
        return findings.size();
    }

    /**
     * Store the fetched inventory for later inspection.
     */
    @Transactional
    public void storeResources(UUID assessmentId, List<ResourceSnapshot> resources) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<AssessmentResource> rows = resources.stream()
                .map(resource -> AssessmentResource.builder()
                        .assessmentId(assessmentId)
                        .resourceId(resource.resourceId())
                        .name(resource.name())
                        .type(resource.type())
                        .resourceGroup(resource.resourceGroup())
                        .location(resource.location())
                        .subscriptionId(resource.subscriptionId())
                        .kind(resource.kind())
                        .sku(resource.sku())
                        .tags(writeTags(resource.tags()))
                        .capturedAt(now)
                        .build())
                .toList();
        resourceRepository.saveAll(rows);
        log.debug("Stored {} inventory rows for assessment {}", rows.size(), assessmentId);
    }

    @Transactional(readOnly = true)
    public Page<Finding> findFindings(UUID assessmentId, FindingFilter filter, Pageable pageable) {
        FindingFilter effective = filter != null ? filter : FindingFilter.none();
        return findingRepository.findFiltered(assessmentId, effective.category(), effective.severity(), pageable);
    }

    @Transactional(readOnly = true)
    public long countFindings(UUID assessmentId) {
        return findingRepository.countByAssessmentId(assessmentId);
    }

    /**
     * Finding counts per severity, every severity present, lowest first.
     */
    @Transactional(readOnly = true)
    public Map<Severity, Long> countBySeverity(UUID assessmentId) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        for (Object[] row : findingRepository.countBySeverity(assessmentId)) {
            counts.put((Severity) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Transactional(readOnly = true)
    public Page<ResourceSnapshot> findResources(UUID assessmentId, Pageable pageable) {
        return resourceRepository.findByAssessmentId(assessmentId, pageable)
                .map(row -> new ResourceSnapshot(
                        row.getResourceId(),
                        row.getName(),
                        row.getType(),
                        row.getResourceGroup(),
                        row.getLocation(),
                        row.getSubscriptionId(),
                        readTags(row.getTags()),
                        row.getSku(),
                        row.getKind()));
    }

    /**
     * Remove everything stored for an assessment. Only called when the assessment itself is deleted.
     */
    @Transactional
    public void deleteAll(UUID assessmentId) {
        int findings = findingRepository.deleteByAssessmentId(assessmentId);
        int resources = resourceRepository.deleteByAssessmentId(assessmentId);
        log.info("Deleted {} findings and {} inventory rows for assessment {}", findings, resources, assessmentId);
    }

    private String writeTags(Map<String, String> tags) {
        if (tags.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tags cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, String> readTags(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Stored tags are not valid JSON: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() > TEXT_LIMIT ? text.substring(0, TEXT_LIMIT) : text;
    }
}
