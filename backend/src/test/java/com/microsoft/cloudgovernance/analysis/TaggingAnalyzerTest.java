package com.microsoft.cloudgovernance.analysis;

import com.microsoft.cloudgovernance.domain.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for TaggingAnalyzer.
 */
class TaggingAnalyzerTest {

    private static final String VM = "Microsoft.Compute/virtualMachines";
    private static final String PUBLIC_IP = "Microsoft.Network/publicIPAddresses";

    private final TaggingAnalyzer analyzer = new TaggingAnalyzer();

    private static PolicyPreferences requiring(List<String> tags, boolean enforce) {
        return new PolicyPreferences(Set.of(NamingPattern.KEBAB_CASE), List.of(),
                EnvironmentIndicatorLevel.OPTIONAL, null, tags, enforce, true);
    }

    @Nested
    @DisplayName("Required tags")
    class RequiredTagTests {

        @Test
        @DisplayName("Should report the missing tag and half coverage for a partially tagged VM")
        void shouldReportMissingOwner() {
            // Given
            var resources = List.of(resource("vm-prod-001", VM, Map.of("env", "prod")));

            // When
            var result = analyzer.analyze(resources, requiring(List.of("env", "owner"), false));

            // Then
            assertThat(result.violations()).hasSize(1);
            Violation violation = result.violations().get(0);
            assertThat(violation.rule()).isEqualTo(ViolationRule.MISSING_REQUIRED_TAGS);
            assertThat(violation.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(violation.issue()).isEqualTo("Missing required tags: owner");
            assertThat(result.evaluations().get(0).score()).isEqualByComparingTo("50.00");
            assertThat(result.score()).isEqualByComparingTo("78.50");
        }

        @Test
        @DisplayName("Should match required tag keys case-insensitively")
        void shouldMatchKeysIgnoringCase() {
            // Given
            var resource = resource("vm-prod-001", VM, Map.of("ENV", "prod", "Owner", "ops"));

            // When
            var missing = TaggingAnalyzer.missingTags(resource, List.of("env", "owner"));

            // Then
            assertThat(missing).isEmpty();
        }

        @Test
        @DisplayName("Should not enforce required tags on non-critical types under the default policy")
        void shouldSkipNonCriticalTypesByDefault() {
            // Given
            var resources = List.of(resource("pip-web", PUBLIC_IP, Map.of("Environment", "prod")));

            // When
            var result = analyzer.analyze(resources, PolicyPreferences.defaults());

            // Then
            assertThat(result.violations()).isEmpty();
            assertThat(result.metrics().get("requiredTagCoverage")).isEqualByComparingTo("20.00");
        }

        @Test
        @DisplayName("Should scale the penalty when tag compliance is enforced")
        void shouldScalePenaltyWhenEnforced() {
            // Given
            var resources = List.of(resource("vm-prod-001", VM, Map.of("env", "prod")));

            // When
            var relaxed = analyzer.analyze(resources, requiring(List.of("env", "owner"), false));
            var enforced = analyzer.analyze(resources, requiring(List.of("env", "owner"), true));

            // Then
            assertThat(relaxed.metrics().get("violationPenalty")).isEqualByComparingTo("5.00");
            assertThat(enforced.metrics().get("violationPenalty")).isEqualByComparingTo("7.50");
            assertThat(enforced.score()).isLessThan(relaxed.score());
        }
    }

    @Nested
    @DisplayName("Tag hygiene")
    class HygieneTests {

        @Test
        @DisplayName("Should report an untagged resource once with NO_TAGS")
        void shouldReportUntaggedResource() {
            // Given
            var resources = List.of(resource("vm-prod-001", VM, Map.of()));

            // When
            var result = analyzer.analyze(resources, requiring(List.of("env", "owner"), false));

            // Then
            assertThat(result.violations()).extracting(Violation::rule).containsExactly(ViolationRule.NO_TAGS);
            assertThat(result.metrics().get("tagCoverage")).isEqualByComparingTo("0.00");
            assertThat(result.score()).isEqualByComparingTo("27.00");
        }

        @Test
        @DisplayName("Should report tags with empty values")
        void shouldReportEmptyValues() {
            // Given
            var tags = new LinkedHashMap<String, String>();
            tags.put("env", "prod");
            tags.put("owner", " ");
            var resources = List.of(resource("vm-prod-001", VM, tags));

            // When
            var result = analyzer.analyze(resources, requiring(List.of("env", "owner"), false));

            // Then
            assertThat(result.violations()).extracting(Violation::rule)
                    .containsExactly(ViolationRule.EMPTY_TAG_VALUES);
            assertThat(result.violations().get(0).issue()).contains("owner");
        }

        @Test
        @DisplayName("Should flag tag keys that differ from the estate's usual casing")
        void shouldFlagInconsistentCasing() {
            // Given
            var resources = List.of(
                    resource("vm-a", VM, Map.of("Environment", "prod")),
                    resource("vm-b", VM, Map.of("Environment", "dev")),
                    resource("vm-c", VM, Map.of("environment", "test")));

            // When
            var result = analyzer.analyze(resources, requiring(List.of("Environment"), false));

            // Then
            assertThat(result.violations()).hasSize(1);
            assertThat(result.violations().get(0).resourceName()).isEqualTo("vm-c");
            assertThat(result.violations().get(0).rule()).isEqualTo(ViolationRule.INCONSISTENT_TAG_NAMING);
            assertThat(result.frequencies()).containsExactly(Map.entry("Environment", 3L));
        }

        @Test
        @DisplayName("Should skip resources without an identifier")
        void shouldSkipResourcesWithoutId() {
            // Given
            var resources = List.of(new ResourceSnapshot(null, "vm-x", VM, "rg", "eastus", "sub-1",
                    Map.of("env", "prod"), null, null));

            // When
            var result = analyzer.analyze(resources, PolicyPreferences.defaults());

            // Then
            assertThat(result.analyzedResources()).isZero();
            assertThat(result.skipped()).hasSize(1);
            assertThat(result.score()).isEqualByComparingTo("100.00");
        }

        @Test
        @DisplayName("Should produce identical results for identical input")
        void shouldBeDeterministic() {
            // Given
            var resources = List.of(
                    resource("vm-a", VM, Map.of("Environment", "prod", "Owner", "")),
                    resource("vm-b", VM, Map.of()),
                    resource("pip-c", PUBLIC_IP, Map.of("environment", "dev")));

            // When
            var first = analyzer.analyze(resources, PolicyPreferences.defaults());
            var second = analyzer.analyze(resources, PolicyPreferences.defaults());

            // Then
            assertThat(second).isEqualTo(first);
        }
    }

    private static ResourceSnapshot resource(String name, String type, Map<String, String> tags) {
        return new ResourceSnapshot("/subscriptions/sub-1/resourceGroups/rg/providers/" + type + "/" + name,
                name, type, "rg", "eastus", "sub-1", tags, null, null);
    }
}
