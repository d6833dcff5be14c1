package com.microsoft.cloudgovernance.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.cloudgovernance.domain.model.ClientPreferences;
import com.microsoft.cloudgovernance.domain.model.NamingPattern;
import com.microsoft.cloudgovernance.domain.repository.ClientPreferencesRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Resolves the policy an assessment is analyzed against.
 *
 * CACHING STRATEGY:
 * - Client preferences are cached per client + organization
 * - Entries are evicted when preferences are updated
 *
 * Stored preferences are lenient: list columns may hold JSON arrays or
 * comma separated text, unknown naming patterns are ignored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyPreferencesService {

    static final String CACHE_NAME = "client-preferences";

    private final ClientPreferencesRepository preferencesRepository;
    private final ObjectMapper objectMapper;

    /**
     * Client policy when one is stored and active, otherwise the default policy.
     */
    @Cacheable(value = CACHE_NAME, key = "#clientId + ':' + #organizationId")
    public PolicyPreferences resolve(UUID clientId, UUID organizationId) {
        if (clientId == null) {
            return PolicyPreferences.defaults();
        }
        return preferencesRepository
                .findFirstByClientIdAndOrganizationIdAndActiveTrueOrderByCreatedAtDesc(clientId, organizationId)
                .map(this::toPolicy)
                .orElseGet(() -> {
                    log.debug("No preferences stored for client: {}; using default policy", clientId);
                    return PolicyPreferences.defaults();
                });
    }

    /**
     * Preferences are edited outside this service; drop cached copies periodically.
     */
    @Scheduled(fixedDelayString = "${compass.preferences.cache-ttl-ms:600000}")
    @CacheEvict(value = CACHE_NAME, allEntries = true)
    public void evictAll() {
        log.debug("Evicting cached client preferences");
    }

    PolicyPreferences toPolicy(ClientPreferences stored) {
        Set<NamingPattern> patterns = EnumSet.noneOf(NamingPattern.class);
        for (String value : parseList(stored.getAllowedNamingPatterns())) {
            NamingPattern pattern = NamingPattern.fromValue(value);
            if (pattern != null) {
                patterns.add(pattern);
            } else {
                log.warn("Ignoring unknown naming pattern '{}' for client: {}", value, stored.getClientId());
            }
        }

        List<String> requiredTags = parseList(stored.getRequiredTags());
        if (requiredTags.isEmpty()) {
            requiredTags = new ArrayList<>(parseList(stored.getSelectedTags()));
            for (String custom : parseList(stored.getCustomTags())) {
                if (requiredTags.stream().noneMatch(t -> t.equalsIgnoreCase(custom))) {
                    requiredTags.add(custom);
                }
            }
        }

        return new PolicyPreferences(
                patterns,
                parseList(stored.getRequiredNamingElements()),
                stored.getEnvironmentIndicatorLevel(),
                stored.getOrganizationMethod(),
                requiredTags,
                Boolean.TRUE.equals(stored.getEnforceTagCompliance()),
                true
        );
    }

    List<String> parseList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("[")) {
            try {
                List<String> values = objectMapper.readValue(trimmed, new TypeReference<List<String>>() {});
                return values.stream()
                        .filter(Objects::nonNull)
                        .map(String::trim)
                        .filter(v -> !v.isEmpty())
                        .toList();
            } catch (JsonProcessingException e) {
                log.warn("Malformed preference list '{}': {}", trimmed, e.getOriginalMessage());
                return List.of();
            }
        }
        return Arrays.stream(trimmed.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
    }
}
