package com.microsoft.cloudgovernance.domain.repository;

import com.microsoft.cloudgovernance.domain.model.ClientPreferences;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ClientPreferencesRepository extends JpaRepository<ClientPreferences, Long> {

    /**
     * Most recent active preferences for a client.
     */
    Optional<ClientPreferences> findFirstByClientIdAndOrganizationIdAndActiveTrueOrderByCreatedAtDesc(
            UUID clientId, UUID organizationId);
}
