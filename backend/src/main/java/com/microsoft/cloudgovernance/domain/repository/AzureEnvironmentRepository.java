package com.microsoft.cloudgovernance.domain.repository;

import com.microsoft.cloudgovernance.domain.model.AzureEnvironment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AzureEnvironmentRepository extends JpaRepository<AzureEnvironment, UUID> {

    Optional<AzureEnvironment> findByIdAndOrganizationId(UUID id, UUID organizationId);
}
