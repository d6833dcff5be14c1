package com.microsoft.cloudgovernance.domain.repository;

import com.microsoft.cloudgovernance.domain.model.OrganizationPlan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrganizationPlanRepository extends JpaRepository<OrganizationPlan, Long> {

    Optional<OrganizationPlan> findByOrganizationId(UUID organizationId);
}
