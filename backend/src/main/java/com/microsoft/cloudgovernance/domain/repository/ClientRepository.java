package com.microsoft.cloudgovernance.domain.repository;

import com.microsoft.cloudgovernance.domain.model.Client;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ClientRepository extends JpaRepository<Client, UUID> {

    boolean existsByIdAndOrganizationId(UUID id, UUID organizationId);
}
