package com.microsoft.cloudgovernance.domain.repository;

import com.microsoft.cloudgovernance.domain.model.CredentialRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CredentialRecordRepository extends JpaRepository<CredentialRecord, Long> {

    Optional<CredentialRecord> findByClientIdAndOrganizationId(UUID clientId, UUID organizationId);

    @Modifying
    @Transactional
    void deleteByClientIdAndOrganizationId(UUID clientId, UUID organizationId);
}
