package com.microsoft.cloudgovernance.domain.repository;

import com.microsoft.cloudgovernance.domain.model.Assessment;
import com.microsoft.cloudgovernance.domain.model.AssessmentStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssessmentRepository extends JpaRepository<Assessment, UUID> {

    /**
     * Organization-scoped lookup. Every read path goes through this.
     */
    Optional<Assessment> findByIdAndOrganizationId(UUID id, UUID organizationId);

    Page<Assessment> findByOrganizationIdOrderByCreatedAtDesc(UUID organizationId, Pageable pageable);

    List<Assessment> findByOrganizationIdAndStatusIn(UUID organizationId, Collection<AssessmentStatus> statuses);

    /**
     * Runs that have not reached a terminal state since the given time.
     */
    @Query("SELECT a FROM Assessment a WHERE a.status IN :statuses AND a.createdAt < :threshold")
    List<Assessment> findStaleAssessments(
            @Param("statuses") Collection<AssessmentStatus> statuses,
            @Param("threshold") LocalDateTime threshold);
}
