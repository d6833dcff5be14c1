package com.microsoft.cloudgovernance.domain.repository;

import com.microsoft.cloudgovernance.domain.model.AssessmentResource;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface AssessmentResourceRepository extends JpaRepository<AssessmentResource, Long> {

    Page<AssessmentResource> findByAssessmentId(UUID assessmentId, Pageable pageable);

    long countByAssessmentId(UUID assessmentId);

    @Modifying
    @Query("DELETE FROM AssessmentResource r WHERE r.assessmentId = :assessmentId")
    int deleteByAssessmentId(@Param("assessmentId") UUID assessmentId);
}
