package com.microsoft.cloudgovernance.domain.repository;

import com.microsoft.cloudgovernance.domain.model.Finding;
import com.microsoft.cloudgovernance.domain.model.FindingCategory;
import com.microsoft.cloudgovernance.domain.model.Severity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FindingRepository extends JpaRepository<Finding, Long> {

    boolean existsByAssessmentId(UUID assessmentId);

    long countByAssessmentId(UUID assessmentId);

    /**
     * Findings of an assessment, optionally narrowed by category and severity.
     * Null filters match everything.
     */
    @Query("SELECT f FROM Finding f WHERE f.assessmentId = :assessmentId " +
           "AND (:category IS NULL OR f.category = :category) " +
           "AND (:severity IS NULL OR f.severity = :severity)")
    Page<Finding> findFiltered(
            @Param("assessmentId") UUID assessmentId,
            @Param("category") FindingCategory category,
            @Param("severity") Severity severity,
            Pageable pageable);

    @Query("SELECT f.severity, COUNT(f) FROM Finding f WHERE f.assessmentId = :assessmentId GROUP BY f.severity")
    List<Object[]> countBySeverity(@Param("assessmentId") UUID assessmentId);

    @Modifying
    @Query("DELETE FROM Finding f WHERE f.assessmentId = :assessmentId")
    int deleteByAssessmentId(@Param("assessmentId") UUID assessmentId);
}
