package com.microsoft.cloudgovernance.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Naming and tagging policy chosen by a client.
 *
 * List-valued columns are stored as JSON arrays.
 */
@Entity
@Table(name = "client_preferences", indexes = {
    @Index(name = "idx_client_pref", columnList = "clientId, organizationId")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClientPreferences {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID clientId;

    @Column(nullable = false)
    private UUID organizationId;

    /**
     * JSON array, e.g. ["Kebab-case","Lowercase"].
     */
    @Column(columnDefinition = "TEXT")
    private String allowedNamingPatterns;

    /**
     * JSON array, e.g. ["Environment indicator","Resource type"].
     */
    @Column(columnDefinition = "TEXT")
    private String requiredNamingElements;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private EnvironmentIndicatorLevel environmentIndicatorLevel;

    /**
     * environment | application | business-unit
     */
    @Column(length = 32)
    private String organizationMethod;

    @Column(columnDefinition = "TEXT")
    private String requiredTags;

    @Column(columnDefinition = "TEXT")
    private String selectedTags;

    @Column(columnDefinition = "TEXT")
    private String customTags;

    private Boolean enforceTagCompliance;

    @Column(columnDefinition = "TEXT")
    private String complianceFrameworks;

    @Column(nullable = false)
    private Boolean active;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (active == null) {
            active = true;
        }
        if (enforceTagCompliance == null) {
            enforceTagCompliance = false;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
