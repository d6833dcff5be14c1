package com.microsoft.cloudgovernance.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Delegated OAuth tokens for one client of one organization.
 */
@Entity
@Table(name = "client_credentials", uniqueConstraints = {
    @UniqueConstraint(name = "uk_credential_client_org", columnNames = {"clientId", "organizationId"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CredentialRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID clientId;

    @Column(nullable = false)
    private UUID organizationId;

    @Column(columnDefinition = "TEXT")
    private String accessToken;

    @Column(columnDefinition = "TEXT")
    private String refreshToken;

    private Instant expiresAt;

    @Column(length = 500)
    private String scopes;

    private Instant lastRefreshedAt;

    @Column(length = 1000)
    private String lastRefreshError;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CredentialStatus status;

    @PrePersist
    protected void onCreate() {
        if (status == null) {
            status = CredentialStatus.UNKNOWN;
        }
    }

    @Override
    public String toString() {
        return "CredentialRecord[client=" + clientId + ", org=" + organizationId
                + ", status=" + status + ", expiresAt=" + expiresAt + "]";
    }
}
