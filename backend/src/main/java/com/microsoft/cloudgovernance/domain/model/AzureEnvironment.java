package com.microsoft.cloudgovernance.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A customer's connection to an Azure tenant and the subscriptions to assess.
 *
 * Environments are managed elsewhere; the assessment engine only reads them
 * and writes the connection health columns.
 */
@Entity
@Table(name = "azure_environments", indexes = {
    @Index(name = "idx_environment_org", columnList = "organizationId"),
    @Index(name = "idx_environment_client", columnList = "clientId")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AzureEnvironment {

    @Id
    private UUID id;

    @Column(nullable = false)
    private UUID organizationId;

    @Column(nullable = false)
    private UUID customerId;

    private UUID clientId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "azure_environment_subscriptions", joinColumns = @JoinColumn(name = "environment_id"))
    @Column(name = "subscription_id", length = 64)
    @OrderColumn(name = "position")
    @Builder.Default
    private List<String> subscriptionIds = new ArrayList<>();

    @Column(length = 64)
    private String servicePrincipalId;

    @Column(nullable = false)
    private Boolean active;

    private Boolean lastConnectionTest;

    private LocalDateTime lastConnectionTestAt;

    @Column(length = 1000)
    private String lastConnectionError;

    /**
     * Last known state of the delegated credential, set when a run hits a credential error.
     */
    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private CredentialStatus credentialStatus;

    @Column(length = 500)
    private String credentialRemediation;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (active == null) {
            active = true;
        }
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    public void recordConnectionTest(boolean success, String error, LocalDateTime testedAt) {
        this.lastConnectionTest = success;
        this.lastConnectionTestAt = testedAt;
        this.lastConnectionError = success ? null : error;
    }

    public void recordCredentialHealth(CredentialStatus status, String remediation) {
        this.credentialStatus = status;
        this.credentialRemediation = remediation;
    }
}
