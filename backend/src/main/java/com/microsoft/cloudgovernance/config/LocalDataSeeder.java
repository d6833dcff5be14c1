package com.microsoft.cloudgovernance.config;

import com.microsoft.cloudgovernance.domain.model.*;
import com.microsoft.cloudgovernance.domain.repository.AzureEnvironmentRepository;
import com.microsoft.cloudgovernance.domain.repository.ClientRepository;
import com.microsoft.cloudgovernance.domain.repository.CredentialRecordRepository;
import com.microsoft.cloudgovernance.domain.repository.OrganizationPlanRepository;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Date;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Seeds a local organization with a plan, a client, a delegated credential and
 * an environment, then logs a bearer token for it.
 *
 * Only seeds data if no plan exists for the local organization.
 */
@Component
@ConditionalOnProperty(name = "app.env", havingValue = "local", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LocalDataSeeder implements CommandLineRunner {

    static final UUID LOCAL_ORGANIZATION = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    static final UUID LOCAL_CUSTOMER = UUID.fromString("00000000-0000-0000-0000-00000000000c");
    static final UUID LOCAL_CLIENT = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    static final UUID LOCAL_ENVIRONMENT = UUID.fromString("00000000-0000-0000-0000-0000000000e1");

    private final OrganizationPlanRepository planRepository;
    private final ClientRepository clientRepository;
    private final CredentialRecordRepository credentialRepository;
    private final AzureEnvironmentRepository environmentRepository;
    private final Clock clock;

    @Value("${jwt.secret:default-secret-key-for-development-only-32chars}")
    private String jwtSecret;

    @Value("${jwt.issuer:cloud-governance}")
    private String jwtIssuer;

    @Override
    @Transactional
    public void run(String... args) {
        if (planRepository.findByOrganizationId(LOCAL_ORGANIZATION).isPresent()) {
            log.info("Local organization already seeded, skipping");
        } else {
            seed();
        }
        log.info("LOCAL MODE: environment {} ready; use header 'Authorization: Bearer {}'",
                LOCAL_ENVIRONMENT, localToken());
    }

    private void seed() {
        LocalDateTime now = LocalDateTime.now(clock);
        log.info("Seeding local organization {}", LOCAL_ORGANIZATION);

        planRepository.save(OrganizationPlan.builder()
                .organizationId(LOCAL_ORGANIZATION)
                .planType("professional")
                .status(PlanStatus.ACTIVE)
                .maxAssessmentsPerMonth(50)
                .maxSubscriptions(10)
                .includesApiAccess(true)
                .includesWhiteLabel(false)
                .includesCustomBranding(false)
                .createdAt(now)
                .build());

        clientRepository.save(Client.builder()
                .id(LOCAL_CLIENT)
                .organizationId(LOCAL_ORGANIZATION)
                .name("Contoso (local)")
                .active(true)
                .createdAt(now)
                .build());

        credentialRepository.save(CredentialRecord.builder()
                .clientId(LOCAL_CLIENT)
                .organizationId(LOCAL_ORGANIZATION)
                .accessToken("local-access-token")
                .refreshToken("local-refresh-token")
                .expiresAt(clock.instant().plus(Duration.ofMinutes(2)))
                .status(CredentialStatus.VALID)
                .build());

        environmentRepository.save(AzureEnvironment.builder()
                .id(LOCAL_ENVIRONMENT)
                .organizationId(LOCAL_ORGANIZATION)
                .customerId(LOCAL_CUSTOMER)
                .clientId(LOCAL_CLIENT)
                .name("Contoso Production")
                .tenantId("00000000-0000-0000-0000-0000000000f1")
                .subscriptionIds(new ArrayList<>(List.of(
                        "11111111-1111-1111-1111-111111111111",
                        "22222222-2222-2222-2222-222222222222")))
                .active(true)
                .createdAt(now)
                .build());
    }

    private String localToken() {
        return Jwts.builder()
                .subject(LOCAL_CUSTOMER.toString())
                .issuer(jwtIssuer)
                .claim("org", LOCAL_ORGANIZATION.toString())
                .claim("roles", "ROLE_USER,ROLE_ADMIN")
                .expiration(Date.from(clock.instant().plus(Duration.ofDays(1))))
                .signWith(Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }
}
