package com.microsoft.cloudgovernance.config;

import com.microsoft.cloudgovernance.adapters.IdentityProviderClient;
import com.microsoft.cloudgovernance.adapters.IdentityProviderException;
import com.microsoft.cloudgovernance.adapters.ResourceGraphClient;
import com.microsoft.cloudgovernance.credential.AccessCredential;
import com.microsoft.cloudgovernance.domain.model.ResourceSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.*;

/**
 * Local development configuration.
 *
 * ENABLED WHEN: app.env=local (the default)
 *
 * This configuration:
 * 1. Leaves every endpoint open; bearer tokens are still honoured when sent
 * 2. Enables permissive CORS for localhost
 * 3. Replaces Resource Graph with a fixed sample inventory
 * 4. Replaces the identity provider with one that issues local tokens
 *
 * No Azure credentials are required.
 */
@Configuration
@ConditionalOnProperty(name = "app.env", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalDevConfig {

    @Bean
    public SecurityFilterChain localSecurityFilterChain(HttpSecurity http) throws Exception {
        log.info("LOCAL MODE: Security disabled for development");

        http
            .cors(cors -> cors.configurationSource(localCorsConfig()))
            .csrf(AbstractHttpConfigurer::disable)
            .authorizeHttpRequests(auth -> auth.anyRequest().permitAll());

        return http.build();
    }

    @Bean
    public CorsConfigurationSource localCorsConfig() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOriginPatterns(List.of(
            "http://localhost:*",
            "https://localhost:*"
        ));
        config.setAllowedMethods(List.of("GET", "POST", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(List.of("*"));
        config.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }

    @Bean
    @Primary
    public ResourceGraphClient mockResourceGraphClient() {
        log.info("LOCAL MODE: Using sample Resource Graph inventory");
        return new SampleResourceGraphClient();
    }

    @Bean
    @Primary
    public IdentityProviderClient mockIdentityProviderClient() {
        return refreshToken -> {
            if (refreshToken == null || refreshToken.startsWith("revoked")) {
                throw new IdentityProviderException(IdentityProviderException.ErrorKind.AUTHORIZATION,
                        "Local refresh token revoked", null);
            }
            return new IdentityProviderClient.TokenResponse(
                    "local-" + UUID.randomUUID(), refreshToken, 3600, "https://management.azure.com/.default");
        };
    }

    /**
     * Serves the same small inventory for every subscription, with a mix of
     * compliant and non-compliant names and tags.
     */
    static class SampleResourceGraphClient implements ResourceGraphClient {

        @Override
        public ResourceGraphPage query(List<String> subscriptionIds, String query, String skipToken,
                                       int pageSize, AccessCredential credential) {
            List<ResourceSnapshot> resources = new ArrayList<>();
            for (String subscriptionId : subscriptionIds) {
                resources.addAll(sampleResources(subscriptionId));
            }
            List<ResourceSnapshot> page = resources.subList(0, Math.min(pageSize, resources.size()));
            log.debug("MOCK: Resource Graph returned {} resources for {}", page.size(), subscriptionIds);
            return new ResourceGraphPage(List.copyOf(page), null, resources.size());
        }

        @Override
        public SubscriptionInfo getSubscription(String subscriptionId, AccessCredential credential) {
            return new SubscriptionInfo(subscriptionId, "Local Subscription", "Enabled");
        }

        private static List<ResourceSnapshot> sampleResources(String subscriptionId) {
            String group = "/subscriptions/" + subscriptionId + "/resourceGroups/rg-app-prod/providers/";
            return List.of(
                resource(group + "Microsoft.Compute/virtualMachines/vm-web-prod-001", "vm-web-prod-001",
                        "Microsoft.Compute/virtualMachines", subscriptionId,
                        Map.of("Environment", "prod", "Owner", "platform-team", "Project", "web",
                               "CostCenter", "cc-100", "Department", "it")),
                resource(group + "Microsoft.Compute/virtualMachines/WebServer2", "WebServer2",
                        "Microsoft.Compute/virtualMachines", subscriptionId,
                        Map.of("environment", "prod")),
                resource(group + "Microsoft.Storage/storageAccounts/stappdata01", "stappdata01",
                        "Microsoft.Storage/storageAccounts", subscriptionId,
                        Map.of("Environment", "", "Owner", "data-team")),
                resource(group + "Microsoft.Web/sites/app-api-dev", "app-api-dev",
                        "Microsoft.Web/sites", subscriptionId, Map.of()),
                resource(group + "Microsoft.KeyVault/vaults/kv_secrets_prod", "kv_secrets_prod",
                        "Microsoft.KeyVault/vaults", subscriptionId,
                        Map.of("Environment", "prod", "Owner", "security"))
            );
        }

        private static ResourceSnapshot resource(String id, String name, String type, String subscriptionId,
                                                 Map<String, String> tags) {
            return new ResourceSnapshot(id, name, type, "rg-app-prod", "eastus", subscriptionId,
                    new LinkedHashMap<>(tags), null, null);
        }
    }
}
