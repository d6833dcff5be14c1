package com.microsoft.cloudgovernance.config;

import com.microsoft.cloudgovernance.analysis.PolicyAnalyzer;
import com.microsoft.cloudgovernance.domain.model.AnalyzerKind;
import com.microsoft.cloudgovernance.inventory.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for analyzers and Azure adapters.
 */
@Configuration
public class AdapterConfig {

    @Bean
    public Map<AnalyzerKind, PolicyAnalyzer> policyAnalyzers(List<PolicyAnalyzer> analyzers) {
        return analyzers.stream()
                .collect(Collectors.toMap(
                        PolicyAnalyzer::kind,
                        Function.identity(),
                        (first, second) -> {
                            throw new IllegalStateException("Two analyzers registered for " + first.kind());
                        },
                        () -> new EnumMap<>(AnalyzerKind.class)
                ));
    }

    @Bean
    @Primary
    public RestTemplate restTemplate(
            RestTemplateBuilder builder,
            @Value("${compass.http.connect-timeout:10s}") Duration connectTimeout,
            @Value("${compass.http.read-timeout:60s}") Duration readTimeout
    ) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    /**
     * Token endpoint client. Its timeouts bound how long a token refresh can take,
     * which the credential vault checks its wait timeout against.
     */
    @Bean
    public RestTemplate identityRestTemplate(
            RestTemplateBuilder builder,
            @Value("${compass.oauth.connect-timeout:5s}") Duration connectTimeout,
            @Value("${compass.oauth.read-timeout:20s}") Duration readTimeout
    ) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    /**
     * Resource Graph retry schedule: exponential backoff with jitter, honoring Retry-After.
     */
    @Bean
    public RetryPolicy inventoryRetryPolicy(
            @Value("${compass.inventory.retry.max-attempts:4}") int maxAttempts,
            @Value("${compass.inventory.retry.base-delay:1s}") Duration baseDelay,
            @Value("${compass.inventory.retry.max-delay:30s}") Duration maxDelay,
            @Value("${compass.inventory.retry.jitter:0.2}") double jitter
    ) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitter);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
