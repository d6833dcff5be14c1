package com.microsoft.cloudgovernance.adapters.azure;

import com.fasterxml.jackson.databind.JsonNode;
import com.microsoft.cloudgovernance.adapters.IdentityProviderClient;
import com.microsoft.cloudgovernance.adapters.IdentityProviderException;
import com.microsoft.cloudgovernance.adapters.IdentityProviderException.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;

/**
 * Refresh-token exchange against the Microsoft identity platform.
 *
 * ERROR CLASSIFICATION:
 * - 400/401 (invalid_grant, consent revoked) -> AUTHORIZATION, never retried
 * - 429/5xx, connection refused -> UNAVAILABLE
 * - socket timeout -> TIMEOUT
 */
@Component
@Slf4j
public class MicrosoftIdentityClient implements IdentityProviderClient {

    private final RestTemplate restTemplate;

    @Value("${compass.oauth.token-endpoint:https://login.microsoftonline.com/common/oauth2/v2.0/token}")
    private String tokenEndpoint;

    @Value("${compass.oauth.client-id:}")
    private String clientId;

    @Value("${compass.oauth.client-secret:}")
    private String clientSecret;

    @Value("${compass.oauth.scope:https://management.azure.com/user_impersonation offline_access}")
    private String scope;

    public MicrosoftIdentityClient(@Qualifier("identityRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public TokenResponse refresh(String refreshToken) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        form.add("client_id", clientId);
        if (clientSecret != null && !clientSecret.isBlank()) {
            form.add("client_secret", clientSecret);
        }
        form.add("scope", scope);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            JsonNode body = restTemplate.postForObject(tokenEndpoint, new HttpEntity<>(form, headers), JsonNode.class);
            if (body == null || body.path("access_token").isMissingNode()) {
                throw new IdentityProviderException(ErrorKind.UNAVAILABLE, "Token endpoint returned no access token", null);
            }
            return new TokenResponse(
                    body.path("access_token").asText(),
                    body.path("refresh_token").asText(refreshToken),
                    body.path("expires_in").asLong(3600),
                    body.path("scope").asText(scope)
            );

        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 400 || status == 401) {
                log.warn("Refresh token rejected by identity provider: HTTP {}", status);
                throw new IdentityProviderException(ErrorKind.AUTHORIZATION,
                        "Refresh token rejected (HTTP " + status + ")", e);
            }
            throw new IdentityProviderException(ErrorKind.UNAVAILABLE,
                    "Identity provider returned HTTP " + status, e);
        } catch (ResourceAccessException e) {
            ErrorKind kind = e.getCause() instanceof SocketTimeoutException ? ErrorKind.TIMEOUT : ErrorKind.UNAVAILABLE;
            throw new IdentityProviderException(kind, "Identity provider unreachable: " + e.getMessage(), e);
        }
    }
}
