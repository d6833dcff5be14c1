package com.microsoft.cloudgovernance.adapters.azure;

import com.fasterxml.jackson.databind.JsonNode;
import com.microsoft.cloudgovernance.adapters.ResourceGraphClient;
import com.microsoft.cloudgovernance.adapters.ResourceGraphException;
import com.microsoft.cloudgovernance.adapters.ResourceGraphException.ErrorKind;
import com.microsoft.cloudgovernance.credential.AccessCredential;
import com.microsoft.cloudgovernance.domain.model.ResourceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Resource Graph client over the ARM REST API.
 *
 * DATA SOURCES:
 * 1. POST /providers/Microsoft.ResourceGraph/resources - paged KQL queries
 * 2. GET /subscriptions/{id} - access probe
 *
 * THROTTLING:
 * Resource Graph answers 429 with either Retry-After (seconds) or
 * x-ms-user-quota-resets-after (hh:mm:ss). Both are surfaced on the
 * exception so the retry policy can wait the requested time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AzureResourceGraphClient implements ResourceGraphClient {

    static final String RESOURCE_GRAPH_URL =
            "https://management.azure.com/providers/Microsoft.ResourceGraph/resources?api-version=2021-03-01";
    static final String SUBSCRIPTION_URL =
            "https://management.azure.com/subscriptions/{subscriptionId}?api-version=2020-01-01";

    private final RestTemplate restTemplate;

    @Override
    public ResourceGraphPage query(
            List<String> subscriptionIds,
            String query,
            String skipToken,
            int pageSize,
            AccessCredential credential
    ) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("$top", pageSize);
        options.put("resultFormat", "objectArray");
        if (skipToken != null) {
            options.put("$skipToken", skipToken);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("subscriptions", subscriptionIds);
        body.put("query", query);
        body.put("options", options);

        log.debug("Resource Graph query: subscriptions={}, continued={}", subscriptionIds, skipToken != null);

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    RESOURCE_GRAPH_URL,
                    HttpMethod.POST,
                    new HttpEntity<>(body, bearerHeaders(credential)),
                    JsonNode.class
            );

            JsonNode root = response.getBody();
            if (root == null) {
                throw new ResourceGraphException(ErrorKind.TRANSIENT, "Empty Resource Graph response");
            }

            List<ResourceSnapshot> resources = new ArrayList<>();
            for (JsonNode row : root.path("data")) {
                resources.add(toSnapshot(row));
            }

            String nextToken = root.path("$skipToken").asText(null);
            long total = root.path("totalRecords").asLong(resources.size());
            return new ResourceGraphPage(resources, nextToken, total);

        } catch (HttpStatusCodeException e) {
            throw classify(e, "Resource Graph query");
        } catch (ResourceAccessException e) {
            throw connectivityFailure(e, "Resource Graph query");
        }
    }

    @Override
    public SubscriptionInfo getSubscription(String subscriptionId, AccessCredential credential) {
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    SUBSCRIPTION_URL,
                    HttpMethod.GET,
                    new HttpEntity<>(bearerHeaders(credential)),
                    JsonNode.class,
                    subscriptionId
            );
            JsonNode root = response.getBody();
            if (root == null) {
                return new SubscriptionInfo(subscriptionId, null, null);
            }
            return new SubscriptionInfo(
                    root.path("subscriptionId").asText(subscriptionId),
                    root.path("displayName").asText(null),
                    root.path("state").asText(null)
            );
        } catch (HttpStatusCodeException e) {
            throw classify(e, "Subscription lookup " + subscriptionId);
        } catch (ResourceAccessException e) {
            throw connectivityFailure(e, "Subscription lookup " + subscriptionId);
        }
    }

    private HttpHeaders bearerHeaders(AccessCredential credential) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credential.accessToken());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    ResourceSnapshot toSnapshot(JsonNode row) {
        Map<String, String> tags = new LinkedHashMap<>();
        JsonNode tagNode = row.path("tags");
        if (tagNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = tagNode.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                tags.put(field.getKey(), field.getValue().isNull() ? "" : field.getValue().asText());
            }
        }

        JsonNode sku = row.path("sku");
        String skuName = sku.isObject() ? sku.path("name").asText(null) : sku.asText(null);

        return new ResourceSnapshot(
                row.path("id").asText(null),
                row.path("name").asText(null),
                row.path("type").asText(null),
                row.path("resourceGroup").asText(null),
                row.path("location").asText(null),
                row.path("subscriptionId").asText(null),
                tags,
                skuName,
                row.path("kind").asText(null)
        );
    }

    static ResourceGraphException classify(HttpStatusCodeException e, String operation) {
        int status = e.getStatusCode().value();
        ErrorKind kind = switch (status) {
            case 429 -> ErrorKind.THROTTLED;
            case 401 -> ErrorKind.UNAUTHORIZED;
            case 403 -> ErrorKind.FORBIDDEN;
            case 404 -> ErrorKind.NOT_FOUND;
            case 408 -> ErrorKind.TIMEOUT;
            case 400, 422 -> ErrorKind.BAD_REQUEST;
            default -> status >= 500 ? ErrorKind.TRANSIENT : ErrorKind.BAD_REQUEST;
        };
        Duration retryAfter = kind == ErrorKind.THROTTLED || kind == ErrorKind.TRANSIENT
                ? parseRetryAfter(e.getResponseHeaders())
                : null;
        return new ResourceGraphException(kind, status, retryAfter,
                operation + " failed with HTTP " + status, e);
    }

    static ResourceGraphException connectivityFailure(ResourceAccessException e, String operation) {
        ErrorKind kind = e.getCause() instanceof SocketTimeoutException ? ErrorKind.TIMEOUT : ErrorKind.TRANSIENT;
        return new ResourceGraphException(kind, null, null, operation + " could not reach Azure: " + e.getMessage(), e);
    }

    static Duration parseRetryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String retryAfter = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (retryAfter != null) {
            try {
                return Duration.ofSeconds(Long.parseLong(retryAfter.trim()));
            } catch (NumberFormatException ignored) {
                log.debug("Unparseable Retry-After header: {}", retryAfter);
            }
        }
        String quotaReset = headers.getFirst("x-ms-user-quota-resets-after");
        if (quotaReset != null) {
            try {
                return Duration.ofSeconds(LocalTime.parse(quotaReset.trim()).toSecondOfDay());
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable quota reset header: {}", quotaReset);
            }
        }
        return null;
    }
}
