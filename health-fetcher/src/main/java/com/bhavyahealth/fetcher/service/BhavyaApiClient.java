package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.exception.PermanentEndpointException;
import com.bhavyahealth.fetcher.exception.TransientEndpointException;
import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.EndpointResult;
import com.bhavyahealth.fetcher.model.EndpointSpec;
import com.bhavyahealth.fetcher.model.FailureKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thin client over the Bhavya REST API.
 *
 * Each endpoint is a GET carrying a JSON body {"tdate": date, "dEndDate": date}.
 * Transient failures (I/O, timeout, 5xx, 429, 401 with a stale token) are retried by the
 * bhavyaApi Resilience4j retry; anything else fails at once. No attempt starts after the
 * hard ceiling and every wait, the token included, is capped by the time left, so a call
 * never takes much longer than the ceiling.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BhavyaApiClient implements EndpointClient {

    private static final String[] LIST_WRAPPERS = {"data", "result", "results", "records"};

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BhavyaTokenProvider tokenProvider;
    private final Retry bhavyaApiRetry;
    private final HealthFetcherProperties properties;
    private final Clock clock;

    @Override
    public EndpointResult fetch(DateKey date, EndpointSpec endpoint) {
        Instant deadline = clock.instant().plus(properties.getApi().getHardCeiling());
        try {
            JsonNode payload = bhavyaApiRetry.executeCallable(() -> attempt(date, endpoint, deadline));
            return EndpointResult.success(endpoint, flatten(payload));

        } catch (TransientEndpointException e) {
            log.warn("{} for {} failed after retries: {}", endpoint.id(), date, e.getMessage());
            return EndpointResult.failure(endpoint, e.getKind(), e.getMessage());

        } catch (PermanentEndpointException e) {
            log.warn("{} for {} failed: {}", endpoint.id(), date, e.getMessage());
            return EndpointResult.failure(endpoint, e.getKind(), e.getMessage());

        } catch (Exception e) {
            log.error("Unexpected failure calling {} for {}: {}", endpoint.id(), date, e.getMessage(), e);
            return EndpointResult.failure(endpoint, FailureKind.UNEXPECTED, e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** One attempt; a transient failure that leaves no time before the deadline is final. */
    private JsonNode attempt(DateKey date, EndpointSpec endpoint, Instant deadline) {
        try {
            return call(date, endpoint, deadline);
        } catch (TransientEndpointException e) {
            if (clock.instant().isBefore(deadline)) {
                throw e;
            }
            throw new PermanentEndpointException(e.getKind(), e.getMessage() + ", gave up after "
                    + properties.getApi().getHardCeiling().toSeconds() + "s", e);
        }
    }

    private JsonNode call(DateKey date, EndpointSpec endpoint, Instant deadline) {
        remainingBefore(deadline);
        String token = tokenProvider.currentToken(deadline);

        // the token wait may have used up the budget
        Duration remaining = remainingBefore(deadline);
        Duration timeout = remaining.compareTo(properties.getApi().getCallTimeout()) < 0
                ? remaining
                : properties.getApi().getCallTimeout();

        String url = properties.getApi().getBaseUrl() + "/" + endpoint.path();
        log.debug("Calling Bhavya API: {} for {}", url, date);

        HttpResponse<String> response;
        try {
            String body = objectMapper.writeValueAsString(Map.of(
                    "tdate", date.toString(),
                    "dEndDate", date.toString()));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + token)
                    .header("Content-Type", "application/json")
                    .method("GET", HttpRequest.BodyPublishers.ofString(body))
                    .build();

            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        } catch (HttpTimeoutException e) {
            throw new TransientEndpointException(FailureKind.TIMEOUT, "Timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new TransientEndpointException(FailureKind.CONNECTION, "I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PermanentEndpointException(FailureKind.INTERRUPTED, "Interrupted", e);
        }

        int status = response.statusCode();
        if (status == 200) {
            return extractPayload(response.body());
        }
        if (status == 401) {
            tokenProvider.invalidate(token);
            throw new TransientEndpointException(FailureKind.AUTHENTICATION, "HTTP 401, token rejected");
        }
        if (status == 429) {
            throw new TransientEndpointException(FailureKind.RATE_LIMITED, "HTTP 429");
        }
        if (status >= 500) {
            throw new TransientEndpointException(FailureKind.SERVER_ERROR, "HTTP " + status);
        }
        throw new PermanentEndpointException(FailureKind.CLIENT_ERROR, "HTTP " + status);
    }

    private Duration remainingBefore(Instant deadline) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new PermanentEndpointException(FailureKind.TIMEOUT,
                    "Gave up after " + properties.getApi().getHardCeiling().toSeconds() + "s");
        }
        return remaining;
    }

    /**
     * The API answers in several shapes: a bare list, an object wrapping a list under one of
     * {@link #LIST_WRAPPERS}, or a plain object. The first row is the one we want.
     */
    JsonNode extractPayload(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PermanentEndpointException(FailureKind.MALFORMED_PAYLOAD, "Response is not JSON", e);
        }
        if (root == null) {
            throw new PermanentEndpointException(FailureKind.EMPTY_PAYLOAD, "Empty response");
        }

        if (root.isArray()) {
            if (root.isEmpty()) {
                throw new PermanentEndpointException(FailureKind.EMPTY_PAYLOAD, "Empty list");
            }
            JsonNode first = root.get(0);
            return first.isObject() ? first : objectMapper.createObjectNode().set("value", first);
        }
        if (root.isObject()) {
            for (String wrapper : LIST_WRAPPERS) {
                JsonNode list = root.get(wrapper);
                if (list != null && list.isArray() && !list.isEmpty()) {
                    return list.get(0);
                }
            }
            return root;
        }
        throw new PermanentEndpointException(FailureKind.EMPTY_PAYLOAD, "Unexpected payload: " + root.getNodeType());
    }

    private Map<String, String> flatten(JsonNode payload) {
        Map<String, String> values = new LinkedHashMap<>();
        if (payload == null || !payload.isObject()) {
            return values;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) continue;
            values.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return values;
    }
}
