package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.exception.PermanentEndpointException;
import com.bhavyahealth.fetcher.exception.TransientEndpointException;
import com.bhavyahealth.fetcher.model.FailureKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Obtains and caches the bearer token for the Bhavya API.
 *
 * At most one token request is in flight. Callers share it and each waits no longer than
 * its own deadline allows; the lock is never held while the request is on the wire.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BhavyaTokenProvider {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HealthFetcherProperties properties;
    private final Clock clock;

    private volatile String token;

    // guarded by this
    private CompletableFuture<String> inFlight;

    /**
     * Returns the cached token, requesting one if needed.
     *
     * @param deadline the caller's hard ceiling; the wait is capped by it and by the call timeout
     */
    public String currentToken(Instant deadline) {
        String cached = token;
        if (cached != null) {
            return cached;
        }

        Duration wait = waitBudget(deadline);
        CompletableFuture<String> request = shared(deadline);
        try {
            return request.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TransientEndpointException(FailureKind.TIMEOUT,
                    "No token within " + wait.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PermanentEndpointException(FailureKind.INTERRUPTED, "Interrupted", e);
        }
    }

    /** Forgets the token if it is still the one that was rejected. */
    public synchronized void invalidate(String staleToken) {
        if (staleToken != null && staleToken.equals(token)) {
            log.info("Bhavya token rejected, will request a new one");
            token = null;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private synchronized CompletableFuture<String> shared(Instant deadline) {
        if (token != null) {
            return CompletableFuture.completedFuture(token);
        }
        if (inFlight != null) {
            return inFlight;
        }
        CompletableFuture<String> request = requestToken(waitBudget(deadline));
        inFlight = request;
        request.whenComplete((value, failure) -> settle(request, value));
        return request;
    }

    private synchronized void settle(CompletableFuture<String> request, String value) {
        if (inFlight == request) {
            inFlight = null;
        }
        if (value != null) {
            token = value;
            log.info("Obtained Bhavya API token");
        }
    }

    private Duration waitBudget(Instant deadline) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new PermanentEndpointException(FailureKind.TIMEOUT, "No time left to obtain a token");
        }
        Duration callTimeout = properties.getApi().getCallTimeout();
        return remaining.compareTo(callTimeout) < 0 ? remaining : callTimeout;
    }

    private CompletableFuture<String> requestToken(Duration timeout) {
        HealthFetcherProperties.Api api = properties.getApi();
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of(
                    "secretKey", api.getSecretKey(),
                    "clientKey", api.getClientKey()));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new PermanentEndpointException(FailureKind.AUTHENTICATION, "Cannot encode token request", e));
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(api.getBaseUrl() + "/generateToken"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.debug("Requesting Bhavya token, timeout {}ms", timeout.toMillis());
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(this::readToken);
    }

    private String readToken(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status >= 500 || status == 429) {
            throw new TransientEndpointException(FailureKind.SERVER_ERROR, "Token endpoint returned HTTP " + status);
        }
        if (status != 200) {
            throw new PermanentEndpointException(FailureKind.AUTHENTICATION, "Token endpoint returned HTTP " + status);
        }
        return extractToken(response.body());
    }

    private RuntimeException translate(Throwable cause) {
        if (cause instanceof TransientEndpointException || cause instanceof PermanentEndpointException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof HttpTimeoutException) {
            return new TransientEndpointException(FailureKind.TIMEOUT, "Token request timed out", cause);
        }
        if (cause instanceof IOException) {
            return new TransientEndpointException(FailureKind.CONNECTION, "Token request failed: " + cause.getMessage(), cause);
        }
        return new PermanentEndpointException(FailureKind.AUTHENTICATION, "Token request failed: " + cause, cause);
    }

    private String extractToken(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PermanentEndpointException(FailureKind.AUTHENTICATION, "Token response is not JSON", e);
        }
        if (root != null && root.isTextual() && !root.asText().isBlank()) {
            return root.asText();
        }
        if (root != null && root.isObject()) {
            for (String field : new String[]{"token", "access_token", "accessToken"}) {
                JsonNode value = root.get(field);
                if (value != null && value.isTextual() && !value.asText().isBlank()) {
                    return value.asText();
                }
            }
        }
        throw new PermanentEndpointException(FailureKind.AUTHENTICATION, "Token response carries no token");
    }
}
