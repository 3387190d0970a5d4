package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.exception.PermanentEndpointException;
import com.bhavyahealth.fetcher.exception.TransientEndpointException;
import com.bhavyahealth.fetcher.model.FailureKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BhavyaTokenProviderTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private final Clock clock = Clock.systemUTC();
    private final HealthFetcherProperties properties = new HealthFetcherProperties();
    private BhavyaTokenProvider provider;

    @BeforeEach
    void setUp() {
        properties.getApi().setBaseUrl("https://api.example.test/bhavya");
        properties.getApi().setSecretKey("secret");
        properties.getApi().setClientKey("client");
        provider = new BhavyaTokenProvider(httpClient, new ObjectMapper(), properties, clock);
    }

    private Instant deadline() {
        return clock.instant().plusSeconds(30);
    }

    private void answer(HttpResponse<String> value) {
        doReturn(CompletableFuture.completedFuture(value)).when(httpClient).sendAsync(any(), any());
    }

    @Test
    void currentToken_RequestedOnceAndCached() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"token\": \"abc\"}");
        answer(response);

        assertEquals("abc", provider.currentToken(deadline()));
        assertEquals("abc", provider.currentToken(deadline()));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(1)).sendAsync(request.capture(), any());
        assertEquals("POST", request.getValue().method());
        assertEquals(URI.create("https://api.example.test/bhavya/generateToken"), request.getValue().uri());
    }

    @Test
    void currentToken_RequestTimeout_CappedByDeadline() {
        properties.getApi().setCallTimeout(Duration.ofSeconds(10));
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"token\": \"abc\"}");
        answer(response);

        provider.currentToken(clock.instant().plusSeconds(2));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(request.capture(), any());
        Duration timeout = request.getValue().timeout().orElseThrow();
        assertTrue(timeout.compareTo(Duration.ofSeconds(2)) <= 0, "timeout was " + timeout);
    }

    @Test
    void currentToken_ConcurrentCallers_ShareOneRequest() throws Exception {
        CompletableFuture<HttpResponse<String>> pending = new CompletableFuture<>();
        doReturn(pending).when(httpClient).sendAsync(any(), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"token\": \"shared\"}");

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> tokens = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                tokens.add(callers.submit(() -> provider.currentToken(deadline())));
            }
            verify(httpClient, timeout(2000)).sendAsync(any(), any());
            pending.complete(response);

            for (Future<String> token : tokens) {
                assertEquals("shared", token.get(5, TimeUnit.SECONDS));
            }
        } finally {
            callers.shutdownNow();
        }
        verify(httpClient, times(1)).sendAsync(any(), any());
    }

    @Test
    void currentToken_NoAnswer_GivesUpAtDeadline() {
        doReturn(new CompletableFuture<HttpResponse<String>>()).when(httpClient).sendAsync(any(), any());

        long start = System.nanoTime();
        TransientEndpointException e = assertThrows(TransientEndpointException.class,
                () -> provider.currentToken(clock.instant().plusMillis(300)));
        long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(FailureKind.TIMEOUT, e.getKind());
        assertTrue(millis < 1000, "waited " + millis + "ms");
    }

    @Test
    void currentToken_DeadlinePassed_FailsWithoutRequest() {
        PermanentEndpointException e = assertThrows(PermanentEndpointException.class,
                () -> provider.currentToken(clock.instant().minusMillis(1)));

        assertEquals(FailureKind.TIMEOUT, e.getKind());
        verifyNoInteractions(httpClient);
    }

    @Test
    void currentToken_FailedRequest_IsNotCached() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"token\": \"second\"}");
        doReturn(CompletableFuture.failedFuture(new ConnectException("refused")),
                CompletableFuture.completedFuture(response))
                .when(httpClient).sendAsync(any(), any());

        TransientEndpointException e = assertThrows(TransientEndpointException.class,
                () -> provider.currentToken(deadline()));

        assertEquals(FailureKind.CONNECTION, e.getKind());
        assertEquals("second", provider.currentToken(deadline()));
    }

    @Test
    void invalidate_StaleToken_ForcesNewRequest() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"access_token\": \"one\"}", "{\"accessToken\": \"two\"}");
        answer(response);

        String first = provider.currentToken(deadline());
        provider.invalidate(first);

        assertEquals("one", first);
        assertEquals("two", provider.currentToken(deadline()));
    }

    @Test
    void invalidate_OtherToken_KeepsCurrent() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("\"plain\"");
        answer(response);

        provider.currentToken(deadline());
        provider.invalidate("something-else");
        provider.currentToken(deadline());

        verify(httpClient, times(1)).sendAsync(any(), any());
    }

    @Test
    void currentToken_Forbidden_IsPermanentAuthenticationFailure() {
        when(response.statusCode()).thenReturn(403);
        answer(response);

        PermanentEndpointException e = assertThrows(PermanentEndpointException.class,
                () -> provider.currentToken(deadline()));
        assertEquals(FailureKind.AUTHENTICATION, e.getKind());
    }

    @Test
    void currentToken_ServerError_IsTransient() {
        when(response.statusCode()).thenReturn(502);
        answer(response);

        assertThrows(TransientEndpointException.class, () -> provider.currentToken(deadline()));
    }

    @Test
    void currentToken_ResponseWithoutToken_Fails() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"status\": \"ok\"}");
        answer(response);

        assertThrows(PermanentEndpointException.class, () -> provider.currentToken(deadline()));
    }
}
