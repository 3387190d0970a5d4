package com.bhavyahealth.fetcher.config;

import com.bhavyahealth.fetcher.exception.InvalidRangeException;
import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.DebugReport;
import com.bhavyahealth.fetcher.model.EndpointSpec;
import com.bhavyahealth.fetcher.model.FetchStatus;
import com.bhavyahealth.fetcher.model.ProgressEvent;
import com.bhavyahealth.fetcher.model.TableSetup;
import com.bhavyahealth.fetcher.service.HealthFetchService;
import com.bhavyahealth.fetcher.service.ProgressStream;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class FetchController {

    private final HealthFetchService fetchService;
    private final HealthFetcherProperties properties;

    // ── Service info ──────────────────────────────────────────────────────────

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok", "message", "Bhavya Health Data Fetcher API"));
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        try {
            FetchStatus status = fetchService.status();
            return ResponseEntity.ok(status);
        } catch (Exception e) {
            log.error("Status query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("status", "error", "error", e.getMessage()));
        }
    }

    /**
     * Create the table if it is missing.
     *
     * POST /api/setup-table
     */
    @PostMapping("/setup-table")
    public ResponseEntity<TableSetup> setupTable() {
        TableSetup setup = fetchService.setupTable();
        return setup.isSuccess()
                ? ResponseEntity.ok(setup)
                : ResponseEntity.internalServerError().body(setup);
    }

    @GetMapping("/debug")
    public ResponseEntity<DebugReport> debug() {
        return ResponseEntity.ok(fetchService.debug());
    }

    @GetMapping("/endpoints")
    public ResponseEntity<Map<String, Object>> endpoints() {
        List<EndpointSpec> endpoints = fetchService.listEndpoints();
        return ResponseEntity.ok(Map.of("endpoints", endpoints, "total", endpoints.size()));
    }

    // ── Fetch triggers (streamed as server-sent events) ──────────────────────

    /**
     * Fetch today's data.
     *
     * GET /api/fetch/today
     */
    @GetMapping("/fetch/today")
    public SseEmitter fetchToday() {
        return stream(fetchService.runToday());
    }

    /**
     * Fetch an inclusive date range.
     *
     * POST /api/fetch/range  {"from_date": "2024-01-01", "to_date": "2024-01-31"}
     */
    @PostMapping("/fetch/range")
    public SseEmitter fetchRange(@RequestBody DateRangeRequest request) {
        if (request.getFromDate() == null || request.getToDate() == null) {
            throw new IllegalArgumentException("Both from_date and to_date are required");
        }
        DateKey from = DateKey.parse(request.getFromDate());
        DateKey to = DateKey.parse(request.getToDate());
        return stream(fetchService.runRange(from, to));
    }

    @ExceptionHandler({InvalidRangeException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", e.getMessage()));
    }

    private SseEmitter stream(ProgressStream progress) {
        SseEmitter emitter = new SseEmitter(properties.getFetch().getSseTimeout().toMillis());
        emitter.onCompletion(progress::close);
        emitter.onTimeout(progress::close);
        emitter.onError(e -> progress.close());

        new Thread(() -> pump(progress, emitter), "sse-" + progress.job().getId()).start();
        return emitter;
    }

    private void pump(ProgressStream progress, SseEmitter emitter) {
        try {
            while (progress.hasNext()) {
                ProgressEvent event = progress.next();
                emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
            }
            emitter.complete();
        } catch (IOException e) {
            log.info("Client disconnected from job {}: {}", progress.job().getId(), e.getMessage());
            progress.close();
        } catch (Exception e) {
            log.error("Streaming job {} failed: {}", progress.job().getId(), e.getMessage(), e);
            progress.close();
            emitter.completeWithError(e);
        }
    }

    @Data
    public static class DateRangeRequest {
        @JsonProperty("from_date")
        private String fromDate;
        @JsonProperty("to_date")
        private String toDate;
    }
}
