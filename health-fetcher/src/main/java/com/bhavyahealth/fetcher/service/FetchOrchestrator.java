package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.exception.StorageException;
import com.bhavyahealth.fetcher.model.BatchSummary;
import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.DateSummary;
import com.bhavyahealth.fetcher.model.EndpointResult;
import com.bhavyahealth.fetcher.model.EndpointSpec;
import com.bhavyahealth.fetcher.model.FailureKind;
import com.bhavyahealth.fetcher.model.FetchJob;
import com.bhavyahealth.fetcher.model.HealthRecord;
import com.bhavyahealth.fetcher.model.ProgressEvent;
import com.bhavyahealth.fetcher.output.HealthRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a {@link FetchJob}: for every pending date, calls all endpoints on a bounded pool,
 * merges the results, upserts the row and reports progress.
 *
 * Workers never touch the progress stream. They post messages to the job's inbox and the
 * job thread alone publishes, releasing date_done / date_skipped strictly in request order
 * even when several dates are in flight.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FetchOrchestrator {

    static final String ALREADY_STORED = "Already exists in database";
    static final String STORED_CONCURRENTLY = "Stored by a concurrent job";

    private final EndpointCatalog catalog;
    private final EndpointClient endpointClient;
    private final HealthRecordMerger merger;
    private final HealthRecordStore store;
    private final HealthFetcherProperties properties;

    public ProgressStream run(FetchJob job) {
        return new ProgressStream(job, properties.getFetch().getBufferSize(), stream -> {
            Thread thread = new Thread(new JobRun(job, stream), "fetch-job-" + job.getId());
            thread.setDaemon(true);
            thread.start();
        });
    }

    // ── Job execution ────────────────────────────────────────────────────────

    /** Terminal outcome of one date, as posted by a worker. */
    private record DateOutcome(int index, DateKey date, DateSummary summary, String skipReason) {

        static DateOutcome done(int index, DateKey date, DateSummary summary) {
            return new DateOutcome(index, date, summary, null);
        }

        static DateOutcome skipped(int index, DateKey date, String reason) {
            return new DateOutcome(index, date, null, reason);
        }

        boolean isSkipped() {
            return skipReason != null;
        }
    }

    /** Inbox message: either a progress event to forward as is, or a date outcome to order. */
    private record Message(ProgressEvent event, DateOutcome outcome) {
    }

    private final class JobRun implements Runnable {

        private final FetchJob job;
        private final ProgressStream stream;
        private final List<DateKey> dates;
        private final int total;
        private final int dateConcurrency;
        private final BlockingQueue<Message> inbox = new LinkedBlockingQueue<>();
        private final OrderedBuffer<DateOutcome> ordered = new OrderedBuffer<>(0);

        private int processed;
        private int skipped;
        private int errored;
        private int endpointFailures;
        private final Map<String, Integer> failuresByDate = new LinkedHashMap<>();

        JobRun(FetchJob job, ProgressStream stream) {
            this.job = job;
            this.stream = stream;
            this.dates = job.getRequested();
            this.total = dates.size();
            this.dateConcurrency = Math.max(1, properties.getFetch().getDateConcurrency());
        }

        @Override
        public void run() {
            log.info("Job {}: {} dates requested, {} to fetch", job.getId(), total, job.getPending().size());

            ExecutorService datePool = Executors.newFixedThreadPool(dateConcurrency,
                    named("fetch-" + job.getId() + "-date"));
            ExecutorService endpointPool = Executors.newFixedThreadPool(
                    Math.max(1, properties.getFetch().getEndpointConcurrency()),
                    named("fetch-" + job.getId() + "-endpoint"));

            String error = null;
            try {
                processDates(datePool, endpointPool);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                job.cancel();
                error = "Interrupted";
            } catch (RuntimeException e) {
                log.error("Job {} failed: {}", job.getId(), e.getMessage(), e);
                error = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
            } finally {
                if (error == null) {
                    datePool.shutdown();
                    endpointPool.shutdown();
                } else {
                    datePool.shutdownNow();
                    endpointPool.shutdownNow();
                }
                BatchSummary summary = summarise(error);
                log.info("Job {} finished{}: {} processed, {} skipped, {} errored, {} endpoint failures",
                        job.getId(), summary.isCancelled() ? " (cancelled)" : "",
                        processed, skipped, errored, endpointFailures);
                stream.publish(ProgressEvent.batchDone(summary));
            }
        }

        private void processDates(ExecutorService datePool, ExecutorService endpointPool) throws InterruptedException {
            int next = 0;
            int inFlight = 0;

            while (true) {
                // cancellation is only looked at before a new date starts
                while (inFlight < dateConcurrency && next < total && !job.isCancelled()) {
                    int index = next++;
                    DateKey date = dates.get(index);
                    if (job.isPending(date)) {
                        inFlight++;
                        datePool.execute(() -> processDate(index, date, endpointPool));
                    } else {
                        ordered.add(index, DateOutcome.skipped(index, date, ALREADY_STORED));
                        releaseOrdered();
                    }
                }

                if (inFlight == 0 && (next >= total || job.isCancelled())) {
                    break;
                }

                Message message = inbox.take();
                if (message.outcome() != null) {
                    inFlight--;
                    ordered.add(message.outcome().index(), message.outcome());
                    releaseOrdered();
                } else {
                    stream.publish(message.event());
                }
            }

            if (ordered.buffered() > 0) {
                throw new IllegalStateException(ordered.buffered() + " date outcomes were never released");
            }
        }

        private void releaseOrdered() {
            DateOutcome outcome;
            while ((outcome = ordered.pollNext()) != null) {
                stream.publish(toEvent(outcome));
                count(outcome);
            }
        }

        private ProgressEvent toEvent(DateOutcome outcome) {
            int position = outcome.index() + 1;
            return outcome.isSkipped()
                    ? ProgressEvent.dateSkipped(outcome.date(), position, total, outcome.skipReason())
                    : ProgressEvent.dateDone(outcome.date(), position, total, outcome.summary());
        }

        private void count(DateOutcome outcome) {
            if (outcome.isSkipped()) {
                skipped++;
                return;
            }
            DateSummary summary = outcome.summary();
            if (summary.isPersisted()) processed++;
            else errored++;
            endpointFailures += summary.getFailed();
            failuresByDate.put(outcome.date().toString(), summary.getFailed());
        }

        private BatchSummary summarise(String error) {
            Long totalRecords;
            try {
                totalRecords = store.count();
            } catch (RuntimeException e) {
                log.warn("Could not read record count after job {}: {}", job.getId(), e.getMessage());
                totalRecords = null;
            }
            return BatchSummary.builder()
                    .jobId(job.getId())
                    .requested(total)
                    .processed(processed)
                    .skipped(skipped)
                    .errored(errored)
                    .cancelled(job.isCancelled())
                    .endpointFailures(endpointFailures)
                    .endpointFailuresByDate(failuresByDate)
                    .totalRecords(totalRecords)
                    .error(error)
                    .build();
        }

        // ── Per-date work, on the date pool ──────────────────────────────────

        private void processDate(int index, DateKey date, ExecutorService endpointPool) {
            DateOutcome outcome;
            try {
                outcome = fetchDate(index, date, endpointPool);
            } catch (Throwable e) {
                // the job thread waits for exactly one outcome per started date
                log.error("Processing {} failed: {}", date, e.getMessage(), e);
                outcome = DateOutcome.done(index, date, DateSummary.builder()
                        .date(date.toString())
                        .succeeded(0)
                        .failed(catalog.size())
                        .failedEndpoints(List.of())
                        .persisted(false)
                        .error(e.getMessage() == null ? e.getClass().getName() : e.getMessage())
                        .build());
            }
            inbox.add(new Message(null, outcome));
        }

        private DateOutcome fetchDate(int index, DateKey date, ExecutorService endpointPool) {
            if (properties.getFetch().isRecheckBeforeFetch() && storedMeanwhile(date)) {
                log.info("{} was stored by another job, skipping", date);
                return DateOutcome.skipped(index, date, STORED_CONCURRENTLY);
            }

            inbox.add(new Message(ProgressEvent.started(date, index + 1, total), null));
            log.info("Fetching {} endpoints for {}", catalog.size(), date);

            List<CompletableFuture<EndpointResult>> calls = new ArrayList<>(catalog.size());
            for (EndpointSpec endpoint : catalog.all()) {
                calls.add(CompletableFuture
                        .supplyAsync(() -> endpointClient.fetch(date, endpoint), endpointPool)
                        .exceptionally(ex -> EndpointResult.failure(endpoint, FailureKind.UNEXPECTED, rootMessage(ex)))
                        .thenApply(result -> {
                            inbox.add(new Message(ProgressEvent.endpointDone(date, result), null));
                            return result;
                        }));
            }

            // join point: all outcomes, never a subset
            CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).join();
            List<EndpointResult> results = calls.stream().map(CompletableFuture::join).toList();

            List<String> failedEndpoints = results.stream()
                    .filter(r -> !r.isSuccess())
                    .map(r -> r.endpoint().id())
                    .toList();

            HealthRecord record = merger.merge(date, results);

            boolean persisted = false;
            String error = null;
            try {
                store.upsert(record);
                persisted = true;
                log.info("Saved {}: {}/{} endpoints ok", date, results.size() - failedEndpoints.size(), results.size());
            } catch (RuntimeException e) {
                log.error("Failed to save {}: {}", date, e.getMessage(), e);
                error = e.getMessage();
            }

            return DateOutcome.done(index, date, DateSummary.builder()
                    .date(date.toString())
                    .succeeded(results.size() - failedEndpoints.size())
                    .failed(failedEndpoints.size())
                    .failedEndpoints(failedEndpoints)
                    .persisted(persisted)
                    .error(error)
                    .build());
        }

        private boolean storedMeanwhile(DateKey date) {
            try {
                return store.exists(Set.of(date)).contains(date);
            } catch (StorageException e) {
                log.warn("Re-check of {} failed, fetching anyway: {}", date, e.getMessage());
                return false;
            }
        }
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
