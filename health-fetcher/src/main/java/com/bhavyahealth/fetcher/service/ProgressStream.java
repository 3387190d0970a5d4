package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.model.BatchSummary;
import com.bhavyahealth.fetcher.model.FetchJob;
import com.bhavyahealth.fetcher.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Bounded single-producer, single-consumer channel of progress events for one job.
 *
 * The producer is started on the first read, so an unread stream costs nothing. It blocks
 * while the buffer is full and never drops an event. The stream ends after batch_done and
 * cannot be restarted. {@link #close()} cancels the job and releases a blocked producer.
 */
@Slf4j
public class ProgressStream implements Iterator<ProgressEvent>, AutoCloseable {

    private static final long OFFER_WAIT_MS = 100;

    private final FetchJob job;
    private final BlockingQueue<ProgressEvent> buffer;
    private final Consumer<ProgressStream> starter;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean closed;

    private ProgressEvent lookahead;
    private volatile boolean finished;

    public ProgressStream(FetchJob job, int capacity, Consumer<ProgressStream> starter) {
        this.job = job;
        this.buffer = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.starter = starter;
    }

    /** A stream for a job that could not start: batch_done with {@code error} and nothing else. */
    static ProgressStream failed(FetchJob job, String error) {
        BatchSummary summary = BatchSummary.builder()
                .jobId(job.getId())
                .requested(job.getRequested().size())
                .error(error)
                .build();
        return new ProgressStream(job, 1, stream -> stream.publish(ProgressEvent.batchDone(summary)));
    }

    public FetchJob job() {
        return job;
    }

    /**
     * Producer side. Blocks while the buffer is full.
     *
     * @return false if the consumer has closed the stream and the event was not delivered
     */
    boolean publish(ProgressEvent event) {
        try {
            while (!buffer.offer(event, OFFER_WAIT_MS, TimeUnit.MILLISECONDS)) {
                if (closed) return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) return true;
        if (finished || closed) return false;

        if (started.compareAndSet(false, true)) {
            starter.accept(this);
        }
        try {
            lookahead = buffer.take();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            return false;
        }
    }

    @Override
    public ProgressEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Progress stream for job " + job.getId() + " has ended");
        }
        ProgressEvent event = lookahead;
        lookahead = null;
        if (event.getType() == ProgressEvent.Type.BATCH_DONE) {
            finished = true;
        }
        return event;
    }

    public boolean isFinished() {
        return finished;
    }

    /** Consumer went away: stop the job after its in-flight dates and discard what is buffered. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (!finished) {
            log.info("Progress stream for job {} closed before batch_done, cancelling", job.getId());
            job.cancel();
        }
        buffer.clear();
    }
}
