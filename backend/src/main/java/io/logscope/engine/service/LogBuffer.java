package io.logscope.engine.service;

import io.logscope.engine.config.LogBufferProperties;
import io.logscope.engine.model.LogRecord;
import io.logscope.engine.repository.LogBatchWriter;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded in-memory queue in front of the log table.
 * <p>
 * Records are flushed when {@code batchSize} are pending or every {@code flushInterval},
 * whichever comes first. Beyond {@code maxSize} the oldest pending records are dropped.
 * A failed insert puts its batch back at the head of the queue, so retries keep
 * chronological order. The lock only guards the queue; inserts run outside it.
 */
@Slf4j
public class LogBuffer implements AutoCloseable {

    private final LogBatchWriter writer;
    private final int batchSize;
    private final int maxSize;
    private final Duration shutdownTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition flushesDone = lock.newCondition();
    private ArrayDeque<LogRecord> pending = new ArrayDeque<>();
    private int flushesInFlight;

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean closed = new AtomicBoolean();
    private boolean terminated;

    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong flushes = new AtomicLong();
    private final AtomicLong inserted = new AtomicLong();

    public LogBuffer(LogBatchWriter writer, LogBufferProperties properties) {
        if (properties.getBatchSize() <= 0) {
            throw new IllegalArgumentException("app.buffer.batch-size must be positive");
        }
        if (properties.getMaxSize() <= 0) {
            throw new IllegalArgumentException("app.buffer.max-size must be positive");
        }
        Duration interval = properties.getFlushInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("app.buffer.flush-interval must be positive");
        }
        this.writer = writer;
        this.batchSize = properties.getBatchSize();
        this.maxSize = properties.getMaxSize();
        this.shutdownTimeout = properties.getShutdownTimeout() != null
                ? properties.getShutdownTimeout() : Duration.ofSeconds(30);

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "log-buffer-flush");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(() -> flushQuietly("interval"), millis, millis, TimeUnit.MILLISECONDS);
        log.info("Log buffer started: batchSize={}, flushInterval={}, maxSize={}", batchSize, interval, maxSize);
    }

    public void add(LogRecord record) {
        add(List.of(record));
    }

    /**
     * Enqueues records, dropping the oldest when the cap is exceeded. Ignored once closed.
     */
    public void add(List<LogRecord> records) {
        if (records == null || records.isEmpty()) return;

        boolean flushNow;
        lock.lock();
        try {
            if (closed.get()) return;
            List<LogRecord> incoming = records;
            int overflow = pending.size() + incoming.size() - maxSize;
            if (overflow > 0) {
                if (overflow >= pending.size()) {
                    int droppedIncoming = Math.max(0, incoming.size() - maxSize);
                    long total = pending.size() + droppedIncoming;
                    pending.clear();
                    incoming = incoming.subList(droppedIncoming, incoming.size());
                    dropped.addAndGet(total);
                    log.warn("Log buffer full, dropped {} oldest records", total);
                } else {
                    for (int i = 0; i < overflow; i++) {
                        pending.pollFirst();
                    }
                    dropped.addAndGet(overflow);
                    log.warn("Log buffer full, dropped {} oldest records", overflow);
                }
            }
            pending.addAll(incoming);
            flushNow = pending.size() >= batchSize;
        } finally {
            lock.unlock();
        }

        if (flushNow) {
            flushQuietly("batch size reached");
        }
    }

    /**
     * Writes everything pending as one batch. On failure the batch is put back at the head of
     * the queue and the writer's exception is rethrown.
     */
    public void flush() {
        ArrayDeque<LogRecord> taken;
        lock.lock();
        try {
            if (pending.isEmpty()) return;
            taken = pending;
            pending = new ArrayDeque<>();
            flushesInFlight++;
        } finally {
            lock.unlock();
        }

        List<LogRecord> batch = new ArrayList<>(taken);
        try {
            writer.insertBatch(batch);
        } catch (RuntimeException e) {
            requeue(taken);
            throw e;
        } finally {
            flushFinished();
        }
        flushes.incrementAndGet();
        inserted.addAndGet(batch.size());
        log.debug("Flushed {} log records", batch.size());
    }

    private void flushQuietly(String reason) {
        try {
            flush();
        } catch (RuntimeException e) {
            log.warn("Log buffer flush ({}) failed, records kept for retry: {}", reason, e.getMessage());
        }
    }

    private void flushFinished() {
        lock.lock();
        try {
            flushesInFlight--;
            if (flushesInFlight == 0) {
                flushesDone.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    private void requeue(ArrayDeque<LogRecord> batch) {
        lock.lock();
        try {
            if (terminated) {
                // nothing flushes a closed buffer any more
                dropped.addAndGet(batch.size());
                log.error("Log buffer already closed, dropped {} records of a failed flush", batch.size());
                return;
            }
            batch.addAll(pending);
            pending = batch;
            int excess = pending.size() - maxSize;
            if (excess > 0) {
                for (int i = 0; i < excess; i++) {
                    pending.pollFirst();
                }
                dropped.addAndGet(excess);
                log.warn("Log buffer full after failed flush, dropped {} oldest records", excess);
            }
        } finally {
            lock.unlock();
        }
    }

    public BufferStats stats() {
        int size;
        lock.lock();
        try {
            size = pending.size();
        } finally {
            lock.unlock();
        }
        return new BufferStats(size, dropped.get(), flushes.get(), inserted.get());
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops the timer, waits for running flushes (timer or size triggered) and performs one
     * final flush. Idempotent.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (!closed.compareAndSet(false, true)) return;
        } finally {
            lock.unlock();
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        awaitFlushesInFlight();

        try {
            flush();
        } catch (RuntimeException e) {
            log.error("Final log buffer flush failed, {} records not persisted", stats().pending(), e);
        }

        lock.lock();
        try {
            terminated = true;
        } finally {
            lock.unlock();
        }
        BufferStats stats = stats();
        log.info("Log buffer closed: flushes={}, inserted={}, dropped={}, pending={}",
                stats.flushes(), stats.inserted(), stats.dropped(), stats.pending());
    }

    private void awaitFlushesInFlight() {
        long remaining = shutdownTimeout.toNanos();
        lock.lock();
        try {
            while (flushesInFlight > 0) {
                if (remaining <= 0) {
                    log.warn("Log buffer closing with {} flush(es) still running", flushesInFlight);
                    return;
                }
                remaining = flushesDone.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} running flush(es)", flushesInFlight);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param pending  records waiting to be written
     * @param dropped  records discarded by the size cap since start
     * @param flushes  successful batch inserts
     * @param inserted records written by successful flushes
     */
    public record BufferStats(int pending, long dropped, long flushes, long inserted) {
    }
}
