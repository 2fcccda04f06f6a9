package io.logscope.engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.logscope.engine.config.LogBufferProperties;
import io.logscope.engine.model.LogRecord;
import io.logscope.engine.repository.LogBatchWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class LogBufferTest {

    private final RecordingWriter writer = new RecordingWriter();
    private LogBuffer buffer;

    @AfterEach
    void tearDown() {
        if (buffer != null) {
            writer.failing.set(false);
            buffer.close();
        }
    }

    private LogBuffer newBuffer(int batchSize, Duration interval, int maxSize) {
        LogBufferProperties properties = new LogBufferProperties();
        properties.setBatchSize(batchSize);
        properties.setFlushInterval(interval);
        properties.setMaxSize(maxSize);
        properties.setShutdownTimeout(Duration.ofSeconds(5));
        buffer = new LogBuffer(writer, properties);
        return buffer;
    }

    private static List<LogRecord> records(int fromInclusive, int toExclusive) {
        return IntStream.range(fromInclusive, toExclusive)
                .mapToObj(i -> LogRecord.builder().id(String.valueOf(i)).message("line " + i).build())
                .collect(Collectors.toList());
    }

    @Test
    void dropsOldestWhenCapacityExceeded() {
        LogBuffer buffer = newBuffer(1000, Duration.ofHours(1), 100);

        buffer.add(records(0, 150));

        LogBuffer.BufferStats stats = buffer.stats();
        assertThat(stats.pending()).isEqualTo(100);
        assertThat(stats.dropped()).isEqualTo(50);

        buffer.flush();
        assertThat(writer.batches).hasSize(1);
        assertThat(writer.batches.get(0)).extracting(LogRecord::id)
                .first().isEqualTo("50");
    }

    @Test
    void dropsFromPendingBeforeIncoming() {
        LogBuffer buffer = newBuffer(1000, Duration.ofHours(1), 10);
        buffer.add(records(0, 8));

        buffer.add(records(8, 12));

        assertThat(buffer.stats().dropped()).isEqualTo(2);
        buffer.flush();
        assertThat(writer.batches.get(0)).extracting(LogRecord::id)
                .containsExactly("2", "3", "4", "5", "6", "7", "8", "9", "10", "11");
    }

    @Test
    void flushesImmediatelyWhenBatchSizeReached() {
        LogBuffer buffer = newBuffer(10, Duration.ofHours(1), 1000);

        buffer.add(records(0, 9));
        assertThat(writer.batches).isEmpty();

        buffer.add(records(9, 10));

        assertThat(writer.batches).hasSize(1);
        assertThat(writer.batches.get(0)).hasSize(10);
        assertThat(buffer.stats().pending()).isZero();
    }

    @Test
    void flushesOnIntervalBelowBatchSize() {
        LogBuffer buffer = newBuffer(1000, Duration.ofMillis(100), 1000);

        buffer.add(records(0, 5));

        await().atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> assertThat(writer.batches).hasSize(1));
        assertThat(writer.batches.get(0)).hasSize(5);
        assertThat(buffer.stats().flushes()).isEqualTo(1);
        assertThat(buffer.stats().inserted()).isEqualTo(5);
    }

    @Test
    void failedFlushRequeuesBatchAheadOfNewerRecords() {
        LogBuffer buffer = newBuffer(1000, Duration.ofHours(1), 1000);
        buffer.add(records(0, 3));
        writer.failing.set(true);

        assertThatThrownBy(buffer::flush).isInstanceOf(DataAccessResourceFailureException.class);
        assertThat(buffer.stats().pending()).isEqualTo(3);
        assertThat(buffer.stats().flushes()).isZero();

        buffer.add(records(3, 5));
        writer.failing.set(false);
        buffer.flush();

        assertThat(writer.batches).hasSize(1);
        assertThat(writer.batches.get(0)).extracting(LogRecord::id).containsExactly("0", "1", "2", "3", "4");
        assertThat(buffer.stats().flushes()).isEqualTo(1);
    }

    @Test
    void requeueRespectsCapacity() {
        LogBuffer buffer = newBuffer(1000, Duration.ofHours(1), 5);
        buffer.add(records(0, 4));
        writer.failing.set(true);
        writer.onInsert = () -> buffer.add(records(4, 7));

        assertThatThrownBy(buffer::flush).isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(buffer.stats().pending()).isEqualTo(5);
        assertThat(buffer.stats().dropped()).isEqualTo(2);
    }

    @Test
    void closeFlushesRemainingRecordsAndIgnoresLaterAdds() {
        LogBuffer buffer = newBuffer(1000, Duration.ofHours(1), 1000);
        buffer.add(records(0, 7));

        buffer.close();
        buffer.add(records(7, 9));

        assertThat(buffer.isClosed()).isTrue();
        assertThat(writer.batches).hasSize(1);
        assertThat(writer.batches.get(0)).hasSize(7);
        assertThat(buffer.stats().pending()).isZero();
    }

    @Test
    void closeIsIdempotent() {
        LogBuffer buffer = newBuffer(1000, Duration.ofHours(1), 1000);
        buffer.add(records(0, 1));

        buffer.close();
        buffer.close();

        assertThat(writer.batches).hasSize(1);
    }

    @Test
    void closeWaitsForFlushRunningOnProducerThread() throws Exception {
        LogBuffer buffer = newBuffer(3, Duration.ofHours(1), 100);
        CountDownLatch inserting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        writer.onInsert = () -> {
            inserting.countDown();
            awaitQuietly(release);
            throw new DataAccessResourceFailureException("clickhouse unavailable");
        };
        ExecutorService threads = Executors.newFixedThreadPool(2);
        try {
            threads.submit(() -> buffer.add(records(0, 3)));
            assertThat(inserting.await(5, TimeUnit.SECONDS)).isTrue();

            Future<?> closing = threads.submit(buffer::close);
            await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> !closing.isDone());

            release.countDown();
            closing.get(5, TimeUnit.SECONDS);
        } finally {
            threads.shutdownNow();
        }

        assertThat(writer.batches).hasSize(1);
        assertThat(writer.batches.get(0)).extracting(LogRecord::id).containsExactly("0", "1", "2");
        assertThat(buffer.stats().pending()).isZero();
        assertThat(buffer.stats().dropped()).isZero();
    }

    @Test
    void failedFlushFinishingAfterCloseCountsAsDropped() throws Exception {
        LogBufferProperties properties = new LogBufferProperties();
        properties.setBatchSize(3);
        properties.setFlushInterval(Duration.ofHours(1));
        properties.setMaxSize(100);
        properties.setShutdownTimeout(Duration.ofMillis(100));
        LogBuffer buffer = new LogBuffer(writer, properties);
        this.buffer = buffer;
        CountDownLatch inserting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        writer.onInsert = () -> {
            inserting.countDown();
            awaitQuietly(release);
            throw new DataAccessResourceFailureException("clickhouse unavailable");
        };
        ExecutorService producer = Executors.newSingleThreadExecutor();
        try {
            producer.submit(() -> buffer.add(records(0, 3)));
            assertThat(inserting.await(5, TimeUnit.SECONDS)).isTrue();

            buffer.close();
            release.countDown();

            await().atMost(Duration.ofSeconds(5)).until(() -> buffer.stats().dropped() == 3);
        } finally {
            producer.shutdownNow();
        }
        assertThat(buffer.stats().pending()).isZero();
        assertThat(writer.batches).isEmpty();
    }

    @Test
    void concurrentProducersLoseNothingBelowCapacity() throws Exception {
        LogBuffer buffer = newBuffer(500, Duration.ofMillis(50), 100_000);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < 8; t++) {
            int base = t * 1000;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 1000; i += 10) {
                    buffer.add(records(base + i, base + i + 10));
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        buffer.close();

        assertThat(writer.totalWritten()).isEqualTo(8000);
        assertThat(buffer.stats().dropped()).isZero();
        assertThat(buffer.stats().inserted()).isEqualTo(8000);
    }

    @Test
    void rejectsInvalidConfiguration() {
        LogBufferProperties properties = new LogBufferProperties();
        properties.setMaxSize(0);

        assertThatThrownBy(() -> new LogBuffer(writer, properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-size");
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class RecordingWriter implements LogBatchWriter {
        private final List<List<LogRecord>> batches = new CopyOnWriteArrayList<>();
        private final AtomicBoolean failing = new AtomicBoolean();
        private volatile Runnable onInsert;

        @Override
        public void insertBatch(List<LogRecord> records) {
            Runnable hook = onInsert;
            if (hook != null) {
                onInsert = null;
                hook.run();
            }
            if (failing.get()) {
                throw new DataAccessResourceFailureException("clickhouse unavailable");
            }
            batches.add(new ArrayList<>(records));
        }

        long totalWritten() {
            return batches.stream().mapToLong(List::size).sum();
        }
    }
}
