package com.actionlog.core.dispatch;

import com.actionlog.core.console.ConsoleEmitter;
import com.actionlog.core.console.LocalEmitter;
import com.actionlog.core.loki.LokiClient;
import com.actionlog.core.loki.LokiPushException;
import com.actionlog.core.model.LogRecord;
import com.actionlog.core.record.LogRecordCodec;
import com.actionlog.core.record.RecordSerializationException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-consumer delivery pipeline from producer threads to Loki.
 *
 * <p>{@link #enqueue} writes the record to the local emitter on the caller's thread and then hands
 * it to the worker through a rendezvous queue; the call returns once the worker has taken it, so a
 * slow push holds up the next producer rather than the current one. The worker pushes records one
 * at a time in the order it accepted them. Delivery is best-effort and at most once: failed pushes
 * are logged and dropped.
 *
 * <p>{@link #shutdown()} stops accepting records, waits for every producer already past the
 * acceptance check to be served, and returns once the worker has exited. Records offered after
 * that are rejected with {@code false}.
 */
public final class LogDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LogDispatcher.class);

    private static final long HANDOFF_POLL_MS = 50;

    /** Lifecycle of the dispatcher. */
    public enum State {
        /** Accepting records, worker active. */
        RUNNING,
        /** No new records accepted; worker finishing the ones already handed over. */
        DRAINING,
        /** Worker has exited. */
        CLOSED
    }

    private final SynchronousQueue<LogRecord> queue = new SynchronousQueue<>();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicInteger waitingProducers = new AtomicInteger();
    private final AtomicLong processed = new AtomicLong();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private final LocalEmitter emitter;
    private final LokiClient loki;
    private final LogRecordCodec codec;
    private final Duration drainTimeout;
    private final Thread worker;

    private LogDispatcher(Builder builder) {
        this.emitter = builder.emitter != null ? builder.emitter : new ConsoleEmitter();
        this.loki = builder.lokiClient;
        this.codec = builder.codec != null ? builder.codec : new LogRecordCodec();
        this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
        if (drainTimeout.isNegative() || drainTimeout.isZero()) {
            throw new IllegalArgumentException("drainTimeout must be > 0");
        }
        this.worker = new Thread(this::workerLoop, Objects.requireNonNull(builder.threadName, "threadName"));
        this.worker.setDaemon(true);
        this.worker.start();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Emits the record locally, then blocks until the worker accepts it.
     *
     * @return {@code true} if the worker took the record, {@code false} if the dispatcher was shut
     *     down or the calling thread was interrupted while waiting
     */
    public boolean enqueue(LogRecord record) {
        Objects.requireNonNull(record, "record");
        emitLocally(record);

        waitingProducers.incrementAndGet();
        try {
            if (!accepting.get()) {
                log.warn("Log dispatcher is shut down; {} not forwarded to Loki", record);
                return false;
            }
            while (!queue.offer(record, HANDOFF_POLL_MS, TimeUnit.MILLISECONDS)) {
                if (terminated.getCount() == 0) {
                    log.warn("Dispatch worker has exited; {} not forwarded to Loki", record);
                    return false;
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while handing {} to the dispatch worker", record);
            return false;
        } finally {
            waitingProducers.decrementAndGet();
        }
    }

    private void emitLocally(LogRecord record) {
        try {
            emitter.emit(record);
        } catch (RuntimeException e) {
            log.warn("Local emission of {} failed", record, e);
        }
    }

    private void workerLoop() {
        try {
            while (true) {
                LogRecord record;
                try {
                    record = queue.poll(HANDOFF_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ie) {
                    // only the forced path of shutdown() interrupts the worker
                    Thread.currentThread().interrupt();
                    break;
                }
                if (record == null) {
                    if (!accepting.get() && waitingProducers.get() == 0) break;
                    continue;
                }
                processed.incrementAndGet();
                try {
                    deliver(record);
                } catch (Throwable t) {
                    log.error("Dispatch worker failed on {}", record, t);
                }
            }
        } finally {
            terminated.countDown();
            log.debug("Dispatch worker {} stopped after {} record(s)", Thread.currentThread().getName(), processed.get());
        }
    }

    private void deliver(LogRecord record) {
        if (loki == null) return;

        String line;
        try {
            line = codec.toJson(record);
        } catch (RecordSerializationException e) {
            log.warn("Skipping log that could not be serialized: {}", e.getMessage(), e);
            return;
        }

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("job", loki.job());
        labels.put("type", record.type());
        try {
            loki.push(labels, record.timestamp(), line);
        } catch (LokiPushException e) {
            if (loki.enabled()) log.error("Failed to send log to Loki", e);
        }
    }

    /**
     * Stops accepting records and waits for the worker to drain. Safe to call more than once.
     *
     * <p>The wait is bounded by the drain timeout. When it expires the worker is interrupted and this
     * method returns even though producers may still be waiting; their records are not delivered.
     */
    public void shutdown() {
        if (accepting.compareAndSet(true, false)) {
            log.debug("Log dispatcher draining; {} producer(s) waiting", waitingProducers.get());
        }
        try {
            if (!terminated.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn(
                        "Drain timeout {} exceeded; interrupting dispatch worker. Producers still waiting: {}",
                        drainTimeout,
                        waitingProducers.get());
                worker.interrupt();
                terminated.await(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            worker.interrupt();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public State state() {
        if (terminated.getCount() == 0) return State.CLOSED;
        return accepting.get() ? State.RUNNING : State.DRAINING;
    }

    /** Records taken off the queue by the worker so far. */
    public long processedCount() {
        return processed.get();
    }

    /** Builder for {@link LogDispatcher}. */
    public static final class Builder {
        private LocalEmitter emitter;
        private LokiClient lokiClient;
        private LogRecordCodec codec;
        private Duration drainTimeout = Duration.ofSeconds(30);
        private String threadName = "actionlog-dispatch-worker";

        private Builder() {}

        /** Local sink called on the producer thread. Defaults to {@link ConsoleEmitter}. */
        public Builder emitter(LocalEmitter emitter) {
            this.emitter = emitter;
            return this;
        }

        /** Remote sink. Without one, records are only emitted locally. */
        public Builder lokiClient(LokiClient lokiClient) {
            this.lokiClient = lokiClient;
            return this;
        }

        public Builder codec(LogRecordCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Upper bound for {@link #shutdown()}; defaults to 30 seconds. */
        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder threadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        /** Builds the dispatcher and starts its worker thread. */
        public LogDispatcher build() {
            return new LogDispatcher(this);
        }
    }
}
