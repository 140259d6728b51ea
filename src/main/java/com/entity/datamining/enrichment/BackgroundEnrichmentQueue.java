package com.entity.datamining.enrichment;

import com.entity.datamining.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unbounded in-memory FIFO of enrichment tasks drained by a single daemon worker thread.
 *
 * <p>Tasks are not persisted; anything still queued when the process exits is lost.
 * {@link #stop(Duration)} lets the worker finish the task it is processing, then the worker
 * exits without taking another one. The worker is never interrupted.</p>
 */
public class BackgroundEnrichmentQueue implements TaskQueue {
    private static final Logger log = LoggerFactory.getLogger(BackgroundEnrichmentQueue.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final LinkedBlockingQueue<FetchTask> tasks = new LinkedBlockingQueue<>();
    private final EnrichmentTaskProcessor processor;
    private final Duration pollInterval;
    private final AtomicLong processedCount = new AtomicLong();
    private final Object lifecycleLock = new Object();

    private volatile boolean stopRequested;
    private Thread worker;

    public BackgroundEnrichmentQueue(EnrichmentTaskProcessor processor) {
        this(processor, DEFAULT_POLL_INTERVAL);
    }

    public BackgroundEnrichmentQueue(EnrichmentTaskProcessor processor, Duration pollInterval) {
        this.processor = Objects.requireNonNull(processor, "processor is required");
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollInterval = pollInterval;
    }

    @Override
    public void enqueue(FetchTask task) {
        Objects.requireNonNull(task, "task is required");
        tasks.offer(task);
        log.info("queue.enqueued entityType={} field={} referenceId={} size={}",
                task.entityType().getWireName(), task.field(), task.referenceId(), tasks.size());
    }

    @Override
    public int size() {
        return tasks.size();
    }

    /**
     * Starts the worker. Does nothing if it is already running.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (worker != null && worker.isAlive()) {
                if (stopRequested) {
                    // worker has not yet left its loop; cancel the pending stop
                    stopRequested = false;
                    log.info("queue.stopCancelled");
                }
                return;
            }
            stopRequested = false;
            worker = new Thread(this::runLoop, "enrichment-worker");
            worker.setDaemon(true);
            worker.start();
            log.info("queue.started pollIntervalMs={}", pollInterval.toMillis());
        }
    }

    /**
     * Asks the worker to exit and waits up to {@code timeout} for it.
     *
     * @return true if the worker is no longer running
     */
    public boolean stop(Duration timeout) {
        Thread current;
        synchronized (lifecycleLock) {
            current = worker;
            if (current == null) {
                return true;
            }
            stopRequested = true;
        }

        try {
            current.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        boolean exited = !current.isAlive();
        synchronized (lifecycleLock) {
            if (exited && worker == current) {
                worker = null;
            }
        }
        if (exited) {
            log.info("queue.stopped pending={}", tasks.size());
        } else {
            log.warn("queue.stopTimeout timeoutMs={} pending={}", timeout.toMillis(), tasks.size());
        }
        return exited;
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return worker != null && worker.isAlive();
        }
    }

    /**
     * Number of tasks the worker has finished since construction.
     */
    public long getProcessedCount() {
        return processedCount.get();
    }

    private void runLoop() {
        log.info("queue.workerStarted");
        while (!shouldExit()) {
            FetchTask task;
            try {
                task = tasks.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (task == null) {
                continue;
            }
            process(task);
        }
        log.info("queue.workerStopped");
    }

    /**
     * Decides under the lifecycle lock so that {@link #start()} either cancels the stop
     * before this worker sees it, or finds no worker and spawns a new one.
     */
    private boolean shouldExit() {
        synchronized (lifecycleLock) {
            if (!stopRequested) {
                return false;
            }
            if (worker == Thread.currentThread()) {
                worker = null;
            }
            return true;
        }
    }

    private void process(FetchTask task) {
        try (LogContext ctx = LogContext.forTask(task.entityType().getWireName(), task.field(), task.referenceId())) {
            EnrichmentOutcome outcome = processor.process(task);
            log.debug("queue.taskDone updated={} failed={}", outcome.updated(), outcome.failed());
        } catch (RuntimeException e) {
            log.error("queue.taskError field={} referenceId={} error={}",
                    task.field(), task.referenceId(), e.getMessage(), e);
        } finally {
            processedCount.incrementAndGet();
        }
    }
}
