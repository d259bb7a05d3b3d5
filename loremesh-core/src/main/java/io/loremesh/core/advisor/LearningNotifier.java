package io.loremesh.core.advisor;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort channel that hands learning records to the advisor on a background thread.
 * {@link #submit} never blocks: when the queue is full the record is dropped and counted.
 */
public final class LearningNotifier implements AutoCloseable {
    public static final int DEFAULT_CAPACITY = 256;

    private static final Logger LOG = LoggerFactory.getLogger(LearningNotifier.class);

    private final KnowledgeAdvisor advisor;
    private final BlockingQueue<LearningRecord> queue;
    private final Thread worker;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private volatile boolean running = true;

    public LearningNotifier(KnowledgeAdvisor advisor) {
        this(advisor, DEFAULT_CAPACITY);
    }

    public LearningNotifier(KnowledgeAdvisor advisor, int capacity) {
        this.advisor = Objects.requireNonNull(advisor, "advisor must not be null");
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.worker = new Thread(this::drain, "loremesh-learning-notifier");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    public boolean submit(LearningRecord record) {
        if (record == null || !running) {
            return false;
        }
        if (queue.offer(record)) {
            return true;
        }
        long total = dropped.incrementAndGet();
        LOG.debug("Learning queue full, dropped {} record ({} dropped so far)", record.category(), total);
        return false;
    }

    public long delivered() {
        return delivered.get();
    }

    public long dropped() {
        return dropped.get();
    }

    public long failed() {
        return failed.get();
    }

    private void drain() {
        while (running || !queue.isEmpty()) {
            LearningRecord record;
            try {
                record = queue.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (record == null) {
                continue;
            }
            try {
                advisor.store(record);
                delivered.incrementAndGet();
            } catch (Exception e) {
                failed.incrementAndGet();
                LOG.warn("Failed to store {} learning record: {}", record.category(), e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        running = false;
        try {
            worker.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!queue.isEmpty()) {
            LOG.warn("Learning notifier closed with {} undelivered records", queue.size());
        }
    }
}
