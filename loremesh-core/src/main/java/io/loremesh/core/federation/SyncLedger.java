package io.loremesh.core.federation;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only log of knowledge sync events between the two repositories.
 *
 * <p>The in-memory history and the persisted document both keep the most recent
 * {@code retention} events. Each registration rewrites the whole document while holding
 * the ledger monitor, so concurrent batches never overwrite each other's events. If the
 * write fails the event stays in memory and the next successful write carries it.
 */
public final class SyncLedger {
    public static final int DEFAULT_RETENTION = 100;

    private static final Logger LOG = LoggerFactory.getLogger(SyncLedger.class);

    private final SyncStore store;
    private final Clock clock;
    private final int retention;
    private final List<SyncEvent> history;
    private long syncCount;

    public SyncLedger(SyncStore store, Clock clock) throws IOException {
        this(store, clock, DEFAULT_RETENTION);
    }

    public SyncLedger(SyncStore store, Clock clock, int retention) throws IOException {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.retention = Math.max(1, retention);
        SyncState state = store.load();
        this.history = new ArrayList<>(tail(state.syncs(), this.retention));
        this.syncCount = Math.max(state.syncCount(), state.syncs().size());
    }

    public void register(String entryId, RepoId source, RepoId target) throws IOException {
        register(entryId, SyncDirection.of(source, target));
    }

    public synchronized void register(String entryId, SyncDirection direction) throws IOException {
        if (entryId == null || entryId.isBlank()) {
            throw new MalformedImportException("entry id must not be blank");
        }
        Objects.requireNonNull(direction, "direction must not be null");

        Instant now = clock.instant();
        history.add(new SyncEvent(now, entryId.trim(), direction));
        syncCount++;
        if (history.size() > retention) {
            history.subList(0, history.size() - retention).clear();
        }
        store.save(new SyncState(now, syncCount, List.copyOf(history)));
    }

    public synchronized SyncResult syncBatch(List<KnowledgeEntry> entries, RepoId source, RepoId target) {
        SyncDirection direction = SyncDirection.of(source, target);
        int synced = 0;
        int errors = 0;
        List<KnowledgeEntry> batch = entries == null ? List.of() : entries;
        for (KnowledgeEntry entry : batch) {
            try {
                validate(entry);
                register(entry.id(), direction);
                synced++;
            } catch (MalformedImportException e) {
                errors++;
                LOG.warn("Skipping malformed entry in {} batch: {}", direction.label(), e.getMessage());
            } catch (IOException e) {
                errors++;
                LOG.warn("Failed to persist sync of {} ({})", entry.id(), direction.label(), e);
            }
        }
        LOG.info("Synced {} of {} entries {} ({} errors)", synced, batch.size(), direction.label(), errors);
        return new SyncResult(synced, 0, errors, direction, clock.instant());
    }

    public synchronized SyncStats stats() {
        if (history.isEmpty()) {
            return SyncStats.empty();
        }
        int aToB = 0;
        int bToA = 0;
        for (SyncEvent event : history) {
            if (SyncDirection.A_TO_B.equals(event.direction())) {
                aToB++;
            } else if (SyncDirection.B_TO_A.equals(event.direction())) {
                bToA++;
            }
        }
        return new SyncStats(history.size(), aToB, bToA, history.get(history.size() - 1).timestamp());
    }

    public synchronized List<SyncEvent> history() {
        return List.copyOf(history);
    }

    public synchronized long syncCount() {
        return syncCount;
    }

    static void validate(KnowledgeEntry entry) {
        if (entry == null) {
            throw new MalformedImportException("entry must not be null");
        }
        if (entry.id().isBlank()) {
            throw new MalformedImportException("entry id is missing");
        }
        if (Double.isNaN(entry.confidence()) || entry.confidence() < 0.0 || entry.confidence() > 1.0) {
            throw new MalformedImportException("confidence out of range for " + entry.id() + ": " + entry.confidence());
        }
        if (entry.sourceRepo() == null) {
            throw new MalformedImportException("source_repo is missing for " + entry.id());
        }
        if (entry.createdAt() == null) {
            throw new MalformedImportException("created_at is missing for " + entry.id());
        }
    }

    private static <T> List<T> tail(List<T> values, int max) {
        if (values.size() <= max) {
            return values;
        }
        return values.subList(values.size() - max, values.size());
    }
}
