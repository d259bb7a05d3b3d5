package io.loremesh.core.federation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a federation round between the two repositories. Entries present on both sides
 * (same id) are resolved first; each surviving entry is then synced away from the
 * repository that owns it.
 */
public final class FederationService {
    private static final Logger LOG = LoggerFactory.getLogger(FederationService.class);

    private final SyncLedger ledger;
    private final ConflictResolver resolver;

    public FederationService(SyncLedger ledger, ConflictResolver resolver) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    public FederationReport federate(List<KnowledgeEntry> fromA, List<KnowledgeEntry> fromB) {
        List<KnowledgeEntry> outgoingA = new ArrayList<>();
        List<KnowledgeEntry> outgoingB = new ArrayList<>();
        List<ConflictResolution> resolutions = new ArrayList<>();

        Map<String, KnowledgeEntry> indexB = new LinkedHashMap<>();
        for (KnowledgeEntry entry : safe(fromB)) {
            if (entry == null || entry.id().isBlank()) {
                outgoingB.add(entry);
            } else {
                indexB.putIfAbsent(entry.id(), entry);
            }
        }

        for (KnowledgeEntry entryA : safe(fromA)) {
            KnowledgeEntry entryB = entryA == null ? null : indexB.remove(entryA.id());
            if (entryB == null) {
                outgoingA.add(entryA);
                continue;
            }
            ConflictResolution resolution = resolver.settle(entryA, entryB);
            resolutions.add(resolution);
            if (resolution.winner() == entryA) {
                outgoingA.add(entryA);
            } else {
                outgoingB.add(entryB);
            }
        }
        outgoingB.addAll(indexB.values());

        SyncResult aToB = ledger.syncBatch(outgoingA, RepoId.A, RepoId.B);
        SyncResult bToA = ledger.syncBatch(outgoingB, RepoId.B, RepoId.A);
        LOG.info(
            "Federation round: {} A → B, {} B → A, {} conflicts resolved",
            aToB.synced(),
            bToA.synced(),
            resolutions.size()
        );
        return new FederationReport(aToB, bToA, resolutions.size(), resolutions);
    }

    private List<KnowledgeEntry> safe(List<KnowledgeEntry> entries) {
        return entries == null ? List.of() : entries;
    }
}
