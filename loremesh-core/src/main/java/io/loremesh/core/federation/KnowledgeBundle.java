package io.loremesh.core.federation;

import java.util.List;

public record KnowledgeBundle(String version, RepoId owner, List<KnowledgeEntry> entries, int malformed) {
    public KnowledgeBundle {
        version = version == null ? "" : version;
        entries = entries == null ? List.of() : List.copyOf(entries);
        malformed = Math.max(0, malformed);
    }

    public double averageConfidence() {
        return entries.stream().mapToDouble(KnowledgeEntry::confidence).average().orElse(0.0);
    }

    public long categories() {
        return entries.stream().map(KnowledgeEntry::category).distinct().count();
    }
}
