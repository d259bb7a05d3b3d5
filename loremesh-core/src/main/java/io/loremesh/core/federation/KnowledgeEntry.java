package io.loremesh.core.federation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KnowledgeEntry(
    String id,
    @JsonProperty("source_repo") RepoId sourceRepo,
    String category,
    double confidence,
    @JsonProperty("created_at") Instant createdAt,
    String query,
    String response
) {
    public KnowledgeEntry {
        id = id == null ? "" : id.trim();
        category = category == null || category.isBlank() ? "unknown" : category.trim();
        query = query == null ? "" : query;
        response = response == null ? "" : response;
    }

    public KnowledgeEntry(String id, RepoId sourceRepo, String category, double confidence, Instant createdAt) {
        this(id, sourceRepo, category, confidence, createdAt, "", "");
    }
}
