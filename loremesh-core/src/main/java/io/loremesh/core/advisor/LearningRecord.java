package io.loremesh.core.advisor;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LearningRecord(
    String query,
    String response,
    String category,
    @JsonProperty("ttl_days") int ttlDays
) {
    public static final int PERMANENT_TTL_DAYS = 36_500;

    public LearningRecord {
        query = query == null ? "" : query;
        response = response == null ? "" : response;
        category = category == null || category.isBlank() ? "general" : category.trim();
        ttlDays = ttlDays <= 0 ? PERMANENT_TTL_DAYS : ttlDays;
    }

    public static LearningRecord permanent(String query, String response, String category) {
        return new LearningRecord(query, response, category, PERMANENT_TTL_DAYS);
    }
}
