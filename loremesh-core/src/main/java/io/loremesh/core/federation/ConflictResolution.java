package io.loremesh.core.federation;

public record ConflictResolution(KnowledgeEntry winner, KnowledgeEntry loser, ResolutionRule rule) {
}
