package io.loremesh.core.federation;

import io.loremesh.core.advisor.LearningNotifier;
import io.loremesh.core.advisor.LearningRecord;
import java.util.Locale;
import java.util.Objects;

/**
 * Picks one of two versions of the same logical entry.
 *
 * <p>If the confidences differ by more than the margin the more confident entry wins.
 * Otherwise the entry with the later {@code createdAt} wins, and equal timestamps go to
 * the first argument.
 */
public final class ConflictResolver {
    public static final double DEFAULT_CONFIDENCE_MARGIN = 0.1;

    // absorbs representation error so that 0.8 vs 0.7 counts as exactly the margin
    private static final double MARGIN_TOLERANCE = 1e-9;

    private final double confidenceMargin;
    private final LearningNotifier notifier;

    public ConflictResolver() {
        this(DEFAULT_CONFIDENCE_MARGIN, null);
    }

    public ConflictResolver(double confidenceMargin, LearningNotifier notifier) {
        this.confidenceMargin = Math.max(0.0, confidenceMargin);
        this.notifier = notifier;
    }

    public KnowledgeEntry resolve(KnowledgeEntry first, KnowledgeEntry second) {
        return settle(first, second).winner();
    }

    public ConflictResolution settle(KnowledgeEntry first, KnowledgeEntry second) {
        ConflictResolution resolution = explain(first, second);
        audit(resolution);
        return resolution;
    }

    public ConflictResolution explain(KnowledgeEntry first, KnowledgeEntry second) {
        Objects.requireNonNull(first, "first entry must not be null");
        Objects.requireNonNull(second, "second entry must not be null");

        double diff = Math.abs(first.confidence() - second.confidence());
        if (diff - confidenceMargin > MARGIN_TOLERANCE) {
            return first.confidence() > second.confidence()
                ? new ConflictResolution(first, second, ResolutionRule.HIGHER_CONFIDENCE)
                : new ConflictResolution(second, first, ResolutionRule.HIGHER_CONFIDENCE);
        }

        int order = compareCreatedAt(first, second);
        if (order > 0) {
            return new ConflictResolution(first, second, ResolutionRule.MORE_RECENT);
        }
        if (order < 0) {
            return new ConflictResolution(second, first, ResolutionRule.MORE_RECENT);
        }
        return new ConflictResolution(first, second, ResolutionRule.TIE_DEFAULT);
    }

    // a missing timestamp sorts before any real one
    private int compareCreatedAt(KnowledgeEntry first, KnowledgeEntry second) {
        if (first.createdAt() == null && second.createdAt() == null) {
            return 0;
        }
        if (first.createdAt() == null) {
            return -1;
        }
        if (second.createdAt() == null) {
            return 1;
        }
        return first.createdAt().compareTo(second.createdAt());
    }

    private void audit(ConflictResolution resolution) {
        if (notifier == null) {
            return;
        }
        notifier.submit(LearningRecord.permanent(
            "How was the conflict on " + resolution.winner().id() + " resolved?",
            "Kept " + resolution.winner().id() + " from " + resolution.winner().sourceRepo()
                + " over " + resolution.loser().id() + " from " + resolution.loser().sourceRepo()
                + " (" + resolution.rule().name().toLowerCase(Locale.ROOT) + ")",
            "conflict_resolution"
        ));
    }
}
