package io.loremesh.core.federation;

import static org.assertj.core.api.Assertions.assertThat;

import io.loremesh.core.advisor.KnowledgeAdvisor;
import io.loremesh.core.advisor.LearningNotifier;
import io.loremesh.core.advisor.LearningRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConflictResolverTest {
    private static final Instant OLDER = Instant.parse("2026-01-10T08:00:00Z");
    private static final Instant NEWER = Instant.parse("2026-02-01T08:00:00Z");

    private final ConflictResolver resolver = new ConflictResolver();

    @Test
    void higherConfidenceWinsRegardlessOfTimestamps() {
        KnowledgeEntry confidentButOld = new KnowledgeEntry("k-1", RepoId.A, "routing", 0.9, OLDER);
        KnowledgeEntry freshButWeak = new KnowledgeEntry("k-1", RepoId.B, "routing", 0.5, NEWER);

        assertThat(resolver.resolve(confidentButOld, freshButWeak)).isSameAs(confidentButOld);
        assertThat(resolver.resolve(freshButWeak, confidentButOld)).isSameAs(confidentButOld);
        assertThat(resolver.explain(freshButWeak, confidentButOld).rule()).isEqualTo(ResolutionRule.HIGHER_CONFIDENCE);
    }

    @Test
    void laterEntryWinsWhenConfidencesAreClose() {
        KnowledgeEntry older = new KnowledgeEntry("k-2", RepoId.A, "code", 0.80, OLDER);
        KnowledgeEntry newer = new KnowledgeEntry("k-2", RepoId.B, "code", 0.75, NEWER);

        assertThat(resolver.resolve(older, newer)).isSameAs(newer);
        assertThat(resolver.resolve(newer, older)).isSameAs(newer);

        ConflictResolution resolution = resolver.explain(older, newer);
        assertThat(resolution.rule()).isEqualTo(ResolutionRule.MORE_RECENT);
        assertThat(resolution.loser()).isSameAs(older);
    }

    @Test
    void differenceOfExactlyTheMarginFallsBackToRecency() {
        KnowledgeEntry older = new KnowledgeEntry("k-6", RepoId.A, "code", 0.8, OLDER);
        KnowledgeEntry newer = new KnowledgeEntry("k-6", RepoId.B, "code", 0.7, NEWER);
        assertThat(resolver.explain(older, newer).rule()).isEqualTo(ResolutionRule.MORE_RECENT);
        assertThat(resolver.resolve(older, newer)).isSameAs(newer);

        KnowledgeEntry olderHigh = new KnowledgeEntry("k-7", RepoId.A, "code", 0.9, OLDER);
        KnowledgeEntry newerHigh = new KnowledgeEntry("k-7", RepoId.B, "code", 0.8, NEWER);
        assertThat(resolver.explain(olderHigh, newerHigh).rule()).isEqualTo(ResolutionRule.MORE_RECENT);
        assertThat(resolver.resolve(olderHigh, newerHigh)).isSameAs(newerHigh);

        KnowledgeEntry justAbove = new KnowledgeEntry("k-8", RepoId.A, "code", 0.81, OLDER);
        assertThat(resolver.explain(justAbove, newer).rule()).isEqualTo(ResolutionRule.HIGHER_CONFIDENCE);
    }

    @Test
    void equalTimestampsResolveToTheFirstEntry() {
        KnowledgeEntry fromA = new KnowledgeEntry("k-3", RepoId.A, "code", 0.70, OLDER);
        KnowledgeEntry fromB = new KnowledgeEntry("k-3", RepoId.B, "code", 0.72, OLDER);

        assertThat(resolver.resolve(fromA, fromB)).isSameAs(fromA);
        assertThat(resolver.resolve(fromB, fromA)).isSameAs(fromB);
        assertThat(resolver.explain(fromA, fromB).rule()).isEqualTo(ResolutionRule.TIE_DEFAULT);
    }

    @Test
    void customMarginWidensTheRecencyWindow() {
        ConflictResolver lenient = new ConflictResolver(0.5, null);
        KnowledgeEntry confident = new KnowledgeEntry("k-4", RepoId.A, "code", 0.9, OLDER);
        KnowledgeEntry recent = new KnowledgeEntry("k-4", RepoId.B, "code", 0.6, NEWER);

        assertThat(lenient.resolve(confident, recent)).isSameAs(recent);
        assertThat(resolver.resolve(confident, recent)).isSameAs(confident);
    }

    @Test
    void shouldPublishAuditRecordForEachResolution() {
        RecordingAdvisor advisor = new RecordingAdvisor();
        LearningNotifier notifier = new LearningNotifier(advisor, 8);
        ConflictResolver audited = new ConflictResolver(0.1, notifier);

        KnowledgeEntry winner = new KnowledgeEntry("k-5", RepoId.A, "code", 0.95, OLDER);
        KnowledgeEntry loser = new KnowledgeEntry("k-5", RepoId.B, "code", 0.40, NEWER);
        assertThat(audited.resolve(winner, loser)).isSameAs(winner);
        notifier.close();

        assertThat(advisor.stored).hasSize(1);
        LearningRecord record = advisor.stored.get(0);
        assertThat(record.category()).isEqualTo("conflict_resolution");
        assertThat(record.response()).contains("from A").contains("from B").contains("higher_confidence");
        assertThat(record.ttlDays()).isEqualTo(LearningRecord.PERMANENT_TTL_DAYS);
    }

    private static final class RecordingAdvisor implements KnowledgeAdvisor {
        private final List<LearningRecord> stored = Collections.synchronizedList(new ArrayList<>());

        @Override
        public String query(String text) {
            return "";
        }

        @Override
        public void store(LearningRecord record) {
            stored.add(record);
        }

        @Override
        public String chat(String message) {
            return "";
        }
    }
}
