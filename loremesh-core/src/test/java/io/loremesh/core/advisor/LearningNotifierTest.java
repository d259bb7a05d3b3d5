package io.loremesh.core.advisor;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class LearningNotifierTest {

    @Test
    void shouldDeliverSubmittedRecords() {
        RecordingAdvisor advisor = new RecordingAdvisor();
        try (LearningNotifier notifier = new LearningNotifier(advisor)) {
            assertThat(notifier.submit(LearningRecord.permanent("q1", "r1", "routing_decision"))).isTrue();
            assertThat(notifier.submit(LearningRecord.permanent("q2", "r2", "routing_decision"))).isTrue();
        }

        assertThat(advisor.stored).extracting(LearningRecord::query).containsExactly("q1", "q2");
    }

    @Test
    void shouldDropWhenQueueIsFullWithoutBlocking() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        KnowledgeAdvisor slow = new KnowledgeAdvisor() {
            @Override
            public String query(String text) {
                return "";
            }

            @Override
            public void store(LearningRecord record) throws IOException {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }

            @Override
            public String chat(String message) {
                return "";
            }
        };

        try (LearningNotifier notifier = new LearningNotifier(slow, 1)) {
            notifier.submit(LearningRecord.permanent("first", "", "audit"));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(notifier.submit(LearningRecord.permanent("second", "", "audit"))).isTrue();
            assertThat(notifier.submit(LearningRecord.permanent("third", "", "audit"))).isFalse();
            assertThat(notifier.dropped()).isEqualTo(1);
            release.countDown();
        }
    }

    @Test
    void shouldCountFailedDeliveries() {
        KnowledgeAdvisor failing = new KnowledgeAdvisor() {
            @Override
            public String query(String text) {
                return "";
            }

            @Override
            public void store(LearningRecord record) throws IOException {
                throw new IOException("backend unreachable");
            }

            @Override
            public String chat(String message) {
                return "";
            }
        };

        LearningNotifier notifier = new LearningNotifier(failing);
        notifier.submit(LearningRecord.permanent("q", "r", "routing_decision"));
        notifier.close();

        assertThat(notifier.failed()).isEqualTo(1);
        assertThat(notifier.delivered()).isZero();
        assertThat(notifier.submit(LearningRecord.permanent("late", "", "audit"))).isFalse();
    }

    private static final class RecordingAdvisor implements KnowledgeAdvisor {
        private final List<LearningRecord> stored = new CopyOnWriteArrayList<>();

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
