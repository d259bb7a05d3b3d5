package io.loremesh.core.federation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KnowledgeBundleReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadValidEntriesAndCountMalformedOnes() throws Exception {
        Path file = tempDir.resolve("knowledge.json");
        Files.writeString(file, """
            {
              "version": "1.0",
              "timestamp": "1734688800.0",
              "total_entries": 5,
              "entries": [
                {"id": "k-1", "query": "How to retry?", "response": "Use backoff", "category": "code", "confidence": 0.92, "created_at": "2025-12-20T10:00:00.123456"},
                {"id": "k-2", "query": "q", "response": "r", "category": "ops", "confidence": 0.61, "created_at": "2025-12-21T08:30:00Z"},
                {"query": "no id", "confidence": 0.5, "created_at": "2025-12-21T08:30:00Z"},
                {"id": "k-4", "confidence": "high", "created_at": "2025-12-21T08:30:00Z"},
                {"id": "k-5", "confidence": 0.5, "created_at": "yesterday"}
              ]
            }
            """);

        KnowledgeBundle bundle = new KnowledgeBundleReader().read(file, RepoId.B);

        assertThat(bundle.version()).isEqualTo("1.0");
        assertThat(bundle.malformed()).isEqualTo(3);
        assertThat(bundle.entries()).extracting(KnowledgeEntry::id).containsExactly("k-1", "k-2");
        KnowledgeEntry first = bundle.entries().get(0);
        assertThat(first.sourceRepo()).isEqualTo(RepoId.B);
        assertThat(first.createdAt()).isEqualTo(Instant.parse("2025-12-20T10:00:00.123456Z"));
        assertThat(first.response()).isEqualTo("Use backoff");
        assertThat(bundle.categories()).isEqualTo(2);
    }

    @Test
    void missingFileIsAnIoError() {
        assertThatThrownBy(() -> new KnowledgeBundleReader().read(tempDir.resolve("absent.json"), RepoId.A))
            .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void documentWithoutEntriesIsMalformed() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"version\": \"1.0\"}");

        assertThatThrownBy(() -> new KnowledgeBundleReader().read(file, RepoId.A))
            .isInstanceOf(MalformedImportException.class);
    }
}
