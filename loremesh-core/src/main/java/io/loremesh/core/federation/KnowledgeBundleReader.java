package io.loremesh.core.federation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the portable export document
 * {@code {"version", "timestamp", "total_entries", "entries": [...]}} produced by a
 * repository. Records that cannot become a {@link KnowledgeEntry} are counted, not thrown.
 */
public final class KnowledgeBundleReader {
    private static final Logger LOG = LoggerFactory.getLogger(KnowledgeBundleReader.class);

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
        Instant::parse,
        value -> OffsetDateTime.parse(value).toInstant(),
        value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC)
    );

    private final ObjectMapper mapper = new ObjectMapper();

    public KnowledgeBundle read(Path path, RepoId owner) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "knowledge bundle not found");
        }
        return parse(mapper.readTree(Files.readString(path)), owner);
    }

    public KnowledgeBundle parse(JsonNode root, RepoId owner) {
        JsonNode entriesNode = root == null ? null : root.get("entries");
        if (entriesNode == null || !entriesNode.isArray()) {
            throw new MalformedImportException("knowledge bundle has no entries array");
        }
        List<KnowledgeEntry> entries = new ArrayList<>();
        int malformed = 0;
        for (JsonNode node : entriesNode) {
            try {
                entries.add(toEntry(node, owner));
            } catch (MalformedImportException e) {
                malformed++;
                LOG.debug("Rejected bundle record: {}", e.getMessage());
            }
        }
        if (malformed > 0) {
            LOG.warn("Rejected {} malformed records out of {}", malformed, entriesNode.size());
        }
        return new KnowledgeBundle(root.path("version").asText(""), owner, entries, malformed);
    }

    KnowledgeEntry toEntry(JsonNode node, RepoId owner) {
        if (node == null || !node.isObject()) {
            throw new MalformedImportException("entry is not an object");
        }
        String id = node.path("id").asText("").trim();
        if (id.isEmpty()) {
            throw new MalformedImportException("entry id is missing");
        }
        JsonNode confidenceNode = node.get("confidence");
        if (confidenceNode == null || !confidenceNode.isNumber()) {
            throw new MalformedImportException("confidence is missing or not a number for " + id);
        }
        double confidence = confidenceNode.asDouble();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new MalformedImportException("confidence out of range for " + id + ": " + confidence);
        }
        Instant createdAt = parseTimestamp(node.path("created_at").asText(""), id);
        KnowledgeEntry entry = new KnowledgeEntry(
            id,
            owner,
            node.path("category").asText("unknown"),
            confidence,
            createdAt,
            node.path("query").asText(""),
            node.path("response").asText("")
        );
        SyncLedger.validate(entry);
        return entry;
    }

    static Instant parseTimestamp(String raw, String id) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            throw new MalformedImportException("created_at is missing for " + id);
        }
        DateTimeParseException last = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new MalformedImportException("created_at is not ISO-8601 for " + id + ": " + value, last);
    }
}
