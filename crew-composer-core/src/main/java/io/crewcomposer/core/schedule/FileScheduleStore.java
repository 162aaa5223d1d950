package io.crewcomposer.core.schedule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schedule collection in a single JSON document, {@code {"schedules": [...]}}.
 *
 * <p>Mutations run read-modify-write under the {@link StoreLock}; every write goes to a sibling
 * temporary file that then replaces the document by atomic rename, so readers never see a
 * partial file and {@link #list()} needs no lock. An unreadable document reads as empty.
 */
public final class FileScheduleStore implements ScheduleStore {
    public static final Path DEFAULT_RELATIVE_PATH = Path.of("db", "schedules.json");
    public static final String LOCK_SUFFIX = ".lock";
    static final String COLLECTION_FIELD = "schedules";

    private static final Logger LOG = LoggerFactory.getLogger(FileScheduleStore.class);

    private final Path path;
    private final StoreLock lock;
    private final Clock clock;
    private final ObjectMapper mapper;

    public FileScheduleStore(Path path) {
        this(path, new FileStoreLock(lockPathFor(path)), Clock.systemUTC());
    }

    public FileScheduleStore(Path path, StoreLock lock, Clock clock) {
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath().normalize();
        this.lock = Objects.requireNonNull(lock, "lock must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = ScheduleJson.newMapper();
    }

    public static Path lockPathFor(Path storePath) {
        return storePath.resolveSibling(storePath.getFileName() + LOCK_SUFFIX);
    }

    public Path path() {
        return path;
    }

    @Override
    public List<ScheduleEntry> list() {
        ArrayNode items = items(read());
        List<ScheduleEntry> entries = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            decode(item).ifPresent(entries::add);
        }
        return List.copyOf(entries);
    }

    @Override
    public ScheduleEntry upsert(ScheduleEntry entry) throws IOException {
        Objects.requireNonNull(entry, "entry must not be null");
        try (StoreLock.Lease ignored = lock.acquire()) {
            ObjectNode document = read();
            ArrayNode items = items(document);
            String id = entry.id().isBlank() ? UUID.randomUUID().toString() : entry.id();
            Instant now = clock.instant();

            int index = indexOf(items, id);
            ScheduleEntry existing = index >= 0 ? decode(items.get(index)).orElse(null) : null;
            Instant createdAt = existing != null && existing.createdAt() != null
                ? existing.createdAt()
                : entry.createdAt() != null ? entry.createdAt() : now;
            Instant updatedAt = nextVersion(existing == null ? null : existing.updatedAt(), now);

            ScheduleEntry stored = entry.withIdentity(id, createdAt, updatedAt);
            JsonNode node = mapper.valueToTree(stored);
            if (index >= 0) {
                items.set(index, node);
                removeDuplicates(items, id, index);
            } else {
                items.add(node);
            }
            write(document);
            return stored;
        }
    }

    @Override
    public boolean delete(String id) throws IOException {
        if (id == null || id.isBlank()) {
            return false;
        }
        String target = id.trim();
        try (StoreLock.Lease ignored = lock.acquire()) {
            ObjectNode document = read();
            ArrayNode items = items(document);
            boolean removed = false;
            for (int i = items.size() - 1; i >= 0; i--) {
                if (target.equals(idOf(items.get(i)))) {
                    items.remove(i);
                    removed = true;
                }
            }
            if (removed) {
                write(document);
            }
            return removed;
        }
    }

    @Override
    public StoreRevision revision() throws IOException {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new StoreRevision(attributes.lastModifiedTime(), attributes.fileKey(), attributes.size());
        } catch (NoSuchFileException e) {
            return StoreRevision.MISSING;
        }
    }

    private ObjectNode read() {
        if (!Files.exists(path)) {
            return emptyDocument();
        }
        try {
            String raw = Files.readString(path);
            if (raw.isBlank()) {
                return emptyDocument();
            }
            JsonNode root = mapper.readTree(raw);
            if (root == null || !root.isObject()) {
                LOG.warn("Schedule store {} is not a JSON object; treating it as empty", path);
                return emptyDocument();
            }
            ObjectNode document = (ObjectNode) root;
            if (!document.path(COLLECTION_FIELD).isArray()) {
                document.putArray(COLLECTION_FIELD);
            }
            return document;
        } catch (IOException e) {
            LOG.warn("Unable to read schedule store {}; treating it as empty: {}", path, e.getMessage());
            return emptyDocument();
        }
    }

    private void write(ObjectNode document) throws IOException {
        Files.createDirectories(path.getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Optional<ScheduleEntry> decode(JsonNode item) {
        try {
            ScheduleEntry entry = mapper.treeToValue(item, ScheduleEntry.class);
            if (entry == null || entry.id().isBlank()) {
                LOG.debug("Dropping schedule record without id in {}", path);
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (IOException | IllegalArgumentException e) {
            LOG.debug("Dropping malformed schedule record {} in {}: {}", idOf(item), path, e.getMessage());
            return Optional.empty();
        }
    }

    private ObjectNode emptyDocument() {
        ObjectNode document = mapper.createObjectNode();
        document.putArray(COLLECTION_FIELD);
        return document;
    }

    private static ArrayNode items(ObjectNode document) {
        return (ArrayNode) document.get(COLLECTION_FIELD);
    }

    private static int indexOf(ArrayNode items, String id) {
        for (int i = 0; i < items.size(); i++) {
            if (id.equals(idOf(items.get(i)))) {
                return i;
            }
        }
        return -1;
    }

    private static void removeDuplicates(ArrayNode items, String id, int keep) {
        for (int i = items.size() - 1; i > keep; i--) {
            if (id.equals(idOf(items.get(i)))) {
                items.remove(i);
            }
        }
    }

    private static String idOf(JsonNode item) {
        return item.path("id").asText("").trim();
    }

    private static Instant nextVersion(Instant previous, Instant now) {
        if (previous == null || now.isAfter(previous)) {
            return now;
        }
        return previous.plus(1, ChronoUnit.MICROS);
    }
}
