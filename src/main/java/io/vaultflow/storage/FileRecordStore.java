package io.vaultflow.storage;

import io.vaultflow.config.VaultFlowConfig;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.util.Ids;
import io.vaultflow.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * The vault itself: one directory per collection, one Markdown file per record.
 *
 * <p>Exclusive create publishes a fully written temporary file under its final name with a hard
 * link, which fails if the name is taken. Moves and updates are single {@code rename(2)} calls.
 * Neither operation ever falls back to a non-atomic copy.
 */
public final class FileRecordStore implements RecordStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileRecordStore.class);

    private final VaultFlowConfig config;
    private final StoreClock clock;

    public FileRecordStore(VaultFlowConfig config) {
        this(config, new FileStoreClock(config.clockDir()));
    }

    public FileRecordStore(VaultFlowConfig config, StoreClock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void init() {
        try {
            Files.createDirectories(config.rootDir());
            for (WorkflowState state : WorkflowState.values()) {
                Files.createDirectories(config.collectionDir(CollectionRef.of(state)));
            }
            Files.createDirectories(config.collectionDir(CollectionRef.QUARANTINE));
            Files.createDirectories(config.inProgressRoot());
            Files.createDirectories(config.heartbeatsDir());
            Files.createDirectories(config.tmpDir());
            Files.createDirectories(config.clockDir());
        } catch (IOException e) {
            throw new VaultStoreException("Failed to initialize vault directories under " + config.rootDir(), e);
        }
    }

    @Override
    public void createExclusive(CollectionRef collection, WorkItem item) {
        Path target = recordPath(collection, item.id());
        byte[] content = RecordCodec.encode(item).getBytes(StandardCharsets.UTF_8);
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            Files.createDirectories(config.tmpDir());
            tmp = config.tmpDir().resolve(item.id() + "." + UUID.randomUUID() + ".tmp");
            Files.write(tmp, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE, StandardOpenOption.SYNC);
            try {
                Files.createLink(target, tmp);
            } catch (UnsupportedOperationException e) {
                LOG.debug("Hard links unsupported under {}, creating {} in place", config.rootDir(), target);
                Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE, StandardOpenOption.SYNC);
            }
            LOG.debug("Created {} in {}", item.id(), collection);
        } catch (FileAlreadyExistsException e) {
            throw new RecordAlreadyExistsException(collection, item.id());
        } catch (IOException e) {
            throw new VaultStoreException("Failed to create record " + target, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    /**
     * Renames the record file with {@code ATOMIC_MOVE}. Concurrent movers of the same source see
     * exactly one winner. The target check is not part of the rename: {@code rename(2)} replaces an
     * existing file, so two moves of different copies of one id into the same collection can still
     * collapse into one. Such copies only arise when the same id is admitted into two different
     * collections at the same moment, which the locate-then-create admission check does not exclude.
     */
    @Override
    public void moveAtomic(CollectionRef from, CollectionRef to, String id) {
        Path source = recordPath(from, id);
        Path target = recordPath(to, id);
        try {
            Files.createDirectories(target.getParent());
            if (Files.exists(target)) {
                throw new RecordAlreadyExistsException(to, id);
            }
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            LOG.debug("Moved {} {} -> {}", id, from, to);
        } catch (NoSuchFileException e) {
            throw new RecordNotFoundException(from, id);
        } catch (AtomicMoveNotSupportedException e) {
            throw new VaultStoreException("Atomic move not supported between " + source + " and " + target, e);
        } catch (IOException e) {
            throw new VaultStoreException("Failed to move " + source + " to " + target, e);
        }
    }

    @Override
    public List<String> list(CollectionRef collection) {
        Path dir = config.collectionDir(collection);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile)
                    .map(p -> RecordCodec.idOf(p.getFileName().toString()))
                    .flatMap(Optional::stream)
                    .forEach(ids::add);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new VaultStoreException("Failed to list " + dir, e);
        }
        ids.sort(Comparator.naturalOrder());
        return ids;
    }

    @Override
    public Optional<WorkItem> read(CollectionRef collection, String id) {
        return readRaw(collection, id).map(text -> RecordCodec.decode(collection, id, text));
    }

    @Override
    public Optional<String> readRaw(CollectionRef collection, String id) {
        Path path = recordPath(collection, id);
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new VaultStoreException("Failed to read " + path, e);
        }
    }

    @Override
    public WorkItem update(CollectionRef collection, String id, UnaryOperator<WorkItem> mutator) {
        WorkItem current = read(collection, id).orElseThrow(() -> new RecordNotFoundException(collection, id));
        WorkItem next = mutator.apply(current);
        if (next == null || !id.equals(next.id())) {
            throw new IllegalArgumentException("Update of " + id + " must keep the record id");
        }
        Path target = recordPath(collection, id);
        Path tmp = config.tmpDir().resolve(id + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(config.tmpDir());
            Files.writeString(tmp, RecordCodec.encode(next), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE, StandardOpenOption.SYNC);
            // rename(2) would resurrect a record that was moved away since the read
            if (!Files.exists(target)) {
                throw new RecordNotFoundException(collection, id);
            }
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            return next;
        } catch (IOException e) {
            throw new VaultStoreException("Failed to update " + target, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    @Override
    public Optional<CollectionRef> locate(String id) {
        Ids.require(id, "record id");
        for (CollectionRef collection : collections()) {
            if (Files.isRegularFile(recordPath(collection, id))) {
                return Optional.of(collection);
            }
        }
        return Optional.empty();
    }

    @Override
    public void quarantine(CollectionRef collection, String id) {
        moveAtomic(collection, CollectionRef.QUARANTINE, id);
        LOG.warn("Quarantined {} from {}", id, collection);
    }

    @Override
    public List<CollectionRef> collections() {
        List<CollectionRef> out = new ArrayList<>();
        for (WorkflowState state : WorkflowState.values()) {
            out.add(CollectionRef.of(state));
        }
        out.addAll(ownerScopes());
        out.add(CollectionRef.QUARANTINE);
        return out;
    }

    @Override
    public List<CollectionRef> ownerScopes() {
        Path root = config.inProgressRoot();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<CollectionRef> out = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(root)) {
            dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(Ids::isValid)
                    .sorted()
                    .forEach(owner -> out.add(CollectionRef.ownerScoped(owner)));
        } catch (IOException e) {
            throw new VaultStoreException("Failed to list owner scopes under " + root, e);
        }
        return out;
    }

    @Override
    public Instant heartbeat(String ownerId) {
        Ids.require(ownerId, "owner id");
        Instant at = now();
        Path file = config.heartbeatsDir().resolve(ownerId);
        Path tmp = config.tmpDir().resolve("heartbeat-" + ownerId + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(config.heartbeatsDir());
            Files.createDirectories(config.tmpDir());
            Files.writeString(tmp, at.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            return at;
        } catch (IOException e) {
            throw new VaultStoreException("Failed to write heartbeat " + file, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    @Override
    public Map<String, Instant> heartbeats() {
        Path dir = config.heartbeatsDir();
        Map<String, Instant> out = new LinkedHashMap<>();
        if (!Files.isDirectory(dir)) {
            return out;
        }
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.sorted().toList()) {
                String owner = file.getFileName().toString();
                if (!Ids.isValid(owner) || !Files.isRegularFile(file)) {
                    continue;
                }
                try {
                    String raw = Files.readString(file, StandardCharsets.UTF_8);
                    Optional<Instant> stamped = Timestamps.parse(raw);
                    out.put(owner, stamped.isPresent()
                            ? stamped.get()
                            : Files.getLastModifiedTime(file).toInstant());
                } catch (NoSuchFileException e) {
                    LOG.debug("Heartbeat {} vanished while scanning", file);
                }
            }
        } catch (IOException e) {
            throw new VaultStoreException("Failed to read heartbeats under " + dir, e);
        }
        return out;
    }

    @Override
    public Instant now() {
        try {
            return clock.now();
        } catch (IOException e) {
            throw new VaultStoreException("Store clock unavailable under " + config.clockDir(), e);
        }
    }

    public VaultFlowConfig config() {
        return config;
    }

    private Path recordPath(CollectionRef collection, String id) {
        Ids.require(id, "record id");
        return config.collectionDir(collection).resolve(RecordCodec.fileName(id));
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }
}
