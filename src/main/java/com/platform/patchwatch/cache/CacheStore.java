package com.platform.patchwatch.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.patchwatch.error.CacheCorruptionException;
import com.platform.patchwatch.error.CacheWriteException;
import com.platform.patchwatch.model.InventorySnapshot;
import com.platform.patchwatch.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Single-file JSON cache of the inventory. Writes go to a temp file in the
 * same directory and are renamed into place, so readers see either the old
 * or the new snapshot and never a partial one.
 */
@Slf4j
public class CacheStore {

    private final Path file;
    private final ObjectMapper mapper;
    private final SnapshotCodec codec;
    private final SnapshotMigrator migrator;
    private final MetricsRegistry metricsRegistry;

    public CacheStore(Path file, ObjectMapper mapper, SnapshotCodec codec, SnapshotMigrator migrator,
                      MetricsRegistry metricsRegistry) {
        this.file = file.toAbsolutePath();
        this.mapper = mapper;
        this.codec = codec;
        this.migrator = migrator;
        this.metricsRegistry = metricsRegistry;
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return Files.exists(file);
    }

    public synchronized void save(InventorySnapshot snapshot) {
        Path temp = null;
        try {
            Files.createDirectories(file.getParent());
            byte[] content = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(codec.encode(snapshot));
            temp = Files.createTempFile(file.getParent(), file.getFileName().toString() + ".", ".tmp");
            writeDurably(temp, content);
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            temp = null;
            metricsRegistry.recordCacheWrite(true);
            log.debug("Saved {} hosts to {}", snapshot.hosts().size(), file);
        } catch (IOException e) {
            metricsRegistry.recordCacheWrite(false);
            throw new CacheWriteException(file, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * Read the cache without touching the file. Older schemas are upgraded in
     * memory only.
     *
     * @return empty when there is no cache file yet
     * @throws CacheCorruptionException when the file cannot be read as any known schema
     */
    public synchronized Optional<InventorySnapshot> load() {
        return read().map(Loaded::snapshot);
    }

    /**
     * Read the cache and rewrite it in the current schema when it was older.
     * A failed rewrite is logged and the upgraded snapshot is still returned;
     * the next save writes the current schema anyway.
     *
     * @return empty when there is no cache file yet
     * @throws CacheCorruptionException when the file cannot be read as any known schema
     */
    public synchronized Optional<InventorySnapshot> loadAndUpgrade() {
        Optional<Loaded> loaded = read();
        loaded.filter(Loaded::migrated).ifPresent(l -> {
            try {
                save(l.snapshot());
                metricsRegistry.recordCacheMigration(l.storedVersion(), SnapshotCodec.CURRENT_VERSION);
                log.info("Upgraded cache {} from schema {} to {}", file, l.storedVersion(), SnapshotCodec.CURRENT_VERSION);
            } catch (CacheWriteException e) {
                log.warn("Could not rewrite cache {} in schema {}, keeping schema {} on disk: {}",
                    file, SnapshotCodec.CURRENT_VERSION, l.storedVersion(), e.getMessage());
            }
        });
        return loaded.map(Loaded::snapshot);
    }

    private Optional<Loaded> read() {
        if (!Files.exists(file)) {
            log.info("No cache at {}", file);
            return Optional.empty();
        }
        try {
            JsonNode root = mapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
            if (root == null || !root.isObject()) {
                throw new CacheCorruptionException(file, "not a JSON object");
            }
            int version = SnapshotMigrator.versionOf(root);
            if (version == SnapshotCodec.CURRENT_VERSION) {
                return Optional.of(new Loaded(codec.decode(root), version));
            }
            return Optional.of(new Loaded(codec.decode(migrator.migrate((ObjectNode) root)), version));
        } catch (JsonProcessingException e) {
            throw new CacheCorruptionException(file, "invalid JSON: " + e.getOriginalMessage(), e);
        } catch (MalformedSnapshotException e) {
            throw new CacheCorruptionException(file, e.getMessage(), e);
        } catch (IOException e) {
            throw new CacheCorruptionException(file, "unreadable: " + e.getMessage(), e);
        }
    }

    /**
     * Move a broken cache file aside. The original is kept for inspection.
     *
     * @return where the file now lives, or empty if there was nothing to move
     */
    public synchronized Optional<Path> quarantine() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        Path target = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(file, target, StandardCopyOption.ATOMIC_MOVE);
            log.warn("Moved unreadable cache {} to {}", file, target);
            return Optional.of(target);
        } catch (IOException e) {
            throw new CacheWriteException(file, e);
        }
    }

    private static void writeDurably(Path temp, byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    private record Loaded(InventorySnapshot snapshot, int storedVersion) {

        boolean migrated() {
            return storedVersion != SnapshotCodec.CURRENT_VERSION;
        }
    }
}
