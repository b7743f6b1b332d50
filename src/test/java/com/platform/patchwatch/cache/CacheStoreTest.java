package com.platform.patchwatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.patchwatch.error.CacheCorruptionException;
import com.platform.patchwatch.error.CacheWriteException;
import com.platform.patchwatch.model.HostRecord;
import com.platform.patchwatch.model.InventorySnapshot;
import com.platform.patchwatch.model.OsDescriptor;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.provider.ProviderKind;
import com.platform.patchwatch.state.HostState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class CacheStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private static final String LEGACY_CACHE = """
            {
              "schema_version": 1,
              "saved_at": "2024-02-28T09:30:00",
              "hosts": [
                {"name": "web-1", "ip": "10.0.0.5", "port": 2222, "username": "ops", "description": "frontend",
                 "os": "linux", "flavor": "debian", "version": "12", "package_manager": "apt",
                 "supported": true, "online": true, "last_refresh": "2024-02-28T09:00:00+00:00",
                 "updates": [
                   {"name": "netdata", "current_version": "2.6.3", "new_version": "2.7.0",
                    "security": false, "source": "netdata:stable"},
                   {"name": "libfoo1", "current_version": "(none)", "new_version": "1.4-2",
                    "security": true, "source": "Debian-Security"}
                 ]},
                {"name": "old-1", "ip": "10.0.0.9", "os": "linux", "flavor": "arch",
                 "package_manager": null, "supported": false},
                {"name": "new-1", "ip": "10.0.0.10"}
              ]
            }
            """;

    @TempDir
    Path dir;

    private static InventorySnapshot sample() {
        HostRecord web = new HostRecord("web-1", "10.0.0.5", 2222, "ops", "frontend", HostState.DISCOVERED,
            new OsDescriptor("linux", "debian", "12"), ProviderKind.APT, false, true, T0,
            List.of(new Update("netdata", "2.6.3", "2.7.0", false, "netdata:stable"),
                new Update("libfoo1", null, "1.4-2", true, null)));
        HostRecord bsd = new HostRecord("bsd-1", "10.0.0.6", 22, null, null, HostState.UNSUPPORTED,
            new OsDescriptor("netbsd", "netbsd", "10.0"), null, false, false, null, List.of());
        HostRecord fresh = new HostRecord("new-1", "10.0.0.7", 22, null, null, HostState.UNKNOWN,
            null, null, false, false, null, List.of());
        return new InventorySnapshot(2, T0, List.of(web, bsd, fresh));
    }

    @Test
    void missingFileLoadsAsEmpty() {
        assertThat(TestCacheStores.at(dir.resolve("cache.json")).load()).isEmpty();
    }

    @Test
    void savedSnapshotLoadsBackUnchanged() {
        CacheStore store = TestCacheStores.at(dir.resolve("cache.json"));

        store.save(sample());

        assertThat(store.load()).contains(sample());
    }

    @Test
    void saveLeavesNoTemporaryFiles() throws IOException {
        CacheStore store = TestCacheStores.at(dir.resolve("cache.json"));

        store.save(sample());
        store.save(sample());

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("cache.json");
        }
    }

    @Test
    void writesSchemaVersionAndSnakeCaseFields() throws IOException {
        CacheStore store = TestCacheStores.at(dir.resolve("cache.json"));
        store.save(sample());

        JsonNode root = new ObjectMapper().readTree(dir.resolve("cache.json").toFile());

        assertThat(root.get("schema_version").asInt()).isEqualTo(2);
        JsonNode web = root.get("hosts").get(0);
        assertThat(web.get("provider").asText()).isEqualTo("apt");
        assertThat(web.get("last_refresh").asText()).isEqualTo("2024-03-01T10:00:00Z");
        assertThat(web.get("updates").get(1).get("current_version").isNull()).isTrue();
    }

    @Test
    void upgradesLegacyCacheInPlace() throws IOException {
        Path file = dir.resolve("cache.json");
        Files.writeString(file, LEGACY_CACHE);
        CacheStore store = TestCacheStores.at(file);

        InventorySnapshot snapshot = store.loadAndUpgrade().orElseThrow();

        assertThat(snapshot.snapshotTime()).isEqualTo(Instant.parse("2024-02-28T09:30:00Z"));
        HostRecord web = snapshot.host("web-1").orElseThrow();
        assertThat(web.address()).isEqualTo("10.0.0.5");
        assertThat(web.port()).isEqualTo(2222);
        assertThat(web.username()).isEqualTo("ops");
        assertThat(web.description()).isEqualTo("frontend");
        assertThat(web.state()).isEqualTo(HostState.DISCOVERED);
        assertThat(web.os()).isEqualTo(new OsDescriptor("linux", "debian", "12"));
        assertThat(web.provider()).isEqualTo(ProviderKind.APT);
        assertThat(web.lastRefresh()).isEqualTo(Instant.parse("2024-02-28T09:00:00Z"));
        assertThat(web.updates()).containsExactly(
            new Update("netdata", "2.6.3", "2.7.0", false, "netdata:stable"),
            new Update("libfoo1", null, "1.4-2", true, "Debian-Security"));
        assertThat(snapshot.host("old-1").orElseThrow().state()).isEqualTo(HostState.UNSUPPORTED);
        assertThat(snapshot.host("new-1").orElseThrow().state()).isEqualTo(HostState.UNKNOWN);

        JsonNode rewritten = new ObjectMapper().readTree(file.toFile());
        assertThat(rewritten.get("schema_version").asInt()).isEqualTo(2);
        assertThat(store.load()).contains(snapshot);
    }

    @Test
    void plainLoadLeavesLegacyFileUntouched() throws IOException {
        Path file = dir.resolve("cache.json");
        Files.writeString(file, LEGACY_CACHE);
        CacheStore store = TestCacheStores.at(file);

        InventorySnapshot snapshot = store.load().orElseThrow();

        assertThat(snapshot.host("web-1").orElseThrow().provider()).isEqualTo(ProviderKind.APT);
        assertThat(Files.readString(file)).isEqualTo(LEGACY_CACHE);
    }

    @Test
    void failedUpgradeWriteStillReturnsSnapshot() throws IOException {
        Path file = dir.resolve("cache.json");
        Files.writeString(file, LEGACY_CACHE);
        CacheStore store = spy(TestCacheStores.at(file));
        doThrow(new CacheWriteException(file, new IOException("No space left on device")))
            .when(store).save(any());

        Optional<InventorySnapshot> snapshot = store.loadAndUpgrade();

        assertThat(snapshot).hasValueSatisfying(s -> assertThat(s.hosts()).hasSize(3));
        assertThat(Files.readString(file)).isEqualTo(LEGACY_CACHE);
    }

    @Test
    void invalidJsonIsCorruption() throws IOException {
        Path file = dir.resolve("cache.json");
        Files.writeString(file, "{\"schema_version\": 2, \"hosts\": [");

        assertThatThrownBy(() -> TestCacheStores.at(file).load())
            .isInstanceOf(CacheCorruptionException.class)
            .hasMessageContaining(CacheCorruptionException.REMEDIAL_ACTION);
    }

    @Test
    void persistedTransientStateIsCorruption() throws IOException {
        Path file = dir.resolve("cache.json");
        Files.writeString(file, """
            {"schema_version": 2, "snapshot_time": null,
             "hosts": [{"name": "a", "address": "10.0.0.1", "state": "REFRESHING"}]}
            """);

        assertThatThrownBy(() -> TestCacheStores.at(file).load())
            .isInstanceOf(CacheCorruptionException.class)
            .hasMessageContaining("REFRESHING");
    }

    @Test
    void newerSchemaIsCorruption() throws IOException {
        Path file = dir.resolve("cache.json");
        Files.writeString(file, "{\"schema_version\": 3, \"hosts\": []}");

        assertThatThrownBy(() -> TestCacheStores.at(file).load())
            .isInstanceOf(CacheCorruptionException.class)
            .hasMessageContaining("3");
    }

    @Test
    void quarantineMovesBrokenFileAside() throws IOException {
        Path file = dir.resolve("cache.json");
        Files.writeString(file, "garbage");
        CacheStore store = TestCacheStores.at(file);

        Optional<Path> moved = store.quarantine();

        assertThat(moved).isPresent();
        assertThat(moved.get().getFileName().toString()).startsWith("cache.json.corrupt-");
        assertThat(Files.readString(moved.get())).isEqualTo("garbage");
        assertThat(store.exists()).isFalse();
        assertThat(store.quarantine()).isEmpty();
    }

    @Test
    void unwritableLocationRaisesWriteError() throws IOException {
        Path blocker = dir.resolve("not-a-dir");
        Files.writeString(blocker, "");
        CacheStore store = TestCacheStores.at(blocker.resolve("cache.json"));

        assertThatThrownBy(() -> store.save(sample())).isInstanceOf(CacheWriteException.class);
    }
}
