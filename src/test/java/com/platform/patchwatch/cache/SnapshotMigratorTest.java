package com.platform.patchwatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotMigratorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SnapshotMigrator migrator = new SnapshotMigrator(ZoneId.of("Europe/Berlin"));

    private ObjectNode read(String json) throws Exception {
        return (ObjectNode) mapper.readTree(json);
    }

    @Test
    void readsNaiveTimestampsInLegacyZone() throws Exception {
        ObjectNode migrated = migrator.migrate(read(
            "{\"schema_version\": 1, \"saved_at\": \"2024-01-15T12:00:00\", \"hosts\": []}"));

        assertThat(migrated.get("schema_version").asInt()).isEqualTo(2);
        assertThat(migrated.get("snapshot_time").asText()).isEqualTo("2024-01-15T11:00:00Z");
    }

    @Test
    void keepsExplicitOffsets() throws Exception {
        ObjectNode migrated = migrator.migrate(read(
            "{\"schema_version\": 1, \"saved_at\": \"2024-01-15T12:00:00-05:00\", \"hosts\": []}"));

        assertThat(migrated.get("snapshot_time").asText()).isEqualTo("2024-01-15T17:00:00Z");
    }

    @Test
    void unknownPackageManagerBecomesUnsupported() throws Exception {
        ObjectNode migrated = migrator.migrate(read("""
            {"schema_version": 1, "hosts": [
              {"name": "a", "ip": "10.0.0.1", "os": "linux", "flavor": "gentoo", "package_manager": "emerge",
               "last_refresh": "2024-01-15T12:00:00Z",
               "updates": [{"name": "x", "new_version": "2"}]}]}
            """));

        JsonNode host = migrated.get("hosts").get(0);
        assertThat(host.get("state").asText()).isEqualTo("UNSUPPORTED");
        assertThat(host.get("provider").isNull()).isTrue();
        assertThat(host.get("last_refresh").isNull()).isTrue();
        assertThat(host.get("updates").size()).isZero();
    }

    @Test
    void currentDocumentNeedsNoMigration() throws Exception {
        assertThat(migrator.needsMigration(read("{\"schema_version\": 2, \"hosts\": []}"))).isFalse();
        assertThat(migrator.needsMigration(read("{\"schema_version\": 1, \"hosts\": []}"))).isTrue();
    }

    @Test
    void missingVersionIsMalformed() throws Exception {
        ObjectNode root = read("{\"hosts\": []}");

        assertThatThrownBy(() -> SnapshotMigrator.versionOf(root)).isInstanceOf(MalformedSnapshotException.class);
    }

    @Test
    void unreadableTimestampIsMalformed() throws Exception {
        ObjectNode root = read("{\"schema_version\": 1, \"saved_at\": \"yesterday\", \"hosts\": []}");

        assertThatThrownBy(() -> migrator.migrate(root)).isInstanceOf(MalformedSnapshotException.class);
    }
}
