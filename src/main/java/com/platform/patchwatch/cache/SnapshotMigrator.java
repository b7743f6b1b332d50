package com.platform.patchwatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.patchwatch.provider.ProviderKind;
import com.platform.patchwatch.state.HostState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Upgrades older cache documents one schema version at a time.
 */
@Slf4j
@Component
public class SnapshotMigrator {

    // legacy placeholder for "not installed"
    private static final String NO_VERSION = "(none)";

    private final ZoneId legacyZone;
    private final Map<Integer, UnaryOperator<ObjectNode>> steps;

    public SnapshotMigrator() {
        this(ZoneId.systemDefault());
    }

    /**
     * @param legacyZone zone used to read timestamps that were written without one
     */
    public SnapshotMigrator(ZoneId legacyZone) {
        this.legacyZone = legacyZone;
        this.steps = Map.of(1, this::fromV1);
    }

    public static int versionOf(JsonNode root) {
        JsonNode version = root.get(SnapshotCodec.SCHEMA_VERSION);
        if (version == null || !version.canConvertToInt()) {
            throw new MalformedSnapshotException("Missing or non-numeric schema_version");
        }
        return version.asInt();
    }

    public boolean needsMigration(JsonNode root) {
        return versionOf(root) < SnapshotCodec.CURRENT_VERSION;
    }

    /**
     * Bring a document up to the current schema version.
     *
     * @throws MalformedSnapshotException for versions this build does not know
     */
    public ObjectNode migrate(ObjectNode root) {
        int version = versionOf(root);
        if (version > SnapshotCodec.CURRENT_VERSION || version < 1) {
            throw new MalformedSnapshotException("Unknown cache schema version " + version);
        }
        ObjectNode current = root;
        while (version < SnapshotCodec.CURRENT_VERSION) {
            UnaryOperator<ObjectNode> step = steps.get(version);
            if (step == null) {
                throw new MalformedSnapshotException("No migration from schema version " + version);
            }
            current = step.apply(current);
            int next = versionOf(current);
            log.info("Migrated cache schema {} -> {}", version, next);
            version = next;
        }
        return current;
    }

    /**
     * Version 1 stored flat host records straight from the detection step.
     */
    private ObjectNode fromV1(ObjectNode v1) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode v2 = nodes.objectNode();
        v2.put(SnapshotCodec.SCHEMA_VERSION, 2);
        v2.put(SnapshotCodec.SNAPSHOT_TIME, legacyInstant(v1, "saved_at"));
        ArrayNode hosts = v2.putArray(SnapshotCodec.HOSTS);

        for (JsonNode old : v1.path("hosts")) {
            ObjectNode host = hosts.addObject();
            host.set("name", old.get("name"));
            host.set("address", old.has("address") ? old.get("address") : old.get("ip"));
            host.put("port", old.path("port").asInt(22));
            host.put("username", text(old, "username"));
            host.put("description", text(old, "description"));

            String os = text(old, "os");
            Optional<ProviderKind> provider = ProviderKind.fromId(text(old, "package_manager"));
            boolean supported = old.path("supported").asBoolean(true);
            HostState state;
            if (os == null) {
                state = HostState.UNKNOWN;
            } else if (!supported || provider.isEmpty()) {
                state = HostState.UNSUPPORTED;
            } else {
                state = HostState.DISCOVERED;
            }
            host.put("state", state.name());
            if (os == null) {
                host.putNull("os");
            } else {
                ObjectNode descriptor = host.putObject("os");
                descriptor.put("kind", os);
                descriptor.put("flavor", text(old, "flavor"));
                descriptor.put("version", text(old, "version"));
            }
            host.put("provider", state == HostState.DISCOVERED ? provider.get().getId() : null);
            host.put("platform_rejected", false);
            host.put("online", old.path("online").asBoolean(true));

            String lastRefresh = state == HostState.DISCOVERED ? legacyInstant(old, "last_refresh") : null;
            host.put("last_refresh", lastRefresh);
            ArrayNode updates = host.putArray("updates");
            if (lastRefresh != null) {
                for (JsonNode u : old.path("updates")) {
                    ObjectNode update = updates.addObject();
                    update.put("package_name", text(u, "name"));
                    String current = text(u, "current_version");
                    update.put("current_version", NO_VERSION.equals(current) ? null : current);
                    update.put("new_version", text(u, "new_version"));
                    update.put("security", u.path("security").asBoolean(false));
                    update.put("source", text(u, "source"));
                }
            }
        }
        return v2;
    }

    private String legacyInstant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant().toString();
        } catch (DateTimeParseException e) {
            try {
                Instant instant = LocalDateTime.parse(value).atZone(legacyZone).toInstant();
                return instant.toString();
            } catch (DateTimeParseException inner) {
                throw new MalformedSnapshotException("Unreadable timestamp in '" + field + "': " + value, inner);
            }
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
