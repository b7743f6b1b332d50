package com.platform.patchwatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.patchwatch.model.HostRecord;
import com.platform.patchwatch.model.InventorySnapshot;
import com.platform.patchwatch.model.OsDescriptor;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.provider.ProviderKind;
import com.platform.patchwatch.state.HostState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Field-by-field mapping between {@link InventorySnapshot} and the current
 * cache schema. Older schemas go through {@link SnapshotMigrator} first.
 */
@Component
public class SnapshotCodec {

    public static final int CURRENT_VERSION = 2;

    static final String SCHEMA_VERSION = "schema_version";
    static final String SNAPSHOT_TIME = "snapshot_time";
    static final String HOSTS = "hosts";

    private final ObjectMapper mapper;

    public SnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode encode(InventorySnapshot snapshot) {
        ObjectNode root = mapper.createObjectNode();
        root.put(SCHEMA_VERSION, CURRENT_VERSION);
        putInstant(root, SNAPSHOT_TIME, snapshot.snapshotTime());
        ArrayNode hosts = root.putArray(HOSTS);
        for (HostRecord host : snapshot.hosts()) {
            hosts.add(encodeHost(host));
        }
        return root;
    }

    private ObjectNode encodeHost(HostRecord host) {
        if (host.state().isTransient()) {
            throw new IllegalArgumentException("Transient state " + host.state() + " cannot be persisted");
        }
        ObjectNode node = mapper.createObjectNode();
        node.put("name", host.name());
        node.put("address", host.address());
        node.put("port", host.port());
        node.put("username", host.username());
        node.put("description", host.description());
        node.put("state", host.state().name());
        if (host.os() == null) {
            node.putNull("os");
        } else {
            ObjectNode os = node.putObject("os");
            os.put("kind", host.os().kind());
            os.put("flavor", host.os().flavor());
            os.put("version", host.os().version());
        }
        node.put("provider", host.provider() == null ? null : host.provider().getId());
        node.put("platform_rejected", host.platformRejected());
        node.put("online", host.online());
        putInstant(node, "last_refresh", host.lastRefresh());
        ArrayNode updates = node.putArray("updates");
        for (Update update : host.updates()) {
            ObjectNode u = updates.addObject();
            u.put("package_name", update.packageName());
            u.put("current_version", update.currentVersion());
            u.put("new_version", update.newVersion());
            u.put("security", update.security());
            u.put("source", update.source());
        }
        return node;
    }

    /**
     * Decode a document already at {@link #CURRENT_VERSION}.
     *
     * @throws MalformedSnapshotException when a field is missing or inconsistent
     */
    public InventorySnapshot decode(JsonNode root) {
        int version = root.path(SCHEMA_VERSION).asInt(-1);
        if (version != CURRENT_VERSION) {
            throw new MalformedSnapshotException("Expected schema version " + CURRENT_VERSION + " but found " + version);
        }
        JsonNode hosts = root.get(HOSTS);
        if (hosts == null || !hosts.isArray()) {
            throw new MalformedSnapshotException("Missing hosts array");
        }
        List<HostRecord> records = new ArrayList<>();
        for (JsonNode host : hosts) {
            records.add(decodeHost(host));
        }
        return new InventorySnapshot(CURRENT_VERSION, optionalInstant(root, SNAPSHOT_TIME), records);
    }

    private HostRecord decodeHost(JsonNode node) {
        String name = requiredText(node, "name");
        HostState state = parseState(name, requiredText(node, "state"));
        OsDescriptor os = null;
        JsonNode osNode = node.get("os");
        if (osNode != null && !osNode.isNull()) {
            os = new OsDescriptor(requiredText(osNode, "kind"), optionalText(osNode, "flavor"),
                optionalText(osNode, "version"));
        }
        String providerId = optionalText(node, "provider");
        ProviderKind provider = null;
        if (providerId != null) {
            provider = ProviderKind.fromId(providerId).orElseThrow(() ->
                new MalformedSnapshotException("Host " + name + " has unknown provider " + providerId));
        }
        if (state == HostState.DISCOVERED && provider == null) {
            throw new MalformedSnapshotException("Host " + name + " is discovered but has no provider");
        }

        Instant lastRefresh = optionalInstant(node, "last_refresh");
        List<Update> updates = new ArrayList<>();
        JsonNode updatesNode = node.path("updates");
        for (JsonNode u : updatesNode) {
            updates.add(new Update(
                requiredText(u, "package_name"),
                optionalText(u, "current_version"),
                requiredText(u, "new_version"),
                u.path("security").asBoolean(false),
                optionalText(u, "source")));
        }
        if (lastRefresh == null && !updates.isEmpty()) {
            throw new MalformedSnapshotException("Host " + name + " has updates but was never refreshed");
        }

        return new HostRecord(
            name,
            requiredText(node, "address"),
            node.path("port").asInt(22),
            optionalText(node, "username"),
            optionalText(node, "description"),
            state,
            os,
            provider,
            node.path("platform_rejected").asBoolean(false),
            node.path("online").asBoolean(false),
            lastRefresh,
            updates);
    }

    private static HostState parseState(String host, String value) {
        HostState state;
        try {
            state = HostState.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException("Host " + host + " has unknown state " + value, e);
        }
        if (state.isTransient()) {
            throw new MalformedSnapshotException("Host " + host + " was persisted in transient state " + state);
        }
        return state;
    }

    private static String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null) {
            throw new MalformedSnapshotException("Missing field '" + field + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant optionalInstant(JsonNode node, String field) {
        String text = optionalText(node, field);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new MalformedSnapshotException("Field '" + field + "' is not an ISO-8601 instant: " + text, e);
        }
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        node.put(field, value == null ? null : value.toString());
    }
}
