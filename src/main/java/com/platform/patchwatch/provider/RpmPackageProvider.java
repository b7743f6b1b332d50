package com.platform.patchwatch.provider;

import com.platform.patchwatch.error.OutputParseException;
import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.transport.CommandResult;
import com.platform.patchwatch.transport.TransportSession;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * RHEL family via dnf or yum; both speak the same {@code check-update} dialect.
 * {@code check-update} exits 0 with nothing pending and 100 when updates exist.
 */
@Slf4j
public abstract class RpmPackageProvider extends AbstractUpdateProvider {

    static final int UPDATES_AVAILABLE = 100;
    private static final String OBSOLETING_SECTION = "Obsoleting Packages";

    private final String binary;

    protected RpmPackageProvider(String binary) {
        super(Map.of());
        this.binary = binary;
    }

    @Override
    public ProviderOutcome<Void> syncRepositories(TransportSession session, SudoPolicy policy) {
        String command = binary + " makecache --refresh";
        runChecked(session, ProviderOperation.SYNC_REPOSITORIES, command, Set.of(0));
        log.debug("{} metadata refreshed on {}", binary, session.hostName());
        return ProviderOutcome.completed(null);
    }

    @Override
    public ProviderOutcome<Set<String>> fetchSecurityUpdates(TransportSession session, SudoPolicy policy) {
        Optional<String> command = commandFor(ProviderOperation.FETCH_SECURITY_UPDATES,
            binary + " check-update --security --quiet", policy);
        if (command.isEmpty()) {
            return ProviderOutcome.skippedPrivileged(ProviderOperation.FETCH_SECURITY_UPDATES);
        }
        CommandResult result = runChecked(session, ProviderOperation.FETCH_SECURITY_UPDATES,
            command.get(), Set.of(0, UPDATES_AVAILABLE));
        Set<String> names = new LinkedHashSet<>();
        for (String[] entry : parseCheckUpdate(result)) {
            names.add(entry[0]);
        }
        log.debug("{} reported {} security updates on {}", binary, names.size(), session.hostName());
        return ProviderOutcome.completed(Set.copyOf(names));
    }

    @Override
    protected String updatesCommand() {
        return binary + " check-update --quiet";
    }

    @Override
    protected List<Update> queryUpdates(TransportSession session, String command) {
        CommandResult result = runChecked(session, ProviderOperation.FETCH_UPDATES, command,
            Set.of(0, UPDATES_AVAILABLE));
        if (result.exitCode() == 0) {
            return List.of();
        }

        List<String[]> entries = parseCheckUpdate(result);
        if (entries.isEmpty()) {
            throw new OutputParseException(kind().getId(), String.format(
                "%s reported pending updates on %s but no line could be parsed", binary, session.hostName()));
        }

        Map<String, String> installed = installedVersions(session);
        List<Update> updates = new ArrayList<>(entries.size());
        for (String[] entry : entries) {
            updates.add(Update.of(entry[0], installed.get(entry[0]), entry[1], entry[2]));
        }
        return updates;
    }

    /**
     * Installed versions keyed by {@code name.arch}. When several versions of a
     * package are installed the last one listed wins.
     */
    private Map<String, String> installedVersions(TransportSession session) {
        CommandResult result = runChecked(session, ProviderOperation.FETCH_UPDATES,
            binary + " list installed --quiet", Set.of(0));
        Map<String, String> versions = new HashMap<>();
        for (String line : nonBlankLines(result)) {
            String[] parts = line.split("\\s+");
            if (parts.length >= 3) {
                versions.put(parts[0], parts[1]);
            }
        }
        return versions;
    }

    /**
     * {@code name.arch version repo} triples, stopping at the obsoletes section.
     */
    static List<String[]> parseCheckUpdate(CommandResult result) {
        List<String[]> entries = new ArrayList<>();
        for (String line : nonBlankLines(result)) {
            if (line.startsWith(OBSOLETING_SECTION)) {
                break;
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 3) {
                log.debug("Skipping unparseable check-update line: {}", line);
                continue;
            }
            entries.add(new String[] {parts[0], parts[1], parts[2]});
        }
        return entries;
    }
}
