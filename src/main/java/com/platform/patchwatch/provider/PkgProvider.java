package com.platform.patchwatch.provider;

import com.platform.patchwatch.error.OutputParseException;
import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.transport.CommandResult;
import com.platform.patchwatch.transport.TransportSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FreeBSD binary packages via {@code pkg}. Base system and ports are not covered.
 * Security attribution comes from {@code pkg audit}, which lists vulnerable
 * installed packages as {@code name-version}.
 */
@Slf4j
@Component
public class PkgProvider extends AbstractUpdateProvider {

    static final String SYNC_COMMAND = "pkg update";
    static final String UPDATES_COMMAND = "pkg upgrade -n";
    static final String AUDIT_COMMAND = "pkg audit -q";
    static final String DEFAULT_SOURCE = "Packages Mirror";

    private static final Pattern UPGRADE_LINE = Pattern.compile(
        "^(\\S+):\\s+(\\S+)\\s+->\\s+(\\S+)(?:\\s+\\[([^\\]]+)\\])?$");
    private static final Pattern INSTALL_LINE = Pattern.compile(
        "^(\\S+):\\s+(\\S+)(?:\\s+\\[([^\\]]+)\\])?$");

    private enum Section {
        NONE, INSTALLED, UPGRADED, IGNORED
    }

    public PkgProvider() {
        super(Map.of(ProviderOperation.SYNC_REPOSITORIES, SYNC_COMMAND));
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.PKG;
    }

    @Override
    public ProviderOutcome<Void> syncRepositories(TransportSession session, SudoPolicy policy) {
        Optional<String> command = commandFor(ProviderOperation.SYNC_REPOSITORIES, SYNC_COMMAND, policy);
        if (command.isEmpty()) {
            return ProviderOutcome.skippedPrivileged(ProviderOperation.SYNC_REPOSITORIES);
        }
        runChecked(session, ProviderOperation.SYNC_REPOSITORIES, command.get(), Set.of(0));
        return ProviderOutcome.completed(null);
    }

    @Override
    public ProviderOutcome<Set<String>> fetchSecurityUpdates(TransportSession session, SudoPolicy policy) {
        Optional<String> command = commandFor(ProviderOperation.FETCH_SECURITY_UPDATES, AUDIT_COMMAND, policy);
        if (command.isEmpty()) {
            return ProviderOutcome.skippedPrivileged(ProviderOperation.FETCH_SECURITY_UPDATES);
        }
        CommandResult result = session.run(command.get());
        // pkg audit exits nonzero when it finds vulnerable packages
        if (!result.succeeded() && !result.stderr().isBlank()) {
            throw failure(ProviderOperation.FETCH_SECURITY_UPDATES, result);
        }
        Set<String> vulnerable = new LinkedHashSet<>(nonBlankLines(result));
        log.debug("pkg audit found {} vulnerable packages on {}", vulnerable.size(), session.hostName());
        return ProviderOutcome.completed(Set.copyOf(vulnerable));
    }

    @Override
    protected String updatesCommand() {
        return UPDATES_COMMAND;
    }

    @Override
    protected List<Update> queryUpdates(TransportSession session, String command) {
        CommandResult result = session.run(command);
        // a dry run exits 1 when it has something to do
        if (!result.succeeded() && (result.exitCode() != 1 || !result.stderr().isBlank())) {
            throw failure(ProviderOperation.FETCH_UPDATES, result);
        }

        Section section = Section.NONE;
        boolean sawSection = false;
        List<Update> updates = new ArrayList<>();
        for (String line : nonBlankLines(result)) {
            Optional<Section> header = sectionOf(line);
            if (header.isPresent()) {
                section = header.get();
                sawSection = true;
                continue;
            }
            if (section == Section.INSTALLED || section == Section.UPGRADED) {
                Optional<Update> update = parseLine(line, section);
                if (update.isPresent()) {
                    updates.add(update.get());
                } else if (line.startsWith("Number of packages")) {
                    section = Section.NONE;
                } else {
                    log.debug("Skipping unparseable pkg line: {}", line);
                }
            }
        }

        if (!result.succeeded() && !sawSection) {
            throw new OutputParseException(kind().getId(), String.format(
                "pkg reported pending changes on %s but printed no package list", session.hostName()));
        }
        return updates;
    }

    @Override
    protected boolean isSecurityMatch(Update update, Set<String> vulnerable) {
        return update.currentVersion() != null
            && vulnerable.contains(update.packageName() + "-" + update.currentVersion());
    }

    private static Optional<Section> sectionOf(String line) {
        if (!line.endsWith(":")) {
            return Optional.empty();
        }
        if (line.contains("REINSTALLED") || line.contains("REMOVED") || line.contains("DOWNGRADED")) {
            return Optional.of(Section.IGNORED);
        }
        if (line.contains("UPGRADED")) {
            return Optional.of(Section.UPGRADED);
        }
        if (line.contains("INSTALLED")) {
            return Optional.of(Section.INSTALLED);
        }
        return Optional.empty();
    }

    private static Optional<Update> parseLine(String line, Section section) {
        if (section == Section.UPGRADED) {
            Matcher m = UPGRADE_LINE.matcher(line);
            if (m.matches()) {
                return Optional.of(Update.of(m.group(1), m.group(2), m.group(3), sourceOf(m.group(4))));
            }
            return Optional.empty();
        }
        Matcher m = INSTALL_LINE.matcher(line);
        if (m.matches()) {
            return Optional.of(Update.of(m.group(1), null, m.group(2), sourceOf(m.group(3))));
        }
        return Optional.empty();
    }

    private static String sourceOf(String repo) {
        return repo == null ? DEFAULT_SOURCE : repo;
    }
}
