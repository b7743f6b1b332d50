package com.platform.patchwatch.provider;

import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.transport.CommandResult;
import com.platform.patchwatch.transport.TransportSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenBSD packages via {@code pkg_add}. The mirror is queried live, so there is
 * nothing to sync, and OpenBSD publishes no per-package security metadata.
 */
@Slf4j
@Component
public class PkgAddProvider extends AbstractUpdateProvider {

    static final String UPDATES_COMMAND = "/usr/sbin/pkg_add -u -v -x -n | grep -e '^Update candidate'";
    static final String SOURCE = "Packages Mirror";

    private static final Pattern CANDIDATE_LINE = Pattern.compile(
        "^Update candidates: ([\\w\\-.+]+)-([^\\s]+) -> ([\\w\\-.+]+)-([^\\s]+)$");

    public PkgAddProvider() {
        super(Map.of());
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.PKG_ADD;
    }

    @Override
    public ProviderOutcome<Void> syncRepositories(TransportSession session, SudoPolicy policy) {
        return ProviderOutcome.notRequired("pkg_add queries the mirror directly");
    }

    @Override
    public ProviderOutcome<Set<String>> fetchSecurityUpdates(TransportSession session, SudoPolicy policy) {
        return ProviderOutcome.completed(Set.of());
    }

    @Override
    protected String updatesCommand() {
        return UPDATES_COMMAND;
    }

    @Override
    protected List<Update> queryUpdates(TransportSession session, String command) {
        CommandResult result = session.run(command);
        if (!result.succeeded() && (result.exitCode() != 1 || !result.stderr().isBlank())) {
            throw failure(ProviderOperation.FETCH_UPDATES, result);
        }
        List<Update> updates = new ArrayList<>();
        for (String line : nonBlankLines(result)) {
            parseLine(line).ifPresent(updates::add);
        }
        return updates;
    }

    static Optional<Update> parseLine(String line) {
        Matcher m = CANDIDATE_LINE.matcher(line);
        if (!m.matches()) {
            log.debug("Skipping unparseable pkg_add line: {}", line);
            return Optional.empty();
        }
        String name = m.group(1);
        String current = m.group(2);
        String newName = m.group(3);
        String next = m.group(4);
        if (!name.equals(newName)) {
            log.warn("Package name changes from {} to {}, skipping", name, newName);
            return Optional.empty();
        }
        if (current.equals(next)) {
            return Optional.empty();
        }
        return Optional.of(Update.of(name, current, next, SOURCE));
    }
}
