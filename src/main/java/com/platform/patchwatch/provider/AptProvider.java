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
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Debian and Ubuntu via {@code apt-get}. Security updates are those whose
 * source label names a security pocket.
 */
@Slf4j
@Component
public class AptProvider extends AbstractUpdateProvider {

    static final String SYNC_COMMAND = "apt-get update";
    static final String UPDATES_COMMAND = "apt-get dist-upgrade -s | grep -e '^Inst'";

    // Inst <name> [<current>] (<new> <source> [<arch>])
    private static final Pattern INST_LINE = Pattern.compile(
        "^Inst\\s+(\\S+)\\s+(?:\\[([^\\]]+)\\]\\s+)?\\((\\S+)\\s+(.+?)\\s+\\[[^\\]]+\\]\\)");

    public AptProvider() {
        super(Map.of(ProviderOperation.SYNC_REPOSITORIES, SYNC_COMMAND));
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.APT;
    }

    @Override
    public ProviderOutcome<Void> syncRepositories(TransportSession session, SudoPolicy policy) {
        Optional<String> command = commandFor(ProviderOperation.SYNC_REPOSITORIES, SYNC_COMMAND, policy);
        if (command.isEmpty()) {
            return ProviderOutcome.skippedPrivileged(ProviderOperation.SYNC_REPOSITORIES);
        }
        runChecked(session, ProviderOperation.SYNC_REPOSITORIES, command.get(), Set.of(0));
        log.debug("apt repositories synchronized on {}", session.hostName());
        return ProviderOutcome.completed(null);
    }

    @Override
    public ProviderOutcome<List<Update>> fetchUpdates(TransportSession session, SudoPolicy policy) {
        return commandFor(ProviderOperation.FETCH_UPDATES, UPDATES_COMMAND, policy)
            .map(command -> ProviderOutcome.completed(queryUpdates(session, command)))
            .orElseGet(() -> ProviderOutcome.skippedPrivileged(ProviderOperation.FETCH_UPDATES));
    }

    @Override
    public ProviderOutcome<Set<String>> fetchSecurityUpdates(TransportSession session, SudoPolicy policy) {
        return commandFor(ProviderOperation.FETCH_SECURITY_UPDATES, UPDATES_COMMAND, policy)
            .map(command -> {
                Set<String> names = new LinkedHashSet<>();
                queryUpdates(session, command).stream()
                    .filter(Update::security)
                    .forEach(update -> names.add(update.packageName()));
                return ProviderOutcome.completed(Set.copyOf(names));
            })
            .orElseGet(() -> ProviderOutcome.skippedPrivileged(ProviderOperation.FETCH_SECURITY_UPDATES));
    }

    @Override
    protected String updatesCommand() {
        return UPDATES_COMMAND;
    }

    @Override
    protected List<Update> queryUpdates(TransportSession session, String command) {
        CommandResult result = session.run(command);
        // grep exits 1 when nothing matched; only an error message makes that a failure
        if (result.exitCode() != 0 && (result.exitCode() != 1 || !result.stderr().isBlank())) {
            throw failure(ProviderOperation.FETCH_UPDATES, result);
        }

        List<String> lines = nonBlankLines(result);
        List<Update> updates = new ArrayList<>();
        for (String line : lines) {
            Optional<Update> update = parseLine(line);
            if (update.isPresent()) {
                updates.add(update.get());
            } else {
                log.debug("Skipping unparseable apt line: {}", line);
            }
        }
        if (updates.isEmpty() && !lines.isEmpty()) {
            throw new OutputParseException(kind().getId(),
                String.format("None of %d apt lines could be parsed on %s", lines.size(), session.hostName()));
        }
        log.debug("apt reported {} updates on {}", updates.size(), session.hostName());
        return updates;
    }

    static Optional<Update> parseLine(String line) {
        Matcher m = INST_LINE.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        String source = m.group(4).strip();
        boolean security = source.toLowerCase(Locale.ROOT).contains("security");
        return Optional.of(new Update(m.group(1), m.group(2), m.group(3), security, source));
    }
}
