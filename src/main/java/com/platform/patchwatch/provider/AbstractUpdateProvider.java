package com.platform.patchwatch.provider;

import com.platform.patchwatch.error.CommandFailedException;
import com.platform.patchwatch.error.PrivilegeException;
import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.transport.CommandResult;
import com.platform.patchwatch.transport.TransportSession;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared plumbing for providers: sudo prefixing, exit-code checks and
 * security reconciliation over the general update list.
 */
@Slf4j
public abstract class AbstractUpdateProvider implements UpdateProvider {

    static final String SUDO_PREFIX = "sudo -n ";

    private final Map<ProviderOperation, String> privileged;

    /**
     * @param privileged operations that need root, mapped to the command each runs
     */
    protected AbstractUpdateProvider(Map<ProviderOperation, String> privileged) {
        this.privileged = privileged.isEmpty()
            ? Map.of()
            : new EnumMap<>(privileged);
    }

    @Override
    public boolean requiresElevation(ProviderOperation operation) {
        return privileged.containsKey(operation);
    }

    @Override
    public List<String> privilegedCommands() {
        return privileged.values().stream().toList();
    }

    /**
     * The command line to run for an operation, or empty when it needs
     * elevation the policy does not grant.
     */
    protected Optional<String> commandFor(ProviderOperation operation, String command, SudoPolicy policy) {
        if (!requiresElevation(operation)) {
            return Optional.of(command);
        }
        if (policy != SudoPolicy.NOPASSWD) {
            log.debug("{}: skipping {} under sudo policy {}", kind(), operation, policy);
            return Optional.empty();
        }
        return Optional.of(SUDO_PREFIX + command);
    }

    /**
     * Run a command and fail unless it exits with one of the accepted codes.
     */
    protected CommandResult runChecked(TransportSession session, ProviderOperation operation,
                                       String command, Set<Integer> acceptedExitCodes) {
        CommandResult result = session.run(command);
        if (!acceptedExitCodes.contains(result.exitCode())) {
            throw failure(operation, result);
        }
        return result;
    }

    protected RuntimeException failure(ProviderOperation operation, CommandResult result) {
        if (result.command().startsWith(SUDO_PREFIX) && isSudoRefusal(result.stderr())) {
            return new PrivilegeException(operation,
                String.format("sudo refused '%s'; a NOPASSWD sudoers entry is required", result.command()));
        }
        return new CommandFailedException(result.command(), result.exitCode(), result.stderr());
    }

    private static boolean isSudoRefusal(String stderr) {
        String lower = stderr.toLowerCase(Locale.ROOT);
        return lower.contains("a password is required") || lower.contains("not allowed to execute")
            || lower.contains("is not in the sudoers file");
    }

    /**
     * Fetch the general list, then flag entries the security query names.
     * Security identifiers absent from the general list are dropped.
     */
    @Override
    public ProviderOutcome<List<Update>> fetchUpdates(TransportSession session, SudoPolicy policy) {
        Optional<String> command = commandFor(ProviderOperation.FETCH_UPDATES, updatesCommand(), policy);
        if (command.isEmpty()) {
            return ProviderOutcome.skippedPrivileged(ProviderOperation.FETCH_UPDATES);
        }
        List<Update> updates = queryUpdates(session, command.get());
        if (updates.isEmpty()) {
            return ProviderOutcome.completed(List.of());
        }

        ProviderOutcome<Set<String>> security = fetchSecurityUpdates(session, policy);
        if (!security.isCompleted() || security.value().isEmpty()) {
            return ProviderOutcome.completed(List.copyOf(updates));
        }
        List<Update> flagged = new ArrayList<>(updates.size());
        for (Update update : updates) {
            flagged.add(update.withSecurity(update.security() || isSecurityMatch(update, security.value())));
        }
        log.debug("{}: {} of {} updates flagged as security", kind(),
            flagged.stream().filter(Update::security).count(), flagged.size());
        return ProviderOutcome.completed(List.copyOf(flagged));
    }

    /**
     * Command for the general update query, before any sudo prefix.
     */
    protected abstract String updatesCommand();

    /**
     * Run the general query and parse it. Security flags may be left unset.
     */
    protected abstract List<Update> queryUpdates(TransportSession session, String command);

    protected boolean isSecurityMatch(Update update, Set<String> securityIds) {
        return securityIds.contains(update.packageName());
    }

    protected static List<String> nonBlankLines(CommandResult result) {
        return result.stdoutLines().stream()
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .toList();
    }
}
