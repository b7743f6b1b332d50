package com.platform.patchwatch.provider;

import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.transport.TransportSession;

import java.util.List;
import java.util.Set;

/**
 * Package manager adapter. Implementations are stateless; all host state
 * arrives through the session and the effective sudo policy.
 */
public interface UpdateProvider {

    ProviderKind kind();

    boolean requiresElevation(ProviderOperation operation);

    /**
     * The exact commands this provider runs under {@code sudo}, for sudoers configuration.
     */
    List<String> privilegedCommands();

    /**
     * Refresh the remote package metadata.
     */
    ProviderOutcome<Void> syncRepositories(TransportSession session, SudoPolicy policy);

    /**
     * All pending updates, with security flags already applied.
     */
    ProviderOutcome<List<Update>> fetchUpdates(TransportSession session, SudoPolicy policy);

    /**
     * Identifiers of packages with pending security fixes, as the package manager prints them.
     */
    ProviderOutcome<Set<String>> fetchSecurityUpdates(TransportSession session, SudoPolicy policy);
}
