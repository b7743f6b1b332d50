package com.platform.patchwatch.provider;

import java.util.Arrays;
import java.util.List;

/**
 * What a provider needs from sudoers, for operators preparing hosts.
 */
public record ProviderInfo(
    String name,
    String description,
    List<ProviderOperation> privilegedOperations,
    List<String> sudoCommands
) {

    public static ProviderInfo of(UpdateProvider provider) {
        List<ProviderOperation> privileged = Arrays.stream(ProviderOperation.values())
            .filter(provider::requiresElevation)
            .toList();
        return new ProviderInfo(
            provider.kind().getId(),
            provider.kind().getDescription(),
            privileged,
            provider.privilegedCommands());
    }
}
