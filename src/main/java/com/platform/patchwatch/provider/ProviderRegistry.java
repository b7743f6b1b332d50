package com.platform.patchwatch.provider;

import com.platform.patchwatch.error.OperationNotSupportedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup from provider kind to the provider bean serving it.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<ProviderKind, UpdateProvider> providers;

    public ProviderRegistry(List<UpdateProvider> providers) {
        Map<ProviderKind, UpdateProvider> byKind = new EnumMap<>(ProviderKind.class);
        for (UpdateProvider provider : providers) {
            UpdateProvider previous = byKind.put(provider.kind(), provider);
            if (previous != null) {
                throw new IllegalStateException("Two providers registered for " + provider.kind());
            }
        }
        this.providers = byKind;
        log.info("Registered update providers: {}", byKind.keySet());
    }

    public Optional<UpdateProvider> find(ProviderKind kind) {
        return Optional.ofNullable(kind).map(providers::get);
    }

    public UpdateProvider get(ProviderKind kind) {
        return find(kind).orElseThrow(() ->
            new OperationNotSupportedException("No provider registered for " + kind));
    }

    public List<ProviderInfo> describe() {
        return providers.values().stream().map(ProviderInfo::of).toList();
    }
}
