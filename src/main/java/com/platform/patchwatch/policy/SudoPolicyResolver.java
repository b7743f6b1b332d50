package com.platform.patchwatch.policy;

import com.platform.patchwatch.model.HostView;
import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.provider.ProviderOperation;
import com.platform.patchwatch.provider.UpdateProvider;
import org.springframework.stereotype.Component;

/**
 * Decides whether a provider step may run on a host. Pure: no I/O, no state.
 */
@Component
public class SudoPolicyResolver {

    /**
     * The host override when present, otherwise the global default.
     */
    public SudoPolicy effectivePolicy(HostView host, SudoPolicy globalDefault) {
        return host.sudoPolicy() != null ? host.sudoPolicy() : globalDefault;
    }

    public boolean isPermitted(HostView host, UpdateProvider provider, ProviderOperation operation,
                               SudoPolicy globalDefault) {
        return !provider.requiresElevation(operation)
            || effectivePolicy(host, globalDefault) == SudoPolicy.NOPASSWD;
    }

    public boolean canSync(HostView host, UpdateProvider provider, SudoPolicy globalDefault) {
        return isPermitted(host, provider, ProviderOperation.SYNC_REPOSITORIES, globalDefault);
    }

    public boolean canRefresh(HostView host, UpdateProvider provider, SudoPolicy globalDefault) {
        return isPermitted(host, provider, ProviderOperation.FETCH_UPDATES, globalDefault)
            && isPermitted(host, provider, ProviderOperation.FETCH_SECURITY_UPDATES, globalDefault);
    }
}
