package com.platform.patchwatch.policy;

import com.platform.patchwatch.model.HostView;
import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.provider.AptProvider;
import com.platform.patchwatch.provider.DnfProvider;
import com.platform.patchwatch.provider.ProviderKind;
import com.platform.patchwatch.provider.ProviderOperation;
import com.platform.patchwatch.state.HostState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SudoPolicyResolverTest {

    private final SudoPolicyResolver resolver = new SudoPolicyResolver();
    private final AptProvider apt = new AptProvider();

    private static HostView host(SudoPolicy override) {
        return new HostView("web-1", "10.0.0.5", 22, "ops", null, override, null, null,
            HostState.DISCOVERED, null, ProviderKind.APT, false, true, null, List.of());
    }

    @Test
    void hostOverrideWinsOverGlobalDefault() {
        assertThat(resolver.effectivePolicy(host(SudoPolicy.NOPASSWD), SudoPolicy.SKIP)).isEqualTo(SudoPolicy.NOPASSWD);
        assertThat(resolver.effectivePolicy(host(SudoPolicy.SKIP), SudoPolicy.NOPASSWD)).isEqualTo(SudoPolicy.SKIP);
        assertThat(resolver.effectivePolicy(host(null), SudoPolicy.NOPASSWD)).isEqualTo(SudoPolicy.NOPASSWD);
    }

    @Test
    void privilegedStepNeedsNopasswd() {
        assertThat(resolver.canSync(host(null), apt, SudoPolicy.SKIP)).isFalse();
        assertThat(resolver.canSync(host(SudoPolicy.NOPASSWD), apt, SudoPolicy.SKIP)).isTrue();
    }

    @Test
    void unprivilegedStepAlwaysPermitted() {
        assertThat(resolver.isPermitted(host(SudoPolicy.SKIP), apt, ProviderOperation.FETCH_UPDATES, SudoPolicy.SKIP))
            .isTrue();
        assertThat(resolver.canRefresh(host(SudoPolicy.SKIP), apt, SudoPolicy.SKIP)).isTrue();
        assertThat(resolver.canSync(host(SudoPolicy.SKIP), new DnfProvider(), SudoPolicy.SKIP)).isTrue();
    }
}
