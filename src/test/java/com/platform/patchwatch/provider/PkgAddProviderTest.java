package com.platform.patchwatch.provider;

import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.transport.ScriptedSession;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PkgAddProviderTest {

    private final PkgAddProvider provider = new PkgAddProvider();

    @Test
    void parsesUpdateCandidates() {
        ScriptedSession session = new ScriptedSession("obsd-1")
            .on(PkgAddProvider.UPDATES_COMMAND, 0,
                "Update candidates: curl-8.4.0 -> curl-8.5.0\n"
                    + "Update candidates: quirks-6.159 -> quirks-6.159\n"
                    + "Update candidates: python-3.10.13 -> python3-3.11.7\n");

        assertThat(provider.fetchUpdates(session, SudoPolicy.SKIP).value()).containsExactly(
            new Update("curl", "8.4.0", "8.5.0", false, PkgAddProvider.SOURCE));
    }

    @Test
    void parseSkipsForeignLines() {
        assertThat(PkgAddProvider.parseLine("quirks-6.159 signed on 2024-01-01")).isEmpty();
    }

    @Test
    void syncIsNotRequired() {
        ScriptedSession session = new ScriptedSession("obsd-1");

        ProviderOutcome<Void> outcome = provider.syncRepositories(session, SudoPolicy.NOPASSWD);

        assertThat(outcome.status()).isEqualTo(ProviderOutcome.Status.NOT_REQUIRED);
        assertThat(session.commands()).isEmpty();
    }

    @Test
    void noSecurityMetadata() {
        assertThat(provider.fetchSecurityUpdates(new ScriptedSession("obsd-1"), SudoPolicy.SKIP).value())
            .isEmpty();
    }
}
