package com.platform.patchwatch.provider;

import com.platform.patchwatch.error.CommandFailedException;
import com.platform.patchwatch.error.OutputParseException;
import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.transport.ScriptedSession;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DnfProviderTest {

    private final DnfProvider provider = new DnfProvider();

    private ScriptedSession session() {
        return new ScriptedSession("db-1")
            .on("dnf check-update --quiet", 100,
                "\n"
                    + "kernel.x86_64          5.14.0-362.18.1.el9_3   baseos\n"
                    + "openssl.x86_64         1:3.0.7-25.el9_3        baseos\n"
                    + "tzdata.noarch          2024a-1.el9             appstream\n"
                    + "Obsoleting Packages\n"
                    + "grub2-tools.x86_64     1:2.06-70.el9           baseos\n")
            .on("dnf list installed --quiet", 0,
                "Installed Packages\n"
                    + "kernel.x86_64          5.14.0-284.11.1.el9_2   @anaconda\n"
                    + "kernel.x86_64          5.14.0-362.8.1.el9_3    @baseos\n"
                    + "openssl.x86_64         1:3.0.7-24.el9          @baseos\n")
            .on("dnf check-update --security --quiet", 100,
                "openssl.x86_64         1:3.0.7-25.el9_3        baseos\n");
    }

    @Test
    void reconcilesSecurityFlagsWithGeneralList() {
        List<Update> updates = provider.fetchUpdates(session(), SudoPolicy.SKIP).value();

        assertThat(updates).extracting(Update::packageName)
            .containsExactly("kernel.x86_64", "openssl.x86_64", "tzdata.noarch");
        assertThat(updates).filteredOn(Update::security)
            .extracting(Update::packageName)
            .containsExactly("openssl.x86_64");
    }

    @Test
    void takesLastListedInstalledVersion() {
        List<Update> updates = provider.fetchUpdates(session(), SudoPolicy.SKIP).value();

        assertThat(updates.get(0).currentVersion()).isEqualTo("5.14.0-362.8.1.el9_3");
        assertThat(updates.get(1).currentVersion()).isEqualTo("1:3.0.7-24.el9");
        assertThat(updates.get(2).currentVersion()).isNull();
        assertThat(updates.get(0).source()).isEqualTo("baseos");
    }

    @Test
    void ignoresObsoletingSection() {
        List<Update> updates = provider.fetchUpdates(session(), SudoPolicy.SKIP).value();

        assertThat(updates).extracting(Update::packageName).doesNotContain("grub2-tools.x86_64");
    }

    @Test
    void exitZeroMeansNothingPending() {
        ScriptedSession session = new ScriptedSession("db-1").on("dnf check-update --quiet", 0, "");

        assertThat(provider.fetchUpdates(session, SudoPolicy.SKIP).value()).isEmpty();
        assertThat(session.commands()).containsExactly("dnf check-update --quiet");
    }

    @Test
    void pendingUpdatesWithoutParseableLinesFail() {
        ScriptedSession session = new ScriptedSession("db-1").on("dnf check-update --quiet", 100, "oops\n");

        assertThatThrownBy(() -> provider.fetchUpdates(session, SudoPolicy.SKIP))
            .isInstanceOf(OutputParseException.class);
    }

    @Test
    void unexpectedExitCodeFails() {
        ScriptedSession session = new ScriptedSession("db-1")
            .on("dnf check-update --quiet", 1, "", "Error: Failed to download metadata");

        assertThatThrownBy(() -> provider.fetchUpdates(session, SudoPolicy.SKIP))
            .isInstanceOf(CommandFailedException.class);
    }

    @Test
    void syncNeedsNoElevation() {
        ScriptedSession session = new ScriptedSession("db-1").on("dnf makecache --refresh", 0, "");

        assertThat(provider.syncRepositories(session, SudoPolicy.SKIP).isCompleted()).isTrue();
        assertThat(provider.privilegedCommands()).isEmpty();
    }

    @Test
    void yumSpeaksSameDialect() {
        YumProvider yum = new YumProvider();
        ScriptedSession session = new ScriptedSession("legacy-1")
            .on("yum check-update --quiet", 100, "bash.x86_64   4.2.46-35.el7_9   updates\n")
            .on("yum list installed --quiet", 0, "bash.x86_64   4.2.46-34.el7   @base\n")
            .on("yum check-update --security --quiet", 0, "");

        List<Update> updates = yum.fetchUpdates(session, SudoPolicy.SKIP).value();

        assertThat(yum.kind()).isEqualTo(ProviderKind.YUM);
        assertThat(updates).containsExactly(
            new Update("bash.x86_64", "4.2.46-34.el7", "4.2.46-35.el7_9", false, "updates"));
    }
}
