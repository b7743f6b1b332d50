package com.platform.patchwatch.provider;

import com.platform.patchwatch.error.UnsupportedPlatformException;
import com.platform.patchwatch.model.OsDescriptor;
import com.platform.patchwatch.transport.ScriptedSession;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlatformDetectorTest {

    private final PlatformDetector detector = new PlatformDetector();

    private static ScriptedSession linux(String osRelease) {
        return new ScriptedSession("h").on("uname -s", 0, "Linux\n").on("cat /etc/os-release", 0, osRelease);
    }

    @Test
    void debianUsesApt() {
        PlatformDetector.Detection detection = detector.detect(
            linux("PRETTY_NAME=\"Debian GNU/Linux 12\"\nID=debian\nVERSION_ID=\"12\"\n"));

        assertThat(detection.provider()).isEqualTo(ProviderKind.APT);
        assertThat(detection.os()).isEqualTo(new OsDescriptor("linux", "debian", "12"));
    }

    @Test
    void derivativeFallsBackToIdLike() {
        PlatformDetector.Detection detection = detector.detect(
            linux("ID=linuxmint\nID_LIKE=\"ubuntu debian\"\nVERSION_ID=\"21.3\"\n"));

        assertThat(detection.provider()).isEqualTo(ProviderKind.APT);
        assertThat(detection.os().flavor()).isEqualTo("linuxmint");
    }

    @Test
    void oldRhelUsesYum() {
        assertThat(detector.detect(linux("ID=\"centos\"\nID_LIKE=\"rhel fedora\"\nVERSION_ID=\"7\"\n")).provider())
            .isEqualTo(ProviderKind.YUM);
        assertThat(detector.detect(linux("ID=\"rocky\"\nID_LIKE=\"rhel centos fedora\"\nVERSION_ID=\"9.3\"\n")).provider())
            .isEqualTo(ProviderKind.DNF);
    }

    @Test
    void fedoraAlwaysUsesDnf() {
        assertThat(detector.detect(linux("ID=fedora\nVERSION_ID=39\n")).provider()).isEqualTo(ProviderKind.DNF);
    }

    @Test
    void unknownLinuxFlavorIsUnsupported() {
        PlatformDetector.Detection detection = detector.detect(linux("ID=arch\n"));

        assertThat(detection.isSupported()).isFalse();
        assertThat(detection.os().flavor()).isEqualTo("arch");
    }

    @Test
    void bsdKernelsMapToTheirProviders() {
        ScriptedSession freebsd = new ScriptedSession("h")
            .on("uname -s", 0, "FreeBSD\n").on("uname -r", 0, "14.0-RELEASE-p4\n");
        ScriptedSession openbsd = new ScriptedSession("h")
            .on("uname -s", 0, "OpenBSD\n").on("uname -r", 0, "7.4\n");

        assertThat(detector.detect(freebsd))
            .isEqualTo(new PlatformDetector.Detection(new OsDescriptor("freebsd", "freebsd", "14.0-RELEASE-p4"),
                ProviderKind.PKG));
        assertThat(detector.detect(openbsd).provider()).isEqualTo(ProviderKind.PKG_ADD);
    }

    @Test
    void otherKernelIsRecordedWithoutProvider() {
        ScriptedSession darwin = new ScriptedSession("h")
            .on("uname -s", 0, "Darwin\n").on("uname -r", 0, "23.2.0\n");

        PlatformDetector.Detection detection = detector.detect(darwin);

        assertThat(detection.isSupported()).isFalse();
        assertThat(detection.os().kind()).isEqualTo("darwin");
    }

    @Test
    void nonPosixAnswerIsRejected() {
        ScriptedSession windows = new ScriptedSession("h")
            .on("uname -s", 1, "", "'uname' is not recognized as an internal or external command");

        assertThatThrownBy(() -> detector.detect(windows)).isInstanceOf(UnsupportedPlatformException.class);
    }

    @Test
    void osReleaseParsingStripsQuotesAndComments() {
        assertThat(PlatformDetector.parseOsRelease("# comment\nID='ubuntu'\nVERSION_ID=\"22.04\"\n\n"))
            .containsEntry("ID", "ubuntu")
            .containsEntry("VERSION_ID", "22.04")
            .hasSize(2);
    }
}
