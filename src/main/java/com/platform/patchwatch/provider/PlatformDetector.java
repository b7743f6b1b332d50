package com.platform.patchwatch.provider;

import com.platform.patchwatch.error.UnsupportedPlatformException;
import com.platform.patchwatch.model.OsDescriptor;
import com.platform.patchwatch.transport.CommandResult;
import com.platform.patchwatch.transport.TransportSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Identifies a remote platform and the provider that can serve it.
 */
@Slf4j
@Component
public class PlatformDetector {

    /**
     * Detected platform; {@code provider} is null when no provider matches.
     */
    public record Detection(OsDescriptor os, ProviderKind provider) {

        public boolean isSupported() {
            return provider != null;
        }
    }

    private static final Pattern KERNEL_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_.\\-]*$");

    private static final Map<String, ProviderKind> LINUX_FLAVORS = Map.of(
        "debian", ProviderKind.APT,
        "ubuntu", ProviderKind.APT,
        "rhel", ProviderKind.DNF,
        "centos", ProviderKind.DNF,
        "fedora", ProviderKind.DNF,
        "rocky", ProviderKind.DNF,
        "almalinux", ProviderKind.DNF,
        "ol", ProviderKind.DNF
    );

    private static final int FIRST_DNF_RELEASE = 8;

    public Detection detect(TransportSession session) {
        String kernel = kernelName(session);
        return switch (kernel) {
            case "linux" -> detectLinux(session);
            case "freebsd" -> new Detection(new OsDescriptor(kernel, kernel, release(session)), ProviderKind.PKG);
            case "openbsd" -> new Detection(new OsDescriptor(kernel, kernel, release(session)), ProviderKind.PKG_ADD);
            default -> {
                log.info("{} runs {}, which no provider supports", session.hostName(), kernel);
                yield new Detection(new OsDescriptor(kernel, kernel, release(session)), null);
            }
        };
    }

    private String kernelName(TransportSession session) {
        CommandResult result = session.run("uname -s");
        String answer = result.stdout().strip();
        if (!result.succeeded() || !KERNEL_NAME.matcher(answer).matches()) {
            throw new UnsupportedPlatformException(String.format(
                "%s did not answer 'uname -s' like a POSIX system (exit %d)", session.hostName(), result.exitCode()));
        }
        return answer.toLowerCase(Locale.ROOT);
    }

    private String release(TransportSession session) {
        CommandResult result = session.run("uname -r");
        return result.succeeded() && !result.stdout().isBlank() ? result.stdout().strip() : null;
    }

    private Detection detectLinux(TransportSession session) {
        CommandResult result = session.run("cat /etc/os-release");
        if (!result.succeeded()) {
            log.info("{} has no readable /etc/os-release", session.hostName());
            return new Detection(new OsDescriptor("linux", null, null), null);
        }
        Map<String, String> release = parseOsRelease(result.stdout());
        String id = release.getOrDefault("ID", "").toLowerCase(Locale.ROOT);
        String version = release.get("VERSION_ID");
        OsDescriptor os = new OsDescriptor("linux", id.isEmpty() ? null : id, version);

        List<String> candidates = new ArrayList<>();
        candidates.add(id);
        String like = release.get("ID_LIKE");
        if (like != null) {
            for (String token : like.toLowerCase(Locale.ROOT).split("\\s+")) {
                candidates.add(token);
            }
        }

        Optional<ProviderKind> provider = candidates.stream()
            .filter(LINUX_FLAVORS::containsKey)
            .map(LINUX_FLAVORS::get)
            .findFirst();
        if (provider.isEmpty()) {
            log.info("{} runs Linux flavor '{}', which no provider supports", session.hostName(), id);
            return new Detection(os, null);
        }
        return new Detection(os, refineRpm(provider.get(), id, version));
    }

    private static ProviderKind refineRpm(ProviderKind kind, String id, String version) {
        if (kind != ProviderKind.DNF || "fedora".equals(id)) {
            return kind;
        }
        Integer major = majorVersion(version);
        return major != null && major < FIRST_DNF_RELEASE ? ProviderKind.YUM : ProviderKind.DNF;
    }

    private static Integer majorVersion(String version) {
        if (version == null) {
            return null;
        }
        String head = version.split("\\.")[0];
        try {
            return Integer.parseInt(head);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Map<String, String> parseOsRelease(String content) {
        Map<String, String> values = new HashMap<>();
        for (String line : content.split("\\R")) {
            String trimmed = line.strip();
            int eq = trimmed.indexOf('=');
            if (trimmed.isEmpty() || trimmed.startsWith("#") || eq <= 0) {
                continue;
            }
            String value = trimmed.substring(eq + 1).strip();
            if (value.length() >= 2 && (value.startsWith("\"") || value.startsWith("'"))) {
                value = value.substring(1, value.length() - 1);
            }
            values.put(trimmed.substring(0, eq), value);
        }
        return values;
    }
}
