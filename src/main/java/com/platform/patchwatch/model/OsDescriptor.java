package com.platform.patchwatch.model;

/**
 * Platform identity detected during discovery.
 *
 * @param kind    lower-cased kernel name from {@code uname -s} (linux, freebsd, openbsd...)
 * @param flavor  distribution family (debian, ubuntu, rhel...), kernel name on BSDs
 * @param version release identifier, may be {@code null} when the host does not report one
 */
public record OsDescriptor(String kind, String flavor, String version) {

    public String summary() {
        StringBuilder sb = new StringBuilder(kind);
        if (flavor != null && !flavor.equals(kind)) {
            sb.append('/').append(flavor);
        }
        if (version != null) {
            sb.append(' ').append(version);
        }
        return sb.toString();
    }
}
