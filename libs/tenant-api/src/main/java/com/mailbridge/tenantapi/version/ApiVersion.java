package com.mailbridge.tenantapi.version;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Release number of a tenant API, {@code major.minor.patch}. Pre-release and build suffixes
 * ({@code 3.20.0-a.1}, {@code 3.19.4+abc}) are ignored, so a pre-release compares equal to its
 * release. Missing minor or patch parts count as zero.
 */
public record ApiVersion(int major, int minor, int patch) implements Comparable<ApiVersion> {

    private static final Pattern FORMAT = Pattern.compile("^v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:[-+].*)?$");

    public ApiVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version parts must not be negative");
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a version number
     */
    public static ApiVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("version must not be null");
        }
        Matcher m = FORMAT.matcher(text.strip());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a version number: '" + text + "'");
        }
        return new ApiVersion(part(m.group(1)), part(m.group(2)), part(m.group(3)));
    }

    public boolean isAtLeast(ApiVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(ApiVersion o) {
        if (major != o.major) {
            return Integer.compare(major, o.major);
        }
        if (minor != o.minor) {
            return Integer.compare(minor, o.minor);
        }
        return Integer.compare(patch, o.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }

    private static int part(String group) {
        return group == null ? 0 : Integer.parseInt(group);
    }
}
