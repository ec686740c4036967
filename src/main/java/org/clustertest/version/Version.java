package org.clustertest.version;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Framework version of the form {@code MAJOR.MINOR[.PATCH][-devN]}.
 *
 * <p>A missing patch component is normalized to {@code 0}, so {@code 1.3} and {@code 1.3.0} are
 * equal. A development version sorts before the release with the same numeric components.
 */
public final class Version implements Comparable<Version> {
    private static final Pattern VERSION_PATTERN =
            Pattern.compile("^(\\d+)\\.(\\d+)(?:\\.(\\d+))?(?:-dev(\\d+))?$");

    private final int major;
    private final int minor;
    private final int patch;
    private final Integer devNumber;

    private Version(final int major, final int minor, final int patch, final Integer devNumber) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.devNumber = devNumber;
    }

    public static Version of(final int major, final int minor, final int patch) {
        return new Version(requireNonNegative(major, "major"), requireNonNegative(minor, "minor"),
                requireNonNegative(patch, "patch"), null);
    }

    public static Version dev(final int major, final int minor, final int patch, final int devNumber) {
        return new Version(requireNonNegative(major, "major"), requireNonNegative(minor, "minor"),
                requireNonNegative(patch, "patch"), requireNonNegative(devNumber, "devNumber"));
    }

    public static Version parse(final String text) {
        if (text == null) {
            throw new VersionFormatException(null, "version string must not be null");
        }
        final String normalized = text.trim();
        if (normalized.isEmpty()) {
            throw new VersionFormatException(text, "version string must not be blank");
        }
        final Matcher matcher = VERSION_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            throw new VersionFormatException(text, "invalid version format: '" + text + "'");
        }
        final int major = parseComponent(text, matcher.group(1));
        final int minor = parseComponent(text, matcher.group(2));
        final int patch = matcher.group(3) == null ? 0 : parseComponent(text, matcher.group(3));
        final Integer devNumber = matcher.group(4) == null ? null : parseComponent(text, matcher.group(4));
        return new Version(major, minor, patch, devNumber);
    }

    public int major() {
        return major;
    }

    public int minor() {
        return minor;
    }

    public int patch() {
        return patch;
    }

    public boolean isDevelopment() {
        return devNumber != null;
    }

    /**
     * Development number, or {@code -1} for a release version.
     */
    public int devNumber() {
        return devNumber == null ? -1 : devNumber;
    }

    @Override
    public int compareTo(final Version other) {
        Objects.requireNonNull(other, "other");
        int result = Integer.compare(major, other.major);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(minor, other.minor);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(patch, other.patch);
        if (result != 0) {
            return result;
        }
        if (devNumber == null) {
            return other.devNumber == null ? 0 : 1;
        }
        if (other.devNumber == null) {
            return -1;
        }
        return Integer.compare(devNumber, other.devNumber);
    }

    public boolean isAtMost(final Version other) {
        return compareTo(other) <= 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Version other)) {
            return false;
        }
        return major == other.major
                && minor == other.minor
                && patch == other.patch
                && Objects.equals(devNumber, other.devNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, devNumber);
    }

    @Override
    public String toString() {
        final String release = major + "." + minor + "." + patch;
        return devNumber == null ? release : release + "-dev" + devNumber;
    }

    private static int parseComponent(final String text, final String component) {
        try {
            return Integer.parseInt(component);
        } catch (NumberFormatException e) {
            throw new VersionFormatException(text, "version component out of range: '" + component + "'");
        }
    }

    private static int requireNonNegative(final int value, final String fieldName) {
        if (value < 0) {
            throw new IllegalArgumentException(fieldName + " must be >= 0");
        }
        return value;
    }
}
