package org.clustertest.config;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.clustertest.obs.JsonLinesLogger;
import org.clustertest.obs.LogLevel;
import org.clustertest.obs.StructuredJsonLinesLogger;
import org.clustertest.version.Version;

/**
 * Process-level settings of the framework core.
 *
 * <p>Each setting is resolved from a system property first and an environment variable second.
 */
public record FrameworkConfig(Version frameworkVersion, boolean verbose, LogLevel logLevel) {
    public static final String DEFAULT_FRAMEWORK_VERSION = "1.0.0-dev0";

    static final String VERSION_PROPERTY = "clustertest.version";
    static final String VERSION_ENV = "CLUSTERTEST_VERSION";
    static final String VERBOSE_PROPERTY = "clustertest.verbose";
    static final String VERBOSE_ENV = "CLUSTERTEST_VERBOSE";
    static final String LOG_LEVEL_PROPERTY = "clustertest.logLevel";
    static final String LOG_LEVEL_ENV = "CLUSTERTEST_LOG_LEVEL";

    public FrameworkConfig {
        Objects.requireNonNull(frameworkVersion, "frameworkVersion");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static FrameworkConfig defaults() {
        return new FrameworkConfig(Version.parse(DEFAULT_FRAMEWORK_VERSION), false, LogLevel.INFO);
    }

    public static FrameworkConfig fromEnvironment() {
        return resolve(System::getProperty, System.getenv(), packageVersion());
    }

    static FrameworkConfig resolve(
            final Function<String, String> properties,
            final Map<String, String> environment,
            final String packageVersion) {
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(environment, "environment");

        final String versionText = firstNonBlank(
                properties.apply(VERSION_PROPERTY),
                environment.get(VERSION_ENV),
                releaseVersionOrNull(packageVersion),
                DEFAULT_FRAMEWORK_VERSION);
        final boolean verbose = parseBooleanSwitch(
                firstNonBlank(properties.apply(VERBOSE_PROPERTY), environment.get(VERBOSE_ENV)),
                false);
        final String levelText = firstNonBlank(
                properties.apply(LOG_LEVEL_PROPERTY),
                environment.get(LOG_LEVEL_ENV));
        LogLevel level = levelText == null ? LogLevel.INFO : LogLevel.parse(levelText);
        if (verbose && !LogLevel.VERBOSE.isEnabledAt(level)) {
            level = LogLevel.VERBOSE;
        }
        return new FrameworkConfig(Version.parse(versionText), verbose, level);
    }

    public FrameworkConfig withFrameworkVersion(final String version) {
        return new FrameworkConfig(Version.parse(version), verbose, logLevel);
    }

    public FrameworkConfig withVerbose(final boolean enabled) {
        LogLevel level = logLevel;
        if (enabled && !LogLevel.VERBOSE.isEnabledAt(level)) {
            level = LogLevel.VERBOSE;
        }
        return new FrameworkConfig(frameworkVersion, enabled, level);
    }

    public JsonLinesLogger createLogger() {
        return StructuredJsonLinesLogger.standardError(logLevel);
    }

    static boolean parseBooleanSwitch(final String value, final boolean defaultValue) {
        final String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return defaultValue;
        }
        return switch (normalized) {
            case "true", "1", "yes", "y", "on", "enabled" -> true;
            case "false", "0", "no", "n", "off", "disabled" -> false;
            default -> defaultValue;
        };
    }

    private static String packageVersion() {
        final Package pkg = FrameworkConfig.class.getPackage();
        return pkg == null ? null : pkg.getImplementationVersion();
    }

    // Manifest versions such as 1.2.0-SNAPSHOT are not framework versions.
    private static String releaseVersionOrNull(final String packageVersion) {
        if (packageVersion == null || packageVersion.isBlank()) {
            return null;
        }
        try {
            return Version.parse(packageVersion).toString();
        } catch (IllegalArgumentException ignored) {
            return null;
        }
    }

    private static String firstNonBlank(final String... values) {
        for (final String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
