package org.clustertest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.function.Function;
import org.clustertest.obs.LogLevel;
import org.clustertest.version.Version;
import org.clustertest.version.VersionFormatException;
import org.junit.jupiter.api.Test;

class FrameworkConfigTest {
    private static final Function<String, String> NO_PROPERTIES = key -> null;

    @Test
    void fallsBackToBuiltInDefaults() {
        FrameworkConfig config = FrameworkConfig.resolve(NO_PROPERTIES, Map.of(), null);

        assertEquals(Version.parse(FrameworkConfig.DEFAULT_FRAMEWORK_VERSION), config.frameworkVersion());
        assertFalse(config.verbose());
        assertEquals(LogLevel.INFO, config.logLevel());
        assertEquals(FrameworkConfig.defaults(), config);
    }

    @Test
    void systemPropertyWinsOverEnvironment() {
        Map<String, String> properties = Map.of(FrameworkConfig.VERSION_PROPERTY, "4.2");
        Map<String, String> environment = Map.of(FrameworkConfig.VERSION_ENV, "3.0");

        FrameworkConfig config = FrameworkConfig.resolve(properties::get, environment, "5.0.0");

        assertEquals(Version.of(4, 2, 0), config.frameworkVersion());
    }

    @Test
    void environmentWinsOverPackageVersion() {
        FrameworkConfig config = FrameworkConfig.resolve(
            NO_PROPERTIES,
            Map.of(FrameworkConfig.VERSION_ENV, "3.0-dev1"),
            "5.0.0"
        );

        assertEquals(Version.dev(3, 0, 0, 1), config.frameworkVersion());
    }

    @Test
    void usesPackageVersionOnlyWhenItIsAFrameworkVersion() {
        assertEquals(
            Version.of(5, 1, 0),
            FrameworkConfig.resolve(NO_PROPERTIES, Map.of(), "5.1").frameworkVersion()
        );
        assertEquals(
            Version.parse(FrameworkConfig.DEFAULT_FRAMEWORK_VERSION),
            FrameworkConfig.resolve(NO_PROPERTIES, Map.of(), "1.0.0-SNAPSHOT").frameworkVersion()
        );
    }

    @Test
    void verboseSwitchRaisesLogLevel() {
        FrameworkConfig config = FrameworkConfig.resolve(
            NO_PROPERTIES,
            Map.of(FrameworkConfig.VERBOSE_ENV, "on", FrameworkConfig.LOG_LEVEL_ENV, "warning"),
            null
        );

        assertTrue(config.verbose());
        assertEquals(LogLevel.VERBOSE, config.logLevel());
        assertEquals(LogLevel.VERBOSE, FrameworkConfig.defaults().withVerbose(true).logLevel());
    }

    @Test
    void explicitDebugLevelIsKeptWhenVerbose() {
        FrameworkConfig config = FrameworkConfig.resolve(
            key -> FrameworkConfig.LOG_LEVEL_PROPERTY.equals(key) ? "debug" : null,
            Map.of(FrameworkConfig.VERBOSE_ENV, "yes"),
            null
        );

        assertEquals(LogLevel.DEBUG, config.logLevel());
    }

    @Test
    void parsesBooleanSwitches() {
        assertTrue(FrameworkConfig.parseBooleanSwitch("Enabled", false));
        assertTrue(FrameworkConfig.parseBooleanSwitch("1", false));
        assertFalse(FrameworkConfig.parseBooleanSwitch("off", true));
        assertFalse(FrameworkConfig.parseBooleanSwitch("disabled", true));
        assertTrue(FrameworkConfig.parseBooleanSwitch("maybe", true));
        assertFalse(FrameworkConfig.parseBooleanSwitch(null, false));
    }

    @Test
    void rejectsMalformedConfiguredVersion() {
        assertThrows(
            VersionFormatException.class,
            () -> FrameworkConfig.resolve(NO_PROPERTIES, Map.of(FrameworkConfig.VERSION_ENV, "four"), null)
        );
        assertThrows(VersionFormatException.class, () -> FrameworkConfig.defaults().withFrameworkVersion("4"));
    }
}
