package de.mirkosertic.vocabcoverage.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time from the Maven-filtered build-info.properties.
 * Falls back to "dev"/"unknown" when the resource was not filtered.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = loadProperties();
        version = valueOrDefault(props.getProperty("build.version"), "dev");
        buildTimestamp = valueOrDefault(props.getProperty("build.timestamp"), "unknown");
        logger.debug("Build info: version={}, timestamp={}", version, buildTimestamp);
    }

    private BuildInfo() {
    }

    private static Properties loadProperties() {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }
        return props;
    }

    // An unfiltered resource still contains the ${...} placeholder
    private static String valueOrDefault(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }

    public static String describe() {
        return "vocabcoverage " + version + " (built " + buildTimestamp + ")";
    }
}
