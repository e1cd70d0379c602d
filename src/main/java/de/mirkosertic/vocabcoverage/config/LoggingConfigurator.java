package de.mirkosertic.vocabcoverage.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches logging between stderr and a rolling log file.
 * <p>
 * By default logback.xml is used, which writes to stderr so that the frequency table on stdout
 * stays machine readable. In file mode logback-file.xml is loaded instead and all output goes to
 * ~/.vocabcoverage/log.
 */
public final class LoggingConfigurator {

    public static final String LOGGING_PROPERTY = "vocabcoverage.logging";
    static final String FILE_CONFIG = "logback-file.xml";

    private LoggingConfigurator() {
    }

    /**
     * @return true if file logging was requested through {@code -Dvocabcoverage.logging=file}
     */
    public static boolean fileModeRequested() {
        return "file".equalsIgnoreCase(System.getProperty(LOGGING_PROPERTY));
    }

    /**
     * Must be called before anything else logs.
     *
     * @param fileMode true to log into ~/.vocabcoverage/log instead of stderr
     */
    public static void configure(final boolean fileMode) {
        if (fileMode) {
            ensureLogDirectoryExists();
            loadConfiguration(FILE_CONFIG);
        }
        // stderr mode uses logback.xml which is loaded automatically
    }

    public static Path getLogDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void ensureLogDirectoryExists() {
        final Path logDir = getLogDirectory();
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + logDir);
        }
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            context.putProperty("LOG_DIR", getLogDirectory().toString());

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (final InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final IOException e) {
            System.err.println("Warning: Could not read logback configuration: " + e.getMessage());
        }
    }
}
