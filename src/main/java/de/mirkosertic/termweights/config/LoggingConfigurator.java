package de.mirkosertic.termweights.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Switches Logback to file output for unattended batch runs.
 * <p>
 * In the batch profile, loads logback-file.xml which writes to
 * {@code ~/.termweights/log/termweights.log}. Otherwise logback.xml with console output is
 * picked up automatically.
 */
public final class LoggingConfigurator {

    private static final String LOG_DIR = System.getProperty("user.home") + "/.termweights/log";
    private static final String FILE_CONFIG = "logback-file.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before anything logs.
     *
     * @param fileLogging true to log into the log directory instead of the console
     */
    public static void configure(final boolean fileLogging) {
        if (fileLogging) {
            ensureLogDirectoryExists();
            loadConfiguration(FILE_CONFIG);
        }
    }

    private static void ensureLogDirectoryExists() {
        try {
            final Path logDir = Paths.get(LOG_DIR);
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + LOG_DIR + ": " + e.getMessage());
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath, keeping console logging");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final IOException e) {
            System.err.println("Warning: Could not read " + configFile + ": " + e.getMessage());
        }
    }
}
