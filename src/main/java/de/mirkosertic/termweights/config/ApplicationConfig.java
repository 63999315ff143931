package de.mirkosertic.termweights.config;

import de.mirkosertic.termweights.weights.LineParsePolicy;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration of a term weights run.
 * Loads configuration from YAML files, environment variables and system properties.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. Working directory config file (./termweights.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_IMPORT_DIR = "TERMWEIGHTS_IMPORT_DIR";
    private static final String ENV_EXPORT_DIR = "TERMWEIGHTS_EXPORT_DIR";
    private static final String ENV_STOPLIST = "TERMWEIGHTS_STOPLIST";
    private static final String PROP_PREFIX = "termweights.";
    public static final String PROP_PROFILE = "termweights.profile";
    private static final String USER_CONFIG_FILE = "termweights.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Locations
    private String importDir = "Import";
    private String exportDir = "Export";
    private String stoplist = "stoplist.txt";

    // File naming
    private String frequencySuffix = ".txt";
    private String weightsExtension = "wts";
    private String htmlSuffix = ".html";

    // Parsing
    private boolean strictParsing = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(Paths.get(USER_CONFIG_FILE), System.getenv());
    }

    /**
     * Load configuration with an explicit working directory config file and environment.
     */
    public static ApplicationConfig load(final Path userConfigPath, final Map<String, String> environment) {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load config file from the working directory (may override some settings)
        config.loadFromUserConfig(userConfigPath);

        // Step 3: Apply environment variables, then system properties (highest priority)
        config.applyEnvironmentOverrides(environment);
        config.applySystemPropertyOverrides();

        logger.info("Configuration loaded: importDir={}, exportDir={}, stoplist={}, strictParsing={}",
                config.importDir, config.exportDir, config.stoplist, config.strictParsing);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path userConfigPath) {
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> section = (Map<String, Object>) config.get("termweights");
        if (section == null) {
            return;
        }

        this.importDir = stringValue(section, "import-dir", importDir);
        this.exportDir = stringValue(section, "export-dir", exportDir);
        this.stoplist = stringValue(section, "stoplist", stoplist);
        this.frequencySuffix = stringValue(section, "frequency-suffix", frequencySuffix);
        this.weightsExtension = stringValue(section, "weights-extension", weightsExtension);
        this.htmlSuffix = stringValue(section, "html-suffix", htmlSuffix);
        if (section.containsKey("strict-parsing")) {
            this.strictParsing = Boolean.parseBoolean(String.valueOf(section.get("strict-parsing")));
        }
    }

    private String stringValue(final Map<String, Object> section, final String key, final String current) {
        final Object value = section.get(key);
        if (value == null) {
            return current;
        }
        return resolveVariables(value.toString());
    }

    private void applyEnvironmentOverrides(final Map<String, String> environment) {
        final String envImportDir = environment.get(ENV_IMPORT_DIR);
        if (envImportDir != null && !envImportDir.trim().isEmpty()) {
            this.importDir = envImportDir.trim();
            logger.info("Import directory from environment: {}", this.importDir);
        }

        final String envExportDir = environment.get(ENV_EXPORT_DIR);
        if (envExportDir != null && !envExportDir.trim().isEmpty()) {
            this.exportDir = envExportDir.trim();
            logger.info("Export directory from environment: {}", this.exportDir);
        }

        final String envStoplist = environment.get(ENV_STOPLIST);
        if (envStoplist != null && !envStoplist.trim().isEmpty()) {
            this.stoplist = envStoplist.trim();
            logger.info("Stoplist from environment: {}", this.stoplist);
        }
    }

    private void applySystemPropertyOverrides() {
        this.importDir = systemProperty("import-dir", importDir);
        this.exportDir = systemProperty("export-dir", exportDir);
        this.stoplist = systemProperty("stoplist", stoplist);
        final String strict = System.getProperty(PROP_PREFIX + "strict-parsing");
        if (strict != null && !strict.isEmpty()) {
            this.strictParsing = Boolean.parseBoolean(strict);
        }
    }

    private static String systemProperty(final String key, final String current) {
        final String value = System.getProperty(PROP_PREFIX + key);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        return current;
    }

    /**
     * Whether the {@code batch} profile is active, which sends logging to a file instead of the console.
     */
    public static boolean isBatchProfile() {
        return "batch".equalsIgnoreCase(System.getProperty(PROP_PROFILE, "default"));
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private @Nullable String resolveVariables(final @Nullable String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    /**
     * Check the values that cannot be defaulted sensibly.
     *
     * @throws ConfigurationException if a file naming setting is empty
     */
    public void validate() throws ConfigurationException {
        if (frequencySuffix.isEmpty()) {
            throw new ConfigurationException("termweights.frequency-suffix must not be empty");
        }
        if (htmlSuffix.isEmpty()) {
            throw new ConfigurationException("termweights.html-suffix must not be empty");
        }
        if (weightsExtension.isEmpty() || weightsExtension.startsWith(".")) {
            throw new ConfigurationException("termweights.weights-extension must be a non-empty extension without a dot, was '"
                    + weightsExtension + "'");
        }
    }

    // Getters
    public Path getImportDir() {
        return Paths.get(importDir);
    }

    public Path getExportDir() {
        return Paths.get(exportDir);
    }

    public Path getStoplist() {
        return Paths.get(stoplist);
    }

    public String getFrequencySuffix() {
        return frequencySuffix;
    }

    public String getWeightsExtension() {
        return weightsExtension;
    }

    public String getHtmlSuffix() {
        return htmlSuffix;
    }

    public boolean isStrictParsing() {
        return strictParsing;
    }

    public LineParsePolicy getLineParsePolicy() {
        return strictParsing ? LineParsePolicy.STRICT : LineParsePolicy.LENIENT;
    }
}
