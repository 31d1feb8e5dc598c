package FileServer;

import java.io.*;
import java.util.Properties;
import java.util.logging.Logger;
import java.util.logging.Level;

/**
 * Static file handler configuration from a properties file and environment variables.
 * Environment variables take precedence over properties file values.
 */
public class StaticFileConfig {

    private static final Logger logger = Logger.getLogger(StaticFileConfig.class.getName());
    private static final String DEFAULT_CONFIG_FILE = "staticfiles.properties";

    // Default configuration values
    public static final String DEFAULT_FILENAME = "index.html";
    public static final int DEFAULT_CHUNK_SIZE = 1024 * 200;
    private static final String DEFAULT_LOGGING_FORMAT = "json";
    private static final String DEFAULT_LOGGING_LEVEL = "INFO";

    private final Properties properties;

    private String defaultFilename;
    private int chunkSize;
    private String loggingFormat;
    private String loggingLevel;

    public StaticFileConfig() {
        this(DEFAULT_CONFIG_FILE);
    }

    public StaticFileConfig(String configFilePath) {
        properties = new Properties();
        File configFile = new File(configFilePath);
        if (configFile.exists()) {
            try (FileInputStream fis = new FileInputStream(configFile)) {
                properties.load(fis);
                logger.info("Configuration loaded from: " + configFilePath);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Failed to load config file: " + configFilePath, e);
            }
        } else {
            logger.fine("Config file not found: " + configFilePath + ", using defaults and environment variables");
        }
        loadConfiguration();
    }

    public StaticFileConfig(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
        loadConfiguration();
    }

    private void loadConfiguration() {
        defaultFilename = getStringConfig("static.default.filename", "STATIC_DEFAULT_FILENAME", DEFAULT_FILENAME);
        chunkSize = getIntConfig("static.chunk.size", "STATIC_CHUNK_SIZE", DEFAULT_CHUNK_SIZE);

        loggingFormat = getStringConfig("logging.format", "LOGGING_FORMAT", DEFAULT_LOGGING_FORMAT);
        loggingLevel = getStringConfig("logging.level", "LOGGING_LEVEL", DEFAULT_LOGGING_LEVEL);

        validateConfiguration();
    }

    private void validateConfiguration() {
        if (chunkSize <= 0) {
            logger.warning("Chunk size must be positive, got " + chunkSize + ". Using default: " + DEFAULT_CHUNK_SIZE);
            chunkSize = DEFAULT_CHUNK_SIZE;
        }

        if (defaultFilename == null || defaultFilename.trim().isEmpty() || defaultFilename.contains("/")) {
            logger.warning("Invalid default filename '" + defaultFilename + "'. Using default: " + DEFAULT_FILENAME);
            defaultFilename = DEFAULT_FILENAME;
        }
    }

    private String getStringConfig(String propertyKey, String envKey, String defaultValue) {
        // Environment variable takes precedence
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        return properties.getProperty(propertyKey, defaultValue);
    }

    private int getIntConfig(String propertyKey, String envKey, int defaultValue) {
        String value = getStringConfig(propertyKey, envKey, String.valueOf(defaultValue));
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warning("Invalid integer value for " + propertyKey + ": " + value + ", using default: " + defaultValue);
            return defaultValue;
        }
    }

    // Getters
    public String getDefaultFilename() {
        return defaultFilename;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public String getLoggingFormat() {
        return loggingFormat;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public boolean isJsonLogging() {
        return "json".equalsIgnoreCase(loggingFormat);
    }
}
