package nl.bytesoflife.deltasch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Properties;

/**
 * Library defaults, read once from {@code /deltasch-defaults.properties} on the classpath.
 * A JVM system property with the same key takes precedence over the bundled value.
 */
public final class SchematicConfig {

    private static final Logger log = LoggerFactory.getLogger(SchematicConfig.class);

    public static final String RESOURCE = "/deltasch-defaults.properties";

    public static final String VERSION_MIN = "deltasch.version.min";
    public static final String VERSION_MAX = "deltasch.version.max";
    public static final String FORMAT_VERSION = "deltasch.format.version";
    public static final String FORMAT_GENERATOR = "deltasch.format.generator";
    public static final String FORMAT_GENERATOR_VERSION = "deltasch.format.generatorVersion";
    public static final String PARSER_STRICT = "deltasch.parser.strict";
    public static final String PARSER_COMMENTS = "deltasch.parser.comments";
    public static final String WRITER_MODE = "deltasch.writer.mode";
    public static final String WRITER_BACKUP_SUFFIX = "deltasch.writer.backupSuffix";
    public static final String WRITER_DECIMALS = "deltasch.writer.decimals";
    public static final String CONNECTIVITY_TOLERANCE = "deltasch.connectivity.tolerance";
    public static final String CONNECTIVITY_UNIFY_GLOBALS = "deltasch.connectivity.unifyGlobalLabels";
    public static final String CONNECTIVITY_INCLUDE_BUSES = "deltasch.connectivity.includeBuses";
    public static final String HIERARCHY_DIRECTION_POLICY = "deltasch.hierarchy.directionPolicy";

    private static volatile SchematicConfig defaults;

    private final Properties properties;
    private final boolean systemOverrides;

    private SchematicConfig(Properties properties, boolean systemOverrides) {
        this.properties = properties;
        this.systemOverrides = systemOverrides;
    }

    public static SchematicConfig defaults() {
        if (defaults == null) {
            synchronized (SchematicConfig.class) {
                if (defaults == null) {
                    defaults = load();
                }
            }
        }
        return defaults;
    }

    /**
     * Configuration backed by the given properties only, for callers that manage their own.
     * System properties do not override them.
     */
    public static SchematicConfig of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new SchematicConfig(copy, false);
    }

    private static SchematicConfig load() {
        try (InputStream is = SchematicConfig.class.getResourceAsStream(RESOURCE)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + RESOURCE);
            Properties properties = new Properties();
            properties.load(is);
            log.debug("Loaded {} default settings from {}", properties.size(), RESOURCE);
            return new SchematicConfig(properties, true);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + RESOURCE, e);
        }
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (systemOverrides) {
            value = System.getProperty(key, value);
        }
        if (value == null) {
            throw new IllegalStateException("Missing configuration value: " + key);
        }
        return value.trim();
    }

    public int getInt(String key) {
        String value = getString(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Configuration value " + key + " is not an integer: " + value, e);
        }
    }

    public double getDouble(String key) {
        String value = getString(key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Configuration value " + key + " is not a number: " + value, e);
        }
    }

    public boolean getBoolean(String key) {
        return Boolean.parseBoolean(getString(key));
    }

    public <E extends Enum<E>> E getEnum(String key, Class<E> type) {
        String value = getString(key);
        try {
            return Enum.valueOf(type, value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Configuration value " + key + " is not one of "
                    + Arrays.toString(type.getEnumConstants()) + ": " + value, e);
        }
    }
}
