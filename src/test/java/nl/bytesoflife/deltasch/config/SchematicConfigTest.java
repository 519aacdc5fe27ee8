package nl.bytesoflife.deltasch.config;

import nl.bytesoflife.deltasch.connectivity.ConnectivityOptions;
import nl.bytesoflife.deltasch.hierarchy.DirectionPolicy;
import nl.bytesoflife.deltasch.hierarchy.HierarchyOptions;
import nl.bytesoflife.deltasch.parser.ParserOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SchematicConfigTest {

    private final Properties properties = new Properties();

    @AfterEach
    void clearOverrides() {
        System.clearProperty(SchematicConfig.CONNECTIVITY_TOLERANCE);
    }

    @Test
    void bundledDefaults() {
        SchematicConfig config = SchematicConfig.defaults();
        assertEquals(20211123, config.getInt(SchematicConfig.VERSION_MIN));
        assertEquals(20251231, config.getInt(SchematicConfig.VERSION_MAX));
        assertEquals(0.01, config.getDouble(SchematicConfig.CONNECTIVITY_TOLERANCE), 1e-12);
        assertTrue(config.getBoolean(SchematicConfig.CONNECTIVITY_UNIFY_GLOBALS));
        assertEquals(DirectionPolicy.SIGNAL_FLOW,
                config.getEnum(SchematicConfig.HIERARCHY_DIRECTION_POLICY, DirectionPolicy.class));
    }

    @Test
    void optionsFollowProperties() {
        properties.putAll(allDefaults());
        properties.setProperty(SchematicConfig.CONNECTIVITY_TOLERANCE, "0.1");
        properties.setProperty(SchematicConfig.CONNECTIVITY_INCLUDE_BUSES, "true");
        properties.setProperty(SchematicConfig.PARSER_STRICT, "false");
        properties.setProperty(SchematicConfig.HIERARCHY_DIRECTION_POLICY, "matching");
        SchematicConfig config = SchematicConfig.of(properties);

        ConnectivityOptions connectivity = ConnectivityOptions.from(config);
        assertEquals(0.1, connectivity.getTolerance(), 1e-12);
        assertTrue(connectivity.isIncludeBuses());
        assertFalse(ParserOptions.from(config).isStrict());
        assertEquals(DirectionPolicy.MATCHING, HierarchyOptions.from(config).getDirectionPolicy());
    }

    @Test
    void systemPropertyOverridesFile() {
        System.setProperty(SchematicConfig.CONNECTIVITY_TOLERANCE, "0.5");
        assertEquals(0.5, SchematicConfig.defaults().getDouble(SchematicConfig.CONNECTIVITY_TOLERANCE), 1e-12);
        assertEquals(0.5, ConnectivityOptions.defaults().getTolerance(), 1e-12);
    }

    @Test
    void explicitPropertiesIgnoreSystemProperties() {
        System.setProperty(SchematicConfig.CONNECTIVITY_TOLERANCE, "0.5");
        properties.setProperty(SchematicConfig.CONNECTIVITY_TOLERANCE, "0.2");

        assertEquals(0.2, SchematicConfig.of(properties).getDouble(SchematicConfig.CONNECTIVITY_TOLERANCE), 1e-12);
        assertThrows(IllegalStateException.class,
                () -> SchematicConfig.of(new Properties()).getString(SchematicConfig.CONNECTIVITY_TOLERANCE));
    }

    @Test
    void badValuesAreReported() {
        properties.setProperty(SchematicConfig.VERSION_MIN, "soon");
        properties.setProperty(SchematicConfig.HIERARCHY_DIRECTION_POLICY, "sideways");
        SchematicConfig config = SchematicConfig.of(properties);

        assertThrows(IllegalStateException.class, () -> config.getInt(SchematicConfig.VERSION_MIN));
        assertThrows(IllegalStateException.class,
                () -> config.getEnum(SchematicConfig.HIERARCHY_DIRECTION_POLICY, DirectionPolicy.class));
        assertThrows(IllegalStateException.class, () -> config.getString("deltasch.no.such.key"));
    }

    private static Properties allDefaults() {
        Properties all = new Properties();
        SchematicConfig defaults = SchematicConfig.defaults();
        for (String key : new String[]{SchematicConfig.VERSION_MIN, SchematicConfig.VERSION_MAX,
                SchematicConfig.PARSER_COMMENTS, SchematicConfig.CONNECTIVITY_UNIFY_GLOBALS}) {
            all.setProperty(key, defaults.getString(key));
        }
        return all;
    }
}
