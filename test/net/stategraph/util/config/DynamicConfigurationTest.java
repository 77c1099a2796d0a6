package net.stategraph.util.config;

import org.junit.Test;
import static org.junit.Assert.*;

import java.util.Properties;

/**
 * Unit tests for DynamicConfiguration and PropertiesConfiguration.
 */
public class DynamicConfigurationTest {

    private static PropertiesConfiguration props(String... pairs) {
        Properties p = new Properties();
        for (int i = 0; i < pairs.length; i += 2)
            p.setProperty(pairs[i], pairs[i + 1]);
        return new PropertiesConfiguration(p);
    }

    @Test
    public void testSourceOrder() {
        DynamicConfiguration config = new DynamicConfiguration()
            .addSource(props("a", "first"))
            .addSource(props("a", "second", "b", "only"));

        assertEquals("first", config.get("a"));
        assertEquals("only", config.get("b"));
        assertNull(config.get("c"));
    }

    @Test
    public void testOverrides() {
        DynamicConfiguration config = new DynamicConfiguration()
            .addSource(props("a", "source"));
        config.put("a", "override");
        assertEquals("override", config.get("a"));
        config.remove("a");
        assertEquals("source", config.get("a"));
    }

    @Test
    public void testNullConfiguration() {
        assertNull(Configuration.NULL.get("stategraph.marker"));
    }

    @Test
    public void testSystemProperty() {
        String key = "stategraph.test.property";
        System.setProperty(key, "set");
        try {
            assertEquals("set", DynamicConfiguration.makeDefault().get(key));
        } finally {
            System.clearProperty(key);
        }
    }

    @Test
    public void testClassPathResource() {
        PropertiesConfiguration res = PropertiesConfiguration.fromResource(
            getClass().getClassLoader(), DynamicConfiguration.RESOURCE_NAME);
        assertEquals("[*]", res.get("stategraph.marker"));
        assertEquals("false",
                     res.get("stategraph.builder.lenientScopeClose"));
    }

    @Test
    public void testMissingResource() {
        PropertiesConfiguration res = PropertiesConfiguration.fromResource(
            getClass().getClassLoader(), "no-such-file.properties");
        assertTrue(res.getBase().isEmpty());
    }

}
