package net.stategraph.util.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Logger;

public class PropertiesConfiguration implements Configuration {

    private static final Logger LOGGER = Logger.getLogger("Configuration");

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        if (base == null)
            throw new NullPointerException("Properties may not be null");
        this.base = base;
    }

    public Properties getBase() {
        return base;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static Properties loadProperties(InputStream in)
            throws IOException {
        Properties ret = new Properties();
        ret.load(in);
        return ret;
    }

    /**
     * Load the named class path resource; a missing resource yields an
     * empty configuration.
     */
    public static PropertiesConfiguration fromResource(ClassLoader loader,
                                                       String name) {
        InputStream in = loader.getResourceAsStream(name);
        if (in == null) {
            LOGGER.config("No " + name + " on class path");
            return new PropertiesConfiguration(new Properties());
        }
        try {
            try {
                return new PropertiesConfiguration(loadProperties(in));
            } finally {
                in.close();
            }
        } catch (IOException exc) {
            throw new RuntimeException("Could not read " + name, exc);
        }
    }

}
