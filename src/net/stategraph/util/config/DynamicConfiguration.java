package net.stategraph.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A layered configuration.
 * Explicitly put values take precedence; other keys are looked up in the
 * sources in the order they were added.
 */
public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    /* stategraph.builder.lenientScopeClose is looked up as
     * STATEGRAPH_BUILDER_LENIENTSCOPECLOSE. */
    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(key.toUpperCase().replace(".", "_"));
        }
    };

    public static final String RESOURCE_NAME = "stategraph.properties";

    private final List<Configuration> sources;
    private final Map<String, String> overrides;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        overrides = new LinkedHashMap<String, String>();
    }

    public String get(String key) {
        if (overrides.containsKey(key)) return overrides.get(key);
        for (Configuration src : sources) {
            String ret = src.get(key);
            if (ret != null) return ret;
        }
        return null;
    }

    public DynamicConfiguration put(String key, String value) {
        overrides.put(key, value);
        return this;
    }

    public void remove(String key) {
        overrides.remove(key);
    }

    public DynamicConfiguration addSource(Configuration source) {
        if (source == null)
            throw new NullPointerException(
                "Configuration source may not be null");
        sources.add(source);
        return this;
    }

    /**
     * A configuration consulting system properties, then the environment,
     * then the stategraph.properties resource of the class path.
     */
    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        ret.addSource(PropertiesConfiguration.fromResource(
            DynamicConfiguration.class.getClassLoader(), RESOURCE_NAME));
        return ret;
    }

}
