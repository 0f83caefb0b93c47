package cz.vut.fit.shroudinger;

import java.time.Duration;
import java.util.Properties;

/**
 * Fluent builder for the {@link Properties} consumed by the resolver components.
 */
public final class PropertiesBuilder {
    private final Properties _properties;

    public PropertiesBuilder() {
        _properties = new Properties();
    }

    public PropertiesBuilder(Properties base) {
        _properties = new Properties();
        _properties.putAll(base);
    }

    public PropertiesBuilder add(String key, String value) {
        _properties.setProperty(key, value);
        return this;
    }

    public PropertiesBuilder add(String key, long value) {
        return add(key, Long.toString(value));
    }

    public PropertiesBuilder add(String key, double value) {
        return add(key, Double.toString(value));
    }

    public PropertiesBuilder addMillis(String key, Duration value) {
        return add(key, value.toMillis());
    }

    public Properties get() {
        return _properties;
    }
}
