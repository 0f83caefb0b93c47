package cz.vut.fit.shroudinger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Properties;

/**
 * Common utility functions shared by the resolver components.
 */
public final class Common {
    private Common() {
    }

    /**
     * Creates a new Jackson JSON {@link ObjectMapper} builder with the following settings:
     * <ul>
     *     <li>Include the JavaTimeModule to support Java 8 date/time datatypes.</li>
     *     <li>Write timestamps as ISO-8601 strings and durations as milliseconds.</li>
     *     <li>Accept enum values case-insensitively (configuration lists use lowercase names).</li>
     *     <li>Do not fail on unknown properties.</li>
     * </ul>
     *
     * @return a new {@link MapperBuilder}
     */
    public static MapperBuilder<? extends ObjectMapper, ?> makeMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .configure(JsonParser.Feature.INCLUDE_SOURCE_IN_LOCATION, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, true)
                .configure(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS, false)
                .configure(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true);
    }

    /**
     * Creates a logger for a specific resolver component. The logger name will be created by concatenating
     * the class name, a dot, and the value of the static field {@code COMPONENT_NAME} in the class.
     *
     * @param clazz the class to get the logger for
     * @return a SLF4J {@link Logger} instance
     */
    public static Logger getComponentLogger(Class<?> clazz) {
        try {
            final String componentName = clazz.getField("COMPONENT_NAME")
                    .get(null).toString();
            return org.slf4j.LoggerFactory.getLogger(clazz.getName() + "." + componentName);
        } catch (IllegalAccessException | NoSuchFieldException e) {
            throw new RuntimeException(e);
        }
    }

    public static long getLong(@NotNull Properties properties, @NotNull String key, @NotNull String defaultValue) {
        return Long.parseLong(properties.getProperty(key, defaultValue).trim());
    }

    public static int getInt(@NotNull Properties properties, @NotNull String key, @NotNull String defaultValue) {
        return Integer.parseInt(properties.getProperty(key, defaultValue).trim());
    }

    public static double getDouble(@NotNull Properties properties, @NotNull String key, @NotNull String defaultValue) {
        return Double.parseDouble(properties.getProperty(key, defaultValue).trim());
    }

    public static boolean getBoolean(@NotNull Properties properties, @NotNull String key, @NotNull String defaultValue) {
        return Boolean.parseBoolean(properties.getProperty(key, defaultValue).trim());
    }

    public static Duration getMillis(@NotNull Properties properties, @NotNull String key, @NotNull String defaultValue) {
        return Duration.ofMillis(getLong(properties, key, defaultValue));
    }

    public static Duration getSeconds(@NotNull Properties properties, @NotNull String key, @NotNull String defaultValue) {
        return Duration.ofSeconds(getLong(properties, key, defaultValue));
    }
}
