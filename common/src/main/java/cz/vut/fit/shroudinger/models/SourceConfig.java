package cz.vut.fit.shroudinger.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import cz.vut.fit.shroudinger.errors.ConfigurationException;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An externally supplied blocklist source definition.
 *
 * @param name     A unique source name.
 * @param origin   The origin of the list: an {@code http(s)://} URL, a {@code file:} URI or a plain path.
 * @param format   The grammar of the list.
 * @param category The category assigned to the entries of the list.
 * @param priority The source priority; higher wins when several sources claim the same domain.
 * @param enabled  Disabled sources are skipped and their entries removed on reload.
 */
public record SourceConfig(@NotNull String name,
                           @NotNull String origin,
                           @NotNull SourceFormat format,
                           @NotNull Category category,
                           int priority,
                           boolean enabled) {

    @JsonCreator
    public SourceConfig(@JsonProperty("name") String name,
                        @JsonProperty("origin") String origin,
                        @JsonProperty("format") SourceFormat format,
                        @JsonProperty("category") Category category,
                        @JsonProperty("priority") int priority,
                        @JsonProperty("enabled") Boolean enabled) {
        this(name, origin, format, category, priority, enabled == null || enabled);
    }

    public SourceConfig {
        if (name == null || name.isBlank())
            throw new ConfigurationException("A source must have a name");
        if (origin == null || origin.isBlank())
            throw new ConfigurationException("Source " + name + " has no origin");
        if (format == null)
            throw new ConfigurationException("Source " + name + " has no format");

        category = Objects.requireNonNullElse(category, Category.CUSTOM);
    }
}
