package cz.vut.fit.shroudinger.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The grammar of a blocklist source.
 */
public enum SourceFormat {
    /**
     * Host-mapping lines, {@code 0.0.0.0 domain} or {@code 127.0.0.1 domain}.
     */
    HOSTS("hosts"),
    /**
     * Adblock-style filter rules, {@code ||domain^} and {@code @@||domain^}.
     */
    FILTER_LIST("filter-list"),
    /**
     * One domain per line, optionally prefixed with {@code *.} for a suffix rule.
     */
    PLAIN_DOMAINS("plain-domains");

    private final String _label;

    SourceFormat(String label) {
        _label = label;
    }

    @JsonValue
    public String label() {
        return _label;
    }

    @JsonCreator
    public static SourceFormat fromLabel(String label) {
        if (label == null)
            throw new IllegalArgumentException("Missing source format");

        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "hosts" -> HOSTS;
            case "filter-list", "filter_list", "adblock" -> FILTER_LIST;
            case "plain-domains", "plain_domains", "domains" -> PLAIN_DOMAINS;
            default -> throw new IllegalArgumentException("Unknown source format: " + label);
        };
    }
}
