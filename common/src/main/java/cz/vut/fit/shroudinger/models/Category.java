package cz.vut.fit.shroudinger.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The category of a blocklist rule.
 */
public enum Category {
    ADS,
    TRACKING,
    MALWARE,
    CUSTOM;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a category label. Unknown or missing labels map to {@link #CUSTOM}.
     */
    @JsonCreator
    public static Category fromLabel(String label) {
        if (label == null || label.isBlank())
            return CUSTOM;

        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "ads", "advertising" -> ADS;
            case "tracking", "trackers" -> TRACKING;
            case "malware", "phishing" -> MALWARE;
            default -> CUSTOM;
        };
    }
}
