package cz.vut.fit.shroudinger.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Encrypted DNS transport protocols.
 */
public enum Protocol {
    DOT("DoT", 853),
    DOH("DoH", 443),
    DOQ("DoQ", 853);

    private final String _label;
    private final int _defaultPort;

    Protocol(String label, int defaultPort) {
        _label = label;
        _defaultPort = defaultPort;
    }

    @JsonValue
    public String label() {
        return _label;
    }

    public int defaultPort() {
        return _defaultPort;
    }

    @JsonCreator
    public static Protocol fromLabel(String label) {
        if (label == null)
            throw new IllegalArgumentException("Missing protocol");

        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "dot", "tls" -> DOT;
            case "doh", "https" -> DOH;
            case "doq", "quic" -> DOQ;
            default -> throw new IllegalArgumentException("Unknown protocol: " + label);
        };
    }
}
