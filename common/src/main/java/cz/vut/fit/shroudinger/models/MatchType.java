package cz.vut.fit.shroudinger.models;

/**
 * How a rule matches domain names.
 */
public enum MatchType {
    /**
     * The rule matches exactly one name.
     */
    EXACT,
    /**
     * The rule matches the name and all its subdomains.
     */
    SUFFIX
}
