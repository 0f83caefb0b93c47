package cz.vut.fit.shroudinger.models;

/**
 * The matching stage that decided a check.
 */
public enum MatchedBy {
    EXACT,
    TRIE,
    NONE
}
