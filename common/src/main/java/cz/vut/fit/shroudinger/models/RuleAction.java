package cz.vut.fit.shroudinger.models;

/**
 * What a rule does with a matching name. Allow rules come from exception entries of filter lists.
 */
public enum RuleAction {
    BLOCK,
    ALLOW
}
