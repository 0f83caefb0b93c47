package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.models.BlocklistEntry;
import cz.vut.fit.shroudinger.models.MatchType;
import org.jetbrains.annotations.NotNull;

/**
 * Identifies a rule slot: an exact rule and a suffix rule for the same name are different rules and never
 * replace each other.
 */
public record RuleKey(@NotNull String domain, @NotNull MatchType matchType) {

    public static RuleKey of(@NotNull BlocklistEntry entry) {
        return new RuleKey(entry.domain(), entry.matchType());
    }

    public static RuleKey exact(@NotNull String domain) {
        return new RuleKey(domain, MatchType.EXACT);
    }

    public static RuleKey suffix(@NotNull String domain) {
        return new RuleKey(domain, MatchType.SUFFIX);
    }
}
