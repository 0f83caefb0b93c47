package cz.vut.fit.shroudinger.models;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * A single blocklist rule, unique per (source, domain).
 *
 * @param domain    The normalised (lowercase, no trailing dot) domain name the rule applies to.
 * @param matchType Whether the rule matches only the name itself or also all its subdomains.
 * @param action    Whether the rule blocks or explicitly allows the name.
 * @param category  The rule category.
 * @param source    The name of the source the rule was loaded from.
 * @param priority  The priority of the source; higher wins in a merge.
 * @param createdAt When the rule was parsed.
 */
public record BlocklistEntry(@NotNull String domain,
                             @NotNull MatchType matchType,
                             @NotNull RuleAction action,
                             @NotNull Category category,
                             @NotNull String source,
                             int priority,
                             @NotNull Instant createdAt) {

    private static final Splitter LABEL_SPLITTER = Splitter.on('.');

    /**
     * Returns the labels of the domain ordered from the top-level label inward,
     * i.e. {@code a.b.com} yields {@code [com, b, a]}.
     */
    public List<String> reversedLabels() {
        return Lists.reverse(LABEL_SPLITTER.splitToList(domain));
    }

    /**
     * Tests whether two entries express the same rule, ignoring their provenance and creation time.
     */
    public boolean sameRuleAs(@NotNull BlocklistEntry other) {
        return domain.equals(other.domain)
                && matchType == other.matchType
                && action == other.action
                && category == other.category;
    }
}
