package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.models.MatchType;
import cz.vut.fit.shroudinger.models.RuleAction;
import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Set;

/**
 * Parses the domain-level subset of the Adblock filter syntax:
 * <ul>
 *     <li>{@code ||example.com^} blocks the name and all its subdomains,</li>
 *     <li>{@code @@||example.com^} allows them, overriding block rules of lower priority.</li>
 * </ul>
 * Rules that cannot be evaluated on a name alone (cosmetic rules, URL patterns, wildcards and rules with
 * modifiers other than {@code $important}) are skipped without being counted as rejected.
 */
public class FilterListParser extends LineParser {
    private static final Set<String> ACCEPTED_MODIFIERS = Set.of("", "important");

    @Override
    protected boolean isComment(@NotNull String line) {
        var first = line.charAt(0);
        return first == '!' || first == '#' || first == '[';
    }

    @Override
    protected void parseLine(@NotNull String line, @NotNull SourceConfig source, @NotNull Instant createdAt,
                             @NotNull ParsedSource.Builder builder) {
        var action = RuleAction.BLOCK;
        var rule = line;
        if (rule.startsWith("@@")) {
            action = RuleAction.ALLOW;
            rule = rule.substring(2);
        }

        if (!rule.startsWith("||") || rule.contains("##") || rule.contains("#@#"))
            return;
        rule = rule.substring(2);

        var modifiers = "";
        var dollar = rule.indexOf('$');
        if (dollar >= 0) {
            modifiers = rule.substring(dollar + 1);
            rule = rule.substring(0, dollar);
        }
        if (!ACCEPTED_MODIFIERS.contains(modifiers))
            return;

        if (!rule.endsWith("^"))
            return;
        rule = rule.substring(0, rule.length() - 1);

        if (rule.indexOf('*') >= 0 || rule.indexOf('/') >= 0)
            return;

        addOrReject(rule, MatchType.SUFFIX, action, source, createdAt, builder);
    }
}
