package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.models.MatchType;
import cz.vut.fit.shroudinger.models.RuleAction;
import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;

/**
 * Parses lists with one name per line. A leading {@code *.} turns the line into a suffix rule
 * covering the name and all its subdomains.
 */
public class PlainDomainsParser extends LineParser {

    @Override
    protected boolean isComment(@NotNull String line) {
        var first = line.charAt(0);
        return first == '#' || first == '!' || first == ';';
    }

    @Override
    protected void parseLine(@NotNull String line, @NotNull SourceConfig source, @NotNull Instant createdAt,
                             @NotNull ParsedSource.Builder builder) {
        var name = stripInlineComment(line);
        if (name.startsWith("*.")) {
            addOrReject(name.substring(2), MatchType.SUFFIX, RuleAction.BLOCK, source, createdAt, builder);
        } else {
            addOrReject(name, MatchType.EXACT, RuleAction.BLOCK, source, createdAt, builder);
        }
    }
}
