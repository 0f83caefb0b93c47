package cz.vut.fit.shroudinger.loader;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.net.InetAddresses;
import cz.vut.fit.shroudinger.models.MatchType;
import cz.vut.fit.shroudinger.models.RuleAction;
import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Parses hosts files: {@code <address> <name> [<name>...]}. Every listed name becomes an exact block rule.
 * Names that every hosts file maps to the local machine are ignored.
 */
public class HostsParser extends LineParser {
    private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final Set<String> LOCAL_NAMES = Set.of("localhost", "localhost.localdomain", "local",
            "broadcasthost", "ip6-localhost", "ip6-loopback", "ip6-localnet", "ip6-mcastprefix", "ip6-allnodes",
            "ip6-allrouters", "ip6-allhosts", "0.0.0.0");

    @Override
    protected boolean isComment(@NotNull String line) {
        return line.charAt(0) == '#';
    }

    @Override
    protected void parseLine(@NotNull String line, @NotNull SourceConfig source, @NotNull Instant createdAt,
                             @NotNull ParsedSource.Builder builder) {
        var tokens = WHITESPACE.splitToList(stripInlineComment(line));
        if (tokens.size() < 2 || !InetAddresses.isInetAddress(tokens.get(0))) {
            builder.reject();
            return;
        }

        for (var name : tokens.subList(1, tokens.size())) {
            if (LOCAL_NAMES.contains(name.toLowerCase(Locale.ROOT)))
                continue;
            addOrReject(name, MatchType.EXACT, RuleAction.BLOCK, source, createdAt, builder);
        }
    }
}
