package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.DomainNames;
import cz.vut.fit.shroudinger.errors.ValidationException;
import cz.vut.fit.shroudinger.models.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Base for line-oriented formats. Blank lines are skipped; subclasses decide what a comment is
 * and how a rule line maps to entries.
 */
public abstract class LineParser implements BlocklistParser {

    @Override
    public @NotNull ParsedSource parse(@NotNull String content, @NotNull SourceConfig source,
                                       @NotNull Instant createdAt) {
        var builder = new ParsedSource.Builder();
        content.lines().forEach(rawLine -> {
            var line = rawLine.strip();
            if (line.isEmpty() || isComment(line))
                return;
            parseLine(line, source, createdAt, builder);
        });
        return builder.build();
    }

    protected abstract boolean isComment(@NotNull String line);

    protected abstract void parseLine(@NotNull String line, @NotNull SourceConfig source, @NotNull Instant createdAt,
                                      @NotNull ParsedSource.Builder builder);

    /**
     * Normalises the name and adds the rule, or counts the line as rejected if the name is invalid.
     */
    protected static void addOrReject(@NotNull String rawDomain, @NotNull MatchType matchType,
                                      @NotNull RuleAction action, @NotNull SourceConfig source,
                                      @NotNull Instant createdAt, @NotNull ParsedSource.Builder builder) {
        var domain = normalizeOrNull(rawDomain);
        if (domain == null) {
            builder.reject();
            return;
        }

        builder.add(new BlocklistEntry(domain, matchType, action, source.category(), source.name(),
                source.priority(), createdAt));
    }

    protected static @Nullable String normalizeOrNull(@NotNull String rawDomain) {
        try {
            return DomainNames.normalize(rawDomain);
        } catch (ValidationException e) {
            return null;
        }
    }

    /**
     * Strips an inline {@code #} comment.
     */
    protected static String stripInlineComment(String line) {
        var hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash).strip();
    }
}
