package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;

/**
 * Turns the raw content of a blocklist source into entries.
 */
public interface BlocklistParser {
    @NotNull ParsedSource parse(@NotNull String content, @NotNull SourceConfig source, @NotNull Instant createdAt);
}
