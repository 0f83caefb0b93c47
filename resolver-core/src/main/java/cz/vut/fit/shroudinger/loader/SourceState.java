package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.models.BlocklistEntry;
import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Map;

/**
 * The last successfully loaded content of a source.
 *
 * @param config      The source definition.
 * @param entries     The entries keyed by name and match type.
 * @param lastUpdated When the content was loaded.
 */
public record SourceState(@NotNull SourceConfig config,
                          @NotNull Map<RuleKey, BlocklistEntry> entries,
                          @NotNull Instant lastUpdated) {
}
