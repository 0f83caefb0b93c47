package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.Common;
import cz.vut.fit.shroudinger.models.BlocklistEntry;
import cz.vut.fit.shroudinger.models.MatchType;
import cz.vut.fit.shroudinger.models.RuleAction;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Merges the entries of all loaded sources into a single rule set with at most one exact and one suffix entry
 * per name.
 * <p>
 * Exact and suffix rules occupy separate slots, so a host list that blocks a name never removes the suffix rule
 * another list holds for the same name. Within a slot, the entry of the source with the highest priority wins;
 * among sources of equal priority, the most recently updated one wins, then the one with the lexicographically
 * smaller name.
 * <p>
 * Across the two slots the exact entry decides for the name itself, with one exception: an exact block rule is
 * dropped when an allow rule for the same name comes from a source that ranks at least as high. An explicit
 * exemption thereby overrides a block of equal or lower priority whatever the match types.
 * <p>
 * When the merged set would exceed the configured maximum, the entries of the lowest-priority sources are
 * dropped first.
 */
public final class EntryMerger {
    public static final String COMPONENT_NAME = "entry-merger";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(EntryMerger.class);

    static final Comparator<SourceState> PRECEDENCE = Comparator
            .comparingInt((SourceState state) -> state.config().priority()).reversed()
            .thenComparing(SourceState::lastUpdated, Comparator.reverseOrder())
            .thenComparing(state -> state.config().name());

    private record Ranked(BlocklistEntry entry, int rank) {
    }

    private EntryMerger() {
    }

    public static List<BlocklistEntry> merge(@NotNull Collection<SourceState> sources, long maxEntries) {
        var ordered = new ArrayList<>(sources);
        ordered.sort(PRECEDENCE);

        // Lower rank means higher precedence
        var merged = new LinkedHashMap<RuleKey, Ranked>();
        long dropped = 0;
        for (int rank = 0; rank < ordered.size(); rank++) {
            for (var entry : ordered.get(rank).entries().values()) {
                var key = RuleKey.of(entry);
                if (merged.containsKey(key))
                    continue;
                if (merged.size() >= maxEntries) {
                    dropped++;
                    continue;
                }
                merged.put(key, new Ranked(entry, rank));
            }
        }

        if (dropped > 0) {
            Logger.warn("The merged blocklist exceeds the limit of {} entries; {} lower-priority entries dropped",
                    maxEntries, dropped);
        }

        int overridden = 0;
        var result = new ArrayList<BlocklistEntry>(merged.size());
        for (var ranked : merged.values()) {
            if (isOverriddenByAllow(ranked, merged)) {
                overridden++;
                continue;
            }
            result.add(ranked.entry());
        }

        if (overridden > 0)
            Logger.debug("{} exact block rules overridden by suffix allow rules", overridden);

        return result;
    }

    private static boolean isOverriddenByAllow(Ranked ranked, Map<RuleKey, Ranked> merged) {
        var entry = ranked.entry();
        if (entry.matchType() != MatchType.EXACT || entry.action() != RuleAction.BLOCK)
            return false;

        var suffix = merged.get(RuleKey.suffix(entry.domain()));
        return suffix != null
                && suffix.entry().action() == RuleAction.ALLOW
                && suffix.rank() <= ranked.rank();
    }
}
