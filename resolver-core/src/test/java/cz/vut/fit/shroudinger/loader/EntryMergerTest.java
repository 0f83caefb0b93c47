package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.models.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static cz.vut.fit.shroudinger.TestEntries.source;
import static org.junit.jupiter.api.Assertions.*;

public class EntryMergerTest {
    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private static SourceState state(String name, int priority, Instant updated, RuleAction action,
                                     String... domains) {
        return state(name, priority, updated, MatchType.EXACT, action, Category.ADS, domains);
    }

    private static SourceState state(String name, int priority, Instant updated, MatchType matchType,
                                     RuleAction action, Category category, String... domains) {
        var config = source(name, SourceFormat.PLAIN_DOMAINS, priority);
        var entries = new LinkedHashMap<RuleKey, BlocklistEntry>();
        for (var domain : domains) {
            var entry = new BlocklistEntry(domain, matchType, action, category, name, priority, updated);
            entries.put(RuleKey.of(entry), entry);
        }
        return new SourceState(config, entries, updated);
    }

    private static Map<RuleKey, BlocklistEntry> byKey(List<BlocklistEntry> merged) {
        return merged.stream().collect(Collectors.toMap(RuleKey::of, e -> e));
    }

    @Test
    void testHighestPriorityWins() {
        var low = state("low", 1, T0, RuleAction.BLOCK, "ads.example.com", "only-low.com");
        var high = state("high", 2, T0, RuleAction.ALLOW, "ads.example.com");

        var merged = EntryMerger.merge(List.of(low, high), 100).stream()
                .collect(Collectors.toMap(BlocklistEntry::domain, e -> e));

        assertEquals(2, merged.size());
        assertEquals("high", merged.get("ads.example.com").source());
        assertEquals(RuleAction.ALLOW, merged.get("ads.example.com").action());
        assertEquals("low", merged.get("only-low.com").source());
    }

    @Test
    void testTieBrokenByMostRecentUpdate() {
        var older = state("older", 5, T0, RuleAction.BLOCK, "ads.example.com");
        var newer = state("newer", 5, T0.plusSeconds(10), RuleAction.ALLOW, "ads.example.com");

        var merged = EntryMerger.merge(List.of(older, newer), 100);
        assertEquals(1, merged.size());
        assertEquals("newer", merged.get(0).source());
    }

    @Test
    void testMaxEntriesDropsLowestPriorityFirst() {
        var high = state("high", 10, T0, RuleAction.BLOCK, "a.com", "b.com");
        var low = state("low", 1, T0, RuleAction.BLOCK, "c.com", "d.com");

        var merged = EntryMerger.merge(List.of(low, high), 3);
        var domains = merged.stream().map(BlocklistEntry::domain).collect(Collectors.toSet());

        assertEquals(3, merged.size());
        assertTrue(domains.containsAll(List.of("a.com", "b.com")));
    }

    @Test
    void testExactRuleDoesNotRemoveSuffixRuleOfLowerPriority() {
        var hosts = state("hosts", 2, T0, MatchType.EXACT, RuleAction.BLOCK, Category.ADS, "example.com");
        var filters = state("filters", 1, T0, MatchType.SUFFIX, RuleAction.BLOCK, Category.TRACKING, "example.com");

        var merged = byKey(EntryMerger.merge(List.of(hosts, filters), 100));

        assertEquals(2, merged.size());
        assertEquals("hosts", merged.get(RuleKey.exact("example.com")).source());
        assertEquals("filters", merged.get(RuleKey.suffix("example.com")).source());
    }

    @Test
    void testPriorityAppliesWithinOneMatchType() {
        var low = state("low", 1, T0, MatchType.SUFFIX, RuleAction.BLOCK, Category.ADS, "example.com");
        var high = state("high", 2, T0, MatchType.SUFFIX, RuleAction.BLOCK, Category.MALWARE, "example.com");
        var exact = state("exact", 1, T0, MatchType.EXACT, RuleAction.BLOCK, Category.ADS, "example.com");

        var merged = byKey(EntryMerger.merge(List.of(low, high, exact), 100));

        assertEquals(2, merged.size());
        assertEquals(Category.MALWARE, merged.get(RuleKey.suffix("example.com")).category());
        assertEquals("exact", merged.get(RuleKey.exact("example.com")).source());
    }

    @Test
    void testSuffixAllowOverridesExactBlockOfLowerPriority() {
        var hosts = state("hosts", 1, T0, MatchType.EXACT, RuleAction.BLOCK, Category.ADS, "ads.example.com");
        var filters = state("filters", 2, T0, MatchType.SUFFIX, RuleAction.ALLOW, Category.ADS, "ads.example.com");

        var merged = byKey(EntryMerger.merge(List.of(hosts, filters), 100));

        assertEquals(1, merged.size());
        assertEquals(RuleAction.ALLOW, merged.get(RuleKey.suffix("ads.example.com")).action());
    }

    @Test
    void testExactBlockOfHigherPrioritySurvivesSuffixAllow() {
        var hosts = state("hosts", 2, T0, MatchType.EXACT, RuleAction.BLOCK, Category.ADS, "ads.example.com");
        var filters = state("filters", 1, T0, MatchType.SUFFIX, RuleAction.ALLOW, Category.ADS, "ads.example.com");

        var merged = byKey(EntryMerger.merge(List.of(hosts, filters), 100));

        assertEquals(2, merged.size());
        assertEquals(RuleAction.BLOCK, merged.get(RuleKey.exact("ads.example.com")).action());
    }
}
