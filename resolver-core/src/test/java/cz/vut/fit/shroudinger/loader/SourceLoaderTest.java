package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.PropertiesBuilder;
import cz.vut.fit.shroudinger.ResolverConfig;
import cz.vut.fit.shroudinger.errors.ErrorKind;
import cz.vut.fit.shroudinger.errors.SourceFetchException;
import cz.vut.fit.shroudinger.matching.MatchingEngine;
import cz.vut.fit.shroudinger.models.*;
import cz.vut.fit.shroudinger.stats.StatsAggregator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.*;

import static cz.vut.fit.shroudinger.TestEntries.source;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

public class SourceLoaderTest {
    private SourceFetcher fetcher;
    private StatsAggregator stats;
    private MatchingEngine engine;
    private SourceLoader loader;

    @BeforeEach
    void setUp() {
        fetcher = mock(SourceFetcher.class);
        stats = new StatsAggregator();
        var properties = new PropertiesBuilder()
                .add(ResolverConfig.RELOAD_INTERVAL_S_CONFIG, 0)
                .get();
        engine = new MatchingEngine(properties, stats);
        loader = new SourceLoader(properties, fetcher, engine, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        loader.close();
    }

    private void serve(SourceConfig source, String content) throws SourceFetchException {
        when(fetcher.fetch(argThat(s -> s != null && s.name().equals(source.name())))).thenReturn(content);
    }

    private static SourceReloadResult resultOf(List<SourceReloadResult> results, String name) {
        return results.stream().filter(r -> r.sourceName().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void testFirstReloadPublishesSnapshot() throws Exception {
        var hosts = source("hosts", SourceFormat.HOSTS, 1);
        serve(hosts, "0.0.0.0 ads.example.com\n0.0.0.0 tracker.example.com\n0.0.0.0 bad..name\n");

        var results = loader.reload(List.of(hosts));

        assertEquals(List.of(new SourceReloadResult("hosts", 2, 0, 0, 1, null, null)), results);
        assertTrue(engine.isReady());
        assertTrue(engine.check("ads.example.com", "A").blocked());
        assertEquals(1, loader.activeSources());
        assertNotNull(loader.lastReload());
        assertEquals(Map.of("hosts", 2), stats.snapshot().perSourceCounts());
    }

    @Test
    void testReloadOfUnchangedSourcesIsIdempotent() throws Exception {
        var hosts = source("hosts", SourceFormat.HOSTS, 1);
        var filters = source("filters", SourceFormat.FILTER_LIST, 2);
        serve(hosts, "0.0.0.0 ads.example.com\n0.0.0.0 tracker.example.com\n");
        serve(filters, "||malware.example.org^\n@@||tracker.example.com^\n");

        loader.reload(List.of(hosts, filters));
        var first = engine.current();

        var results = loader.reload(List.of(hosts, filters));
        var second = engine.current();

        for (var result : results) {
            assertFalse(result.hasChanges(), "An unchanged source must not report churn.");
            assertNull(result.error());
        }
        assertSame(first, second, "An unchanged blocklist must not be republished.");
        assertEquals(first.fingerprint(), second.fingerprint());
    }

    @Test
    void testReportsAddedRemovedAndUpdated() throws Exception {
        var filters = source("filters", SourceFormat.FILTER_LIST, 1);
        when(fetcher.fetch(any()))
                .thenReturn("||a.com^\n||b.com^\n||c.com^\n")
                .thenReturn("||a.com^\n@@||b.com^\n||d.com^\n||e.com^\n");

        loader.reload(List.of(filters));
        var results = loader.reload(List.of(filters));

        assertEquals(new SourceReloadResult("filters", 2, 1, 1, 0, null, null), results.get(0));
        assertFalse(engine.check("x.b.com", "A").blocked());
        assertFalse(engine.check("c.com", "A").blocked());
        assertTrue(engine.check("x.d.com", "A").blocked());
    }

    @Test
    void testSwitchingMatchTypeIsReportedAsReplacement() throws Exception {
        var plain = source("plain", SourceFormat.PLAIN_DOMAINS, 1);
        when(fetcher.fetch(any()))
                .thenReturn("a.com\nb.com\n")
                .thenReturn("a.com\n*.b.com\n");

        loader.reload(List.of(plain));
        var results = loader.reload(List.of(plain));

        assertEquals(new SourceReloadResult("plain", 1, 1, 0, 0, null, null), results.get(0));
        assertTrue(engine.check("x.b.com", "A").blocked());
    }

    @Test
    void testHostsEntryKeepsSuffixCoverageOfLowerPrioritySource() throws Exception {
        var hosts = source("hosts", SourceFormat.HOSTS, 2);
        var filters = source("filters", SourceFormat.FILTER_LIST, 1);
        serve(hosts, "0.0.0.0 example.com\n");
        serve(filters, "||example.com^\n");

        loader.reload(List.of(hosts, filters));

        var child = engine.check("sub.example.com", "A");
        assertTrue(child.blocked());
        assertEquals(MatchedBy.TRIE, child.matchedBy());
        assertEquals(MatchedBy.EXACT, engine.check("example.com", "A").matchedBy());
    }

    @Test
    void testExactRuleWinsOverHigherPrioritySuffixRule() throws Exception {
        var hosts = new SourceConfig("hosts", "file:/lists/hosts.txt", SourceFormat.HOSTS, Category.ADS, 1, true);
        var filters = new SourceConfig("filters", "file:/lists/filters.txt", SourceFormat.FILTER_LIST,
                Category.MALWARE, 2, true);
        serve(hosts, "0.0.0.0 example.com\n");
        serve(filters, "||example.com^\n");

        loader.reload(List.of(hosts, filters));

        assertEquals(MatchResult.blocked(Category.ADS, MatchedBy.EXACT), engine.check("example.com", "A"));
        assertEquals(MatchResult.blocked(Category.MALWARE, MatchedBy.TRIE), engine.check("a.example.com", "A"));
    }

    @Test
    void testHigherPriorityAllowRuleWins() throws Exception {
        var blocker = source("blocker", SourceFormat.HOSTS, 1);
        var exempter = source("exempter", SourceFormat.FILTER_LIST, 2);
        serve(blocker, "0.0.0.0 ads.example.com\n");
        serve(exempter, "@@||ads.example.com^\n");

        loader.reload(List.of(blocker, exempter));

        var result = engine.check("ads.example.com", "A");
        assertFalse(result.blocked());
        assertEquals(MatchedBy.TRIE, result.matchedBy());
    }

    @Test
    void testFailedSourceIsIsolatedAndKeepsPreviousEntries() throws Exception {
        var good = source("good", SourceFormat.PLAIN_DOMAINS, 1);
        var flaky = source("flaky", SourceFormat.PLAIN_DOMAINS, 1);
        serve(good, "good.example.com\n");
        when(fetcher.fetch(argThat(s -> s != null && s.name().equals("flaky"))))
                .thenReturn("flaky.example.com\n")
                .thenThrow(new SourceFetchException("Unexpected HTTP status 503"));

        loader.reload(List.of(good, flaky));
        var results = loader.reload(List.of(good, flaky));

        var flakyResult = resultOf(results, "flaky");
        assertEquals(ErrorKind.SOURCE_FETCH, flakyResult.error());
        assertEquals("Unexpected HTTP status 503", flakyResult.errorMessage());
        assertNull(resultOf(results, "good").error());

        assertTrue(engine.check("good.example.com", "A").blocked());
        assertTrue(engine.check("flaky.example.com", "A").blocked(), "The previous entries must be kept.");
    }

    @Test
    void testFailedFirstLoadDoesNotBlockOthers() throws Exception {
        var good = source("good", SourceFormat.PLAIN_DOMAINS, 1);
        var broken = source("broken", SourceFormat.PLAIN_DOMAINS, 1);
        serve(good, "good.example.com\n");
        when(fetcher.fetch(argThat(s -> s != null && s.name().equals("broken"))))
                .thenThrow(new SourceFetchException("Cannot read source file: NoSuchFileException"));

        var results = loader.reload(List.of(good, broken));

        assertEquals(ErrorKind.SOURCE_FETCH, resultOf(results, "broken").error());
        assertTrue(engine.check("good.example.com", "A").blocked());
    }

    @Test
    void testDisabledSourceIsRemoved() throws Exception {
        var plain = source("plain", SourceFormat.PLAIN_DOMAINS, 1);
        serve(plain, "a.com\nb.com\n");
        loader.reload(List.of(plain));

        var disabled = new SourceConfig(plain.name(), plain.origin(), plain.format(), plain.category(),
                plain.priority(), false);
        var results = loader.reload(List.of(disabled));

        assertEquals(List.of(new SourceReloadResult("plain", 0, 2, 0, 0, null, null)), results);
        assertFalse(engine.check("a.com", "A").blocked());
        assertEquals(0, engine.current().totalEntries());
        verify(fetcher, times(1)).fetch(any());
    }

    @Test
    void testRemovedSourceIsDropped() throws Exception {
        var first = source("first", SourceFormat.PLAIN_DOMAINS, 1);
        var second = source("second", SourceFormat.PLAIN_DOMAINS, 1);
        serve(first, "a.com\n");
        serve(second, "b.com\n");

        loader.reload(List.of(first, second));
        loader.reload(List.of(second));

        assertFalse(engine.check("a.com", "A").blocked());
        assertTrue(engine.check("b.com", "A").blocked());
    }

    @Test
    void testEmptySourceListPublishesEmptySnapshot() {
        assertTrue(loader.reload(List.of()).isEmpty());
        assertTrue(engine.isReady());
        assertEquals(0, engine.current().totalEntries());
    }

    private record RawRule(String domain, MatchType matchType, RuleAction action, Category category,
                           int priority, String source) {

        boolean outranks(RawRule other) {
            if (priority != other.priority)
                return priority > other.priority;
            return source.compareTo(other.source) <= 0;
        }
    }

    @Test
    void testCheckMatchesScanOfRawSourceRules() throws Exception {
        var random = new Random(1234);
        var formats = List.of(SourceFormat.HOSTS, SourceFormat.HOSTS, SourceFormat.FILTER_LIST,
                SourceFormat.FILTER_LIST, SourceFormat.PLAIN_DOMAINS, SourceFormat.PLAIN_DOMAINS);
        var sources = new ArrayList<SourceConfig>();
        var raw = new ArrayList<RawRule>();
        var names = new TreeSet<String>();

        for (int i = 0; i < formats.size(); i++) {
            var format = formats.get(i);
            var category = Category.values()[i % Category.values().length];
            var source = new SourceConfig("src" + i, "file:/lists/src" + i + ".txt", format, category,
                    1 + random.nextInt(3), true);
            sources.add(source);

            var content = new StringBuilder();
            for (int r = 0; r < 30; r++) {
                var name = randomName(random);
                names.add(name);
                var matchType = MatchType.EXACT;
                var action = RuleAction.BLOCK;
                switch (format) {
                    case HOSTS -> content.append("0.0.0.0 ").append(name);
                    case FILTER_LIST -> {
                        matchType = MatchType.SUFFIX;
                        if (random.nextInt(4) == 0) {
                            action = RuleAction.ALLOW;
                            content.append("@@");
                        }
                        content.append("||").append(name).append('^');
                    }
                    case PLAIN_DOMAINS -> {
                        if (random.nextBoolean()) {
                            matchType = MatchType.SUFFIX;
                            content.append("*.");
                        }
                        content.append(name);
                    }
                }
                content.append('\n');
                raw.add(new RawRule(name, matchType, action, category, source.priority(), source.name()));
            }
            serve(source, content.toString());
        }

        loader.reload(sources);

        var queries = new ArrayList<String>();
        for (var name : names) {
            queries.add(name);
            queries.add("deep." + name);
        }
        for (int i = 0; i < 200; i++)
            queries.add(randomName(random));

        for (var query : queries)
            assertEquals(scan(raw, query), engine.checkNormalized(query), "Mismatch for a generated name");
    }

    private static String randomName(Random random) {
        var labels = new String[]{"ads", "cdn", "track", "img", "x"};
        var roots = new String[]{"example.com", "example.net", "test.org"};
        var builder = new StringBuilder();
        for (int depth = random.nextInt(3); depth > 0; depth--)
            builder.append(labels[random.nextInt(labels.length)]).append('.');
        return builder.append(roots[random.nextInt(roots.length)]).toString();
    }

    /**
     * Picks the deciding rule of one match type for a name: the highest-ranking source wins, and within one source
     * an allow rule beats a block rule.
     */
    private static RawRule winner(List<RawRule> rules, String domain, MatchType matchType) {
        RawRule best = null;
        for (var rule : rules) {
            if (!rule.domain().equals(domain) || rule.matchType() != matchType)
                continue;
            if (best == null) {
                best = rule;
            } else if (rule.source().equals(best.source())) {
                if (rule.action() == RuleAction.ALLOW)
                    best = rule;
            } else if (rule.outranks(best)) {
                best = rule;
            }
        }
        return best;
    }

    private static MatchResult scan(List<RawRule> rules, String domain) {
        var exact = winner(rules, domain, MatchType.EXACT);
        var ownSuffix = winner(rules, domain, MatchType.SUFFIX);
        var exactOverridden = exact != null && exact.action() == RuleAction.BLOCK
                && ownSuffix != null && ownSuffix.action() == RuleAction.ALLOW && ownSuffix.outranks(exact);
        if (exact != null && !exactOverridden)
            return verdict(exact, MatchedBy.EXACT);

        var candidate = domain;
        while (true) {
            var suffix = winner(rules, candidate, MatchType.SUFFIX);
            if (suffix != null)
                return verdict(suffix, MatchedBy.TRIE);
            var dot = candidate.indexOf('.');
            if (dot < 0)
                return MatchResult.NOT_BLOCKED;
            candidate = candidate.substring(dot + 1);
        }
    }

    private static MatchResult verdict(RawRule rule, MatchedBy stage) {
        return rule.action() == RuleAction.BLOCK
                ? MatchResult.blocked(rule.category(), stage)
                : MatchResult.allowed(stage);
    }
}
