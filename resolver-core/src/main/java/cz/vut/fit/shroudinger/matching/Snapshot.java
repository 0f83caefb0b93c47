package cz.vut.fit.shroudinger.matching;

import com.google.common.hash.Hashing;
import cz.vut.fit.shroudinger.models.*;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.*;

/**
 * An immutable, self-consistent view of the merged blocklist: the Bloom filter, the exact-match table
 * and the suffix trie are always built together from the same entry set and published as one unit.
 */
public final class Snapshot {
    private final BloomFilter _bloom;
    private final ExactMatchTable _exact;
    private final SuffixTrie _trie;
    private final Instant _builtAt;
    private final int _totalEntries;
    private final Map<String, Integer> _perSourceCounts;
    private final Map<Category, Integer> _categoryCounts;
    private final String _fingerprint;

    private Snapshot(BloomFilter bloom, ExactMatchTable exact, SuffixTrie trie, Instant builtAt, int totalEntries,
                     Map<String, Integer> perSourceCounts, Map<Category, Integer> categoryCounts,
                     String fingerprint) {
        _bloom = bloom;
        _exact = exact;
        _trie = trie;
        _builtAt = builtAt;
        _totalEntries = totalEntries;
        _perSourceCounts = perSourceCounts;
        _categoryCounts = categoryCounts;
        _fingerprint = fingerprint;
    }

    /**
     * Builds a snapshot from merged entries, which must hold at most one exact and one suffix entry per domain.
     *
     * @param entries           The merged entries.
     * @param falsePositiveRate The target false-positive rate of the Bloom filter.
     * @param builtAt           The build timestamp.
     * @return The new snapshot.
     */
    public static Snapshot build(@NotNull Collection<BlocklistEntry> entries, double falsePositiveRate,
                                 @NotNull Instant builtAt) {
        var bloom = new BloomFilter(entries.size(), falsePositiveRate);
        var exact = new ExactMatchTable(entries.size());
        var trie = new SuffixTrie();
        var perSource = new TreeMap<String, Integer>();
        var perCategory = new EnumMap<Category, Integer>(Category.class);

        for (var entry : entries) {
            bloom.put(entry.domain());
            if (entry.matchType() == MatchType.EXACT)
                exact.put(entry);
            else
                trie.insert(entry);

            perSource.merge(entry.source(), 1, Integer::sum);
            if (entry.action() == RuleAction.BLOCK)
                perCategory.merge(entry.category(), 1, Integer::sum);
        }

        return new Snapshot(bloom, exact, trie, builtAt, entries.size(),
                Collections.unmodifiableMap(perSource), Collections.unmodifiableMap(perCategory),
                fingerprint(entries));
    }

    public static Snapshot empty(double falsePositiveRate, @NotNull Instant builtAt) {
        return build(List.of(), falsePositiveRate, builtAt);
    }

    /**
     * Computes an order-independent digest of the rule set. Two snapshots built from the same rules have the same
     * fingerprint, which makes a reload that changed nothing easy to recognise.
     */
    static String fingerprint(Collection<BlocklistEntry> entries) {
        var sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(BlocklistEntry::domain).thenComparing(BlocklistEntry::matchType));

        var hasher = Hashing.sha256().newHasher();
        for (var entry : sorted) {
            hasher.putString(entry.domain(), StandardCharsets.UTF_8)
                    .putByte((byte) entry.matchType().ordinal())
                    .putByte((byte) entry.action().ordinal())
                    .putByte((byte) entry.category().ordinal())
                    .putString(entry.source(), StandardCharsets.UTF_8)
                    .putByte((byte) 0);
        }
        return hasher.hash().toString();
    }

    /**
     * Evaluates a normalised name against this snapshot.
     * <ol>
     *     <li>If neither the name nor any of its ancestors may be in the Bloom filter, the name is not blocked.</li>
     *     <li>An exact-match rule for the name decides.</li>
     *     <li>Otherwise the deepest suffix rule on the path of the name decides.</li>
     * </ol>
     * An allow rule that decides yields a "not blocked" verdict attributed to its stage.
     */
    public MatchResult match(@NotNull String domain) {
        if (!mayContainSelfOrAncestor(domain))
            return MatchResult.NOT_BLOCKED;

        var exactEntry = _exact.get(domain);
        if (exactEntry != null)
            return verdictOf(exactEntry, MatchedBy.EXACT);

        var suffixEntry = _trie.findDeepestTerminal(domain);
        if (suffixEntry != null)
            return verdictOf(suffixEntry, MatchedBy.TRIE);

        return MatchResult.NOT_BLOCKED;
    }

    private boolean mayContainSelfOrAncestor(String domain) {
        int start = 0;
        while (true) {
            if (_bloom.mightContain(start == 0 ? domain : domain.substring(start)))
                return true;

            int dot = domain.indexOf('.', start);
            if (dot < 0)
                return false;
            start = dot + 1;
        }
    }

    private static MatchResult verdictOf(BlocklistEntry entry, MatchedBy stage) {
        return entry.action() == RuleAction.BLOCK
                ? MatchResult.blocked(entry.category(), stage)
                : MatchResult.allowed(stage);
    }

    public Instant builtAt() {
        return _builtAt;
    }

    public int totalEntries() {
        return _totalEntries;
    }

    public Map<String, Integer> perSourceCounts() {
        return _perSourceCounts;
    }

    public Map<Category, Integer> categoryCounts() {
        return _categoryCounts;
    }

    public String fingerprint() {
        return _fingerprint;
    }

    public BloomFilter bloomFilter() {
        return _bloom;
    }

    public ExactMatchTable exactTable() {
        return _exact;
    }

    public SuffixTrie suffixTrie() {
        return _trie;
    }
}
