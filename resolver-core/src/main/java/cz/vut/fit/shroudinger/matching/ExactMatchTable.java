package cz.vut.fit.shroudinger.matching;

import cz.vut.fit.shroudinger.models.BlocklistEntry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Hash lookup of exact-match rules, keyed by the normalised domain name.
 */
public final class ExactMatchTable {
    private final Map<String, BlocklistEntry> _entries;

    public ExactMatchTable(int expectedSize) {
        _entries = new HashMap<>(Math.max(16, (int) (expectedSize / 0.75f) + 1));
    }

    void put(@NotNull BlocklistEntry entry) {
        _entries.put(entry.domain(), entry);
    }

    public @Nullable BlocklistEntry get(@NotNull String domain) {
        return _entries.get(domain);
    }

    public int size() {
        return _entries.size();
    }
}
