package cz.vut.fit.shroudinger;

import cz.vut.fit.shroudinger.models.*;

import java.time.Instant;

public final class TestEntries {
    public static final Instant CREATED = Instant.parse("2024-05-01T00:00:00Z");

    private TestEntries() {
    }

    public static BlocklistEntry exact(String domain, RuleAction action, Category category) {
        return new BlocklistEntry(domain, MatchType.EXACT, action, category, "test", 1, CREATED);
    }

    public static BlocklistEntry suffix(String domain, RuleAction action, Category category) {
        return new BlocklistEntry(domain, MatchType.SUFFIX, action, category, "test", 1, CREATED);
    }

    public static BlocklistEntry blockExact(String domain) {
        return exact(domain, RuleAction.BLOCK, Category.ADS);
    }

    public static BlocklistEntry blockSuffix(String domain) {
        return suffix(domain, RuleAction.BLOCK, Category.ADS);
    }

    public static SourceConfig source(String name, SourceFormat format, int priority) {
        return new SourceConfig(name, "file:/lists/" + name + ".txt", format, Category.ADS, priority, true);
    }
}
