package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.models.BlocklistEntry;
import cz.vut.fit.shroudinger.models.RuleAction;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The entries parsed from one source, unique per name and match type, and the number of rejected lines.
 *
 * @param entries  The entries keyed by name and match type.
 * @param rejected The number of rule lines dropped because they did not contain a valid name.
 */
public record ParsedSource(@NotNull Map<RuleKey, BlocklistEntry> entries, int rejected) {

    public static final class Builder {
        private final Map<RuleKey, BlocklistEntry> _entries = new LinkedHashMap<>();
        private int _rejected;

        /**
         * Adds an entry. When the source already holds a rule of the same match type for the same name, an allow
         * rule beats a block rule; otherwise the first rule is kept.
         */
        public Builder add(@NotNull BlocklistEntry entry) {
            _entries.merge(RuleKey.of(entry), entry, Builder::stronger);
            return this;
        }

        public Builder reject() {
            _rejected++;
            return this;
        }

        public ParsedSource build() {
            return new ParsedSource(Collections.unmodifiableMap(_entries), _rejected);
        }

        private static BlocklistEntry stronger(BlocklistEntry existing, BlocklistEntry candidate) {
            if (existing.action() != candidate.action())
                return existing.action() == RuleAction.ALLOW ? existing : candidate;
            return existing;
        }
    }
}
