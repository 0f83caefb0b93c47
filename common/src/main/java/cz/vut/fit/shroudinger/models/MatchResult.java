package cz.vut.fit.shroudinger.models;

import org.jetbrains.annotations.Nullable;

/**
 * The verdict of a blocklist check. Never contains the checked name.
 *
 * @param blocked   True if the name must be blocked.
 * @param category  The category of the deciding rule, or null if no block rule decided.
 * @param matchedBy The stage that decided the verdict.
 * @param ready     False while no snapshot has been published; the verdict is then always "not blocked".
 */
public record MatchResult(boolean blocked,
                          @Nullable Category category,
                          MatchedBy matchedBy,
                          boolean ready) {

    public static final MatchResult NOT_READY = new MatchResult(false, null, MatchedBy.NONE, false);
    public static final MatchResult NOT_BLOCKED = new MatchResult(false, null, MatchedBy.NONE, true);

    public static MatchResult blocked(Category category, MatchedBy matchedBy) {
        return new MatchResult(true, category, matchedBy, true);
    }

    public static MatchResult allowed(MatchedBy matchedBy) {
        return new MatchResult(false, null, matchedBy, true);
    }
}
