package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.models.SourceFormat;
import org.jetbrains.annotations.NotNull;

/**
 * Selects the parser for a source format.
 */
public final class Parsers {
    private static final BlocklistParser HOSTS = new HostsParser();
    private static final BlocklistParser FILTER_LIST = new FilterListParser();
    private static final BlocklistParser PLAIN_DOMAINS = new PlainDomainsParser();

    private Parsers() {
    }

    public static BlocklistParser forFormat(@NotNull SourceFormat format) {
        return switch (format) {
            case HOSTS -> HOSTS;
            case FILTER_LIST -> FILTER_LIST;
            case PLAIN_DOMAINS -> PLAIN_DOMAINS;
        };
    }
}
