package cz.vut.fit.shroudinger;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import cz.vut.fit.shroudinger.errors.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.net.IDN;
import java.util.Locale;

/**
 * Domain name normalisation shared by the source parsers and the query path.
 * <p>
 * A normalised name is lowercase ASCII (IDNs are converted to their ACE form), has no trailing dot,
 * is at most {@value #MAX_NAME_LENGTH} characters long and consists of non-empty labels of at most
 * {@value #MAX_LABEL_LENGTH} characters. None of the rejection messages contains the name itself.
 */
public final class DomainNames {
    public static final int MAX_NAME_LENGTH = 253;
    public static final int MAX_LABEL_LENGTH = 63;

    private static final Splitter LABEL_SPLITTER = Splitter.on('.');
    // Underscores are not valid in host names but are common in real blocklists (e.g. _dmarc records)
    private static final CharMatcher LABEL_CHARS = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.anyOf("-_"))
            .precomputed();

    private DomainNames() {
    }

    /**
     * Normalises a domain name.
     *
     * @param input the raw name
     * @return the normalised name
     * @throws ValidationException if the name is empty, too long, or has an empty or malformed label
     */
    public static @NotNull String normalize(String input) throws ValidationException {
        if (input == null)
            throw new ValidationException("Missing domain name");

        var name = input.trim();
        if (name.endsWith("."))
            name = name.substring(0, name.length() - 1);
        if (name.isEmpty())
            throw new ValidationException("Empty domain name");

        if (!CharMatcher.ascii().matchesAllOf(name)) {
            try {
                name = IDN.toASCII(name, IDN.ALLOW_UNASSIGNED);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Domain name is not a valid IDN");
            }
        }

        name = name.toLowerCase(Locale.ROOT);
        if (name.length() > MAX_NAME_LENGTH)
            throw new ValidationException("Domain name too long");

        for (var label : LABEL_SPLITTER.split(name)) {
            if (label.isEmpty())
                throw new ValidationException("Domain name has an empty label");
            if (label.length() > MAX_LABEL_LENGTH)
                throw new ValidationException("Domain name label too long");
            if (!LABEL_CHARS.matchesAllOf(label))
                throw new ValidationException("Domain name contains invalid characters");
        }

        return name;
    }
}
