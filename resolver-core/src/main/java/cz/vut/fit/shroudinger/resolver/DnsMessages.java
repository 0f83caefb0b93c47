package cz.vut.fit.shroudinger.resolver;

import cz.vut.fit.shroudinger.errors.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.*;
import org.xbill.DNS.Record;

import java.io.IOException;
import java.util.Locale;

/**
 * Helpers for building DNS queries and validating upstream responses in wire format.
 */
public final class DnsMessages {
    private DnsMessages() {
    }

    /**
     * Parses a query type mnemonic ({@code A}, {@code aaaa}, {@code TYPE65}, ...).
     *
     * @return The numeric type.
     * @throws ValidationException if the mnemonic is unknown or denotes a meta type that cannot be queried.
     */
    public static int parseType(@NotNull String qtype) throws ValidationException {
        var type = Type.value(qtype.trim().toUpperCase(Locale.ROOT));
        if (type < 0)
            throw new ValidationException("Unknown query type");
        if (type == Type.OPT || type == Type.TSIG || type == Type.TKEY || type == Type.IXFR || type == Type.AXFR)
            throw new ValidationException("Unsupported query type");
        return type;
    }

    /**
     * Builds a recursive query with a random message ID.
     *
     * @param normalizedDomain A name accepted by {@link cz.vut.fit.shroudinger.DomainNames#normalize(String)}.
     * @param type             The numeric query type.
     */
    public static Message newQuery(@NotNull String normalizedDomain, int type) throws ValidationException {
        try {
            var name = Name.fromString(normalizedDomain, Name.root);
            return Message.newQuery(Record.newRecord(name, type, DClass.IN));
        } catch (TextParseException e) {
            throw new ValidationException("Malformed domain name");
        }
    }

    /**
     * Parses a response and checks that it answers the given query.
     * <p>
     * A response with an rcode other than NOERROR or NXDOMAIN is treated as a server failure.
     *
     * @throws IOException if the response is malformed, does not match the query or reports a server failure.
     */
    public static Message parseResponse(@NotNull Message query, byte @NotNull [] wire) throws IOException {
        var response = new Message(wire);
        var header = response.getHeader();

        if (header.getID() != query.getHeader().getID())
            throw new IOException("Response ID does not match the query");
        if (!header.getFlag(Flags.QR))
            throw new IOException("Message is not a response");

        var question = response.getQuestion();
        var expected = query.getQuestion();
        if (question == null || !question.getName().equals(expected.getName())
                || question.getType() != expected.getType())
            throw new IOException("Response question does not match the query");

        var rcode = header.getRcode();
        if (rcode != Rcode.NOERROR && rcode != Rcode.NXDOMAIN)
            throw new IOException("Upstream server returned " + Rcode.string(rcode));

        return response;
    }

    /**
     * Determines how long a response may be cached, in seconds.
     * <ul>
     *     <li>For a response with answers, the minimum TTL of the answer records.</li>
     *     <li>For a negative response, the lesser of the SOA record TTL and its MINIMUM field.</li>
     *     <li>Otherwise, the provided negative TTL.</li>
     * </ul>
     */
    public static long cacheTtl(@NotNull Message response, long negativeTtl) {
        var answers = response.getSection(Section.ANSWER);
        if (!answers.isEmpty()) {
            long min = Long.MAX_VALUE;
            for (var record : answers)
                min = Math.min(min, record.getTTL());
            return min;
        }

        for (var record : response.getSection(Section.AUTHORITY)) {
            if (record instanceof SOARecord soa)
                return Math.min(soa.getTTL(), soa.getMinimum());
        }

        return negativeTtl;
    }
}
