package cz.vut.fit.shroudinger.matching;

import com.google.common.base.Preconditions;
import com.google.common.hash.Funnels;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;

/**
 * An append-only Bloom filter over domain names, backed by Guava's {@link com.google.common.hash.BloomFilter}.
 * <p>
 * Guava sizes the bit array and picks the number of hash functions from the expected number of elements and the
 * target false-positive rate. The filter is written only while its snapshot is being built and is read-only once
 * published.
 */
public final class BloomFilter {
    private final com.google.common.hash.BloomFilter<CharSequence> _filter;
    private final long _expectedInsertions;
    private final double _falsePositiveRate;

    public BloomFilter(long expectedInsertions, double falsePositiveRate) {
        Preconditions.checkArgument(expectedInsertions >= 0, "expectedInsertions must not be negative");
        Preconditions.checkArgument(falsePositiveRate > 0.0 && falsePositiveRate < 1.0,
                "falsePositiveRate must be in (0, 1)");

        _expectedInsertions = Math.max(1, expectedInsertions);
        _falsePositiveRate = falsePositiveRate;
        _filter = com.google.common.hash.BloomFilter.create(Funnels.stringFunnel(StandardCharsets.UTF_8),
                _expectedInsertions, falsePositiveRate);
    }

    public void put(@NotNull String element) {
        _filter.put(element);
    }

    public boolean mightContain(@NotNull String element) {
        return _filter.mightContain(element);
    }

    public long expectedInsertions() {
        return _expectedInsertions;
    }

    public double falsePositiveRate() {
        return _falsePositiveRate;
    }

    /**
     * @return the false-positive probability for the elements inserted so far
     */
    public double expectedFpp() {
        return _filter.expectedFpp();
    }

    public long approximateElementCount() {
        return _filter.approximateElementCount();
    }
}
