package com.hcltech.rmg.common.random;

import com.hcltech.rmg.common.ISystemProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniformly distributed integers.
 * <p>
 * Abstracted so that callers needing randomness (shuffling, sampling) can be driven by a fixed
 * sequence in tests.
 */
@FunctionalInterface
public interface IRandomInts {

    /** System property holding an optional seed for {@link #fromSystemProps(ISystemProps)}. */
    String SEED_PROPERTY = "seqlist.random.seed";

    /**
     * Returns an integer uniformly drawn from {@code [fromInclusive, toExclusive)}.
     * Callers must pass {@code toExclusive > fromInclusive}.
     */
    int nextInt(int fromInclusive, int toExclusive);

    static IRandomInts threadLocal() {
        return (from, to) -> ThreadLocalRandom.current().nextInt(from, to);
    }

    /** Reproducible source. Not thread-safe beyond what {@link Random} offers. */
    static IRandomInts seeded(long seed) {
        Random random = new Random(seed);
        return (from, to) -> {
            if (to <= from) throw new IllegalArgumentException("bound must be greater than origin: [" + from + ", " + to + ")");
            return from + random.nextInt(to - from);
        };
    }

    /**
     * Seeded from {@value #SEED_PROPERTY} when that property is set, otherwise thread-local.
     *
     * @throws IllegalStateException if the seed property is not a valid long
     */
    static IRandomInts fromSystemProps(ISystemProps props) {
        return ISystemProps.getOptionalLong(props, SEED_PROPERTY)
                .map(seed -> {
                    Holder.LOG.info("Using seeded random source from {}={}", SEED_PROPERTY, seed);
                    return seeded(seed);
                })
                .orElseGet(IRandomInts::threadLocal);
    }

    final class Holder {
        private static final Logger LOG = LoggerFactory.getLogger(IRandomInts.class);

        private Holder() {
        }
    }
}
