package org.zmachine3.runtime.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.zmachine3.runtime.spi.IRandomProvider;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final Well19937c rng;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.rng = new Well19937c(seed);
    }

    /**
     * Creates a provider seeded from the clock and the instance identity.
     */
    public SeededRandomProvider() {
        this.rng = new Well19937c();
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public void reseed(long seed) {
        rng.setSeed(seed);
    }

    @Override
    public void reseedUnpredictably() {
        rng.setSeed(System.nanoTime() ^ System.identityHashCode(this));
    }
}
