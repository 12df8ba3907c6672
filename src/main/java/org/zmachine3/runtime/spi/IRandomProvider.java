package org.zmachine3.runtime.spi;

/**
 * Source of uniformly distributed integers for the {@code random} opcode.
 * Implementations must be reproducible for a given seed.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Restarts the sequence from the given seed.
     *
     * @param seed the new seed
     */
    void reseed(long seed);

    /**
     * Restarts the sequence from a seed that cannot be predicted.
     */
    void reseedUnpredictably();
}
