package org.zmachine3.runtime.model;

import org.zmachine3.runtime.Config;
import org.zmachine3.runtime.spi.IRandomProvider;

/**
 * Implements the two modes of the {@code random} opcode.
 * <p>
 * In random mode values come from the provider. Seeding with a value below
 * {@link Config#PREDICTABLE_SEED_LIMIT} switches to predictable mode, which counts 1, 2, .., seed
 * and starts over, as story test suites expect.
 */
public class RandomSource {

    private final IRandomProvider provider;
    private int predictableLimit = 0;
    private int predictableCounter = 0;

    public RandomSource(IRandomProvider provider) {
        this.provider = provider;
    }

    /**
     * Executes {@code random} with a signed argument.
     * @param range Positive for a value in [1, range], negative to seed with -range, zero to seed unpredictably.
     * @return The generated value, or 0 after reseeding.
     */
    public int random(int range) {
        if (range > 0) {
            return next(range);
        }
        if (range == 0) {
            predictableLimit = 0;
            provider.reseedUnpredictably();
        } else {
            seed(-range);
        }
        return 0;
    }

    /**
     * Seeds the source.
     * @param seed A positive seed; values below the predictable limit select the counting mode.
     */
    public void seed(long seed) {
        if (seed > 0 && seed < Config.PREDICTABLE_SEED_LIMIT) {
            predictableLimit = (int) seed;
            predictableCounter = 0;
        } else {
            predictableLimit = 0;
            provider.reseed(seed);
        }
    }

    public boolean isPredictable() {
        return predictableLimit > 0;
    }

    private int next(int range) {
        if (predictableLimit > 0) {
            int value = predictableCounter % predictableLimit + 1;
            predictableCounter++;
            return (value - 1) % range + 1;
        }
        return provider.nextInt(range) + 1;
    }
}
