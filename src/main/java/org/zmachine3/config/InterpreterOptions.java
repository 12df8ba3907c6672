package org.zmachine3.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Typed view of the {@code zmachine} configuration block.
 *
 * @param randomSeed The initial seed of the random source; 0 seeds unpredictably.
 * @param checksumPolicy What to do when the story checksum does not match.
 * @param maxStackDepth The evaluation stack capacity in words.
 * @param maxCallDepth The maximum routine nesting.
 * @param trace Whether every executed instruction is logged.
 * @param splitScreenAvailable Whether the story is told that the host can split the screen.
 */
public record InterpreterOptions(
        long randomSeed,
        ChecksumPolicy checksumPolicy,
        int maxStackDepth,
        int maxCallDepth,
        boolean trace,
        boolean splitScreenAvailable) {

    /**
     * Handling of a checksum mismatch at load time.
     */
    public enum ChecksumPolicy {
        /** Refuse to load the story. */
        STRICT,
        /** Log a warning and load the story. */
        WARN,
        /** Load the story silently. */
        IGNORE
    }

    private static final String ROOT = "zmachine";

    public InterpreterOptions {
        if (maxStackDepth < 1) {
            throw new IllegalArgumentException("max-stack-depth must be positive, was " + maxStackDepth);
        }
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("max-call-depth must be positive, was " + maxCallDepth);
        }
    }

    /**
     * Returns the built-in defaults, identical to {@code reference.conf}.
     * @return The default options.
     */
    public static InterpreterOptions defaults() {
        return new InterpreterOptions(0, ChecksumPolicy.STRICT, 1024, 1024, false, false);
    }

    /**
     * Reads the options from a loaded configuration.
     * @param config The configuration containing a {@code zmachine} block.
     * @return The options.
     * @throws ConfigException if a value is missing or has the wrong type.
     */
    public static InterpreterOptions fromConfig(Config config) {
        Config c = config.getConfig(ROOT);
        return new InterpreterOptions(
                c.getLong("random-seed"),
                c.getEnum(ChecksumPolicy.class, "checksum-policy"),
                c.getInt("max-stack-depth"),
                c.getInt("max-call-depth"),
                c.getBoolean("trace"),
                c.getBoolean("split-screen-available"));
    }

    /**
     * Returns a copy with a different random seed.
     * @param seed The seed.
     * @return The new options.
     */
    public InterpreterOptions withRandomSeed(long seed) {
        return new InterpreterOptions(seed, checksumPolicy, maxStackDepth, maxCallDepth, trace, splitScreenAvailable);
    }

    /**
     * Returns a copy with tracing switched on or off.
     * @param enabled Whether to trace.
     * @return The new options.
     */
    public InterpreterOptions withTrace(boolean enabled) {
        return new InterpreterOptions(randomSeed, checksumPolicy, maxStackDepth, maxCallDepth, enabled, splitScreenAvailable);
    }

    /**
     * Returns a copy with a different checksum policy.
     * @param policy The policy.
     * @return The new options.
     */
    public InterpreterOptions withChecksumPolicy(ChecksumPolicy policy) {
        return new InterpreterOptions(randomSeed, policy, maxStackDepth, maxCallDepth, trace, splitScreenAvailable);
    }
}
