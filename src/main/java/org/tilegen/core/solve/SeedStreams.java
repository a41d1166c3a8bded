package org.tilegen.core.solve;

import java.util.Random;

/**
 * Derives every random stream of a solve from the one global seed. No stream is
 * shared between threads.
 */
public final class SeedStreams {

    private static final long TIE_BREAK_SALT = 0x7469655F62726BL;

    private SeedStreams() {
    }

    /** Seed of attempt {@code attempt} (0-based). Attempt 0 uses the derived seed too. */
    public static long attemptSeed(long seed, int attempt) {
        return mix(seed, attempt);
    }

    public static Random workerRandom(long attemptSeed, int worker, int round) {
        return new Random(mix(mix(attemptSeed, worker), round));
    }

    /** One value per cell, used only to order cells whose entropies are exactly equal. */
    public static long[] tieBreaks(long attemptSeed, int cellCount) {
        Random r = new Random(mix(attemptSeed, TIE_BREAK_SALT));
        long[] out = new long[cellCount];
        for (int i = 0; i < cellCount; i++) {
            out[i] = r.nextLong();
        }
        return out;
    }

    // SplitMix64 finalizer over (a, b)
    static long mix(long a, long b) {
        long z = a + 0x9E3779B97F4A7C15L * (b + 1);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
