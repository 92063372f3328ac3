package com.github.dimitryivaniuta.pack.draw;

import java.util.concurrent.ThreadLocalRandom;

/** Default, non-cryptographic randomness. */
public class ThreadLocalRandomSource implements RandomSource {

    @Override
    public double nextDouble(double bound) {
        return ThreadLocalRandom.current().nextDouble(bound);
    }

    @Override
    public int nextInt(int bound) {
        return ThreadLocalRandom.current().nextInt(bound);
    }
}
