package com.github.dimitryivaniuta.pack.draw;

/** Source of the two kinds of randomness a draw needs. Implementations must be thread-safe. */
public interface RandomSource {

    /** Uniform value in {@code [0, bound)}. */
    double nextDouble(double bound);

    /** Uniform index in {@code [0, bound)}. */
    int nextInt(int bound);
}
