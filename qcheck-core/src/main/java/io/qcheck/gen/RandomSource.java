package io.qcheck.gen;

/**
 * Randomness context threaded through every sampling call.
 *
 * <p>A source is owned by a single check run and is not thread-safe.
 */
public interface RandomSource {

  /**
   * Returns a uniformly distributed int in {@code [0, bound)}.
   *
   * @param bound the exclusive upper bound, must be positive
   * @return the next int
   */
  int nextInt(int bound);

  /**
   * Returns a uniformly distributed int in the closed interval {@code [lo, hi]}.
   *
   * @param lo the inclusive lower bound
   * @param hi the inclusive upper bound
   * @return the next int
   */
  int nextInt(int lo, int hi);

  /**
   * Returns a uniformly distributed long over the full signed 64-bit range.
   *
   * @return the next long
   */
  long nextLong();

  /**
   * Returns a uniformly distributed double in {@code [0, 1)}.
   *
   * @return the next double
   */
  double nextDouble();

  /**
   * Returns a fair coin flip.
   *
   * @return the next boolean
   */
  boolean nextBoolean();

  /**
   * The seed this source was created with; reusing it replays the same stream of draws.
   *
   * @return the seed
   */
  long seed();
}
