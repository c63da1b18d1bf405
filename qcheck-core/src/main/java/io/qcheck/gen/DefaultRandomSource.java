package io.qcheck.gen;

import java.util.SplittableRandom;

/** {@link RandomSource} backed by a seeded {@link SplittableRandom}. */
public final class DefaultRandomSource implements RandomSource {
  private static final SplittableRandom SEEDS = new SplittableRandom();

  private final long seed;
  private final SplittableRandom random;

  /**
   * Creates a source that replays the same draws for the same seed.
   *
   * @param seed the seed
   */
  public DefaultRandomSource(long seed) {
    this.seed = seed;
    this.random = new SplittableRandom(seed);
  }

  /**
   * Creates a source with a fresh, unpredictable seed.
   *
   * @return a new source
   */
  public static DefaultRandomSource create() {
    long seed;
    synchronized (SEEDS) {
      seed = SEEDS.nextLong();
    }
    return new DefaultRandomSource(seed);
  }

  @Override
  public int nextInt(int bound) {
    return random.nextInt(bound);
  }

  @Override
  public int nextInt(int lo, int hi) {
    // long arithmetic so [Integer.MIN_VALUE, Integer.MAX_VALUE] does not overflow
    return (int) random.nextLong(lo, (long) hi + 1);
  }

  @Override
  public long nextLong() {
    return random.nextLong();
  }

  @Override
  public double nextDouble() {
    return random.nextDouble();
  }

  @Override
  public boolean nextBoolean() {
    return random.nextBoolean();
  }

  @Override
  public long seed() {
    return seed;
  }

  @Override
  public String toString() {
    return "DefaultRandomSource{seed=" + seed + "}";
  }
}
