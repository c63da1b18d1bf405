package io.qcheck.shrink;

import io.qcheck.gen.RandomSource;

/**
 * Proposes one simplification step for a value.
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface Simplifier<T> {

  /**
   * Proposes a simpler candidate for {@code value}. Implementations must not modify {@code
   * value}.
   *
   * @param value the value to simplify
   * @param random randomness for choosing what to simplify
   * @return a changed proposal, or an unchanged one holding {@code value}
   */
  ShrinkProposal<T> simplify(T value, RandomSource random);
}
