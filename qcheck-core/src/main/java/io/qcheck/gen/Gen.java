package io.qcheck.gen;

import java.util.function.Function;

/**
 * A repeatable producer of randomized values.
 *
 * <p>Generators are built once by composing the factories in {@link Gens} and then sampled any
 * number of times. Each call to {@link #next(RandomSource)} is independent; the only state it may
 * touch is the supplied random source.
 *
 * @param <T> the type of generated values
 */
@FunctionalInterface
public interface Gen<T> {

  /**
   * Samples one fresh value.
   *
   * @param random the randomness to draw from
   * @return the generated value
   */
  T next(RandomSource random);

  /**
   * Returns a generator that applies {@code mapper} to every value sampled from this one.
   *
   * @param mapper the transformation
   * @param <R> the mapped type
   * @return the mapped generator
   */
  default <R> Gen<R> map(Function<? super T, ? extends R> mapper) {
    return Gens.map(this, mapper);
  }
}
