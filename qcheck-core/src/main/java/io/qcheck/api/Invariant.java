package io.qcheck.api;

/**
 * A predicate that is expected to hold for every generated value.
 *
 * <p>Returning {@code false} falsifies the invariant for that value. Throwing is allowed and is
 * reported separately from falsification.
 *
 * @param <T> the type of values checked
 */
@FunctionalInterface
public interface Invariant<T> {

  /**
   * Tests one value.
   *
   * @param value the generated value
   * @return whether the invariant holds for {@code value}
   * @throws Exception if the check itself fails
   */
  boolean holds(T value) throws Exception;
}
