package io.qcheck.shrink;

/**
 * Outcome of {@link Shrinker#reduce}.
 *
 * @param reductions number of accepted simplification steps
 * @param minimized the smallest value found that still falsifies the invariant
 * @param error the failure raised by the invariant on a candidate, or null
 * @param <T> the value type
 */
public record Reduction<T>(int reductions, T minimized, Throwable error) {

  public Reduction(int reductions, T minimized) {
    this(reductions, minimized, null);
  }

  /** Whether shrinking stopped because the invariant threw on a candidate. */
  public boolean interrupted() {
    return error != null;
  }
}
