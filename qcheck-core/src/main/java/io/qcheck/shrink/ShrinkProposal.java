package io.qcheck.shrink;

/**
 * Result of one simplification step.
 *
 * @param changed whether a simpler candidate was found
 * @param candidate the simpler candidate, or the original value when nothing changed
 * @param <T> the value type
 */
public record ShrinkProposal<T>(boolean changed, T candidate) {

  public static <T> ShrinkProposal<T> unchanged(T value) {
    return new ShrinkProposal<>(false, value);
  }

  public static <T> ShrinkProposal<T> changed(T candidate) {
    return new ShrinkProposal<>(true, candidate);
  }
}
