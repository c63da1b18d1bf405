package io.qcheck.shrink;

import io.qcheck.api.Invariant;
import io.qcheck.api.Outcome;
import io.qcheck.api.ValidationUtils;
import io.qcheck.gen.RandomSource;
import io.qcheck.value.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy, randomized minimizer of counterexamples.
 *
 * <p>Starting from a value that falsifies an invariant, the shrinker repeatedly asks its {@link
 * Simplifier} for a candidate. The first changed candidate that still falsifies the invariant is
 * accepted and the search continues from it with a fresh attempt budget. A candidate for which
 * the invariant holds is discarded and the same value is tried again. Once {@code
 * reductionAttempts} consecutive attempts produce nothing acceptable, the current value is
 * returned. The result is locally minimal with high probability, not globally minimal.
 *
 * <p>If the invariant throws on a candidate, shrinking stops and the error is returned in the
 * {@link Reduction}.
 *
 * @param <T> the value type
 */
public final class Shrinker<T> {
  private static final Logger log = LoggerFactory.getLogger(Shrinker.class);

  private final Simplifier<T> simplifier;
  private final int reductionAttempts;
  private final RandomSource random;

  /**
   * @param simplifier proposes simplification steps
   * @param reductionAttempts attempts per accepted step, at least 1
   * @param random randomness handed to the simplifier
   */
  public Shrinker(Simplifier<T> simplifier, int reductionAttempts, RandomSource random) {
    this.simplifier = ValidationUtils.requireNonNull(simplifier, "simplifier");
    ValidationUtils.requirePositive(reductionAttempts, "reductionAttempts");
    this.reductionAttempts = reductionAttempts;
    this.random = ValidationUtils.requireNonNull(random, "random");
  }

  /**
   * Shrinks {@code value}, which must falsify {@code invariant}.
   *
   * @param value the failing value
   * @param invariant the invariant it falsifies
   * @return the number of accepted steps and the smallest failing value found
   */
  public Reduction<T> reduce(T value, Invariant<? super T> invariant) {
    T current = value;
    int reductions = 0;
    int attempts = 0;
    while (attempts < reductionAttempts) {
      attempts++;
      ShrinkProposal<T> proposal = simplifier.simplify(current, random);
      if (!proposal.changed()) {
        continue;
      }
      T candidate = proposal.candidate();
      Outcome outcome = Outcome.evaluate(invariant, candidate);
      if (outcome instanceof Outcome.Errored errored) {
        log.debug("Invariant threw on candidate {}", Values.repr(candidate), errored.error());
        return new Reduction<>(reductions, current, errored.error());
      }
      if (outcome instanceof Outcome.Falsified) {
        reductions++;
        attempts = 0;
        current = candidate;
        if (log.isDebugEnabled()) {
          log.debug("Reduction {}: {}", reductions, Values.repr(current));
        }
      }
    }
    return new Reduction<>(reductions, current);
  }
}
