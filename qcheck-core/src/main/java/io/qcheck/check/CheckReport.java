package io.qcheck.check;

import java.util.ArrayList;
import java.util.List;

/**
 * Counterexamples collected by one run of {@link PropertyChecker#run}.
 *
 * <p>An empty report means no falsifying value was sampled, not that the invariant holds.
 *
 * @param seed the seed of the run, usable to replay it
 * @param trials the number of values sampled
 * @param counterexamples the counterexamples, in trial order
 * @param <T> the value type
 */
public record CheckReport<T>(long seed, int trials, List<Counterexample<T>> counterexamples) {

  public CheckReport {
    counterexamples = List.copyOf(counterexamples);
  }

  public boolean passed() {
    return counterexamples.isEmpty();
  }

  /** {@link Counterexample#describe()} of each counterexample, in trial order. */
  public List<String> descriptions() {
    List<String> out = new ArrayList<>(counterexamples.size());
    for (Counterexample<T> c : counterexamples) {
      out.add(c.describe());
    }
    return out;
  }
}
