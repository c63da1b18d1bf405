package io.qcheck.check;

import io.qcheck.value.Values;
import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * A value for which an invariant did not hold.
 *
 * @param <T> the value type
 */
public sealed interface Counterexample<T> permits Counterexample.Falsified, Counterexample.Errored {

  /** The value originally sampled by the generator. */
  T value();

  /** One-line (or, for errors, multi-line) text used in reports. */
  String describe();

  /**
   * The invariant returned {@code false}; {@code minimized} is the result of shrinking.
   *
   * @param value the sampled value
   * @param reductions accepted shrink steps
   * @param minimized the smallest failing value found
   */
  record Falsified<T>(T value, int reductions, T minimized) implements Counterexample<T> {
    @Override
    public String describe() {
      return "after " + reductions + " reductions: " + Values.repr(minimized);
    }
  }

  /**
   * The invariant threw, either on the sampled value or on a shrink candidate.
   *
   * @param value the sampled value
   * @param error what the invariant threw
   */
  record Errored<T>(T value, Throwable error) implements Counterexample<T> {
    @Override
    public String describe() {
      StringWriter trace = new StringWriter();
      error.printStackTrace(new PrintWriter(trace));
      return Values.repr(value) + " : " + trace;
    }
  }
}
