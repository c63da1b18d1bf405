package io.qcheck.api;

/** Result of evaluating an {@link Invariant} on one value. */
public sealed interface Outcome permits Outcome.Held, Outcome.Falsified, Outcome.Errored {

  /**
   * Evaluates {@code invariant} on {@code value}. Anything thrown by the invariant, errors
   * included, is captured in an {@link Errored} outcome.
   *
   * @param invariant the invariant
   * @param value the value
   * @param <T> the value type
   * @return the outcome
   */
  static <T> Outcome evaluate(Invariant<? super T> invariant, T value) {
    try {
      return invariant.holds(value) ? Held.INSTANCE : Falsified.INSTANCE;
    } catch (Throwable t) {
      return new Errored(t);
    }
  }

  /** The invariant returned {@code true}. */
  record Held() implements Outcome {
    public static final Held INSTANCE = new Held();
  }

  /** The invariant returned {@code false}. */
  record Falsified() implements Outcome {
    public static final Falsified INSTANCE = new Falsified();
  }

  /** The invariant threw. */
  record Errored(Throwable error) implements Outcome {
    public Errored {
      ValidationUtils.requireNonNull(error, "error");
    }
  }
}
