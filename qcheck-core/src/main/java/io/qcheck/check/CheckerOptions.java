package io.qcheck.check;

import io.qcheck.api.QCheckConfigurationException;
import io.qcheck.api.ValidationUtils;
import java.util.OptionalLong;

/**
 * Checker configuration.
 *
 * @param trials number of values sampled per check, at least 1
 * @param reductionAttempts simplification attempts per accepted shrink step, at least 1
 * @param exampleLimit most counterexamples shown in a failure message, at least 0
 * @param seed fixed seed for the random source, or empty for a fresh seed per run
 */
public record CheckerOptions(
    int trials, int reductionAttempts, int exampleLimit, OptionalLong seed) {

  /** System property overriding {@link #trials()}. */
  public static final String TRIALS_PROPERTY = "qcheck.trials";

  /** System property overriding {@link #reductionAttempts()}. */
  public static final String REDUCTION_ATTEMPTS_PROPERTY = "qcheck.reductionAttempts";

  /** System property overriding {@link #exampleLimit()}. */
  public static final String EXAMPLES_PROPERTY = "qcheck.examples";

  /** System property fixing {@link #seed()}. */
  public static final String SEED_PROPERTY = "qcheck.seed";

  /** 100 trials, 10 reduction attempts, 5 examples, fresh seed. */
  public static final CheckerOptions DEFAULT =
      new CheckerOptions(100, 10, 5, OptionalLong.empty());

  /** A short run for expensive invariants. */
  public static final CheckerOptions QUICK = new CheckerOptions(20, 10, 5, OptionalLong.empty());

  /** A long run with a larger shrink budget. */
  public static final CheckerOptions THOROUGH =
      new CheckerOptions(1000, 50, 5, OptionalLong.empty());

  public CheckerOptions {
    ValidationUtils.requirePositive(trials, "trials");
    ValidationUtils.requirePositive(reductionAttempts, "reductionAttempts");
    ValidationUtils.requireNonNegative(exampleLimit, "exampleLimit");
    if (seed == null) {
      throw new QCheckConfigurationException("seed must not be null, use OptionalLong.empty()");
    }
  }

  /**
   * Returns a copy of these options with a fixed seed.
   *
   * @param seed the seed
   * @return the new options
   */
  public CheckerOptions withSeed(long seed) {
    return new CheckerOptions(trials, reductionAttempts, exampleLimit, OptionalLong.of(seed));
  }

  /**
   * {@link #DEFAULT} overridden by the {@code qcheck.*} system properties that are set.
   *
   * @return the options
   * @throws QCheckConfigurationException if a property is not a valid number
   */
  public static CheckerOptions fromSystemProperties() {
    Builder builder = builder();
    String trials = System.getProperty(TRIALS_PROPERTY);
    if (trials != null) {
      builder.trials(parseInt(TRIALS_PROPERTY, trials));
    }
    String attempts = System.getProperty(REDUCTION_ATTEMPTS_PROPERTY);
    if (attempts != null) {
      builder.reductionAttempts(parseInt(REDUCTION_ATTEMPTS_PROPERTY, attempts));
    }
    String examples = System.getProperty(EXAMPLES_PROPERTY);
    if (examples != null) {
      builder.exampleLimit(parseInt(EXAMPLES_PROPERTY, examples));
    }
    String seed = System.getProperty(SEED_PROPERTY);
    if (seed != null) {
      try {
        builder.seed(Long.parseLong(seed.trim()));
      } catch (NumberFormatException e) {
        throw QCheckConfigurationException.invalidProperty(SEED_PROPERTY, seed, e);
      }
    }
    return builder.build();
  }

  private static int parseInt(String property, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw QCheckConfigurationException.invalidProperty(property, value, e);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private int trials = 100;
    private int reductionAttempts = 10;
    private int exampleLimit = 5;
    private OptionalLong seed = OptionalLong.empty();

    public Builder trials(int value) {
      this.trials = value;
      return this;
    }

    public Builder reductionAttempts(int value) {
      this.reductionAttempts = value;
      return this;
    }

    public Builder exampleLimit(int value) {
      this.exampleLimit = value;
      return this;
    }

    public Builder seed(long value) {
      this.seed = OptionalLong.of(value);
      return this;
    }

    public CheckerOptions build() {
      return new CheckerOptions(trials, reductionAttempts, exampleLimit, seed);
    }
  }
}
