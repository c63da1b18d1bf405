package io.qcheck.check;

import io.qcheck.api.Invariant;
import io.qcheck.api.Outcome;
import io.qcheck.api.ValidationUtils;
import io.qcheck.gen.DefaultRandomSource;
import io.qcheck.gen.Gen;
import io.qcheck.gen.RandomSource;
import io.qcheck.shrink.Reduction;
import io.qcheck.shrink.Shrinker;
import io.qcheck.shrink.Simplifier;
import io.qcheck.shrink.StructuralSimplifier;
import io.qcheck.value.Values;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples a generator, evaluates an invariant on each sample and shrinks the failures.
 *
 * <p>Each trial ends in one of three ways:
 *
 * <ul>
 *   <li>the invariant holds: nothing is recorded
 *   <li>the invariant returns {@code false}: the value is shrunk and recorded as {@link
 *       Counterexample.Falsified}, described as {@code after <N> reductions: <value>}
 *   <li>the invariant throws: the value is recorded as {@link Counterexample.Errored} with the
 *       error and its stack trace, without shrinking
 * </ul>
 *
 * <p>Nothing thrown by the invariant escapes a check. Failures of the generator itself propagate
 * to the caller.
 *
 * <p>Example:
 *
 * <pre>{@code
 * PropertyChecker checker = new PropertyChecker(CheckerOptions.fromSystemProperties());
 * checker.checkFails(
 *     TestContext.DEFAULT,
 *     doc -> Values.depth(doc) <= 3,
 *     DocumentValues.document(3, true));
 * }</pre>
 */
public final class PropertyChecker {
  private static final Logger log = LoggerFactory.getLogger(PropertyChecker.class);

  private final CheckerOptions options;

  public PropertyChecker() {
    this(CheckerOptions.DEFAULT);
  }

  public PropertyChecker(CheckerOptions options) {
    this.options = ValidationUtils.requireNonNull(options, "options");
  }

  public CheckerOptions options() {
    return options;
  }

  /**
   * Runs {@link CheckerOptions#trials()} trials and returns the counterexample descriptions.
   *
   * @param invariant the invariant to check
   * @param generator the value generator
   * @param <T> the value type
   * @return descriptions of the counterexamples found, empty if none
   */
  public <T> List<String> check(Invariant<? super T> invariant, Gen<? extends T> generator) {
    return run(invariant, generator).descriptions();
  }

  /**
   * Runs {@link CheckerOptions#trials()} trials, shrinking with {@link StructuralSimplifier}.
   *
   * @param invariant the invariant to check
   * @param generator the value generator
   * @param <T> the value type
   * @return the report
   */
  public <T> CheckReport<T> run(Invariant<? super T> invariant, Gen<? extends T> generator) {
    return run(invariant, generator, StructuralSimplifier.structural());
  }

  /**
   * Runs {@link CheckerOptions#trials()} trials, shrinking with {@code simplifier}.
   *
   * @param invariant the invariant to check
   * @param generator the value generator
   * @param simplifier proposes shrink steps for falsified values
   * @param <T> the value type
   * @return the report
   */
  public <T> CheckReport<T> run(
      Invariant<? super T> invariant, Gen<? extends T> generator, Simplifier<T> simplifier) {
    ValidationUtils.requireNonNull(invariant, "invariant");
    ValidationUtils.requireNonNull(generator, "generator");
    ValidationUtils.requireNonNull(simplifier, "simplifier");

    RandomSource random = newRandomSource();
    Shrinker<T> shrinker = new Shrinker<>(simplifier, options.reductionAttempts(), random);
    List<Counterexample<T>> found = new ArrayList<>();
    for (int trial = 0; trial < options.trials(); trial++) {
      T value = generator.next(random);
      Outcome outcome = Outcome.evaluate(invariant, value);
      if (outcome instanceof Outcome.Errored errored) {
        log.debug("Trial {}: invariant threw on {}", trial, Values.repr(value), errored.error());
        found.add(new Counterexample.Errored<>(value, errored.error()));
      } else if (outcome instanceof Outcome.Falsified) {
        log.debug("Trial {}: falsified by {}", trial, Values.repr(value));
        Reduction<T> reduction = shrinker.reduce(value, invariant);
        if (reduction.interrupted()) {
          found.add(new Counterexample.Errored<>(value, reduction.error()));
        } else {
          found.add(
              new Counterexample.Falsified<>(value, reduction.reductions(), reduction.minimized()));
        }
      }
    }
    if (!found.isEmpty()) {
      log.info(
          "Found {} counterexample(s) in {} trials (seed {})",
          found.size(),
          options.trials(),
          random.seed());
    }
    return new CheckReport<>(random.seed(), options.trials(), found);
  }

  /**
   * Runs a check and fails {@code context} if any counterexample was found. The message reports
   * the number of counterexamples, the first {@link CheckerOptions#exampleLimit()} of them and the
   * seed that replays the run.
   *
   * @param context the test runner
   * @param invariant the invariant to check
   * @param generator the value generator
   * @param <T> the value type
   */
  public <T> void checkFails(
      TestContext context, Invariant<? super T> invariant, Gen<? extends T> generator) {
    ValidationUtils.requireNonNull(context, "context");
    CheckReport<T> report = run(invariant, generator);
    if (!report.passed()) {
      context.fail(failureMessage(report, options.exampleLimit()));
    }
  }

  /**
   * Formats a failed report.
   *
   * @param report the report, with at least one counterexample
   * @param exampleLimit most counterexamples to include
   * @return the message
   */
  public static String failureMessage(CheckReport<?> report, int exampleLimit) {
    List<String> descriptions = report.descriptions();
    int shown = Math.min(descriptions.size(), exampleLimit);
    StringBuilder sb =
        new StringBuilder()
            .append("found ")
            .append(descriptions.size())
            .append(" counter examples, displaying first ")
            .append(shown)
            .append(':');
    for (int i = 0; i < shown; i++) {
      sb.append("\n    -> ").append(descriptions.get(i));
    }
    sb.append("\nseed: ")
        .append(report.seed())
        .append(" (replay with -D")
        .append(CheckerOptions.SEED_PROPERTY)
        .append('=')
        .append(report.seed())
        .append(')');
    return sb.toString();
  }

  private RandomSource newRandomSource() {
    return options.seed().isPresent()
        ? new DefaultRandomSource(options.seed().getAsLong())
        : DefaultRandomSource.create();
  }
}
