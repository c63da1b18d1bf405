package io.qcheck.check;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The test runner as seen by {@link PropertyChecker#checkFails}: something that accepts a failure
 * message and aborts the current test.
 */
@FunctionalInterface
public interface TestContext {

  /** Fails by throwing {@link PropertyFailedError}, which any test framework reports. */
  TestContext DEFAULT =
      message -> {
        throw new PropertyFailedError(message);
      };

  /**
   * Reports a failure.
   *
   * @param message the failure message
   */
  void fail(String message);

  /**
   * A context that logs failures at warn level and lets the caller continue. Useful for
   * exploratory runs.
   *
   * @return a lenient context
   */
  static TestContext lenient() {
    Logger log = LoggerFactory.getLogger(TestContext.class);
    return message -> log.warn("Property failed: {}", message);
  }
}
