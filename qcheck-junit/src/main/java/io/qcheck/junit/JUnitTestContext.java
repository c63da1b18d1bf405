package io.qcheck.junit;

import io.qcheck.check.TestContext;
import org.junit.jupiter.api.Assertions;

/** {@link TestContext} that fails the current JUnit 5 test. */
public final class JUnitTestContext implements TestContext {
  public static final JUnitTestContext INSTANCE = new JUnitTestContext();

  private JUnitTestContext() {}

  @Override
  public void fail(String message) {
    Assertions.fail(message);
  }
}
