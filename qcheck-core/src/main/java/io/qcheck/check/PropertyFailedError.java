package io.qcheck.check;

/** Thrown by {@link TestContext#DEFAULT} to fail the running test. */
public class PropertyFailedError extends AssertionError {
  private static final long serialVersionUID = 1L;

  public PropertyFailedError(String message) {
    super(message);
  }
}
