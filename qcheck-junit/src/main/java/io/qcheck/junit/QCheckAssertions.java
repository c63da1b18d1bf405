package io.qcheck.junit;

import io.qcheck.api.Invariant;
import io.qcheck.check.CheckerOptions;
import io.qcheck.check.PropertyChecker;
import io.qcheck.gen.Gen;

/**
 * Assertions for JUnit 5 tests.
 *
 * <pre>{@code
 * @Test
 * void depthIsBounded() {
 *   QCheckAssertions.assertProperty(
 *       doc -> Values.depth(doc) <= 2, DocumentValues.document(2, false));
 * }
 * }</pre>
 */
public final class QCheckAssertions {

  private QCheckAssertions() {}

  /**
   * Fails the current test if {@code invariant} does not hold for values of {@code generator}.
   * Options come from {@link CheckerOptions#fromSystemProperties()}.
   *
   * @param invariant the invariant
   * @param generator the generator
   * @param <T> the value type
   */
  public static <T> void assertProperty(
      Invariant<? super T> invariant, Gen<? extends T> generator) {
    assertProperty(CheckerOptions.fromSystemProperties(), invariant, generator);
  }

  /**
   * Fails the current test if {@code invariant} does not hold for values of {@code generator}.
   *
   * @param options checker options
   * @param invariant the invariant
   * @param generator the generator
   * @param <T> the value type
   */
  public static <T> void assertProperty(
      CheckerOptions options, Invariant<? super T> invariant, Gen<? extends T> generator) {
    new PropertyChecker(options).checkFails(JUnitTestContext.INSTANCE, invariant, generator);
  }
}
