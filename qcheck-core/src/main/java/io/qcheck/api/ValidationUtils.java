package io.qcheck.api;

import java.util.Collection;

/** Utility class for common validation operations that throw appropriate exceptions. */
public final class ValidationUtils {

  private ValidationUtils() {}

  /**
   * Validates that a generator argument is not null.
   *
   * @param value the value to check
   * @param parameterName the name of the parameter for error reporting
   * @param <T> the value type
   * @return the value
   * @throws GeneratorMisuseException if value is null
   */
  public static <T> T requireNonNull(T value, String parameterName) {
    if (value == null) {
      throw new GeneratorMisuseException(
          String.format("Required parameter '%s' cannot be null", parameterName));
    }
    return value;
  }

  /**
   * Validates that a choice collection has at least one element.
   *
   * @param values the collection to check
   * @param parameterName the name of the parameter for error reporting
   * @throws GeneratorMisuseException if the collection is null or empty
   */
  public static void requireNonEmpty(Collection<?> values, String parameterName) {
    requireNonNull(values, parameterName);
    if (values.isEmpty()) {
      throw GeneratorMisuseException.emptyChoice(parameterName);
    }
  }

  /**
   * Validates that a closed interval is not inverted.
   *
   * @param lo the lower bound
   * @param hi the upper bound
   * @throws GeneratorMisuseException if {@code lo > hi}
   */
  public static void requireBounds(long lo, long hi) {
    if (lo > hi) {
      throw GeneratorMisuseException.invalidBounds(lo, hi);
    }
  }

  /**
   * Validates a sampled length.
   *
   * @param length the sampled length, may be null
   * @return the length as an int
   * @throws GeneratorMisuseException if the length is null or negative
   */
  public static int requireLength(Integer length) {
    if (length == null || length < 0) {
      throw GeneratorMisuseException.invalidLength(length);
    }
    return length;
  }

  /**
   * Validates that a configuration value is strictly positive.
   *
   * @param value the value to check
   * @param parameterName the name of the parameter for error reporting
   * @throws QCheckConfigurationException if {@code value <= 0}
   */
  public static void requirePositive(int value, String parameterName) {
    if (value <= 0) {
      throw new QCheckConfigurationException(
          String.format("Parameter '%s' must be positive", parameterName), String.valueOf(value));
    }
  }

  /**
   * Validates that a configuration value is not negative.
   *
   * @param value the value to check
   * @param parameterName the name of the parameter for error reporting
   * @throws QCheckConfigurationException if {@code value < 0}
   */
  public static void requireNonNegative(int value, String parameterName) {
    if (value < 0) {
      throw new QCheckConfigurationException(
          String.format("Parameter '%s' cannot be negative", parameterName),
          String.valueOf(value));
    }
  }
}
