package io.qcheck.api;

/**
 * Thrown when a generator combinator is used with arguments it cannot honour, such as an empty
 * choice set, inverted bounds or a negative length. This is a programming error in the test, not
 * a condition to recover from.
 */
public class GeneratorMisuseException extends QCheckException {

  /**
   * Constructs a new GeneratorMisuseException with the specified message.
   *
   * @param message the detail message
   */
  public GeneratorMisuseException(String message) {
    super(message, null, "GENERATOR");
  }

  /**
   * Constructs a new GeneratorMisuseException with the specified message and context.
   *
   * @param message the detail message
   * @param context the context information
   */
  public GeneratorMisuseException(String message, String context) {
    super(message, context, "GENERATOR");
  }

  /**
   * Creates an exception for a choice combinator given nothing to choose from.
   *
   * @param parameterName the name of the empty parameter
   * @return a new GeneratorMisuseException instance
   */
  public static GeneratorMisuseException emptyChoice(String parameterName) {
    return new GeneratorMisuseException(
        String.format("Cannot choose from an empty '%s'", parameterName));
  }

  /**
   * Creates an exception for a range whose lower bound exceeds its upper bound.
   *
   * @param lo the lower bound
   * @param hi the upper bound
   * @return a new GeneratorMisuseException instance
   */
  public static GeneratorMisuseException invalidBounds(long lo, long hi) {
    return new GeneratorMisuseException(
        "Lower bound exceeds upper bound", String.format("[%d, %d]", lo, hi));
  }

  /**
   * Creates an exception for a length generator that produced a negative or missing length.
   *
   * @param length the offending length, may be null
   * @return a new GeneratorMisuseException instance
   */
  public static GeneratorMisuseException invalidLength(Integer length) {
    return new GeneratorMisuseException(
        "Length generator must produce a non-negative length", String.valueOf(length));
  }

  /**
   * Creates an exception for a depth budget below the allowed minimum.
   *
   * @param depth the requested depth
   * @param minimum the smallest accepted depth
   * @return a new GeneratorMisuseException instance
   */
  public static GeneratorMisuseException invalidDepth(int depth, int minimum) {
    return new GeneratorMisuseException(
        String.format("Depth budget must be at least %d", minimum), String.valueOf(depth));
  }
}
