package io.qcheck.api;

/**
 * Base exception for all qcheck usage errors. Provides contextual information to help with
 * debugging a misbuilt generator or checker.
 *
 * <p>Failures of the property under test are never reported through this type: they are
 * collected as counterexamples instead.
 */
public class QCheckException extends RuntimeException {
  /** Contextual information about where the error occurred. */
  private final String context;

  /** Error code identifying the specific kind of error. */
  private final String errorCode;

  /**
   * Constructs a new QCheckException with the specified message.
   *
   * @param message the detail message
   */
  public QCheckException(String message) {
    this(message, null, null);
  }

  /**
   * Constructs a new QCheckException with the specified message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public QCheckException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  /**
   * Constructs a new QCheckException with the specified message, context, and error code.
   *
   * @param message the detail message
   * @param context the context information
   * @param errorCode the error code
   */
  public QCheckException(String message, String context, String errorCode) {
    this(message, null, context, errorCode);
  }

  /**
   * Constructs a new QCheckException with the specified message, cause, context, and error code.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   * @param context the context information
   * @param errorCode the error code
   */
  public QCheckException(String message, Throwable cause, String context, String errorCode) {
    super(formatMessage(message, context, errorCode), cause);
    this.context = context;
    this.errorCode = errorCode;
  }

  private static String formatMessage(String message, String context, String errorCode) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (errorCode != null) {
      sb.append(" [Error Code: ").append(errorCode).append("]");
    }
    return sb.toString();
  }

  /**
   * Gets the context information for this exception.
   *
   * @return the context information, or null if none
   */
  public String getContext() {
    return context;
  }

  /**
   * Gets the error code for this exception.
   *
   * @return the error code, or null if none
   */
  public String getErrorCode() {
    return errorCode;
  }
}
