package io.qcheck.api;

/**
 * Exception thrown when checker configuration is invalid, such as a non-positive trial count or a
 * malformed system property.
 */
public class QCheckConfigurationException extends QCheckException {

  /**
   * Constructs a new QCheckConfigurationException with the specified message.
   *
   * @param message the detail message
   */
  public QCheckConfigurationException(String message) {
    super(message, null, "CONFIG");
  }

  /**
   * Constructs a new QCheckConfigurationException with the specified message and context.
   *
   * @param message the detail message
   * @param context the context information
   */
  public QCheckConfigurationException(String message, String context) {
    super(message, context, "CONFIG");
  }

  /**
   * Constructs a new QCheckConfigurationException with the specified message, cause, and context.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   * @param context the context information
   */
  public QCheckConfigurationException(String message, Throwable cause, String context) {
    super(message, cause, context, "CONFIG");
  }

  /**
   * Creates an exception for a system property whose value cannot be parsed.
   *
   * @param property the property name
   * @param value the raw property value
   * @param cause the parse failure
   * @return a new QCheckConfigurationException instance
   */
  public static QCheckConfigurationException invalidProperty(
      String property, String value, Throwable cause) {
    return new QCheckConfigurationException(
        String.format("Invalid value '%s' for system property", value), cause, property);
  }
}
