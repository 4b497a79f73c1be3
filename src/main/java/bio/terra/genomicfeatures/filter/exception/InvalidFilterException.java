package bio.terra.genomicfeatures.filter.exception;

import bio.terra.genomicfeatures.common.exception.BadRequestException;

/**
 * Thrown when a filter cannot be constructed: an empty value list, a value of an unsupported type,
 * a malformed range string or an unrecognized overlap type. These are always raised when the
 * filter is built, before any query is rendered or run.
 */
public class InvalidFilterException extends BadRequestException {
  /**
   * Constructs an exception with the given message. The cause is set to null.
   *
   * @param message description of error that may help with debugging
   */
  public InvalidFilterException(String message) {
    super(message);
  }

  /**
   * Constructs an exception with the given message and cause.
   *
   * @param message description of error that may help with debugging
   * @param cause underlying exception that can be logged for debugging purposes
   */
  public InvalidFilterException(String message, Throwable cause) {
    super(message, cause);
  }
}
