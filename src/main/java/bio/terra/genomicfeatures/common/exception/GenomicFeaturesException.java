package bio.terra.genomicfeatures.common.exception;

import java.util.List;

/**
 * GenomicFeaturesException is the base exception for the other genomic features exceptions. It
 * adds a list of strings to provide error details. These are used in several cases. For example,
 *
 * <ul>
 *   <li>schema errors - to return each column a filter needs that a table does not have
 *   <li>lookup errors - to return each location searched for an annotation database
 * </ul>
 */
public class GenomicFeaturesException extends RuntimeException {
  private final List<String> errorDetails;

  public GenomicFeaturesException(String message) {
    super(message);
    this.errorDetails = null;
  }

  public GenomicFeaturesException(String message, Throwable cause) {
    super(message, cause);
    this.errorDetails = null;
  }

  public GenomicFeaturesException(Throwable cause) {
    super(cause);
    this.errorDetails = null;
  }

  public GenomicFeaturesException(String message, List<String> errorDetails) {
    super(message);
    this.errorDetails = errorDetails;
  }

  public GenomicFeaturesException(String message, Throwable cause, List<String> errorDetails) {
    super(message, cause);
    this.errorDetails = errorDetails;
  }

  public List<String> getErrorDetails() {
    return errorDetails;
  }

  @Override
  public String toString() {
    if (errorDetails == null) {
      return super.toString();
    }
    return super.toString() + " Details: " + String.join("; ", errorDetails);
  }
}
