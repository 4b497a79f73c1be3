package bio.terra.genomicfeatures.common.exception;

import java.util.List;

/** Errors in a request that the caller needs to fix: a malformed filter or a mismatched schema. */
public abstract class BadRequestException extends GenomicFeaturesException {
  public BadRequestException(String message) {
    super(message);
  }

  public BadRequestException(String message, Throwable cause) {
    super(message, cause);
  }

  public BadRequestException(Throwable cause) {
    super(cause);
  }

  public BadRequestException(String message, List<String> errorDetails) {
    super(message, errorDetails);
  }

  public BadRequestException(String message, Throwable cause, List<String> errorDetails) {
    super(message, cause, errorDetails);
  }
}
