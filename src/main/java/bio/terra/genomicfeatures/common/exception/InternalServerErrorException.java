package bio.terra.genomicfeatures.common.exception;

public class InternalServerErrorException extends GenomicFeaturesException {
  public InternalServerErrorException(String message) {
    super(message);
  }

  public InternalServerErrorException(String message, Throwable cause) {
    super(message, cause);
  }

  public InternalServerErrorException(Throwable cause) {
    super(cause);
  }
}
