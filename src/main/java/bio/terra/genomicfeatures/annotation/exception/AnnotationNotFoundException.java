package bio.terra.genomicfeatures.annotation.exception;

import bio.terra.genomicfeatures.common.exception.NotFoundException;
import java.util.List;

public class AnnotationNotFoundException extends NotFoundException {
  public AnnotationNotFoundException(String message) {
    super(message);
  }

  public AnnotationNotFoundException(String message, List<String> errorDetails) {
    super(message, errorDetails);
  }
}
