package bio.terra.genomicfeatures.lowering.exception;

import bio.terra.genomicfeatures.common.exception.BadRequestException;
import java.util.List;

/**
 * Thrown when a filter is lowered against a table that lacks one of the columns it targets, or
 * whose column type cannot hold the filter's values. The filter itself stays valid and can be
 * lowered against another table.
 */
public class SchemaMismatchException extends BadRequestException {
  public SchemaMismatchException(String message) {
    super(message);
  }

  public SchemaMismatchException(String message, List<String> errorDetails) {
    super(message, errorDetails);
  }
}
