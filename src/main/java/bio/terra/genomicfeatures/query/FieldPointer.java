package bio.terra.genomicfeatures.query;

public record FieldPointer(TablePointer tablePointer, String columnName) {
  private static final String ALL_FIELDS_COLUMN_NAME = "*";

  public static FieldPointer allFields(TablePointer tablePointer) {
    return new FieldPointer(tablePointer, ALL_FIELDS_COLUMN_NAME);
  }
}
