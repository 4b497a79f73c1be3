package bio.terra.genomicfeatures.query;

/** The name and type of a table column, or of a column in a {@link RowResult}. */
public record ColumnSchema(String columnName, CellValue.SQLDataType sqlDataType) {}
