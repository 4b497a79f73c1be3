package bio.terra.genomicfeatures.query;

import java.util.List;
import java.util.Optional;

/** The columns of a table, in table order. */
public record TableSchema(String tableName, List<ColumnSchema> columns) {

  public TableSchema {
    columns = List.copyOf(columns);
  }

  public Optional<ColumnSchema> getColumn(String columnName) {
    return columns.stream().filter(column -> column.columnName().equals(columnName)).findFirst();
  }

  public boolean hasColumn(String columnName) {
    return getColumn(columnName).isPresent();
  }

  public List<String> getColumnNames() {
    return columns.stream().map(ColumnSchema::columnName).toList();
  }
}
