package bio.terra.genomicfeatures.query;

import java.util.List;
import java.util.stream.IntStream;

/** The schema of the columns in {@link RowResult}s, in SELECT order. */
public record ColumnHeaderSchema(List<ColumnSchema> columnSchemas) {
  public ColumnHeaderSchema {
    columnSchemas = List.copyOf(columnSchemas);
  }

  public int getIndex(String columnName) {
    return IntStream.range(0, columnSchemas.size())
        .filter(i -> columnSchemas.get(i).columnName().equals(columnName))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Column name '%s' not a part of the column schema.".formatted(columnName)));
  }

  public List<String> getColumnNames() {
    return columnSchemas.stream().map(ColumnSchema::columnName).toList();
  }
}
