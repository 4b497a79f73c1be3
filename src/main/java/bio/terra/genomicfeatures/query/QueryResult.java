package bio.terra.genomicfeatures.query;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/** The rows returned by a query, and the schema of their columns. */
public record QueryResult(List<RowResult> rowResults, ColumnHeaderSchema columnHeaderSchema) {

  public QueryResult {
    rowResults = List.copyOf(rowResults);
  }

  public int size() {
    return rowResults.size();
  }

  /** The values of one column across all rows, in row order. Null cells are skipped. */
  public List<Literal> getColumn(String columnName) {
    int index = columnHeaderSchema.getIndex(columnName);
    return rowResults.stream()
        .map(row -> row.get(index).getLiteral())
        .flatMap(Optional::stream)
        .toList();
  }

  /** The distinct string forms of the values of one column. Null cells are skipped. */
  public Set<String> getColumnValues(String columnName) {
    return getColumn(columnName).stream().map(Literal::toString).collect(Collectors.toSet());
  }
}
