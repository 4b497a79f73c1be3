package bio.terra.genomicfeatures.query.jdbc;

import bio.terra.genomicfeatures.query.CellValue;
import bio.terra.genomicfeatures.query.ColumnHeaderSchema;
import bio.terra.genomicfeatures.query.RowResult;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** A {@link RowResult} read from the current row of a JDBC {@link ResultSet}. */
public class JdbcRowResult implements RowResult {
  private final List<JdbcCellValue> cells = new ArrayList<>();
  private final ColumnHeaderSchema columnHeaderSchema;

  JdbcRowResult(ResultSet rs, ColumnHeaderSchema columnHeaderSchema) throws SQLException {
    this.columnHeaderSchema = columnHeaderSchema;
    for (int i = 0; i < columnHeaderSchema.columnSchemas().size(); i++) {
      cells.add(
          new JdbcCellValue(
              Optional.ofNullable(rs.getObject(i + 1)),
              columnHeaderSchema.columnSchemas().get(i)));
    }
  }

  @Override
  public CellValue get(int index) {
    return cells.get(index);
  }

  @Override
  public CellValue get(String columnName) {
    return cells.get(columnHeaderSchema.getIndex(columnName));
  }

  @Override
  public int size() {
    return cells.size();
  }
}
