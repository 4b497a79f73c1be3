package bio.terra.genomicfeatures.query.jdbc;

import bio.terra.genomicfeatures.query.CellValue;
import bio.terra.genomicfeatures.query.ColumnSchema;
import bio.terra.genomicfeatures.query.Literal;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/** A {@link CellValue} for a value read from a JDBC {@link java.sql.ResultSet}. */
public class JdbcCellValue implements CellValue {
  private final Optional<Object> fieldValue;
  private final ColumnSchema columnSchema;

  JdbcCellValue(Optional<Object> fieldValue, ColumnSchema columnSchema) {
    this.fieldValue = fieldValue;
    this.columnSchema = columnSchema;
  }

  @Override
  public SQLDataType dataType() {
    return columnSchema.sqlDataType();
  }

  public String name() {
    return columnSchema.columnName();
  }

  @Override
  public OptionalLong getLong() {
    assertDataTypeIs(SQLDataType.INT64);
    return fieldValue
        .map(o -> OptionalLong.of(((Number) o).longValue()))
        .orElseGet(OptionalLong::empty);
  }

  @Override
  public Optional<String> getString() {
    assertDataTypeIs(SQLDataType.STRING);
    return fieldValue.map(Object::toString);
  }

  @Override
  public OptionalDouble getDouble() {
    assertDataTypeIs(SQLDataType.FLOAT);
    return fieldValue
        .map(o -> OptionalDouble.of(((Number) o).doubleValue()))
        .orElseGet(OptionalDouble::empty);
  }

  @Override
  public Optional<Boolean> getBoolean() {
    assertDataTypeIs(SQLDataType.BOOLEAN);
    // SQLite has no boolean storage class and hands back 0 or 1.
    return fieldValue.map(o -> o instanceof Number number ? number.longValue() != 0 : (Boolean) o);
  }

  @Override
  public Optional<Literal> getLiteral() {
    return fieldValue.map(
        value ->
            switch (dataType()) {
              case INT64 -> new Literal(((Number) value).longValue());
              case STRING, DATE -> new Literal(value.toString());
              case BOOLEAN -> new Literal(getBoolean().orElseThrow().booleanValue());
              case FLOAT -> new Literal(((Number) value).doubleValue());
            });
  }

  /**
   * Checks that the {@link #dataType()} is what's expected, or else throws an {@link
   * IllegalArgumentException}.
   */
  private void assertDataTypeIs(SQLDataType expected) {
    if (dataType() != expected) {
      throw new IllegalArgumentException(
          "SQLDataType is %s, not the expected %s".formatted(dataType(), expected));
    }
  }
}
