package bio.terra.genomicfeatures.query;

/** A typed constant in a SQL statement. */
public record Literal(
    DataType dataType, String stringVal, long int64Val, boolean booleanVal, double doubleVal)
    implements SqlExpression {

  /** Enum for the literal data types supported in filters. */
  public enum DataType {
    INT64,
    STRING,
    BOOLEAN,
    DOUBLE
  }

  public Literal(String stringVal) {
    this(DataType.STRING, stringVal, 0, false, 0.0);
  }

  public Literal(long int64Val) {
    this(DataType.INT64, null, int64Val, false, 0.0);
  }

  public Literal(boolean booleanVal) {
    this(DataType.BOOLEAN, null, 0, booleanVal, 0.0);
  }

  public Literal(double doubleVal) {
    this(DataType.DOUBLE, null, 0, false, doubleVal);
  }

  private static String sqlEscape(String s) {
    return s.replace("'", "''");
  }

  @Override
  public String renderSQL(SqlRenderContext context) {
    return switch (dataType) {
      case STRING -> stringVal == null ? "NULL" : "'" + sqlEscape(stringVal) + "'";
      case INT64 -> String.valueOf(int64Val);
      case BOOLEAN -> booleanVal ? "TRUE" : "FALSE";
      case DOUBLE -> String.valueOf(doubleVal);
    };
  }

  @Override
  public String toString() {
    return switch (dataType) {
      case STRING -> stringVal;
      case INT64 -> String.valueOf(int64Val);
      case BOOLEAN -> String.valueOf(booleanVal);
      case DOUBLE -> String.valueOf(doubleVal);
    };
  }
}
