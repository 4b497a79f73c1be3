package bio.terra.genomicfeatures.query;

public record TablePointer(String tableName) implements SqlExpression {

  public static TablePointer fromTableName(String tableName) {
    return new TablePointer(tableName);
  }

  @Override
  public String renderSQL(SqlRenderContext context) {
    return tableName;
  }
}
