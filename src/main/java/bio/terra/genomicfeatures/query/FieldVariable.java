package bio.terra.genomicfeatures.query;

/** A column of a table in the FROM clause, rendered as {@code alias.column}. */
public record FieldVariable(FieldPointer fieldPointer, TableVariable tableVariable)
    implements SqlExpression {

  @Override
  public String renderSQL(SqlRenderContext context) {
    return "%s.%s".formatted(context.getAlias(tableVariable), fieldPointer.columnName());
  }
}
