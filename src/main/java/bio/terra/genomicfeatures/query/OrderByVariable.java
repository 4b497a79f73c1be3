package bio.terra.genomicfeatures.query;

/** Sorts rows by a column, ascending. */
public record OrderByVariable(FieldVariable fieldVariable) implements SqlExpression {

  @Override
  public String renderSQL(SqlRenderContext context) {
    return fieldVariable.renderSQL(context) + " ASC";
  }
}
