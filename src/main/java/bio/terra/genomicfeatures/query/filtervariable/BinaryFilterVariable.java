package bio.terra.genomicfeatures.query.filtervariable;

import bio.terra.genomicfeatures.query.FieldVariable;
import bio.terra.genomicfeatures.query.FilterVariable;
import bio.terra.genomicfeatures.query.Literal;
import bio.terra.genomicfeatures.query.SqlExpression;
import bio.terra.genomicfeatures.query.SqlRenderContext;
import org.stringtemplate.v4.ST;

public record BinaryFilterVariable(
    FieldVariable fieldVariable, BinaryOperator operator, Literal value) implements FilterVariable {
  private static final String SUBSTITUTION_TEMPLATE = "<fieldVariable> <operator> <value>";

  @Override
  public String renderSQL(SqlRenderContext context) {
    return new ST(SUBSTITUTION_TEMPLATE)
        .add("operator", operator.renderSQL(context))
        .add("value", value.renderSQL(context))
        .add("fieldVariable", fieldVariable.renderSQL(context))
        .render();
  }

  public enum BinaryOperator implements SqlExpression {
    EQUALS("="),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN_OR_EQUAL(">=");

    private final String sql;

    BinaryOperator(String sql) {
      this.sql = sql;
    }

    @Override
    public String renderSQL(SqlRenderContext context) {
      return sql;
    }
  }
}
