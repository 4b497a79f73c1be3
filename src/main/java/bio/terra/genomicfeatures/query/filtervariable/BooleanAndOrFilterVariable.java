package bio.terra.genomicfeatures.query.filtervariable;

import bio.terra.genomicfeatures.query.FilterVariable;
import bio.terra.genomicfeatures.query.SqlExpression;
import bio.terra.genomicfeatures.query.SqlRenderContext;
import java.util.List;
import java.util.stream.Collectors;

public record BooleanAndOrFilterVariable(LogicalOperator operator, List<FilterVariable> subFilters)
    implements FilterVariable {

  public BooleanAndOrFilterVariable {
    subFilters = List.copyOf(subFilters);
  }

  @Override
  public String renderSQL(SqlRenderContext context) {
    return subFilters.stream()
        .map(sf -> sf.renderSQL(context))
        .collect(Collectors.joining(" " + operator.renderSQL(context) + " ", "(", ")"));
  }

  public enum LogicalOperator implements SqlExpression {
    AND,
    OR;

    @Override
    public String renderSQL(SqlRenderContext context) {
      return name();
    }
  }
}
