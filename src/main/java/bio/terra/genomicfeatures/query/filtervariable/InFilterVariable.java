package bio.terra.genomicfeatures.query.filtervariable;

import bio.terra.genomicfeatures.query.FieldVariable;
import bio.terra.genomicfeatures.query.FilterVariable;
import bio.terra.genomicfeatures.query.Literal;
import bio.terra.genomicfeatures.query.SqlRenderContext;
import com.google.common.base.Preconditions;
import java.util.List;
import java.util.stream.Collectors;
import org.stringtemplate.v4.ST;

/** Membership of a column in a list of literals: {@code column IN (v1, v2, ...)}. */
public record InFilterVariable(FieldVariable fieldVariable, List<Literal> values)
    implements FilterVariable {
  private static final String SUBSTITUTION_TEMPLATE = "<fieldVariable> IN (<values>)";

  public InFilterVariable {
    Preconditions.checkArgument(!values.isEmpty(), "IN needs at least one value");
    values = List.copyOf(values);
  }

  @Override
  public String renderSQL(SqlRenderContext context) {
    return new ST(SUBSTITUTION_TEMPLATE)
        .add("fieldVariable", fieldVariable.renderSQL(context))
        .add(
            "values",
            values.stream()
                .map(literal -> literal.renderSQL(context))
                .collect(Collectors.joining(", ")))
        .render();
  }
}
