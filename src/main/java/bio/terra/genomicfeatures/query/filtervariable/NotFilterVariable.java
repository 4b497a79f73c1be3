package bio.terra.genomicfeatures.query.filtervariable;

import bio.terra.genomicfeatures.query.FilterVariable;
import bio.terra.genomicfeatures.query.SqlRenderContext;

public record NotFilterVariable(FilterVariable subFilter) implements FilterVariable {

  @Override
  public String renderSQL(SqlRenderContext context) {
    return "(NOT " + subFilter.renderSQL(context) + ")";
  }
}
