package bio.terra.genomicfeatures.query.filtervariable;

import bio.terra.genomicfeatures.query.FilterVariable;
import bio.terra.genomicfeatures.query.SqlRenderContext;

/** A predicate no row satisfies. */
public record FalseFilterVariable() implements FilterVariable {

  @Override
  public String renderSQL(SqlRenderContext context) {
    // T-SQL and older SQLite releases have no FALSE keyword.
    return "1 = 0";
  }
}
