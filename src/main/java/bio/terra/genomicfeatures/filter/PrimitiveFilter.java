package bio.terra.genomicfeatures.filter;

import java.util.List;

/** A single-attribute filter, the leaf of an expression tree. */
public interface PrimitiveFilter extends FilterExpression {

  FilterKind kind();

  @Override
  default List<String> columns() {
    return kind().getColumns();
  }
}
