package bio.terra.genomicfeatures.filter;

import java.util.List;
import java.util.Objects;

public record AndFilter(FilterExpression left, FilterExpression right)
    implements FilterExpression {

  public AndFilter {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public List<String> columns() {
    return FilterExpression.unionColumns(left, right);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitAnd(this);
  }

  @Override
  public String toString() {
    return "(" + left + " AND " + right + ")";
  }
}
