package bio.terra.genomicfeatures.filter;

import java.util.List;
import java.util.Objects;

public record OrFilter(FilterExpression left, FilterExpression right)
    implements FilterExpression {

  public OrFilter {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public List<String> columns() {
    return FilterExpression.unionColumns(left, right);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitOr(this);
  }

  @Override
  public String toString() {
    return "(" + left + " OR " + right + ")";
  }
}
