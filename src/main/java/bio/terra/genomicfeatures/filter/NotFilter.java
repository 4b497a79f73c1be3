package bio.terra.genomicfeatures.filter;

import java.util.List;
import java.util.Objects;

public record NotFilter(FilterExpression operand) implements FilterExpression {

  public NotFilter {
    Objects.requireNonNull(operand, "operand");
  }

  @Override
  public List<String> columns() {
    return operand.columns();
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitNot(this);
  }

  @Override
  public String toString() {
    return "(NOT " + operand + ")";
  }
}
