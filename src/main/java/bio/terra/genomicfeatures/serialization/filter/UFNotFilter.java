package bio.terra.genomicfeatures.serialization.filter;

import bio.terra.genomicfeatures.filter.NotFilter;
import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import bio.terra.genomicfeatures.serialization.FilterSerializer;
import bio.terra.genomicfeatures.serialization.UFFilterExpression;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * External representation of the negation of a filter.
 *
 * <p>This is a POJO class intended for serialization. This JSON format is user-facing.
 */
@JsonDeserialize(builder = UFNotFilter.Builder.class)
public class UFNotFilter extends UFFilterExpression {
  private final UFFilterExpression operand;

  public UFNotFilter(NotFilter notFilter) {
    super(Type.NOT);
    this.operand = FilterSerializer.serialize(notFilter.operand());
  }

  private UFNotFilter(Builder builder) {
    super(builder);
    this.operand = builder.operand;
  }

  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static class Builder extends UFFilterExpression.Builder {
    private UFFilterExpression operand;

    public Builder operand(UFFilterExpression operand) {
      this.operand = operand;
      return this;
    }

    /** Call the private constructor. */
    @Override
    public UFNotFilter build() {
      return new UFNotFilter(this);
    }
  }

  @Override
  public NotFilter deserializeToInternal() {
    if (operand == null) {
      throw new InvalidFilterException("NOT filter needs an operand");
    }
    return new NotFilter(operand.deserializeToInternal());
  }

  public UFFilterExpression getOperand() {
    return operand;
  }
}
