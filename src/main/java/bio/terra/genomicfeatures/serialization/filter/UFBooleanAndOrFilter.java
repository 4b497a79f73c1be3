package bio.terra.genomicfeatures.serialization.filter;

import bio.terra.genomicfeatures.filter.AndFilter;
import bio.terra.genomicfeatures.filter.FilterExpression;
import bio.terra.genomicfeatures.filter.OrFilter;
import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import bio.terra.genomicfeatures.serialization.FilterSerializer;
import bio.terra.genomicfeatures.serialization.UFFilterExpression;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * External representation of the conjunction or disjunction of two filters. The type property is
 * either AND or OR.
 *
 * <p>This is a POJO class intended for serialization. This JSON format is user-facing.
 */
@JsonDeserialize(builder = UFBooleanAndOrFilter.Builder.class)
public class UFBooleanAndOrFilter extends UFFilterExpression {
  private final UFFilterExpression left;
  private final UFFilterExpression right;

  public UFBooleanAndOrFilter(AndFilter andFilter) {
    super(Type.AND);
    this.left = FilterSerializer.serialize(andFilter.left());
    this.right = FilterSerializer.serialize(andFilter.right());
  }

  public UFBooleanAndOrFilter(OrFilter orFilter) {
    super(Type.OR);
    this.left = FilterSerializer.serialize(orFilter.left());
    this.right = FilterSerializer.serialize(orFilter.right());
  }

  private UFBooleanAndOrFilter(Builder builder) {
    super(builder);
    this.left = builder.left;
    this.right = builder.right;
  }

  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static class Builder extends UFFilterExpression.Builder {
    private UFFilterExpression left;
    private UFFilterExpression right;

    public Builder left(UFFilterExpression left) {
      this.left = left;
      return this;
    }

    public Builder right(UFFilterExpression right) {
      this.right = right;
      return this;
    }

    /** Call the private constructor. */
    @Override
    public UFBooleanAndOrFilter build() {
      return new UFBooleanAndOrFilter(this);
    }
  }

  @Override
  public FilterExpression deserializeToInternal() {
    if (left == null || right == null) {
      throw new InvalidFilterException(getType() + " filter needs a left and a right operand");
    }
    FilterExpression internalLeft = left.deserializeToInternal();
    FilterExpression internalRight = right.deserializeToInternal();
    return getType() == Type.OR
        ? new OrFilter(internalLeft, internalRight)
        : new AndFilter(internalLeft, internalRight);
  }

  public UFFilterExpression getLeft() {
    return left;
  }

  public UFFilterExpression getRight() {
    return right;
  }
}
