package bio.terra.genomicfeatures.serialization.filter;

import bio.terra.genomicfeatures.filter.CanonicalTxFilter;
import bio.terra.genomicfeatures.serialization.UFFilterExpression;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * External representation of the canonical transcript filter. It has no fields other than its
 * type.
 *
 * <p>This is a POJO class intended for serialization. This JSON format is user-facing.
 */
@JsonDeserialize(builder = UFCanonicalTxFilter.Builder.class)
public class UFCanonicalTxFilter extends UFFilterExpression {

  public UFCanonicalTxFilter() {
    super(Type.CANONICAL_TX);
  }

  private UFCanonicalTxFilter(Builder builder) {
    super(builder);
  }

  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static class Builder extends UFFilterExpression.Builder {
    /** Call the private constructor. */
    @Override
    public UFCanonicalTxFilter build() {
      return new UFCanonicalTxFilter(this);
    }
  }

  @Override
  public CanonicalTxFilter deserializeToInternal() {
    return new CanonicalTxFilter();
  }
}
