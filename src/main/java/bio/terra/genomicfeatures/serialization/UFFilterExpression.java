package bio.terra.genomicfeatures.serialization;

import bio.terra.genomicfeatures.filter.FilterExpression;
import bio.terra.genomicfeatures.serialization.filter.UFBooleanAndOrFilter;
import bio.terra.genomicfeatures.serialization.filter.UFCanonicalTxFilter;
import bio.terra.genomicfeatures.serialization.filter.UFFieldFilter;
import bio.terra.genomicfeatures.serialization.filter.UFGeneRangesFilter;
import bio.terra.genomicfeatures.serialization.filter.UFNotFilter;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * External representation of a filter expression.
 *
 * <p>This is a POJO class intended for serialization. This JSON format is user-facing.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "type",
    visible = true)
@JsonSubTypes({
  @JsonSubTypes.Type(value = UFFieldFilter.class, name = "FIELD"),
  @JsonSubTypes.Type(value = UFCanonicalTxFilter.class, name = "CANONICAL_TX"),
  @JsonSubTypes.Type(value = UFGeneRangesFilter.class, name = "GENE_RANGE"),
  @JsonSubTypes.Type(
      value = UFBooleanAndOrFilter.class,
      names = {"AND", "OR"}),
  @JsonSubTypes.Type(value = UFNotFilter.class, name = "NOT")
})
@JsonDeserialize(builder = UFFilterExpression.Builder.class)
public abstract class UFFilterExpression {
  public enum Type {
    FIELD,
    CANONICAL_TX,
    GENE_RANGE,
    AND,
    OR,
    NOT
  }

  private final Type type;

  protected UFFilterExpression(Type type) {
    this.type = type;
  }

  protected UFFilterExpression(Builder builder) {
    this.type = builder.type;
  }

  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public abstract static class Builder {
    private Type type;

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    /** Call the private constructor. */
    public abstract UFFilterExpression build();
  }

  /** Deserialize to the internal representation of the filter expression. */
  public abstract FilterExpression deserializeToInternal();

  public Type getType() {
    return type;
  }
}
