package bio.terra.genomicfeatures.serialization.filter;

import bio.terra.genomicfeatures.filter.FieldFilter;
import bio.terra.genomicfeatures.filter.FilterKind;
import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import bio.terra.genomicfeatures.serialization.UFFilterExpression;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import java.util.List;

/**
 * External representation of a value filter: a filter kind and the values its column may hold
 * (e.g. gene_biotype in ["protein_coding", "lncRNA"]). Values are written in their canonical
 * string form.
 *
 * <p>This is a POJO class intended for serialization. This JSON format is user-facing.
 */
@JsonDeserialize(builder = UFFieldFilter.Builder.class)
public class UFFieldFilter extends UFFilterExpression {
  private final FilterKind kind;
  private final List<String> values;

  public UFFieldFilter(FieldFilter fieldFilter) {
    super(Type.FIELD);
    this.kind = fieldFilter.kind();
    this.values = List.copyOf(fieldFilter.values().canonicalValues());
  }

  private UFFieldFilter(Builder builder) {
    super(builder);
    this.kind = builder.kind;
    this.values = builder.values;
  }

  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static class Builder extends UFFilterExpression.Builder {
    private FilterKind kind;
    private List<String> values;

    public Builder kind(FilterKind kind) {
      this.kind = kind;
      return this;
    }

    public Builder values(List<String> values) {
      this.values = values;
      return this;
    }

    /** Call the private constructor. */
    @Override
    public UFFieldFilter build() {
      return new UFFieldFilter(this);
    }
  }

  @Override
  public FieldFilter deserializeToInternal() {
    if (kind == null) {
      throw new InvalidFilterException("A value filter needs a kind");
    }
    return new FieldFilter(kind, values);
  }

  public FilterKind getKind() {
    return kind;
  }

  public List<String> getValues() {
    return values;
  }
}
