package bio.terra.genomicfeatures.serialization.filter;

import bio.terra.genomicfeatures.filter.GeneRangesFilter;
import bio.terra.genomicfeatures.serialization.UFFilterExpression;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * External representation of a gene range filter: a range string (e.g. "1:77000000-78000000")
 * and an overlap type ("any" or "within"). A missing overlap type means "any".
 *
 * <p>This is a POJO class intended for serialization. This JSON format is user-facing.
 */
@JsonDeserialize(builder = UFGeneRangesFilter.Builder.class)
public class UFGeneRangesFilter extends UFFilterExpression {
  private final String range;
  private final String overlap;

  public UFGeneRangesFilter(GeneRangesFilter geneRangesFilter) {
    super(Type.GENE_RANGE);
    this.range = geneRangesFilter.range().toString();
    this.overlap = geneRangesFilter.type().getValue();
  }

  private UFGeneRangesFilter(Builder builder) {
    super(builder);
    this.range = builder.range;
    this.overlap = builder.overlap;
  }

  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static class Builder extends UFFilterExpression.Builder {
    private String range;
    private String overlap;

    public Builder range(String range) {
      this.range = range;
      return this;
    }

    public Builder overlap(String overlap) {
      this.overlap = overlap;
      return this;
    }

    /** Call the private constructor. */
    @Override
    public UFGeneRangesFilter build() {
      return new UFGeneRangesFilter(this);
    }
  }

  @Override
  public GeneRangesFilter deserializeToInternal() {
    return overlap == null
        ? new GeneRangesFilter(range)
        : new GeneRangesFilter(range, overlap);
  }

  public String getRange() {
    return range;
  }

  public String getOverlap() {
    return overlap;
  }
}
