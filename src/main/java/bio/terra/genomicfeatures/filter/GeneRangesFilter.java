package bio.terra.genomicfeatures.filter;

import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;

/**
 * Selects genes located on a genomic range. With {@link OverlapType#ANY} a gene is selected when
 * it intersects the range; with {@link OverlapType#WITHIN} it must lie entirely inside it. In both
 * cases the sequence name must match.
 */
public record GeneRangesFilter(GenomicRange range, OverlapType type) implements PrimitiveFilter {

  public GeneRangesFilter {
    if (range == null) {
      throw new InvalidFilterException("A range filter needs a genomic range");
    }
    if (type == null) {
      throw new InvalidFilterException("A range filter needs an overlap type");
    }
  }

  public GeneRangesFilter(String range) {
    this(GenomicRange.parse(range), OverlapType.ANY);
  }

  public GeneRangesFilter(String range, String type) {
    this(GenomicRange.parse(range), OverlapType.fromValue(type));
  }

  @Override
  public FilterKind kind() {
    return FilterKind.GENE_RANGE;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitGeneRanges(this);
  }

  @Override
  public String toString() {
    return "%s(%s, %s)".formatted(kind(), range, type);
  }
}
