package bio.terra.genomicfeatures.filter;

/**
 * Selects canonical transcripts, the rows whose {@code tx_is_canonical} flag is set. Negate it to
 * select the non-canonical ones.
 */
public record CanonicalTxFilter() implements PrimitiveFilter {

  @Override
  public FilterKind kind() {
    return FilterKind.CANONICAL_TX;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitCanonicalTx(this);
  }

  @Override
  public String toString() {
    return kind().toString();
  }
}
