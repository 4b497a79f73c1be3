package bio.terra.genomicfeatures.filter;

/**
 * Constructors for every primitive filter. Value filters take one value, several values, or a
 * single {@link java.util.Collection} of values; strings and integers may be mixed.
 *
 * <pre>{@code
 * FilterExpression filter =
 *     Filters.geneBioType("protein_coding")
 *         .and(Filters.seqName(1, "2"))
 *         .and(Filters.canonicalTx().negate());
 * }</pre>
 */
public final class Filters {

  private Filters() {}

  public static FieldFilter geneId(Object... values) {
    return new FieldFilter(FilterKind.GENE_ID, values);
  }

  public static FieldFilter geneBioType(Object... values) {
    return new FieldFilter(FilterKind.GENE_BIOTYPE, values);
  }

  public static FieldFilter geneName(Object... values) {
    return new FieldFilter(FilterKind.GENE_NAME, values);
  }

  public static FieldFilter txId(Object... values) {
    return new FieldFilter(FilterKind.TX_ID, values);
  }

  public static FieldFilter txBioType(Object... values) {
    return new FieldFilter(FilterKind.TX_BIOTYPE, values);
  }

  public static FieldFilter seqName(Object... values) {
    return new FieldFilter(FilterKind.SEQ_NAME, values);
  }

  public static FieldFilter uniProtId(Object... values) {
    return new FieldFilter(FilterKind.UNIPROT_ID, values);
  }

  public static FieldFilter uniProtDb(Object... values) {
    return new FieldFilter(FilterKind.UNIPROT_DB, values);
  }

  public static FieldFilter uniProtMappingType(Object... values) {
    return new FieldFilter(FilterKind.UNIPROT_MAPPING_TYPE, values);
  }

  public static FieldFilter exonId(Object... values) {
    return new FieldFilter(FilterKind.EXON_ID, values);
  }

  public static CanonicalTxFilter canonicalTx() {
    return new CanonicalTxFilter();
  }

  public static GeneRangesFilter geneRanges(String range) {
    return new GeneRangesFilter(range);
  }

  /**
   * @param type {@code "any"} or {@code "within"}
   */
  public static GeneRangesFilter geneRanges(String range, String type) {
    return new GeneRangesFilter(range, type);
  }
}
