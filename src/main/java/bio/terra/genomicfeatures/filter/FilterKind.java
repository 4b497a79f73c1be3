package bio.terra.genomicfeatures.filter;

import java.util.List;

/** The closed set of attributes a primitive filter can select on, with the columns each binds. */
public enum FilterKind {
  GENE_ID("gene_id"),
  GENE_BIOTYPE("gene_biotype"),
  GENE_NAME("gene_name"),
  TX_ID("tx_id"),
  TX_BIOTYPE("tx_biotype"),
  SEQ_NAME("seq_name"),
  UNIPROT_ID("uniprot_id"),
  UNIPROT_DB("uniprot_db"),
  UNIPROT_MAPPING_TYPE("uniprot_mapping_type"),
  EXON_ID("exon_id"),
  CANONICAL_TX("tx_is_canonical"),
  GENE_RANGE("seq_name", "gene_seq_start", "gene_seq_end");

  private final List<String> columns;

  FilterKind(String... columns) {
    this.columns = List.of(columns);
  }

  public List<String> getColumns() {
    return columns;
  }

  /** True for the kinds that test membership of one column in a value set. */
  public boolean isMembership() {
    return this != CANONICAL_TX && this != GENE_RANGE;
  }
}
