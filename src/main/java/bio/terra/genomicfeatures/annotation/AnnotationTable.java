package bio.terra.genomicfeatures.annotation;

/** The annotation tables rows can be selected from, with the table each is based on. */
public enum AnnotationTable {
  GENES("gene", "gene_id"),
  TRANSCRIPTS("tx", "tx_id"),
  EXONS("exon", "exon_id");

  private final String tableName;
  private final String idColumn;

  AnnotationTable(String tableName, String idColumn) {
    this.tableName = tableName;
    this.idColumn = idColumn;
  }

  public String getTableName() {
    return tableName;
  }

  /** The column rows are ordered by. */
  public String getIdColumn() {
    return idColumn;
  }
}
