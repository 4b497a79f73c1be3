package bio.terra.genomicfeatures.annotation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import bio.terra.genomicfeatures.common.category.Unit;
import bio.terra.genomicfeatures.filter.FilterExpression;
import bio.terra.genomicfeatures.filter.Filters;
import bio.terra.genomicfeatures.lowering.exception.SchemaMismatchException;
import bio.terra.genomicfeatures.query.BackendKind;
import bio.terra.genomicfeatures.query.CellValue.SQLDataType;
import bio.terra.genomicfeatures.query.ColumnSchema;
import bio.terra.genomicfeatures.query.QueryRequest;
import bio.terra.genomicfeatures.query.SqlRenderContext;
import bio.terra.genomicfeatures.query.TableSchema;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(Unit.TAG)
class AnnotationQueryBuilderTest {
  private static final Map<String, TableSchema> SCHEMAS =
      Map.of(
          "gene",
          table(
              "gene",
              "gene_id",
              "gene_name",
              "gene_biotype",
              "seq_name",
              "canonical_transcript",
              "gene_seq_start:INT64",
              "gene_seq_end:INT64"),
          "tx",
          table("tx", "tx_id", "tx_biotype", "gene_id", "tx_is_canonical:INT64"),
          "tx2exon",
          table("tx2exon", "tx_id", "exon_id", "exon_idx:INT64"),
          "exon",
          table("exon", "exon_id", "exon_seq_start:INT64", "exon_seq_end:INT64"));

  private final AnnotationQueryBuilder builder = new AnnotationQueryBuilder(SCHEMAS);

  /** A table of text columns; {@code name:TYPE} gives a column another type. */
  private static TableSchema table(String tableName, String... columns) {
    return new TableSchema(
        tableName,
        Arrays.stream(columns)
            .map(
                column -> {
                  String[] parts = column.split(":");
                  SQLDataType dataType =
                      parts.length > 1 ? SQLDataType.valueOf(parts[1]) : SQLDataType.STRING;
                  return new ColumnSchema(parts[0], dataType);
                })
            .toList());
  }

  private String render(AnnotationTable table, List<String> columns, FilterExpression filter) {
    QueryRequest request = builder.build(table, columns, filter, BackendKind.SQLITE);
    return request.query().renderSQL(new SqlRenderContext(BackendKind.SQLITE));
  }

  @Test
  void baseTableOnly() {
    assertThat(
        render(AnnotationTable.GENES, List.of("gene_id", "gene_name"), null),
        is("SELECT g.gene_id, g.gene_name FROM gene AS g ORDER BY g.gene_id ASC"));
  }

  @Test
  void allBaseColumnsByDefault() {
    QueryRequest request =
        builder.build(AnnotationTable.EXONS, List.of(), null, BackendKind.DUCKDB);
    assertThat(
        request.columnHeaderSchema().getColumnNames(),
        contains("exon_id", "exon_seq_start", "exon_seq_end"));
  }

  @Test
  void filterColumnsAreJoinedAndSelected() {
    assertThat(
        render(AnnotationTable.GENES, List.of("gene_id"), Filters.txBioType("lncRNA")),
        is(
            "SELECT g.gene_id, t.tx_biotype FROM gene AS g JOIN tx AS t ON t.gene_id = g.gene_id "
                + "WHERE t.tx_biotype = 'lncRNA' ORDER BY g.gene_id ASC"));
  }

  @Test
  void filterColumnsFollowFilterKindOrder() {
    FilterExpression biotype = Filters.geneBioType("protein_coding");
    FilterExpression sequence = Filters.seqName("X");
    FilterExpression canonical = Filters.canonicalTx();
    List<String> expected = List.of("gene_id", "gene_biotype", "seq_name", "tx_is_canonical");
    for (FilterExpression filter :
        List.of(
            biotype.and(sequence).or(canonical),
            canonical.or(sequence.and(biotype)),
            sequence.negate().and(canonical.and(biotype)))) {
      QueryRequest request =
          builder.build(AnnotationTable.GENES, List.of("gene_id"), filter, BackendKind.SQLITE);
      assertThat(request.columnHeaderSchema().getColumnNames(), is(expected));
    }
  }

  @Test
  void sharedColumnsBindToTheNearestTable() {
    // gene_id is read from tx, one join closer to exon than gene.
    assertThat(
        render(AnnotationTable.EXONS, List.of("exon_id"), Filters.geneId("ENSG00000000003")),
        is(
            "SELECT e.exon_id, t.gene_id FROM exon AS e "
                + "JOIN tx2exon AS t1 ON t1.exon_id = e.exon_id "
                + "JOIN tx AS t ON t.tx_id = t1.tx_id "
                + "WHERE t.gene_id = 'ENSG00000000003' ORDER BY e.exon_id ASC"));
  }

  @Test
  void canonicalTranscriptsOfGenes() {
    assertThat(
        render(
            AnnotationTable.GENES,
            List.of("tx_id", "canonical_transcript"),
            Filters.canonicalTx().negate()),
        is(
            "SELECT t.tx_id, g.canonical_transcript, t.tx_is_canonical FROM gene AS g "
                + "JOIN tx AS t ON t.gene_id = g.gene_id "
                + "WHERE (NOT t.tx_is_canonical = 1) ORDER BY g.gene_id ASC"));
  }

  @Test
  void integerFlagColumnsAreReadAsBooleans() {
    QueryRequest request =
        builder.build(
            AnnotationTable.TRANSCRIPTS,
            List.of("tx_id", "tx_is_canonical"),
            null,
            BackendKind.SQLITE);
    assertThat(
        request.columnHeaderSchema().columnSchemas(),
        contains(
            new ColumnSchema("tx_id", SQLDataType.STRING),
            new ColumnSchema("tx_is_canonical", SQLDataType.BOOLEAN)));
  }

  @Test
  void unknownColumnsAreReported() {
    List<String> columns = List.of("gene_id", "entrezid", "description");
    SchemaMismatchException exception =
        assertThrows(
            SchemaMismatchException.class,
            () -> builder.build(AnnotationTable.GENES, columns, null, BackendKind.SQLITE));
    assertThat(exception.getErrorDetails(), contains("entrezid", "description"));
  }

  @Test
  void filterOnAnAbsentTableIsReported() {
    FilterExpression filter = Filters.uniProtDb("SWISSPROT");
    List<String> columns = List.of();
    SchemaMismatchException exception =
        assertThrows(
            SchemaMismatchException.class,
            () -> builder.build(AnnotationTable.TRANSCRIPTS, columns, filter, BackendKind.SQLITE));
    assertThat(exception.getErrorDetails(), contains("uniprot_db"));
  }
}
