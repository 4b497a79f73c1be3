package bio.terra.genomicfeatures.annotation;

import bio.terra.genomicfeatures.filter.FilterExpression;
import bio.terra.genomicfeatures.query.BackendKind;
import bio.terra.genomicfeatures.query.QueryExecutor;
import bio.terra.genomicfeatures.query.QueryRequest;
import bio.terra.genomicfeatures.query.QueryResult;
import bio.terra.genomicfeatures.query.TableSchema;
import bio.terra.genomicfeatures.query.jdbc.JdbcQueryExecutor;
import bio.terra.genomicfeatures.query.jdbc.JdbcSchemaReader;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * An open annotation database. Rows of genes, transcripts or exons are selected with an optional
 * filter; columns of related tables are joined in as needed.
 *
 * <p>The handle holds one connection until it is closed.
 */
public class AnnotationDb implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationDb.class);

  private final SingleConnectionDataSource dataSource;
  private final BackendKind backend;
  private final QueryExecutor queryExecutor;
  private final AnnotationQueryBuilder queryBuilder;
  private final Map<String, TableSchema> schemas;

  /** Takes ownership of {@code dataSource}, which is destroyed if the schema cannot be read. */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "The handle takes ownership of the data source and closes it")
  public AnnotationDb(SingleConnectionDataSource dataSource, BackendKind backend) {
    this.dataSource = dataSource;
    this.backend = backend;
    this.queryExecutor = new JdbcQueryExecutor(new JdbcTemplate(dataSource), backend);
    try {
      this.schemas = Map.copyOf(JdbcSchemaReader.readSchemas(dataSource));
    } catch (RuntimeException e) {
      dataSource.destroy();
      throw e;
    }
    this.queryBuilder = new AnnotationQueryBuilder(schemas);
  }

  /** Open the database file with the given backend. */
  public static AnnotationDb open(Path databaseFile, BackendKind backend) {
    LOGGER.info("Opening {} annotation database {}", backend, databaseFile);
    return new AnnotationDb(
        new SingleConnectionDataSource(backend.jdbcUrl(databaseFile), true), backend);
  }

  public BackendKind getBackend() {
    return backend;
  }

  /** Table schemas keyed by table name. */
  public Map<String, TableSchema> getSchemas() {
    return schemas;
  }

  public QueryResult genes() {
    return genes(List.of(), null);
  }

  public QueryResult genes(FilterExpression filter) {
    return genes(List.of(), filter);
  }

  public QueryResult genes(List<String> columns, FilterExpression filter) {
    return query(AnnotationTable.GENES, columns, filter);
  }

  public QueryResult transcripts() {
    return transcripts(List.of(), null);
  }

  public QueryResult transcripts(FilterExpression filter) {
    return transcripts(List.of(), filter);
  }

  public QueryResult transcripts(List<String> columns, FilterExpression filter) {
    return query(AnnotationTable.TRANSCRIPTS, columns, filter);
  }

  public QueryResult exons() {
    return exons(List.of(), null);
  }

  public QueryResult exons(FilterExpression filter) {
    return exons(List.of(), filter);
  }

  public QueryResult exons(List<String> columns, FilterExpression filter) {
    return query(AnnotationTable.EXONS, columns, filter);
  }

  /**
   * Select rows of an annotation table.
   *
   * @param columns the columns to return, or empty for every column of the table
   * @param filter the filter rows must satisfy, or null for every row
   */
  public QueryResult query(AnnotationTable table, List<String> columns, FilterExpression filter) {
    QueryRequest request = queryBuilder.build(table, columns, filter, backend);
    return queryExecutor.execute(request);
  }

  @Override
  public void close() {
    LOGGER.debug("Closing {} annotation database", backend);
    dataSource.destroy();
  }
}
