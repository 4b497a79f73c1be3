package bio.terra.genomicfeatures.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs rendered queries against one database. */
public interface QueryExecutor {
  Logger LOGGER = LoggerFactory.getLogger(QueryExecutor.class);

  /** Execute a query request, returning the results of the query. */
  QueryResult execute(QueryRequest queryRequest);

  BackendKind getBackendKind();

  default String renderSQL(SqlExpression expression) {
    String sql = expression.renderSQL(new SqlRenderContext(getBackendKind()));
    LOGGER.info("Generated SQL: {}", sql);
    return sql;
  }
}
