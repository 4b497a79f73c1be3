package bio.terra.genomicfeatures.query.jdbc;

import bio.terra.genomicfeatures.query.BackendKind;
import bio.terra.genomicfeatures.query.QueryExecutor;
import bio.terra.genomicfeatures.query.QueryRequest;
import bio.terra.genomicfeatures.query.QueryResult;
import bio.terra.genomicfeatures.query.RowResult;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/** A {@link QueryExecutor} for any backend reachable through a JDBC driver. */
public class JdbcQueryExecutor implements QueryExecutor {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  private final JdbcTemplate jdbcTemplate;
  private final BackendKind backendKind;

  public JdbcQueryExecutor(JdbcTemplate jdbcTemplate, BackendKind backendKind) {
    this.jdbcTemplate = jdbcTemplate;
    this.backendKind = backendKind;
  }

  @Override
  public QueryResult execute(QueryRequest queryRequest) {
    String sql = renderSQL(queryRequest.query());
    LOGGER.debug("Running SQL against {}", backendKind);
    List<RowResult> rows =
        jdbcTemplate.query(
            sql, (rs, rowNum) -> new JdbcRowResult(rs, queryRequest.columnHeaderSchema()));
    LOGGER.debug("Query returned {} rows", rows.size());
    return new QueryResult(rows, queryRequest.columnHeaderSchema());
  }

  @Override
  public BackendKind getBackendKind() {
    return backendKind;
  }
}
