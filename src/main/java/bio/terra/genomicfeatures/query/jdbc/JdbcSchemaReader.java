package bio.terra.genomicfeatures.query.jdbc;

import bio.terra.genomicfeatures.common.exception.InternalServerErrorException;
import bio.terra.genomicfeatures.query.CellValue.SQLDataType;
import bio.terra.genomicfeatures.query.ColumnSchema;
import bio.terra.genomicfeatures.query.TableSchema;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;

/** Reads the schema of every table in a database from its JDBC metadata. */
public final class JdbcSchemaReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcSchemaReader.class);

  private JdbcSchemaReader() {}

  /** Table schemas keyed by table name, in the order the driver lists the tables. */
  public static Map<String, TableSchema> readSchemas(DataSource dataSource) {
    try {
      return JdbcUtils.extractDatabaseMetaData(dataSource, JdbcSchemaReader::readTableSchemas);
    } catch (MetaDataAccessException e) {
      throw new InternalServerErrorException("Could not read the database schema", e);
    }
  }

  private static Map<String, TableSchema> readTableSchemas(DatabaseMetaData metaData)
      throws SQLException {
    List<String> tableNames = new ArrayList<>();
    try (ResultSet tables = metaData.getTables(null, null, "%", null)) {
      while (tables.next()) {
        tableNames.add(tables.getString("TABLE_NAME"));
      }
    }

    Map<String, TableSchema> schemas = new LinkedHashMap<>();
    for (String tableName : tableNames) {
      List<ColumnSchema> columns = new ArrayList<>();
      try (ResultSet rs = metaData.getColumns(null, null, tableName, "%")) {
        while (rs.next()) {
          columns.add(
              new ColumnSchema(
                  rs.getString("COLUMN_NAME"),
                  toSqlDataType(rs.getString("TYPE_NAME"), rs.getInt("DATA_TYPE"))));
        }
      }
      LOGGER.debug("Read schema for table {}: {}", tableName, columns);
      schemas.put(tableName, new TableSchema(tableName, columns));
    }
    return schemas;
  }

  /**
   * Map a column type to a {@link SQLDataType}. The declared type name is checked first,
   * since SQLite reports the declared type verbatim while its JDBC type code is only a guess.
   */
  static SQLDataType toSqlDataType(String typeName, int jdbcType) {
    String name = typeName == null ? "" : typeName.toUpperCase(Locale.ROOT);
    if (name.contains("BOOL")) {
      return SQLDataType.BOOLEAN;
    }
    if (name.contains("INT")) {
      return SQLDataType.INT64;
    }
    if (name.contains("CHAR") || name.contains("TEXT") || name.contains("CLOB")) {
      return SQLDataType.STRING;
    }
    if (name.contains("REAL")
        || name.contains("FLOA")
        || name.contains("DOUB")
        || name.contains("DECIMAL")
        || name.contains("NUMERIC")) {
      return SQLDataType.FLOAT;
    }
    if (name.startsWith("DATE") || name.startsWith("TIMESTAMP")) {
      return SQLDataType.DATE;
    }
    return switch (jdbcType) {
      case Types.BOOLEAN, Types.BIT -> SQLDataType.BOOLEAN;
      case Types.INTEGER, Types.TINYINT, Types.SMALLINT, Types.BIGINT -> SQLDataType.INT64;
      case Types.NUMERIC, Types.DECIMAL, Types.FLOAT, Types.DOUBLE, Types.REAL -> SQLDataType.FLOAT;
      case Types.DATE, Types.TIMESTAMP -> SQLDataType.DATE;
      default -> {
        LOGGER.warn("Unrecognized column type {} ({}), reading it as text", typeName, jdbcType);
        yield SQLDataType.STRING;
      }
    };
  }
}
