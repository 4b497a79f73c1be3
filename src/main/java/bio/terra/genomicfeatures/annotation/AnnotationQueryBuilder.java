package bio.terra.genomicfeatures.annotation;

import bio.terra.genomicfeatures.filter.FilterExpression;
import bio.terra.genomicfeatures.filter.FilterKind;
import bio.terra.genomicfeatures.lowering.FilterLowering;
import bio.terra.genomicfeatures.lowering.SqlPredicateBuilder;
import bio.terra.genomicfeatures.lowering.exception.SchemaMismatchException;
import bio.terra.genomicfeatures.query.BackendKind;
import bio.terra.genomicfeatures.query.CellValue.SQLDataType;
import bio.terra.genomicfeatures.query.ColumnHeaderSchema;
import bio.terra.genomicfeatures.query.ColumnSchema;
import bio.terra.genomicfeatures.query.FieldVariable;
import bio.terra.genomicfeatures.query.FilterVariable;
import bio.terra.genomicfeatures.query.OrderByVariable;
import bio.terra.genomicfeatures.query.Query;
import bio.terra.genomicfeatures.query.QueryRequest;
import bio.terra.genomicfeatures.query.TablePointer;
import bio.terra.genomicfeatures.query.TableSchema;
import bio.terra.genomicfeatures.query.TableVariable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the query that selects rows of an {@link AnnotationTable}. The base table is joined with
 * whichever other annotation tables hold the requested columns or the columns the filter reads,
 * following the Ensembl key relationships between tables. A column found in several tables is read
 * from the one fewest joins away from the base table.
 */
public class AnnotationQueryBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationQueryBuilder.class);

  /** A key shared by two annotation tables. */
  record Join(String table, String otherTable, String key) {}

  static final List<Join> JOINS =
      List.of(
          new Join("gene", "tx", "gene_id"),
          new Join("gene", "entrezgene", "gene_id"),
          new Join("gene", "chromosome", "seq_name"),
          new Join("tx", "tx2exon", "tx_id"),
          new Join("tx2exon", "exon", "exon_id"),
          new Join("tx", "uniprot", "tx_id"),
          new Join("tx", "protein", "tx_id"));

  /** Filter columns are selected in this order, whatever the shape of the filter. */
  static final List<String> FILTER_COLUMN_ORDER =
      Arrays.stream(FilterKind.values())
          .flatMap(kind -> kind.getColumns().stream())
          .distinct()
          .toList();

  static final List<String> FLAG_COLUMNS = FilterKind.CANONICAL_TX.getColumns();

  private final Map<String, TableSchema> schemas;

  public AnnotationQueryBuilder(Map<String, TableSchema> schemas) {
    this.schemas = Map.copyOf(schemas);
  }

  /**
   * Build the query for rows of {@code table} that satisfy {@code filter}.
   *
   * @param columns the columns to return, or empty for every column of the base table; the
   *     filter's columns are always returned after them, in {@link FilterKind} order
   * @param filter the filter rows must satisfy, or null for every row
   * @throws SchemaMismatchException if no reachable table has one of the needed columns
   */
  public QueryRequest build(
      AnnotationTable table, List<String> columns, FilterExpression filter, BackendKind backend) {
    TableSchema baseSchema = getSchema(table.getTableName());

    Set<String> neededColumns =
        new LinkedHashSet<>(columns.isEmpty() ? baseSchema.getColumnNames() : columns);
    if (filter != null) {
      filter.columns().stream()
          .sorted(Comparator.comparingInt(FILTER_COLUMN_ORDER::indexOf))
          .forEach(neededColumns::add);
    }

    JoinTree joinTree = new JoinTree(baseSchema.tableName());
    Map<String, String> columnOwners = new LinkedHashMap<>();
    List<String> missing = new ArrayList<>();
    for (String column : neededColumns) {
      joinTree
          .findOwner(column)
          .ifPresentOrElse(owner -> columnOwners.put(column, owner), () -> missing.add(column));
    }
    if (!missing.isEmpty()) {
      throw new SchemaMismatchException(
          "Annotation table %s has no such columns".formatted(table), missing);
    }

    Map<String, TableVariable> tableVariables = joinTree.buildTableVariables(columnOwners.values());
    List<FieldVariable> select = new ArrayList<>();
    List<ColumnSchema> columnSchemas = new ArrayList<>();
    columnOwners.forEach(
        (column, owner) -> {
          select.add(tableVariables.get(owner).makeFieldVariable(column));
          columnSchemas.add(getSchema(owner).getColumn(column).orElseThrow());
        });

    FilterVariable where = null;
    if (filter != null) {
      TableSchema viewSchema = new TableSchema(table.getTableName(), columnSchemas);
      where =
          FilterLowering.lower(
              filter,
              viewSchema,
              new SqlPredicateBuilder(
                  backend,
                  column ->
                      tableVariables.get(columnOwners.get(column)).makeFieldVariable(column)));
    }

    List<OrderByVariable> orderBy = List.of();
    if (baseSchema.hasColumn(table.getIdColumn())) {
      TableVariable baseTable = tableVariables.get(baseSchema.tableName());
      orderBy = List.of(new OrderByVariable(baseTable.makeFieldVariable(table.getIdColumn())));
    }

    Query query =
        new Query.Builder()
            .select(select)
            .tables(List.copyOf(tableVariables.values()))
            .where(where)
            .orderBy(orderBy)
            .build();
    LOGGER.debug("Built query for {} joining tables {}", table, tableVariables.keySet());
    List<ColumnSchema> headerSchemas =
        columnSchemas.stream().map(AnnotationQueryBuilder::asRead).toList();
    return new QueryRequest(query, new ColumnHeaderSchema(headerSchemas));
  }

  /** Flag columns are read as booleans, including where the backend stores them as integers. */
  private static ColumnSchema asRead(ColumnSchema column) {
    if (FLAG_COLUMNS.contains(column.columnName())
        && column.sqlDataType() == SQLDataType.INT64) {
      return new ColumnSchema(column.columnName(), SQLDataType.BOOLEAN);
    }
    return column;
  }

  private TableSchema getSchema(String tableName) {
    TableSchema schema = schemas.get(tableName);
    if (schema == null) {
      throw new SchemaMismatchException(
          "Annotation database has no table %s".formatted(tableName), List.of(tableName));
    }
    return schema;
  }

  private static String neighborOf(Join join, String table) {
    if (join.table().equals(table)) {
      return join.otherTable();
    }
    if (join.otherTable().equals(table)) {
      return join.table();
    }
    return null;
  }

  /** Breadth-first paths from the base table to every annotation table present in the database. */
  private final class JoinTree {
    private final String baseTable;
    private final List<String> visitOrder = new ArrayList<>();
    private final Map<String, Join> parentJoins = new HashMap<>();

    JoinTree(String baseTable) {
      this.baseTable = baseTable;
      Deque<String> queue = new ArrayDeque<>(List.of(baseTable));
      visitOrder.add(baseTable);
      while (!queue.isEmpty()) {
        String current = queue.poll();
        for (Join join : JOINS) {
          String neighbor = neighborOf(join, current);
          if (neighbor != null && schemas.containsKey(neighbor) && !visitOrder.contains(neighbor)) {
            visitOrder.add(neighbor);
            parentJoins.put(neighbor, join);
            queue.add(neighbor);
          }
        }
      }
    }

    /** The nearest table holding the column. */
    Optional<String> findOwner(String column) {
      return visitOrder.stream().filter(t -> schemas.get(t).hasColumn(column)).findFirst();
    }

    /**
     * Table variables for the owner tables and every table on their paths from the base table, in
     * an order where each joined table follows the table it is joined to.
     */
    Map<String, TableVariable> buildTableVariables(Iterable<String> ownerTables) {
      Set<String> included = new LinkedHashSet<>();
      included.add(baseTable);
      for (String owner : ownerTables) {
        for (String t = owner; !t.equals(baseTable); t = neighborOf(parentJoins.get(t), t)) {
          included.add(t);
        }
      }

      Map<String, TableVariable> tableVariables = new LinkedHashMap<>();
      for (String t : visitOrder) {
        if (!included.contains(t)) {
          continue;
        }
        if (t.equals(baseTable)) {
          tableVariables.put(t, TableVariable.forPrimary(TablePointer.fromTableName(t)));
        } else {
          Join join = parentJoins.get(t);
          TableVariable parent = tableVariables.get(neighborOf(join, t));
          tableVariables.put(
              t,
              TableVariable.forJoined(
                  TablePointer.fromTableName(t), join.key(), parent.makeFieldVariable(join.key())));
        }
      }
      return tableVariables;
    }
  }
}
