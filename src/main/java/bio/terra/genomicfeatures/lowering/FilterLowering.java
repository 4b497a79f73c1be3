package bio.terra.genomicfeatures.lowering;

import bio.terra.genomicfeatures.filter.AndFilter;
import bio.terra.genomicfeatures.filter.CanonicalTxFilter;
import bio.terra.genomicfeatures.filter.FieldFilter;
import bio.terra.genomicfeatures.filter.FilterExpression;
import bio.terra.genomicfeatures.filter.FilterKind;
import bio.terra.genomicfeatures.filter.FilterValue;
import bio.terra.genomicfeatures.filter.FilterValues;
import bio.terra.genomicfeatures.filter.GeneRangesFilter;
import bio.terra.genomicfeatures.filter.GenomicRange;
import bio.terra.genomicfeatures.filter.NotFilter;
import bio.terra.genomicfeatures.filter.OrFilter;
import bio.terra.genomicfeatures.lowering.exception.SchemaMismatchException;
import bio.terra.genomicfeatures.query.BackendKind;
import bio.terra.genomicfeatures.query.CellValue.SQLDataType;
import bio.terra.genomicfeatures.query.ColumnSchema;
import bio.terra.genomicfeatures.query.FilterVariable;
import bio.terra.genomicfeatures.query.Literal;
import bio.terra.genomicfeatures.query.TablePointer;
import bio.terra.genomicfeatures.query.TableSchema;
import bio.terra.genomicfeatures.query.TableVariable;
import bio.terra.genomicfeatures.query.filtervariable.BinaryFilterVariable.BinaryOperator;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a {@link FilterExpression} into a predicate of a query target. The tree is walked
 * once; every primitive is lowered exactly once and every boolean node maps onto the target's own
 * connective, so negating a composite negates the whole lowered sub-predicate.
 *
 * <p>Filter values are coerced to the type the schema reports for the column they are compared
 * with. Text columns compare against the canonical string of each value, and integer columns
 * against values that are integers; a value that cannot be stored in the column can never match
 * and is left out.
 */
public final class FilterLowering {
  private static final Logger LOGGER = LoggerFactory.getLogger(FilterLowering.class);

  private FilterLowering() {}

  /**
   * Lower a filter expression onto a SQL predicate over a single table.
   *
   * @throws SchemaMismatchException if the table lacks a column the expression targets
   */
  public static FilterVariable lower(
      FilterExpression expression, TableSchema schema, BackendKind backend) {
    TableVariable table = TableVariable.forPrimary(TablePointer.fromTableName(schema.tableName()));
    return lower(expression, schema, new SqlPredicateBuilder(backend, table::makeFieldVariable));
  }

  /**
   * Lower a filter expression onto any query target.
   *
   * @param schema the columns visible to the predicate, with their types
   * @throws SchemaMismatchException if the schema lacks a column the expression targets
   */
  public static <P> P lower(
      FilterExpression expression, TableSchema schema, PredicateBuilder<P> builder) {
    List<String> missing =
        expression.columns().stream().filter(column -> !schema.hasColumn(column)).toList();
    if (!missing.isEmpty()) {
      throw new SchemaMismatchException(
          "Table %s has no column for filter %s".formatted(schema.tableName(), expression),
          missing);
    }
    LOGGER.debug("Lowering {} against table {}", expression, schema.tableName());
    return expression.accept(new LoweringVisitor<>(schema, builder));
  }

  private static final class LoweringVisitor<P> implements FilterExpression.Visitor<P> {
    private final TableSchema schema;
    private final PredicateBuilder<P> builder;

    LoweringVisitor(TableSchema schema, PredicateBuilder<P> builder) {
      this.schema = schema;
      this.builder = builder;
    }

    @Override
    public P visitField(FieldFilter filter) {
      // A value filter bound to several columns matches when any of them holds a value.
      return filter.kind().getColumns().stream()
          .map(columnName -> membership(column(columnName), filter.values()))
          .reduce(builder::or)
          .orElseThrow();
    }

    @Override
    public P visitCanonicalTx(CanonicalTxFilter filter) {
      ColumnSchema flag = column(FilterKind.CANONICAL_TX.getColumns().get(0));
      if (flag.sqlDataType() != SQLDataType.BOOLEAN && flag.sqlDataType() != SQLDataType.INT64) {
        throw typeMismatch(flag, "a boolean flag");
      }
      return builder.isTrue(flag);
    }

    @Override
    public P visitGeneRanges(GeneRangesFilter filter) {
      List<String> columns = FilterKind.GENE_RANGE.getColumns();
      ColumnSchema seqName = column(columns.get(0));
      ColumnSchema start = column(columns.get(1));
      ColumnSchema end = column(columns.get(2));
      GenomicRange range = filter.range();

      P onSequence = membership(seqName, FilterValues.of(range.seqName()));
      P overlap =
          switch (filter.type()) {
            case ANY -> builder.and(atMost(start, range.end()), atLeast(end, range.start()));
            case WITHIN -> builder.and(atLeast(start, range.start()), atMost(end, range.end()));
          };
      return builder.and(onSequence, overlap);
    }

    @Override
    public P visitAnd(AndFilter filter) {
      return builder.and(filter.left().accept(this), filter.right().accept(this));
    }

    @Override
    public P visitOr(OrFilter filter) {
      return builder.or(filter.left().accept(this), filter.right().accept(this));
    }

    @Override
    public P visitNot(NotFilter filter) {
      return builder.not(filter.operand().accept(this));
    }

    private ColumnSchema column(String columnName) {
      return schema.getColumn(columnName).orElseThrow();
    }

    private P membership(ColumnSchema column, FilterValues values) {
      List<Literal> literals = coerce(column, values);
      if (literals.isEmpty()) {
        LOGGER.debug("No value of {} fits column {}", values, column);
        return builder.alwaysFalse();
      }
      return builder.in(column, literals);
    }

    private List<Literal> coerce(ColumnSchema column, FilterValues values) {
      Set<Literal> literals = new LinkedHashSet<>();
      for (FilterValue value : values) {
        toLiteral(column, value).ifPresent(literals::add);
      }
      return new ArrayList<>(literals);
    }

    private Optional<Literal> toLiteral(ColumnSchema column, FilterValue value) {
      return switch (column.sqlDataType()) {
        case STRING -> Optional.of(new Literal(value.canonical()));
        case INT64 -> {
          OptionalLong asLong = value.asLong();
          yield asLong.isPresent()
              ? Optional.of(new Literal(asLong.getAsLong()))
              : Optional.empty();
        }
        case FLOAT -> {
          OptionalDouble asDouble = value.asDouble();
          yield asDouble.isPresent()
              ? Optional.of(new Literal(asDouble.getAsDouble()))
              : Optional.empty();
        }
        case BOOLEAN, DATE -> throw typeMismatch(column, "filter values");
      };
    }

    private P atLeast(ColumnSchema column, long coordinate) {
      return builder.compare(
          column, BinaryOperator.GREATER_THAN_OR_EQUAL, bound(column, coordinate));
    }

    private P atMost(ColumnSchema column, long coordinate) {
      return builder.compare(column, BinaryOperator.LESS_THAN_OR_EQUAL, bound(column, coordinate));
    }

    private Literal bound(ColumnSchema column, long coordinate) {
      return switch (column.sqlDataType()) {
        case INT64 -> new Literal(coordinate);
        case FLOAT -> new Literal((double) coordinate);
        case STRING, BOOLEAN, DATE -> throw typeMismatch(column, "genomic coordinates");
      };
    }

    private SchemaMismatchException typeMismatch(ColumnSchema column, String expected) {
      return new SchemaMismatchException(
          "Column %s.%s of type %s cannot hold %s"
              .formatted(schema.tableName(), column.columnName(), column.sqlDataType(), expected));
    }
  }
}
