package bio.terra.genomicfeatures.lowering;

import bio.terra.genomicfeatures.query.BackendKind;
import bio.terra.genomicfeatures.query.CellValue.SQLDataType;
import bio.terra.genomicfeatures.query.ColumnSchema;
import bio.terra.genomicfeatures.query.FieldVariable;
import bio.terra.genomicfeatures.query.FilterVariable;
import bio.terra.genomicfeatures.query.Literal;
import bio.terra.genomicfeatures.query.filtervariable.BinaryFilterVariable;
import bio.terra.genomicfeatures.query.filtervariable.BinaryFilterVariable.BinaryOperator;
import bio.terra.genomicfeatures.query.filtervariable.BooleanAndOrFilterVariable;
import bio.terra.genomicfeatures.query.filtervariable.BooleanAndOrFilterVariable.LogicalOperator;
import bio.terra.genomicfeatures.query.filtervariable.FalseFilterVariable;
import bio.terra.genomicfeatures.query.filtervariable.InFilterVariable;
import bio.terra.genomicfeatures.query.filtervariable.NotFilterVariable;
import java.util.List;
import java.util.function.Function;

/**
 * Builds SQL {@link FilterVariable}s for one backend. Column names are bound to table columns by
 * {@code columnBinder}, which lets the same filter target a single table or a join.
 */
public class SqlPredicateBuilder implements PredicateBuilder<FilterVariable> {
  private final BackendKind backend;
  private final Function<String, FieldVariable> columnBinder;

  public SqlPredicateBuilder(BackendKind backend, Function<String, FieldVariable> columnBinder) {
    this.backend = backend;
    this.columnBinder = columnBinder;
  }

  @Override
  public FilterVariable in(ColumnSchema column, List<Literal> values) {
    if (values.size() == 1) {
      return compare(column, BinaryOperator.EQUALS, values.get(0));
    }
    return new InFilterVariable(columnBinder.apply(column.columnName()), values);
  }

  @Override
  public FilterVariable compare(ColumnSchema column, BinaryOperator operator, Literal value) {
    return new BinaryFilterVariable(columnBinder.apply(column.columnName()), operator, value);
  }

  @Override
  public FilterVariable isTrue(ColumnSchema column) {
    // SQLite stores booleans as integers, so a BOOLEAN column there still holds 0 and 1.
    Literal flag =
        column.sqlDataType() == SQLDataType.BOOLEAN
            ? backend.choose(() -> new Literal(1L), () -> new Literal(true))
            : new Literal(1L);
    return compare(column, BinaryOperator.EQUALS, flag);
  }

  @Override
  public FilterVariable and(FilterVariable left, FilterVariable right) {
    return new BooleanAndOrFilterVariable(LogicalOperator.AND, List.of(left, right));
  }

  @Override
  public FilterVariable or(FilterVariable left, FilterVariable right) {
    return new BooleanAndOrFilterVariable(LogicalOperator.OR, List.of(left, right));
  }

  @Override
  public FilterVariable not(FilterVariable operand) {
    return new NotFilterVariable(operand);
  }

  @Override
  public FilterVariable alwaysFalse() {
    return new FalseFilterVariable();
  }
}
