package bio.terra.genomicfeatures.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.stringtemplate.v4.ST;

/**
 * A SELECT over one primary table and any tables joined to it. Joined tables are rendered in list
 * order, so each must follow the table its join column refers to.
 */
public record Query(
    List<FieldVariable> select,
    List<TableVariable> tables,
    FilterVariable where,
    List<OrderByVariable> orderBy)
    implements SqlExpression {
  private static final String TEMPLATE =
      "SELECT <select> FROM <from>"
          + "<if(where)> WHERE <where><endif>"
          + "<if(orderBy)> ORDER BY <orderBy><endif>";

  public Query {
    if (select.isEmpty()) {
      throw new IllegalArgumentException("Query must have at least one SELECT FieldVariable");
    }
    if (tables.isEmpty()) {
      throw new IllegalArgumentException("Query must have at least one TableVariable");
    }
    orderBy = Objects.requireNonNullElse(orderBy, List.of());

    long primaryTables = tables.stream().filter(TableVariable::isPrimary).count();
    if (primaryTables != 1) {
      throw new IllegalArgumentException(
          "Query can only have one primary table, but found " + primaryTables);
    }
  }

  public Query(List<FieldVariable> select, List<TableVariable> tables) {
    this(select, tables, null, null);
  }

  @Override
  public String renderSQL(SqlRenderContext context) {
    // SELECT is rendered first so the selected tables are the first to claim their aliases.
    String selectSQL = joinRendered(select, ", ", context);
    List<TableVariable> fromTables = new ArrayList<>();
    fromTables.add(getPrimaryTable());
    tables.stream().filter(table -> !table.isPrimary()).forEach(fromTables::add);
    String fromSQL = joinRendered(fromTables, " ", context);

    ST template = new ST(TEMPLATE).add("select", selectSQL).add("from", fromSQL);
    if (where != null) {
      template.add("where", where.renderSQL(context));
    }
    if (!orderBy.isEmpty()) {
      template.add("orderBy", joinRendered(orderBy, ", ", context));
    }
    return template.render();
  }

  private static String joinRendered(
      List<? extends SqlExpression> expressions, String delimiter, SqlRenderContext context) {
    return expressions.stream()
        .map(expression -> expression.renderSQL(context))
        .collect(Collectors.joining(delimiter));
  }

  public TableVariable getPrimaryTable() {
    return tables.stream().filter(TableVariable::isPrimary).findFirst().orElseThrow();
  }

  public static class Builder {
    private List<FieldVariable> select;
    private List<TableVariable> tables;
    private FilterVariable where;
    private List<OrderByVariable> orderBy;

    public Builder select(List<FieldVariable> select) {
      this.select = select;
      return this;
    }

    public Builder tables(List<TableVariable> tables) {
      this.tables = tables;
      return this;
    }

    public Builder where(FilterVariable where) {
      this.where = where;
      return this;
    }

    public Builder orderBy(List<OrderByVariable> orderBy) {
      this.orderBy = orderBy;
      return this;
    }

    public Query build() {
      return new Query(select, tables, where, orderBy);
    }
  }
}
