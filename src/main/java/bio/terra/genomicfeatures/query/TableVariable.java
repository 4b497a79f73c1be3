package bio.terra.genomicfeatures.query;

import jakarta.annotation.Nullable;
import org.stringtemplate.v4.ST;

/**
 * A table in the FROM clause of a query: either the primary table, or a table joined on one of
 * its columns equalling a column of a table already in the query.
 */
public record TableVariable(
    TablePointer tablePointer,
    @Nullable String joinField,
    @Nullable FieldVariable joinFieldOnParent)
    implements SqlExpression {

  public static TableVariable forPrimary(TablePointer tablePointer) {
    return new TableVariable(tablePointer, null, null);
  }

  public static TableVariable forJoined(
      TablePointer tablePointer, String joinField, FieldVariable joinFieldOnParent) {
    return new TableVariable(tablePointer, joinField, joinFieldOnParent);
  }

  public FieldVariable makeFieldVariable(String fieldName) {
    return new FieldVariable(new FieldPointer(tablePointer, fieldName), this);
  }

  public boolean isPrimary() {
    return joinField == null;
  }

  @Override
  public String renderSQL(SqlRenderContext context) {
    String alias = context.getAlias(this);
    String sql =
        new ST("<sql> AS <tableAlias>")
            .add("sql", tablePointer.renderSQL(context))
            .add("tableAlias", alias)
            .render();

    if (joinField != null && joinFieldOnParent != null) {
      sql =
          new ST("JOIN <tableReference> ON <tableAlias>.<joinField> = <joinFieldOnParent>")
              .add("tableReference", sql)
              .add("tableAlias", alias)
              .add("joinField", joinField)
              .add("joinFieldOnParent", joinFieldOnParent.renderSQL(context))
              .render();
    }
    return sql;
  }
}
