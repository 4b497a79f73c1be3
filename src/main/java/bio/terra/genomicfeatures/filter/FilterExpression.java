package bio.terra.genomicfeatures.filter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node in an immutable filter expression tree. Leaves are {@link PrimitiveFilter}s, inner nodes
 * are {@link AndFilter}, {@link OrFilter} and {@link NotFilter}. Composing never modifies the
 * operands, so a sub-filter can be reused in any number of expressions.
 */
public interface FilterExpression {

  /** The columns this expression reads, in first-use order and without duplicates. */
  List<String> columns();

  <T> T accept(Visitor<T> visitor);

  default FilterExpression and(FilterExpression other) {
    return new AndFilter(this, other);
  }

  default FilterExpression or(FilterExpression other) {
    return new OrFilter(this, other);
  }

  default FilterExpression negate() {
    return new NotFilter(this);
  }

  static FilterExpression and(FilterExpression left, FilterExpression right) {
    return left.and(right);
  }

  static FilterExpression or(FilterExpression left, FilterExpression right) {
    return left.or(right);
  }

  static FilterExpression not(FilterExpression operand) {
    return operand.negate();
  }

  /**
   * Walks an expression tree. Every node type has its own method, so adding a node type is a
   * compile error in each visitor until it is handled.
   */
  interface Visitor<T> {
    T visitField(FieldFilter filter);

    T visitCanonicalTx(CanonicalTxFilter filter);

    T visitGeneRanges(GeneRangesFilter filter);

    T visitAnd(AndFilter filter);

    T visitOr(OrFilter filter);

    T visitNot(NotFilter filter);
  }

  static List<String> unionColumns(FilterExpression... operands) {
    Set<String> columns = new LinkedHashSet<>();
    for (FilterExpression operand : operands) {
      columns.addAll(operand.columns());
    }
    return List.copyOf(columns);
  }
}
