package bio.terra.genomicfeatures.lowering;

import bio.terra.genomicfeatures.query.ColumnSchema;
import bio.terra.genomicfeatures.query.Literal;
import bio.terra.genomicfeatures.query.filtervariable.BinaryFilterVariable.BinaryOperator;
import java.util.List;

/**
 * The predicates a query target must be able to build for filters to be lowered onto it. Values
 * arrive already coerced to the type of the column they are compared with.
 *
 * @param <P> the target's predicate type
 */
public interface PredicateBuilder<P> {

  /** The column holds one of the values. {@code values} is never empty. */
  P in(ColumnSchema column, List<Literal> values);

  P compare(ColumnSchema column, BinaryOperator operator, Literal value);

  /** The boolean flag stored in the column is set. */
  P isTrue(ColumnSchema column);

  P and(P left, P right);

  P or(P left, P right);

  P not(P operand);

  /** A predicate that selects no rows. */
  P alwaysFalse();
}
