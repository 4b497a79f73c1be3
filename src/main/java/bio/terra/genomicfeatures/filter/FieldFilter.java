package bio.terra.genomicfeatures.filter;

import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import java.util.Objects;

/** Selects rows whose column for {@link #kind()} holds one of {@link #values()}. */
public record FieldFilter(FilterKind kind, FilterValues values) implements PrimitiveFilter {

  public FieldFilter {
    Objects.requireNonNull(kind, "kind");
    if (!kind.isMembership()) {
      throw new InvalidFilterException(kind + " is not a value filter");
    }
    if (values == null) {
      throw new InvalidFilterException("A filter needs at least one value");
    }
  }

  public FieldFilter(FilterKind kind, Object... values) {
    this(kind, FilterValues.of(values));
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitField(this);
  }

  @Override
  public String toString() {
    return kind + "(" + values + ")";
  }
}
