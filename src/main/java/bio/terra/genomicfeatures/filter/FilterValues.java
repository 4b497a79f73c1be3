package bio.terra.genomicfeatures.filter;

import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The normalized, non-empty set of values held by a filter. Insertion order is kept and values that
 * share a canonical form collapse to one entry, so {@code [1, "1"]} holds a single value while
 * {@code [1, "2"]} holds two alternatives.
 */
public final class FilterValues implements Iterable<FilterValue> {
  private final ImmutableSet<FilterValue> values;

  private FilterValues(ImmutableSet<FilterValue> values) {
    this.values = values;
  }

  /**
   * Normalize the values passed to a filter constructor. A single {@link Collection} argument is
   * expanded into its elements; anything else is treated as a list of scalars.
   *
   * @throws InvalidFilterException if there are no values or any value is invalid
   */
  public static FilterValues of(Object... values) {
    if (values == null) {
      throw new InvalidFilterException("Filter values cannot be null");
    }
    if (values.length == 1 && values[0] instanceof Collection<?> collection) {
      return fromCollection(collection);
    }
    return fromCollection(Arrays.asList(values));
  }

  public static FilterValues fromCollection(Collection<?> values) {
    if (values == null || values.isEmpty()) {
      throw new InvalidFilterException("A filter needs at least one value");
    }
    return new FilterValues(
        values.stream().map(FilterValue::of).collect(ImmutableSet.toImmutableSet()));
  }

  public Set<FilterValue> values() {
    return values;
  }

  /** The canonical string of every value, in order. */
  public Set<String> canonicalValues() {
    return values.stream()
        .map(FilterValue::canonical)
        .collect(ImmutableSet.toImmutableSet());
  }

  public int size() {
    return values.size();
  }

  @Override
  public Iterator<FilterValue> iterator() {
    return values.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof FilterValues other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.size() == 1
        ? values.iterator().next().toString()
        : values.stream().map(FilterValue::toString).collect(Collectors.joining(", ", "[", "]"));
  }
}
