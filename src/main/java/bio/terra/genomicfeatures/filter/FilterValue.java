package bio.terra.genomicfeatures.filter;

import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import java.math.BigInteger;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * A single filter value in canonical form. Integers and strings are both accepted and are compared
 * by their string projection, so {@code 1} and {@code "1"} are the same value.
 */
public record FilterValue(String canonical) {
  private static final Pattern INTEGER = Pattern.compile("-?\\d+");
  private static final Pattern DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?");

  public FilterValue {
    if (canonical == null) {
      throw new InvalidFilterException("Filter values cannot be null");
    }
  }

  /**
   * Normalize a scalar supplied by a caller.
   *
   * @throws InvalidFilterException if the value is null or not a string or integral number
   */
  public static FilterValue of(Object value) {
    if (value instanceof FilterValue filterValue) {
      return filterValue;
    }
    if (value instanceof CharSequence text) {
      return new FilterValue(text.toString());
    }
    if (value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte
        || value instanceof BigInteger) {
      return new FilterValue(value.toString());
    }
    if (value == null) {
      throw new InvalidFilterException("Filter values cannot be null");
    }
    throw new InvalidFilterException(
        "Unsupported filter value type %s: %s"
            .formatted(value.getClass().getSimpleName(), value));
  }

  /** The value as a long, or empty if the canonical form is not an integer that fits. */
  public OptionalLong asLong() {
    if (!INTEGER.matcher(canonical).matches()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(canonical));
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }

  /** The value as a double, or empty if the canonical form is not a finite plain decimal. */
  public OptionalDouble asDouble() {
    if (!DECIMAL.matcher(canonical).matches()) {
      return OptionalDouble.empty();
    }
    double value = Double.parseDouble(canonical);
    return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
  }

  @Override
  public String toString() {
    return canonical;
  }
}
