package bio.terra.genomicfeatures.filter;

import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import java.util.Arrays;
import java.util.stream.Collectors;

/** How a stored interval must relate to the queried range to be selected. */
public enum OverlapType {
  /** The stored interval intersects the range. */
  ANY("any"),
  /** The stored interval lies entirely inside the range. */
  WITHIN("within");

  private final String value;

  OverlapType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Parse an overlap type token. Only the exact tokens {@code any} and {@code within} are accepted;
   * there is no default.
   */
  public static OverlapType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.value.equals(value))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidFilterException(
                    "Invalid range overlap type '%s', expected one of: %s"
                        .formatted(
                            value,
                            Arrays.stream(values())
                                .map(OverlapType::getValue)
                                .collect(Collectors.joining(", ")))));
  }

  @Override
  public String toString() {
    return value;
  }
}
