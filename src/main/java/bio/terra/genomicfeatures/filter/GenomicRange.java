package bio.terra.genomicfeatures.filter;

import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * A 1-based, inclusive coordinate interval on one sequence, written {@code SEQNAME:START-END}
 * (e.g. {@code 1:77000000-78000000}).
 */
public record GenomicRange(String seqName, long start, long end) {
  private static final Pattern COORDINATE = Pattern.compile("\\d+");

  public GenomicRange {
    if (StringUtils.isEmpty(seqName)) {
      throw new InvalidFilterException("A genomic range needs a sequence name");
    }
    if (start < 0 || end < 0) {
      throw new InvalidFilterException(
          "Genomic range coordinates cannot be negative: %d-%d".formatted(start, end));
    }
    if (start > end) {
      throw new InvalidFilterException(
          "Genomic range start %d is after its end %d".formatted(start, end));
    }
  }

  /**
   * Parse a range string of the form {@code SEQNAME:START-END}.
   *
   * @throws InvalidFilterException if the string does not have exactly one {@code :}, the
   *     coordinates do not have exactly one {@code -}, a coordinate is not a non-negative integer,
   *     or start is after end
   */
  public static GenomicRange parse(String range) {
    if (range == null) {
      throw new InvalidFilterException("A genomic range cannot be null");
    }
    if (StringUtils.countMatches(range, ':') != 1) {
      throw new InvalidFilterException(
          "Invalid genomic range '%s', expected SEQNAME:START-END".formatted(range));
    }
    String seqName = StringUtils.substringBefore(range, ":");
    String coordinates = StringUtils.substringAfter(range, ":");
    if (StringUtils.countMatches(coordinates, '-') != 1) {
      throw new InvalidFilterException(
          "Invalid coordinates '%s' in genomic range '%s', expected START-END"
              .formatted(coordinates, range));
    }
    long start = parseCoordinate(StringUtils.substringBefore(coordinates, "-"), range);
    long end = parseCoordinate(StringUtils.substringAfter(coordinates, "-"), range);
    return new GenomicRange(seqName, start, end);
  }

  private static long parseCoordinate(String coordinate, String range) {
    if (!COORDINATE.matcher(coordinate).matches()) {
      throw new InvalidFilterException(
          "Invalid coordinate '%s' in genomic range '%s'".formatted(coordinate, range));
    }
    try {
      return Long.parseLong(coordinate);
    } catch (NumberFormatException e) {
      throw new InvalidFilterException(
          "Coordinate '%s' in genomic range '%s' is too large".formatted(coordinate, range), e);
    }
  }

  @Override
  public String toString() {
    return "%s:%d-%d".formatted(seqName, start, end);
  }
}
