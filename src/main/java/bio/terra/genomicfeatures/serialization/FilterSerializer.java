package bio.terra.genomicfeatures.serialization;

import bio.terra.genomicfeatures.filter.AndFilter;
import bio.terra.genomicfeatures.filter.CanonicalTxFilter;
import bio.terra.genomicfeatures.filter.FieldFilter;
import bio.terra.genomicfeatures.filter.FilterExpression;
import bio.terra.genomicfeatures.filter.GeneRangesFilter;
import bio.terra.genomicfeatures.filter.NotFilter;
import bio.terra.genomicfeatures.filter.OrFilter;
import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import bio.terra.genomicfeatures.serialization.filter.UFBooleanAndOrFilter;
import bio.terra.genomicfeatures.serialization.filter.UFCanonicalTxFilter;
import bio.terra.genomicfeatures.serialization.filter.UFFieldFilter;
import bio.terra.genomicfeatures.serialization.filter.UFGeneRangesFilter;
import bio.terra.genomicfeatures.serialization.filter.UFNotFilter;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts filter expressions to and from their user-facing JSON form. Reading JSON goes through
 * the same constructors as building a filter in code, so it rejects the same invalid filters.
 */
public final class FilterSerializer {
  private static final Logger LOGGER = LoggerFactory.getLogger(FilterSerializer.class);

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().findAndRegisterModules().enable(JsonParser.Feature.ALLOW_COMMENTS);

  private FilterSerializer() {}

  /** Convert a filter expression to its external representation. */
  public static UFFilterExpression serialize(FilterExpression expression) {
    return expression.accept(
        new FilterExpression.Visitor<>() {
          @Override
          public UFFilterExpression visitField(FieldFilter filter) {
            return new UFFieldFilter(filter);
          }

          @Override
          public UFFilterExpression visitCanonicalTx(CanonicalTxFilter filter) {
            return new UFCanonicalTxFilter();
          }

          @Override
          public UFFilterExpression visitGeneRanges(GeneRangesFilter filter) {
            return new UFGeneRangesFilter(filter);
          }

          @Override
          public UFFilterExpression visitAnd(AndFilter filter) {
            return new UFBooleanAndOrFilter(filter);
          }

          @Override
          public UFFilterExpression visitOr(OrFilter filter) {
            return new UFBooleanAndOrFilter(filter);
          }

          @Override
          public UFFilterExpression visitNot(NotFilter filter) {
            return new UFNotFilter(filter);
          }
        });
  }

  public static String toJson(FilterExpression expression) {
    try {
      return OBJECT_MAPPER.writeValueAsString(serialize(expression));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not write filter " + expression + " as JSON", e);
    }
  }

  /**
   * Read a filter expression from JSON.
   *
   * @throws InvalidFilterException if the JSON is malformed or describes an invalid filter
   */
  public static FilterExpression fromJson(String json) {
    UFFilterExpression serialized;
    try {
      serialized = OBJECT_MAPPER.readValue(json, UFFilterExpression.class);
    } catch (JsonProcessingException e) {
      LOGGER.debug("Rejected filter JSON: {}", json);
      throw new InvalidFilterException("Invalid filter JSON: " + e.getOriginalMessage(), e);
    }
    if (serialized == null) {
      throw new InvalidFilterException("Filter JSON cannot be null");
    }
    return serialized.deserializeToInternal();
  }
}
