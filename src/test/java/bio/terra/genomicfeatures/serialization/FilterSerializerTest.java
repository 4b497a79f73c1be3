package bio.terra.genomicfeatures.serialization;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import bio.terra.genomicfeatures.common.category.Unit;
import bio.terra.genomicfeatures.filter.FilterExpression;
import bio.terra.genomicfeatures.filter.Filters;
import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import bio.terra.genomicfeatures.serialization.filter.UFBooleanAndOrFilter;
import bio.terra.genomicfeatures.serialization.filter.UFFieldFilter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@Tag(Unit.TAG)
class FilterSerializerTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Test
  void fromJson() {
    String json =
        """
        {
          "type": "AND",
          "left": {"type": "FIELD", "kind": "GENE_BIOTYPE", "values": ["protein_coding"]},
          "right": {
            "type": "OR",
            // either sequence, or a range on chromosome 1
            "left": {"type": "FIELD", "kind": "SEQ_NAME", "values": [1, "X"]},
            "right": {
              "type": "NOT",
              "operand": {"type": "GENE_RANGE", "range": "1:77000000-78000000", "overlap": "within"}
            }
          }
        }
        """;

    FilterExpression expected =
        Filters.geneBioType("protein_coding")
            .and(
                Filters.seqName(1, "X")
                    .or(Filters.geneRanges("1:77000000-78000000", "within").negate()));
    assertThat(FilterSerializer.fromJson(json), is(expected));
  }

  @Test
  void canonicalTxAndDefaultOverlap() {
    assertThat(
        FilterSerializer.fromJson("{\"type\": \"CANONICAL_TX\"}"), is(Filters.canonicalTx()));
    assertThat(
        FilterSerializer.fromJson("{\"type\": \"GENE_RANGE\", \"range\": \"2:100-200\"}"),
        is(Filters.geneRanges("2:100-200", "any")));
  }

  @Test
  void integerValuesMatchTheirStringForm() {
    String json = "{\"type\": \"FIELD\", \"kind\": \"SEQ_NAME\", \"values\": [1, 2]}";
    assertThat(FilterSerializer.fromJson(json), is(Filters.seqName("1", "2")));
  }

  @Test
  void serialize() {
    UFFilterExpression serialized =
        FilterSerializer.serialize(Filters.txId("ENST00000373020").or(Filters.seqName(7)));

    assertThat(serialized, instanceOf(UFBooleanAndOrFilter.class));
    assertThat(serialized.getType(), is(UFFilterExpression.Type.OR));
    UFFilterExpression right = ((UFBooleanAndOrFilter) serialized).getRight();
    assertThat(right, instanceOf(UFFieldFilter.class));
    assertThat(((UFFieldFilter) right).getValues(), is(List.of("7")));
  }

  @Test
  void toJson() throws Exception {
    FilterExpression filter =
        Filters.geneId("ENSG00000000003", "ENSG00000000005").and(Filters.canonicalTx().negate());

    JsonNode json = MAPPER.readTree(FilterSerializer.toJson(filter));
    assertThat(json.get("type").asText(), is("AND"));
    assertThat(json.get("left").get("kind").asText(), is("GENE_ID"));
    assertThat(json.get("left").get("values").size(), is(2));
    assertThat(json.get("right").get("type").asText(), is("NOT"));
    assertThat(json.get("right").get("operand").get("type").asText(), is("CANONICAL_TX"));

    assertThat(FilterSerializer.fromJson(json.toString()), is(filter));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "null",
        "not json",
        "{\"type\": \"XOR\"}",
        "{\"kind\": \"GENE_ID\", \"values\": [\"ENSG00000000003\"]}",
        "{\"type\": \"FIELD\", \"kind\": \"GENE_ID\", \"values\": []}",
        "{\"type\": \"FIELD\", \"kind\": \"GENE_ID\"}",
        "{\"type\": \"FIELD\", \"values\": [\"ENSG00000000003\"]}",
        "{\"type\": \"FIELD\", \"kind\": \"EXON_NUMBER\", \"values\": [\"1\"]}",
        "{\"type\": \"GENE_RANGE\", \"range\": \"1_77000000_78000000\"}",
        "{\"type\": \"GENE_RANGE\", \"range\": \"1:77000000-78000000\", \"overlap\": \"start\"}",
        "{\"type\": \"AND\", \"left\": {\"type\": \"CANONICAL_TX\"}}",
        "{\"type\": \"NOT\"}"
      })
  void invalidFilters(String json) {
    assertThrows(InvalidFilterException.class, () -> FilterSerializer.fromJson(json));
  }
}
