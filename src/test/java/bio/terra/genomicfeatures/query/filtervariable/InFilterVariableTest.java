package bio.terra.genomicfeatures.query.filtervariable;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import bio.terra.genomicfeatures.common.category.Unit;
import bio.terra.genomicfeatures.query.FieldVariable;
import bio.terra.genomicfeatures.query.Literal;
import bio.terra.genomicfeatures.query.SqlRenderContext;
import bio.terra.genomicfeatures.query.SqlRenderContextProvider;
import bio.terra.genomicfeatures.query.TablePointer;
import bio.terra.genomicfeatures.query.TableVariable;
import java.util.List;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ArgumentsSource;

@Tag(Unit.TAG)
class InFilterVariableTest {
  private static final FieldVariable SEQ_NAME =
      TableVariable.forPrimary(TablePointer.fromTableName("gene")).makeFieldVariable("seq_name");

  @ParameterizedTest
  @ArgumentsSource(SqlRenderContextProvider.class)
  void renderSQL(SqlRenderContext context) {
    var filterVariable =
        new InFilterVariable(SEQ_NAME, List.of(new Literal("1"), new Literal("X")));
    assertThat(filterVariable.renderSQL(context), is("g.seq_name IN ('1', 'X')"));
  }

  @Test
  void needsAtLeastOneValue() {
    List<Literal> values = List.of();
    assertThrows(IllegalArgumentException.class, () -> new InFilterVariable(SEQ_NAME, values));
  }
}
