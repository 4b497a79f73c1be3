package bio.terra.genomicfeatures.query.jdbc;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import bio.terra.genomicfeatures.common.category.Unit;
import bio.terra.genomicfeatures.query.CellValue.SQLDataType;
import bio.terra.genomicfeatures.query.ColumnSchema;
import bio.terra.genomicfeatures.query.Literal;
import java.util.Optional;
import java.util.OptionalLong;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(Unit.TAG)
class JdbcCellValueTest {

  private static JdbcCellValue cell(Object value, SQLDataType type) {
    return new JdbcCellValue(Optional.ofNullable(value), new ColumnSchema("column", type));
  }

  @Test
  void getLong() {
    assertThat(cell(77000000, SQLDataType.INT64).getLong(), is(OptionalLong.of(77000000L)));
    assertThat(cell(null, SQLDataType.INT64).getLong(), is(OptionalLong.empty()));
  }

  @Test
  void getBooleanFromIntegerStorage() {
    assertThat(cell(1, SQLDataType.BOOLEAN).getBoolean(), is(Optional.of(true)));
    assertThat(cell(0, SQLDataType.BOOLEAN).getBoolean(), is(Optional.of(false)));
    assertThat(cell(Boolean.TRUE, SQLDataType.BOOLEAN).getBoolean(), is(Optional.of(true)));
  }

  @Test
  void getLiteral() {
    assertThat(
        cell("TSPAN6", SQLDataType.STRING).getLiteral(), is(Optional.of(new Literal("TSPAN6"))));
    assertThat(cell(3307, SQLDataType.INT64).getLiteral(), is(Optional.of(new Literal(3307L))));
    assertThat(cell(1, SQLDataType.BOOLEAN).getLiteral(), is(Optional.of(new Literal(true))));
    assertThat(cell(null, SQLDataType.STRING).getLiteral(), is(Optional.empty()));
  }

  @Test
  void getterMustMatchTheColumnType() {
    JdbcCellValue cell = cell("X", SQLDataType.STRING);
    assertThrows(IllegalArgumentException.class, cell::getLong);
  }
}
