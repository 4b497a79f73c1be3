package bio.terra.genomicfeatures.filter;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import bio.terra.genomicfeatures.common.category.Unit;
import bio.terra.genomicfeatures.filter.exception.InvalidFilterException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(Unit.TAG)
class OverlapTypeTest {

  @Test
  void fromValue() {
    assertThat(OverlapType.fromValue("any"), is(OverlapType.ANY));
    assertThat(OverlapType.fromValue("within"), is(OverlapType.WITHIN));
  }

  @Test
  void fromValueHasNoDefault() {
    InvalidFilterException exception =
        assertThrows(InvalidFilterException.class, () -> OverlapType.fromValue("start"));
    assertThat(
        exception.getMessage(),
        is("Invalid range overlap type 'start', expected one of: any, within"));
    assertThrows(InvalidFilterException.class, () -> OverlapType.fromValue(null));
  }
}
