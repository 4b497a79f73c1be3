package bio.terra.genomicfeatures.query;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import bio.terra.genomicfeatures.common.category.Unit;
import java.nio.file.Path;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@Tag(Unit.TAG)
class BackendKindTest {

  @ParameterizedTest
  @CsvSource({"sqlite, SQLITE", "SQLite, SQLITE", "duckdb, DUCKDB"})
  void fromValue(String value, BackendKind expected) {
    assertThat(BackendKind.fromValue(value), is(expected));
  }

  @Test
  void fromValueRejectsUnknownBackend() {
    assertThrows(IllegalArgumentException.class, () -> BackendKind.fromValue("postgres"));
  }

  @Test
  void choose() {
    assertThat(BackendKind.SQLITE.choose("a", "b"), is("a"));
    assertThat(BackendKind.DUCKDB.choose("a", "b"), is("b"));
  }

  @Test
  void jdbcUrl() {
    Path file = Path.of("/cache/EnsDb.Hsapiens.v108.duckdb");
    assertThat(BackendKind.DUCKDB.jdbcUrl(file), is("jdbc:duckdb:" + file.toAbsolutePath()));
    assertThat(BackendKind.SQLITE.getFileExtension(), is("sqlite"));
  }
}
