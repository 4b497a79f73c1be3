package bio.terra.genomicfeatures.query;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.function.Supplier;

/** The storage backends an annotation database can be opened with. */
public enum BackendKind {
  SQLITE("sqlite", "jdbc:sqlite:"),
  DUCKDB("duckdb", "jdbc:duckdb:");

  private final String value;
  private final String jdbcUrlPrefix;

  BackendKind(String value, String jdbcUrlPrefix) {
    this.value = value;
    this.jdbcUrlPrefix = jdbcUrlPrefix;
  }

  public static BackendKind fromValue(String value) {
    return Arrays.stream(values())
        .filter(kind -> kind.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException(String.format("Invalid backend %s", value)));
  }

  public String getValue() {
    return value;
  }

  /** The file extension of a database file for this backend. */
  public String getFileExtension() {
    return value;
  }

  public String jdbcUrl(Path databaseFile) {
    return jdbcUrlPrefix + databaseFile.toAbsolutePath();
  }

  public <T> T choose(Supplier<T> sqlite, Supplier<T> duckdb) {
    return switch (this) {
      case SQLITE -> sqlite.get();
      case DUCKDB -> duckdb.get();
    };
  }

  public <T> T choose(T sqlite, T duckdb) {
    return choose(() -> sqlite, () -> duckdb);
  }

  @Override
  public String toString() {
    return value;
  }
}
