package bio.terra.genomicfeatures.annotation;

import bio.terra.genomicfeatures.query.BackendKind;
import java.nio.file.Path;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

/** Creates a small Ensembl annotation database, laid out the way each backend releases it. */
public final class AnnotationFixture {
  public static final String SPECIES = "Hsapiens";
  public static final int RELEASE = 108;

  private AnnotationFixture() {}

  /** Create the database in {@code directory} under the name the annotation cache uses. */
  public static Path createDatabase(Path directory, BackendKind backend) {
    Path databaseFile =
        directory.resolve(
            "EnsDb.%s.v%d.%s".formatted(SPECIES, RELEASE, backend.getFileExtension()));
    SingleConnectionDataSource dataSource =
        new SingleConnectionDataSource(backend.jdbcUrl(databaseFile), true);
    try {
      ResourceDatabasePopulator populator =
          new ResourceDatabasePopulator(
              new ClassPathResource("ensembl-schema-" + backend.getValue() + ".sql"),
              new ClassPathResource("ensembl-fixture.sql"));
      DatabasePopulatorUtils.execute(populator, dataSource);
    } finally {
      dataSource.destroy();
    }
    return databaseFile;
  }
}
