package bio.terra.genomicfeatures.annotation;

import bio.terra.genomicfeatures.annotation.exception.AnnotationNotFoundException;
import bio.terra.genomicfeatures.app.configuration.AnnotationConfiguration;
import bio.terra.genomicfeatures.query.BackendKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Finds annotation databases in the local cache directory and opens them. */
@Component
public class AnnotationService {
  private static final Logger logger = LoggerFactory.getLogger(AnnotationService.class);

  private final AnnotationConfiguration annotationConfiguration;

  @Autowired
  public AnnotationService(AnnotationConfiguration annotationConfiguration) {
    this.annotationConfiguration = annotationConfiguration;
  }

  /** Open the annotation database for a species and Ensembl release with the default backend. */
  public AnnotationDb openBackend(String species, int release) {
    return openBackend(species, release, annotationConfiguration.getDefaultBackend());
  }

  /**
   * Open the annotation database for a species and Ensembl release. The caller owns the returned
   * handle and must close it.
   *
   * @throws AnnotationNotFoundException if the cache holds no such database for the backend
   */
  public AnnotationDb openBackend(String species, int release, BackendKind backend) {
    Path databaseFile = getDatabaseFile(species, release, backend);
    if (!Files.isRegularFile(databaseFile)) {
      throw new AnnotationNotFoundException(
          "No %s annotation database for %s release %d".formatted(backend, species, release),
          List.of("Expected file: " + databaseFile));
    }
    logger.info("Found annotation database {}", databaseFile);
    return AnnotationDb.open(databaseFile, backend);
  }

  /** The path of the cached database file, e.g. {@code EnsDb.Hsapiens.v108.sqlite}. */
  public Path getDatabaseFile(String species, int release, BackendKind backend) {
    if (StringUtils.isBlank(species)) {
      throw new IllegalArgumentException("Species must be provided");
    }
    if (StringUtils.isBlank(annotationConfiguration.getCacheDirectory())) {
      throw new IllegalStateException("No annotation cache directory is configured");
    }
    String fileName =
        "EnsDb.%s.v%d.%s"
            .formatted(StringUtils.capitalize(species), release, backend.getFileExtension());
    return Path.of(annotationConfiguration.getCacheDirectory()).resolve(fileName);
  }
}
