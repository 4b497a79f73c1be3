package bio.terra.genomicfeatures.app.configuration;

import bio.terra.genomicfeatures.query.BackendKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Where annotation databases are found, and which backend opens them by default. */
@Configuration
@EnableConfigurationProperties
@ConfigurationProperties(prefix = "genomicfeatures.annotation")
public class AnnotationConfiguration {

  private String cacheDirectory;
  private BackendKind defaultBackend = BackendKind.SQLITE;

  public String getCacheDirectory() {
    return cacheDirectory;
  }

  public void setCacheDirectory(String cacheDirectory) {
    this.cacheDirectory = cacheDirectory;
  }

  public BackendKind getDefaultBackend() {
    return defaultBackend;
  }

  public void setDefaultBackend(BackendKind defaultBackend) {
    this.defaultBackend = defaultBackend;
  }
}
