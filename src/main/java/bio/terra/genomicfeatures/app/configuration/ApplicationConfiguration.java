package bio.terra.genomicfeatures.app.configuration;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@ComponentScan(basePackages = "bio.terra.genomicfeatures")
public class ApplicationConfiguration {}
