package bio.terra.genomicfeatures.annotation;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import bio.terra.genomicfeatures.common.category.Unit;
import bio.terra.genomicfeatures.common.exception.InternalServerErrorException;
import bio.terra.genomicfeatures.query.BackendKind;
import java.sql.SQLException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

@ExtendWith(MockitoExtension.class)
@Tag(Unit.TAG)
class AnnotationDbLifecycleTest {
  @Mock private SingleConnectionDataSource dataSource;

  @Test
  void dataSourceIsDestroyedWhenTheSchemaCannotBeRead() throws SQLException {
    when(dataSource.getConnection()).thenThrow(new SQLException("database is locked"));

    assertThrows(
        InternalServerErrorException.class, () -> new AnnotationDb(dataSource, BackendKind.SQLITE));
    verify(dataSource).destroy();
  }
}
