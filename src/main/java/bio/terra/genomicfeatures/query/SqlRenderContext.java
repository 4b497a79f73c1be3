package bio.terra.genomicfeatures.query;

import com.google.common.annotations.VisibleForTesting;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/** State for rendering one SQL statement: the target backend and the table aliases handed out. */
public class SqlRenderContext {
  private final BackendKind backend;
  private final Map<TableVariable, String> aliases = new HashMap<>();

  public SqlRenderContext(BackendKind backend) {
    this.backend = backend;
  }

  public BackendKind getBackend() {
    return backend;
  }

  /**
   * The default table alias is the first letter of each element in table name, where elements are
   * separated by a `_`. For example, the default alias for table `uniprot_xref` will be `ux`.
   */
  @VisibleForTesting
  static String getDefaultAlias(String tableName) {
    return Arrays.stream(tableName.split("_"))
        .filter(part -> !part.isEmpty())
        .map(part -> part.toLowerCase().substring(0, 1))
        .collect(Collectors.joining());
  }

  /**
   * Given a {@link TableVariable}, return an alias for a generated SQL query. Either an existing
   * alias is returned, or a new alias is generated based on the table name.
   */
  public String getAlias(TableVariable tableVariable) {
    return aliases.computeIfAbsent(
        tableVariable,
        key -> {
          // Append successively higher integers to the default alias until it is unused.
          String defaultAlias = getDefaultAlias(key.tablePointer().tableName());
          String alias = defaultAlias;
          int suffix = 1;
          while (aliases.containsValue(alias)) {
            alias = defaultAlias + suffix++;
          }
          return alias;
        });
  }
}
