package bio.terra.genomicfeatures.query;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * An interface for the value of a cell within a row within a result table.
 *
 * <p>This interface allows us to read data from different databases in a simple but uniform way.
 * Different database types should implement this for returning values.
 */
public interface CellValue {
  /** Enum for the SQL data types of annotation table columns. */
  enum SQLDataType {
    INT64,
    STRING,
    BOOLEAN,
    DATE,
    FLOAT
  }

  /** The type of data in this cell. */
  SQLDataType dataType();

  /**
   * Returns this field's value as a long or empty if the value is null.
   *
   * @throws IllegalArgumentException if the cell's value is not a long
   */
  OptionalLong getLong();

  /**
   * Returns this field's value as a string or empty if the value is null.
   *
   * @throws IllegalArgumentException if the cell's value is not a string
   */
  Optional<String> getString();

  /**
   * Returns this field's value as a double or empty if the value is null.
   *
   * @throws IllegalArgumentException if the cell's value is not a double
   */
  OptionalDouble getDouble();

  /**
   * Returns this field's value as a boolean or empty if the value is null.
   *
   * @throws IllegalArgumentException if the cell's value is not a boolean
   */
  Optional<Boolean> getBoolean();

  /** Returns this field's value as a {@link Literal}, or empty if the value is null. */
  Optional<Literal> getLiteral();
}
