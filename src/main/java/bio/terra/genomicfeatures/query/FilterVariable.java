package bio.terra.genomicfeatures.query;

/** A boolean SQL expression usable in a WHERE clause. */
public interface FilterVariable extends SqlExpression {}
