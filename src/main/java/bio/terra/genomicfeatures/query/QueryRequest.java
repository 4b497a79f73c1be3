package bio.terra.genomicfeatures.query;

/** The request for a query to execute against a database backend. */
public record QueryRequest(Query query, ColumnHeaderSchema columnHeaderSchema) {}
