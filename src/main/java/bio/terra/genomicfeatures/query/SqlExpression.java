package bio.terra.genomicfeatures.query;

public interface SqlExpression {
  String renderSQL(SqlRenderContext context);
}
