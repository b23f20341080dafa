package io.b2mash.b2b.schematenancy.multitenancy;

/**
 * The only place where schema identifiers are interpolated into SQL text. Every builder validates
 * the name first; identifiers cannot be bound as parameters.
 */
public final class SchemaStatements {

  private final SchemaNameValidator validator;
  private final String publicSchemaName;

  public SchemaStatements(SchemaNameValidator validator) {
    this.validator = validator;
    this.publicSchemaName = validator.publicSchemaName();
  }

  public String publicSchemaName() {
    return publicSchemaName;
  }

  public String createSchema(String schemaName) {
    validator.validate(schemaName);
    return "CREATE SCHEMA " + schemaName;
  }

  public String dropSchemaCascade(String schemaName) {
    validator.validate(schemaName);
    return "DROP SCHEMA " + schemaName + " CASCADE";
  }

  /** Tenant schema first so shared tables in public stay visible as a fallback. */
  public String searchPath(String schemaName) {
    if (publicSchemaName.equals(schemaName)) {
      return publicSearchPath();
    }
    validator.validate(schemaName);
    return "SET search_path TO " + schemaName + ", " + publicSchemaName;
  }

  public String publicSearchPath() {
    return "SET search_path TO " + publicSchemaName;
  }
}
