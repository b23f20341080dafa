package io.b2mash.b2b.schematenancy.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.schematenancy.exception.InvalidSchemaNameException;
import org.junit.jupiter.api.Test;

class SchemaStatementsTest {

  private final SchemaStatements statements =
      new SchemaStatements(new SchemaNameValidator("public"));

  @Test
  void buildsCreateAndDrop() {
    assertThat(statements.createSchema("tenant1")).isEqualTo("CREATE SCHEMA tenant1");
    assertThat(statements.dropSchemaCascade("tenant1")).isEqualTo("DROP SCHEMA tenant1 CASCADE");
  }

  @Test
  void tenantSearchPathKeepsPublicAsFallback() {
    assertThat(statements.searchPath("tenant1")).isEqualTo("SET search_path TO tenant1, public");
  }

  @Test
  void publicSearchPathHasNoFallback() {
    assertThat(statements.searchPath("public")).isEqualTo("SET search_path TO public");
    assertThat(statements.publicSearchPath()).isEqualTo("SET search_path TO public");
  }

  @Test
  void refusesToBuildStatementsForInvalidNames() {
    assertThatThrownBy(() -> statements.createSchema("x; DROP SCHEMA public"))
        .isInstanceOf(InvalidSchemaNameException.class);
    assertThatThrownBy(() -> statements.dropSchemaCascade("public"))
        .isInstanceOf(InvalidSchemaNameException.class);
    assertThatThrownBy(() -> statements.searchPath("pg_catalog"))
        .isInstanceOf(InvalidSchemaNameException.class);
  }
}
