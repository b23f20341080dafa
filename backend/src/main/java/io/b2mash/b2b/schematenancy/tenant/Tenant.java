package io.b2mash.b2b.schematenancy.tenant;

import io.b2mash.b2b.schematenancy.multitenancy.SchemaNameValidator;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A tenant mapped to its own PostgreSQL schema. Plain data: creating and dropping the schema is
 * {@link TenantService}'s job, not the entity's.
 */
public class Tenant {

  private UUID id;
  private final String schemaName;
  private String name;
  private LocalDate createdOn;
  private boolean autoCreateSchema = true;
  private boolean autoDropSchema;

  public Tenant(String schemaName, String name) {
    this.schemaName = SchemaNameValidator.normalize(schemaName);
    this.name = name;
  }

  Tenant(
      UUID id,
      String schemaName,
      String name,
      LocalDate createdOn,
      boolean autoCreateSchema,
      boolean autoDropSchema) {
    this.id = id;
    this.schemaName = schemaName;
    this.name = name;
    this.createdOn = createdOn;
    this.autoCreateSchema = autoCreateSchema;
    this.autoDropSchema = autoDropSchema;
  }

  public UUID getId() {
    return id;
  }

  public String getSchemaName() {
    return schemaName;
  }

  public String getName() {
    return name;
  }

  public LocalDate getCreatedOn() {
    return createdOn;
  }

  /** Whether saving a new tenant creates and migrates its schema. Defaults to true. */
  public boolean isAutoCreateSchema() {
    return autoCreateSchema;
  }

  /**
   * Whether deleting the tenant drops its schema and everything in it. Defaults to false; use with
   * caution.
   */
  public boolean isAutoDropSchema() {
    return autoDropSchema;
  }

  public boolean isNew() {
    return id == null;
  }

  public void rename(String name) {
    this.name = name;
  }

  public void setAutoCreateSchema(boolean autoCreateSchema) {
    this.autoCreateSchema = autoCreateSchema;
  }

  public void setAutoDropSchema(boolean autoDropSchema) {
    this.autoDropSchema = autoDropSchema;
  }

  void markSaved(UUID id, LocalDate createdOn) {
    this.id = id;
    this.createdOn = createdOn;
  }

  void markDeleted() {
    this.id = null;
  }

  @Override
  public String toString() {
    return name;
  }
}
