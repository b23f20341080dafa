package io.b2mash.b2b.schematenancy.provisioning;

/** Applies the tenant migration set to one schema. */
public interface TenantMigrator {

  /**
   * @throws io.b2mash.b2b.schematenancy.exception.MigrationFailureException if any migration fails
   */
  void migrate(String schemaName);
}
