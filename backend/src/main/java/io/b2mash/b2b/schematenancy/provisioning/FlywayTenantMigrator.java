package io.b2mash.b2b.schematenancy.provisioning;

import io.b2mash.b2b.schematenancy.config.TenancyProperties;
import io.b2mash.b2b.schematenancy.exception.MigrationFailureException;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs the tenant migrations against the migration pool. Flyway keeps its own history table inside
 * each tenant schema, so re-running is a no-op once a schema is current.
 */
@Component
public class FlywayTenantMigrator implements TenantMigrator {

  private static final Logger log = LoggerFactory.getLogger(FlywayTenantMigrator.class);

  private final DataSource migrationDataSource;
  private final String[] locations;

  public FlywayTenantMigrator(
      @Qualifier("migrationDataSource") DataSource migrationDataSource,
      TenancyProperties properties) {
    this.migrationDataSource = migrationDataSource;
    this.locations = properties.tenantMigrationLocations().toArray(String[]::new);
  }

  @Override
  public void migrate(String schemaName) {
    try {
      var result =
          Flyway.configure()
              .dataSource(migrationDataSource)
              .locations(locations)
              .schemas(schemaName)
              .createSchemas(false)
              .baselineOnMigrate(true)
              .load()
              .migrate();
      log.info("Migrated schema {}: {} migrations applied", schemaName, result.migrationsExecuted);
    } catch (FlywayException e) {
      throw new MigrationFailureException(schemaName, e);
    }
  }
}
