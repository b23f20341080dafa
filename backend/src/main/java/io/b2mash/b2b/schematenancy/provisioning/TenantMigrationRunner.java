package io.b2mash.b2b.schematenancy.provisioning;

import io.b2mash.b2b.schematenancy.config.TenancyProperties;
import io.b2mash.b2b.schematenancy.exception.MigrationFailureException;
import io.b2mash.b2b.schematenancy.multitenancy.SchemaContextFactory;
import io.b2mash.b2b.schematenancy.tenant.Tenant;
import io.b2mash.b2b.schematenancy.tenant.TenantRepository;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Brings every existing tenant schema up to the latest tenant migration at startup. */
@Component
@Order(1)
public class TenantMigrationRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(TenantMigrationRunner.class);

  private final SchemaContextFactory schemaContexts;
  private final TenantRepository tenantRepository;
  private final SchemaLifecycleService schemaLifecycleService;
  private final TenantMigrator tenantMigrator;
  private final TenancyProperties properties;

  public TenantMigrationRunner(
      SchemaContextFactory schemaContexts,
      TenantRepository tenantRepository,
      SchemaLifecycleService schemaLifecycleService,
      TenantMigrator tenantMigrator,
      TenancyProperties properties) {
    this.schemaContexts = schemaContexts;
    this.tenantRepository = tenantRepository;
    this.schemaLifecycleService = schemaLifecycleService;
    this.tenantMigrator = tenantMigrator;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.migrateTenantsOnStartup()) {
      log.info("Tenant migrations on startup disabled");
      return;
    }
    migrateAll();
  }

  /**
   * Migrates each tenant schema that exists. A failing schema is logged and skipped so the others
   * still get migrated.
   *
   * @return schema names whose migration failed
   */
  public List<String> migrateAll() {
    List<String> schemas = new ArrayList<>();
    try (var context = schemaContexts.open()) {
      for (Tenant tenant : tenantRepository.findAll(context)) {
        String schemaName = tenant.getSchemaName();
        if (properties.publicSchemaName().equals(schemaName)) {
          continue;
        }
        if (!schemaLifecycleService.schemaExists(context, schemaName)) {
          log.warn("Schema {} for tenant {} does not exist, skipping", schemaName, tenant);
          continue;
        }
        schemas.add(schemaName);
      }
    }

    if (schemas.isEmpty()) {
      log.info("No tenant schemas found, skipping per-tenant migrations");
      return List.of();
    }

    log.info("Running tenant migrations for {} schemas", schemas.size());
    var failed = new ArrayList<String>();
    for (String schemaName : schemas) {
      try {
        tenantMigrator.migrate(schemaName);
      } catch (MigrationFailureException e) {
        log.error("Failed to migrate schema {}", schemaName, e);
        failed.add(schemaName);
      }
    }
    log.info("Tenant migration runner completed, {} failures", failed.size());
    return failed;
  }
}
