package io.b2mash.b2b.schematenancy.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for schema routing and tenant provisioning.
 *
 * @param publicSchemaName the shared schema holding tenant metadata and fallback tables
 * @param publicTenantName display name of the tenant row bootstrapped for the public schema
 * @param reservedSchemaNames extra names no tenant may claim, on top of the built-in reserved list
 * @param tenantMigrationLocations Flyway locations applied to every tenant schema
 * @param ignoredTables tables hidden from introspection table listings
 * @param domainCache sizing of the domain to tenant resolution cache
 * @param migrateTenantsOnStartup whether tenant migrations are re-applied to every schema at boot
 */
@ConfigurationProperties(prefix = "tenancy")
public record TenancyProperties(
    @DefaultValue("public") String publicSchemaName,
    @DefaultValue("Public") String publicTenantName,
    @DefaultValue List<String> reservedSchemaNames,
    @DefaultValue("classpath:db/migration/tenant") List<String> tenantMigrationLocations,
    @DefaultValue("flyway_schema_history") List<String> ignoredTables,
    @DefaultValue DomainCache domainCache,
    @DefaultValue("true") boolean migrateTenantsOnStartup) {

  public record DomainCache(
      @DefaultValue("10000") long maximumSize,
      @DefaultValue("1h") Duration expireAfterWrite) {}
}
