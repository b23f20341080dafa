package io.b2mash.b2b.schematenancy.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;

import io.b2mash.b2b.schematenancy.TestcontainersConfiguration;
import io.b2mash.b2b.schematenancy.exception.ContextViolationException;
import io.b2mash.b2b.schematenancy.exception.MigrationFailureException;
import io.b2mash.b2b.schematenancy.multitenancy.ConnectionSchemaContext;
import io.b2mash.b2b.schematenancy.multitenancy.SchemaContextFactory;
import io.b2mash.b2b.schematenancy.provisioning.TenantMigrationRunner;
import io.b2mash.b2b.schematenancy.provisioning.TenantMigrator;
import java.util.List;
import java.util.UUID;
import org.flywaydb.core.api.FlywayException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class TenantLifecycleIntegrationTest {

  @Autowired private SchemaContextFactory schemaContexts;
  @Autowired private TenantService tenantService;
  @Autowired private TenantResolver tenantResolver;
  @Autowired private TenantMigrationRunner tenantMigrationRunner;

  @MockitoSpyBean private TenantMigrator tenantMigrator;

  private static String uniqueSchema(String prefix) {
    return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }

  private Tenant createTenant(ConnectionSchemaContext context, String schemaName) {
    var tenant = new Tenant(schemaName, "Tenant " + schemaName);
    tenantService.save(context, tenant);
    return tenant;
  }

  @Test
  void createdTenantHasMigratedSchemaAndContextIsPublic() {
    String schema = uniqueSchema("create");
    try (var context = schemaContexts.open()) {
      var tenant = createTenant(context, schema);

      assertThat(tenant.getId()).isNotNull();
      assertThat(tenant.getCreatedOn()).isNotNull();
      assertThat(context.schemaExists(schema)).isTrue();
      assertThat(context.isPublic()).isTrue();

      context.setSchema(schema);
      Integer projects =
          context.jdbc().sql("SELECT count(*) FROM projects").query(Integer.class).single();
      assertThat(projects).isZero();
    }
  }

  @Test
  void mixedCaseSchemaNameIsStoredLowercase() {
    String schema = uniqueSchema("mixed");
    try (var context = schemaContexts.open()) {
      createTenant(context, schema.toUpperCase());

      assertThat(tenantService.findBySchemaName(context, schema)).isPresent();
      assertThat(context.schemaExists(schema)).isTrue();
    }
  }

  @Test
  void migrationFailureLeavesNoRowNoSchemaAndPublicContext() {
    String schema = uniqueSchema("broken");
    doThrow(new MigrationFailureException(schema, new FlywayException("broken migration")))
        .when(tenantMigrator)
        .migrate(schema);

    try (var context = schemaContexts.open()) {
      var tenant = new Tenant(schema, "Broken");

      assertThatThrownBy(() -> tenantService.save(context, tenant))
          .isInstanceOf(MigrationFailureException.class);

      assertThat(tenant.isNew()).isTrue();
      assertThat(tenantService.findBySchemaName(context, schema)).isEmpty();
      assertThat(context.schemaExists(schema)).isFalse();
      assertThat(context.isPublic()).isTrue();
    }
  }

  @Test
  void duplicateSchemaNameIsRejectedByUniqueConstraint() {
    String schema = uniqueSchema("dup");
    try (var context = schemaContexts.open()) {
      createTenant(context, schema);

      assertThatThrownBy(() -> createTenant(context, schema))
          .isInstanceOf(DataIntegrityViolationException.class);
      assertThat(context.schemaExists(schema)).isTrue();
    }
  }

  @Test
  void conflictingInitialDomainKeepsAdoptedSchemaAndItsData() {
    String owner = uniqueSchema("owner");
    String legacy = uniqueSchema("legacy");
    String domain = owner + ".example.net";
    try (var context = schemaContexts.open()) {
      var ownerTenant = createTenant(context, owner);
      tenantService.addDomain(context, ownerTenant, domain);
      context.jdbc().sql("CREATE SCHEMA " + legacy).update();
      context.jdbc().sql("CREATE TABLE " + legacy + ".ledger (entry TEXT)").update();
      context.jdbc().sql("INSERT INTO " + legacy + ".ledger VALUES ('kept')").update();

      var tenant = new Tenant(legacy, "Legacy");
      assertThatThrownBy(() -> tenantService.create(context, tenant, List.of(domain)))
          .isInstanceOf(DataIntegrityViolationException.class);

      assertThat(tenantService.findBySchemaName(context, legacy)).isEmpty();
      assertThat(context.schemaExists(legacy)).isTrue();
      Integer rows =
          context
              .jdbc()
              .sql("SELECT count(*) FROM " + legacy + ".ledger")
              .query(Integer.class)
              .single();
      assertThat(rows).isEqualTo(1);
      assertThat(context.isPublic()).isTrue();
    }
  }

  @Test
  void domainsAreStoredLowercase() {
    String schema = uniqueSchema("domains");
    try (var context = schemaContexts.open()) {
      var tenant = createTenant(context, schema);

      tenantService.addDomain(context, tenant, schema + ".Example.COM");
      tenantService.addDomain(context, tenant, schema + ".example.com");

      assertThat(tenantService.getDomains(context, tenant))
          .containsExactly(schema + ".example.com");
      assertThat(tenantService.removeDomain(context, tenant, schema + ".EXAMPLE.com"))
          .isEqualTo(1);
      assertThat(tenantService.getDomains(context, tenant)).isEmpty();
    }
  }

  @Test
  void domainResolutionFallsBackToPublicTenant() {
    String schema = uniqueSchema("resolve");
    try (var context = schemaContexts.open()) {
      var tenant = createTenant(context, schema);
      tenantService.addDomain(context, tenant, schema + ".example.org");

      var owner = tenantResolver.getForDomain(context, schema.toUpperCase() + ".EXAMPLE.org");
      assertThat(owner.getId()).isEqualTo(tenant.getId());
      assertThat(tenantResolver.getForDomain(context, "nobody-" + schema + ".example.org"))
          .extracting(Tenant::getSchemaName)
          .isEqualTo("public");
    }
  }

  @Test
  void deleteWithoutAutoDropKeepsSchema() {
    String schema = uniqueSchema("keep");
    try (var context = schemaContexts.open()) {
      var tenant = createTenant(context, schema);

      tenantService.delete(context, tenant);

      assertThat(tenantService.findBySchemaName(context, schema)).isEmpty();
      assertThat(context.schemaExists(schema)).isTrue();
    }
  }

  @Test
  void deleteFromOwnSchemaWithAutoDropReturnsContextToPublic() {
    String schema = uniqueSchema("drop");
    try (var context = schemaContexts.open()) {
      var tenant = new Tenant(schema, "Dropped");
      tenant.setAutoDropSchema(true);
      tenantService.save(context, tenant);
      tenantService.addDomain(context, tenant, schema + ".example.net");

      context.setSchema(schema);
      tenantService.delete(context, tenant);

      assertThat(context.isPublic()).isTrue();
      assertThat(context.schemaExists(schema)).isFalse();
      assertThat(tenantResolver.getForDomain(context, schema + ".example.net").getSchemaName())
          .isEqualTo("public");
    }
  }

  @Test
  void updateUnderUnrelatedSchemaIsRejectedAndRowUnchanged() {
    String first = uniqueSchema("first");
    String second = uniqueSchema("second");
    try (var context = schemaContexts.open()) {
      var tenant = createTenant(context, first);
      createTenant(context, second);

      context.setSchema(second);
      tenant.rename("Renamed");
      assertThatThrownBy(() -> tenantService.save(context, tenant))
          .isInstanceOf(ContextViolationException.class);
      assertThatThrownBy(() -> tenantService.delete(context, tenant))
          .isInstanceOf(ContextViolationException.class);

      context.setToPublic();
      assertThat(tenantService.requireBySchemaName(context, first).getName())
          .isEqualTo("Tenant " + first);
    }
  }

  @Test
  void updateFromOwnSchemaIsAllowed() {
    String schema = uniqueSchema("own");
    try (var context = schemaContexts.open()) {
      var tenant = createTenant(context, schema);

      context.setSchema(schema);
      tenant.rename("Renamed");
      tenantService.save(context, tenant);
      context.setToPublic();

      assertThat(tenantService.requireBySchemaName(context, schema).getName())
          .isEqualTo("Renamed");
    }
  }

  @Test
  void newTenantCannotBeCreatedOutsidePublic() {
    String existing = uniqueSchema("host");
    try (var context = schemaContexts.open()) {
      createTenant(context, existing);
      context.setSchema(existing);

      assertThatThrownBy(() -> createTenant(context, uniqueSchema("guest")))
          .isInstanceOf(ContextViolationException.class);
    }
  }

  @Test
  void tenantsAreIsolatedBySearchPath() {
    String first = uniqueSchema("iso_a");
    String second = uniqueSchema("iso_b");
    try (var context = schemaContexts.open()) {
      createTenant(context, first);
      createTenant(context, second);

      context.setSchema(first);
      context
          .jdbc()
          .sql("INSERT INTO projects (code, name) VALUES ('P1', 'Only in first')")
          .update();

      context.setSchema(second);
      assertThat(context.jdbc().sql("SELECT count(*) FROM projects").query(Integer.class).single())
          .isZero();

      context.setSchema(first);
      assertThat(context.jdbc().sql("SELECT count(*) FROM projects").query(Integer.class).single())
          .isEqualTo(1);
    }
  }

  @Test
  void closedContextHandsBackPublicSearchPath() {
    String schema = uniqueSchema("pooled");
    try (var context = schemaContexts.open()) {
      createTenant(context, schema);
      context.setSchema(schema);
    }

    try (var context = schemaContexts.open()) {
      String searchPath = context.jdbc().sql("SHOW search_path").query(String.class).single();
      assertThat(searchPath).isEqualTo("public");
    }
  }

  @Test
  void migrationRunnerReappliesMigrationsToExistingSchemas() {
    String schema = uniqueSchema("rerun");
    try (var context = schemaContexts.open()) {
      createTenant(context, schema);
    }

    assertThat(tenantMigrationRunner.migrateAll()).isEmpty();
  }
}
