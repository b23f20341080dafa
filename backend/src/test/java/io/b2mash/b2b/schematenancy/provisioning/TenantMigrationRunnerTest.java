package io.b2mash.b2b.schematenancy.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.schematenancy.config.TenancyProperties;
import io.b2mash.b2b.schematenancy.exception.MigrationFailureException;
import io.b2mash.b2b.schematenancy.multitenancy.ConnectionSchemaContext;
import io.b2mash.b2b.schematenancy.multitenancy.SchemaContextFactory;
import io.b2mash.b2b.schematenancy.tenant.Tenant;
import io.b2mash.b2b.schematenancy.tenant.TenantRepository;
import java.time.Duration;
import java.util.List;
import org.flywaydb.core.api.FlywayException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class TenantMigrationRunnerTest {

  @Mock private SchemaContextFactory schemaContexts;
  @Mock private ConnectionSchemaContext context;
  @Mock private TenantRepository tenantRepository;
  @Mock private SchemaLifecycleService schemaLifecycleService;
  @Mock private TenantMigrator tenantMigrator;

  private TenantMigrationRunner runner(boolean migrateOnStartup) {
    var properties =
        new TenancyProperties(
            "public",
            "Public",
            List.of(),
            List.of("classpath:db/migration/tenant"),
            List.of("flyway_schema_history"),
            new TenancyProperties.DomainCache(100, Duration.ofHours(1)),
            migrateOnStartup);
    return new TenantMigrationRunner(
        schemaContexts, tenantRepository, schemaLifecycleService, tenantMigrator, properties);
  }

  @Test
  void migratesEveryExistingTenantSchemaExceptPublic() {
    when(schemaContexts.open()).thenReturn(context);
    when(tenantRepository.findAll(context))
        .thenReturn(
            List.of(
                new Tenant("public", "Public"),
                new Tenant("acme", "Acme"),
                new Tenant("gone", "Gone")));
    when(schemaLifecycleService.schemaExists(context, "acme")).thenReturn(true);
    when(schemaLifecycleService.schemaExists(context, "gone")).thenReturn(false);

    var failed = runner(true).migrateAll();

    assertThat(failed).isEmpty();
    verify(tenantMigrator).migrate("acme");
    verify(tenantMigrator, never()).migrate("public");
    verify(tenantMigrator, never()).migrate("gone");
    verify(context).close();
  }

  @Test
  void continuesPastFailingSchema() {
    when(schemaContexts.open()).thenReturn(context);
    when(tenantRepository.findAll(context))
        .thenReturn(List.of(new Tenant("acme", "Acme"), new Tenant("globex", "Globex")));
    when(schemaLifecycleService.schemaExists(context, "acme")).thenReturn(true);
    when(schemaLifecycleService.schemaExists(context, "globex")).thenReturn(true);
    doThrow(new MigrationFailureException("acme", new FlywayException("checksum mismatch")))
        .when(tenantMigrator)
        .migrate("acme");

    var failed = runner(true).migrateAll();

    assertThat(failed).containsExactly("acme");
    verify(tenantMigrator).migrate("globex");
  }

  @Test
  void disabledRunnerDoesNothing() {
    runner(false).run(new DefaultApplicationArguments());

    verify(schemaContexts, never()).open();
    verify(tenantMigrator, never()).migrate(anyString());
  }
}
