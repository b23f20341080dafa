package io.b2mash.b2b.schematenancy.provisioning;

import io.b2mash.b2b.schematenancy.config.TenancyProperties;
import io.b2mash.b2b.schematenancy.multitenancy.SchemaContextFactory;
import io.b2mash.b2b.schematenancy.tenant.Tenant;
import io.b2mash.b2b.schematenancy.tenant.TenantRepository;
import io.b2mash.b2b.schematenancy.tenant.TenantService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Makes sure a tenant row exists for the public schema. Domain lookups fall back to it, so it has
 * to be there before the first request is routed.
 */
@Component
@Order(0)
public class PublicTenantBootstrapper implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(PublicTenantBootstrapper.class);

  private final SchemaContextFactory schemaContexts;
  private final TenantRepository tenantRepository;
  private final TenantService tenantService;
  private final TenancyProperties properties;

  public PublicTenantBootstrapper(
      SchemaContextFactory schemaContexts,
      TenantRepository tenantRepository,
      TenantService tenantService,
      TenancyProperties properties) {
    this.schemaContexts = schemaContexts;
    this.tenantRepository = tenantRepository;
    this.tenantService = tenantService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    String publicSchema = properties.publicSchemaName();
    try (var context = schemaContexts.open()) {
      if (tenantRepository.findBySchemaName(context, publicSchema).isPresent()) {
        log.debug("Public tenant already present");
        return;
      }
      var publicTenant = new Tenant(publicSchema, properties.publicTenantName());
      publicTenant.setAutoCreateSchema(false);
      tenantService.save(context, publicTenant);
      log.info("Bootstrapped public tenant for schema '{}'", publicSchema);
    }
  }
}
