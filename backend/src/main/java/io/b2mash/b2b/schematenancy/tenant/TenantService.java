package io.b2mash.b2b.schematenancy.tenant;

import io.b2mash.b2b.schematenancy.config.TenancyProperties;
import io.b2mash.b2b.schematenancy.exception.ContextViolationException;
import io.b2mash.b2b.schematenancy.exception.SchemaAlreadyExistsException;
import io.b2mash.b2b.schematenancy.exception.TenantNotFoundException;
import io.b2mash.b2b.schematenancy.multitenancy.ConnectionSchemaContext;
import io.b2mash.b2b.schematenancy.multitenancy.SchemaNameValidator;
import io.b2mash.b2b.schematenancy.provisioning.SchemaLifecycleService;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Tenant lifecycle: couples the tenant row with its physical schema.
 *
 * <p>A new tenant may only be saved while the context is on the public schema. An existing tenant
 * may be updated or deleted from its own schema or from public, never from another tenant's.
 */
@Service
public class TenantService {

  private static final Logger log = LoggerFactory.getLogger(TenantService.class);

  private final TenantRepository tenantRepository;
  private final DomainRepository domainRepository;
  private final SchemaLifecycleService schemaLifecycleService;
  private final TenantResolver tenantResolver;
  private final SchemaNameValidator schemaNameValidator;
  private final ApplicationEventPublisher eventPublisher;

  public TenantService(
      TenantRepository tenantRepository,
      DomainRepository domainRepository,
      SchemaLifecycleService schemaLifecycleService,
      TenantResolver tenantResolver,
      SchemaNameValidator schemaNameValidator,
      ApplicationEventPublisher eventPublisher) {
    this.tenantRepository = tenantRepository;
    this.domainRepository = domainRepository;
    this.schemaLifecycleService = schemaLifecycleService;
    this.tenantResolver = tenantResolver;
    this.schemaNameValidator = schemaNameValidator;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Inserts or updates the tenant. For a new tenant with {@code autoCreateSchema} the schema is
   * created and migrated synchronously; if that or any {@link TenantSchemaCreatedEvent} listener
   * fails, the row is removed again and the original exception is rethrown.
   */
  public void save(ConnectionSchemaContext context, Tenant tenant) {
    if (tenant.isNew()) {
      create(context, tenant, List.of());
    } else {
      update(context, tenant);
    }
  }

  /**
   * Saves a new tenant together with its initial domains. A failing domain rolls the tenant back
   * the same way a failing schema step does.
   */
  public void create(ConnectionSchemaContext context, Tenant tenant, List<String> domains) {
    if (!tenant.isNew()) {
      throw new IllegalStateException("Tenant " + tenant.getSchemaName() + " is already saved");
    }
    if (!context.isPublic()) {
      throw ContextViolationException.forCreate(context.currentSchema());
    }
    // The public tenant row points at the shared schema and never creates it
    boolean sharedSchemaRow =
        schemaNameValidator.publicSchemaName().equals(tenant.getSchemaName())
            && !tenant.isAutoCreateSchema();
    if (!sharedSchemaRow) {
      schemaNameValidator.validate(tenant.getSchemaName());
    }

    tenantRepository.insert(context, tenant);
    log.info("Inserted tenant {} for schema {}", tenant.getId(), tenant.getSchemaName());

    Boolean schemaCreated = tenant.isAutoCreateSchema() ? null : Boolean.FALSE;
    try {
      if (tenant.isAutoCreateSchema()) {
        schemaCreated = schemaLifecycleService.createSchema(context, tenant, true, true);
        eventPublisher.publishEvent(
            new TenantSchemaCreatedEvent(tenant.getId(), tenant.getSchemaName(), schemaCreated));
      }
      domains.forEach(domain -> addDomain(context, tenant, domain));
    } catch (RuntimeException e) {
      log.error("Setup failed for tenant {}, removing it", tenant.getSchemaName(), e);
      // Never drop a schema this save did not create
      boolean dropSchema =
          schemaCreated != null ? schemaCreated : !(e instanceof SchemaAlreadyExistsException);
      compensate(context, tenant, dropSchema, e);
      throw e;
    }
    tenantResolver.evictAll();
  }

  private void update(ConnectionSchemaContext context, Tenant tenant) {
    requireOwnOrPublicContext(context, tenant, "update");
    if (tenantRepository.update(context, tenant) == 0) {
      throw new TenantNotFoundException(tenant.getSchemaName());
    }
    tenantResolver.evictAll();
  }

  public void delete(ConnectionSchemaContext context, Tenant tenant) {
    delete(context, tenant, false);
  }

  /**
   * Deletes the tenant row. The schema is dropped first, cascading to everything in it, when the
   * tenant has {@code autoDropSchema} set or {@code forceDrop} is true and the schema exists.
   */
  public void delete(ConnectionSchemaContext context, Tenant tenant, boolean forceDrop) {
    if (tenant.isNew()) {
      throw new IllegalStateException("Tenant " + tenant.getSchemaName() + " was never saved");
    }
    requireOwnOrPublicContext(context, tenant, "delete");
    remove(context, tenant, tenant.isAutoDropSchema() || forceDrop);
  }

  private void remove(ConnectionSchemaContext context, Tenant tenant, boolean dropSchema) {
    String schemaName = tenant.getSchemaName();
    if (dropSchema && schemaLifecycleService.schemaExists(context, schemaName)) {
      schemaLifecycleService.dropSchema(context, tenant);
    }
    tenantRepository.delete(context, tenant.getId());
    tenant.markDeleted();
    tenantResolver.evictAll();
    log.info("Deleted tenant {}", schemaName);
  }

  public List<String> getDomains(ConnectionSchemaContext context, Tenant tenant) {
    requireSaved(tenant);
    return domainRepository.findDomainNamesByTenant(context, tenant.getId());
  }

  /** Returns the existing domain row or creates it. The domain is stored lowercased. */
  public Domain addDomain(ConnectionSchemaContext context, Tenant tenant, String domain) {
    requireSaved(tenant);
    String normalized = Domain.normalize(domain);
    var result =
        domainRepository
            .findByTenantAndDomain(context, tenant.getId(), normalized)
            .orElseGet(() -> domainRepository.insert(context, tenant.getId(), normalized));
    tenantResolver.evict(normalized);
    return result;
  }

  /** Returns the number of rows removed, 0 when the tenant did not own the domain. */
  public int removeDomain(ConnectionSchemaContext context, Tenant tenant, String domain) {
    requireSaved(tenant);
    String normalized = Domain.normalize(domain);
    int removed = domainRepository.deleteByTenantAndDomain(context, tenant.getId(), normalized);
    tenantResolver.evict(normalized);
    return removed;
  }

  public Optional<Tenant> findBySchemaName(ConnectionSchemaContext context, String schemaName) {
    return tenantRepository.findBySchemaName(context, SchemaNameValidator.normalize(schemaName));
  }

  public Tenant requireBySchemaName(ConnectionSchemaContext context, String schemaName) {
    return findBySchemaName(context, schemaName)
        .orElseThrow(() -> new TenantNotFoundException(schemaName));
  }

  public List<Tenant> findAll(ConnectionSchemaContext context) {
    return tenantRepository.findAll(context);
  }

  private void compensate(
      ConnectionSchemaContext context, Tenant tenant, boolean dropSchema, RuntimeException cause) {
    try {
      // autoDropSchema is ignored here; only a schema this save created is dropped
      remove(context, tenant, dropSchema);
    } catch (RuntimeException e) {
      log.error("Failed to remove tenant {} after setup failure", tenant.getSchemaName(), e);
      cause.addSuppressed(e);
    }
  }

  private static void requireOwnOrPublicContext(
      ConnectionSchemaContext context, Tenant tenant, String operation) {
    if (!context.isPublic() && !context.isCurrent(tenant.getSchemaName())) {
      throw ContextViolationException.forMutation(
          operation, tenant.getSchemaName(), context.currentSchema());
    }
  }

  private static void requireSaved(Tenant tenant) {
    if (tenant.isNew()) {
      throw new IllegalStateException("Tenant " + tenant.getSchemaName() + " was never saved");
    }
  }
}
