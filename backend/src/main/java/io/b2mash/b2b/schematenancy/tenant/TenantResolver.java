package io.b2mash.b2b.schematenancy.tenant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.schematenancy.config.TenancyProperties;
import io.b2mash.b2b.schematenancy.exception.TenantNotFoundException;
import io.b2mash.b2b.schematenancy.multitenancy.ConnectionSchemaContext;
import org.springframework.stereotype.Component;

/**
 * Maps a domain to the tenant that serves it. Unknown domains fall back to the public tenant.
 *
 * <p>Resolved schema names are cached per domain; {@link TenantService} evicts entries whenever
 * domains or tenants change.
 */
@Component
public class TenantResolver {

  private final TenantRepository tenantRepository;
  private final String publicSchemaName;
  private final Cache<String, String> schemaCache;

  public TenantResolver(TenantRepository tenantRepository, TenancyProperties properties) {
    this.tenantRepository = tenantRepository;
    this.publicSchemaName = properties.publicSchemaName();
    this.schemaCache =
        Caffeine.newBuilder()
            .maximumSize(properties.domainCache().maximumSize())
            .expireAfterWrite(properties.domainCache().expireAfterWrite())
            .build();
  }

  /** Returns the schema name routing {@code domain}, the public schema when nobody owns it. */
  public String resolveSchema(ConnectionSchemaContext context, String domain) {
    // Loading holds the entry, so a concurrent evict waits for it and then discards the result
    return schemaCache.get(
        Domain.normalize(domain),
        normalized ->
            tenantRepository
                .findByDomain(context, normalized)
                .map(Tenant::getSchemaName)
                .orElse(publicSchemaName));
  }

  /**
   * Returns the tenant owning {@code domain}, case-insensitively, or the public tenant.
   *
   * @throws TenantNotFoundException if the domain is unknown and no public tenant exists
   */
  public Tenant getForDomain(ConnectionSchemaContext context, String domain) {
    String schemaName = resolveSchema(context, domain);
    return tenantRepository
        .findBySchemaName(context, schemaName)
        .orElseGet(
            () -> {
              // Owner went away between lookups
              schemaCache.invalidate(Domain.normalize(domain));
              return getPublic(context);
            });
  }

  public Tenant getPublic(ConnectionSchemaContext context) {
    return tenantRepository
        .findBySchemaName(context, publicSchemaName)
        .orElseThrow(() -> new TenantNotFoundException(publicSchemaName));
  }

  public void evict(String domain) {
    schemaCache.invalidate(Domain.normalize(domain));
  }

  public void evictAll() {
    schemaCache.invalidateAll();
  }
}
