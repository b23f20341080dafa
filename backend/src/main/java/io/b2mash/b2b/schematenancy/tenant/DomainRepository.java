package io.b2mash.b2b.schematenancy.tenant;

import io.b2mash.b2b.schematenancy.config.TenancyProperties;
import io.b2mash.b2b.schematenancy.multitenancy.ConnectionSchemaContext;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

/** Domain routing rows. Callers pass lowercased domains; see {@link Domain#normalize}. */
@Repository
public class DomainRepository {

  private final String domainsTable;

  public DomainRepository(TenancyProperties properties) {
    this.domainsTable = properties.publicSchemaName() + ".domains";
  }

  public Optional<Domain> findByTenantAndDomain(
      ConnectionSchemaContext context, UUID tenantId, String domain) {
    return context
        .jdbc()
        .sql(
            "SELECT id, domain, tenant_id FROM "
                + domainsTable
                + " WHERE tenant_id = ? AND domain = ?")
        .params(tenantId, domain)
        .query(
            (rs, rowNum) ->
                new Domain(
                    rs.getObject("id", UUID.class),
                    rs.getString("domain"),
                    rs.getObject("tenant_id", UUID.class)))
        .optional();
  }

  /** Fails with a duplicate key error when another tenant already owns the domain. */
  public Domain insert(ConnectionSchemaContext context, UUID tenantId, String domain) {
    UUID id =
        context
            .jdbc()
            .sql("INSERT INTO " + domainsTable + " (domain, tenant_id) VALUES (?, ?) RETURNING id")
            .params(domain, tenantId)
            .query(UUID.class)
            .single();
    return new Domain(id, domain, tenantId);
  }

  public int deleteByTenantAndDomain(
      ConnectionSchemaContext context, UUID tenantId, String domain) {
    return context
        .jdbc()
        .sql("DELETE FROM " + domainsTable + " WHERE tenant_id = ? AND domain = ?")
        .params(tenantId, domain)
        .update();
  }

  public List<String> findDomainNamesByTenant(ConnectionSchemaContext context, UUID tenantId) {
    return context
        .jdbc()
        .sql("SELECT domain FROM " + domainsTable + " WHERE tenant_id = ? ORDER BY domain")
        .param(tenantId)
        .query(String.class)
        .list();
  }
}
