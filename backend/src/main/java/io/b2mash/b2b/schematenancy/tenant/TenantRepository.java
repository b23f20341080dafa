package io.b2mash.b2b.schematenancy.tenant;

import io.b2mash.b2b.schematenancy.config.TenancyProperties;
import io.b2mash.b2b.schematenancy.multitenancy.ConnectionSchemaContext;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

/**
 * Tenant rows in the public schema. Every statement runs on the caller's context so row changes and
 * schema changes share one connection; table names are qualified, so the current search path does
 * not matter.
 */
@Repository
public class TenantRepository {

  private static final String COLUMNS =
      "t.id, t.schema_name, t.name, t.created_on, t.auto_create_schema, t.auto_drop_schema";

  private final String tenantsTable;
  private final String domainsTable;

  public TenantRepository(TenancyProperties properties) {
    this.tenantsTable = properties.publicSchemaName() + ".tenants";
    this.domainsTable = properties.publicSchemaName() + ".domains";
  }

  public void insert(ConnectionSchemaContext context, Tenant tenant) {
    var identity =
        context
            .jdbc()
            .sql(
                "INSERT INTO "
                    + tenantsTable
                    + " (schema_name, name, auto_create_schema, auto_drop_schema)"
                    + " VALUES (?, ?, ?, ?) RETURNING id, created_on")
            .params(
                tenant.getSchemaName(),
                tenant.getName(),
                tenant.isAutoCreateSchema(),
                tenant.isAutoDropSchema())
            .query(
                (rs, rowNum) ->
                    new Identity(
                        rs.getObject("id", UUID.class),
                        rs.getObject("created_on", LocalDate.class)))
            .single();
    tenant.markSaved(identity.id(), identity.createdOn());
  }

  /** Returns the number of rows updated. Schema name and creation date never change. */
  public int update(ConnectionSchemaContext context, Tenant tenant) {
    return context
        .jdbc()
        .sql(
            "UPDATE "
                + tenantsTable
                + " SET name = ?, auto_create_schema = ?, auto_drop_schema = ? WHERE id = ?")
        .params(
            tenant.getName(),
            tenant.isAutoCreateSchema(),
            tenant.isAutoDropSchema(),
            tenant.getId())
        .update();
  }

  public int delete(ConnectionSchemaContext context, UUID id) {
    return context.jdbc().sql("DELETE FROM " + tenantsTable + " WHERE id = ?").param(id).update();
  }

  public Optional<Tenant> findById(ConnectionSchemaContext context, UUID id) {
    return context
        .jdbc()
        .sql("SELECT " + COLUMNS + " FROM " + tenantsTable + " t WHERE t.id = ?")
        .param(id)
        .query(TenantRepository::mapTenant)
        .optional();
  }

  public Optional<Tenant> findBySchemaName(ConnectionSchemaContext context, String schemaName) {
    return context
        .jdbc()
        .sql("SELECT " + COLUMNS + " FROM " + tenantsTable + " t WHERE t.schema_name = ?")
        .param(schemaName)
        .query(TenantRepository::mapTenant)
        .optional();
  }

  /** Expects an already lowercased domain. */
  public Optional<Tenant> findByDomain(ConnectionSchemaContext context, String domain) {
    return context
        .jdbc()
        .sql(
            "SELECT "
                + COLUMNS
                + " FROM "
                + tenantsTable
                + " t JOIN "
                + domainsTable
                + " d ON d.tenant_id = t.id WHERE d.domain = ?")
        .param(domain)
        .query(TenantRepository::mapTenant)
        .optional();
  }

  public List<Tenant> findAll(ConnectionSchemaContext context) {
    return context
        .jdbc()
        .sql("SELECT " + COLUMNS + " FROM " + tenantsTable + " t ORDER BY t.schema_name")
        .query(TenantRepository::mapTenant)
        .list();
  }

  public List<TenantListing> findAllListings(ConnectionSchemaContext context) {
    return context
        .jdbc()
        .sql(
            "SELECT t.schema_name, COALESCE(string_agg(d.domain, ', ' ORDER BY d.domain), '')"
                + " FROM "
                + tenantsTable
                + " t LEFT JOIN "
                + domainsTable
                + " d ON d.tenant_id = t.id"
                + " GROUP BY t.schema_name ORDER BY t.schema_name")
        .query((rs, rowNum) -> new TenantListing(rs.getString(1), rs.getString(2)))
        .list();
  }

  private static Tenant mapTenant(ResultSet rs, int rowNum) throws SQLException {
    return new Tenant(
        rs.getObject("id", UUID.class),
        rs.getString("schema_name"),
        rs.getString("name"),
        rs.getObject("created_on", LocalDate.class),
        rs.getBoolean("auto_create_schema"),
        rs.getBoolean("auto_drop_schema"));
  }

  private record Identity(UUID id, LocalDate createdOn) {}
}
