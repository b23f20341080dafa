package io.b2mash.b2b.schematenancy.tenant;

/**
 * One line of the tenant report.
 *
 * @param schemaName the tenant's schema
 * @param domains the tenant's domains joined with ", ", empty when it has none
 */
public record TenantListing(String schemaName, String domains) {}
