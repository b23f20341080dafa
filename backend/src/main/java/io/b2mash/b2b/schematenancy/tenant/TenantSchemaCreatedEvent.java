package io.b2mash.b2b.schematenancy.tenant;

import java.util.UUID;

/**
 * Published synchronously after a new tenant's schema step, while the tenant can still be rolled
 * back: a listener that throws causes the tenant and its schema to be removed again.
 *
 * @param schemaCreated false when the schema already existed and creation was skipped
 */
public record TenantSchemaCreatedEvent(UUID tenantId, String schemaName, boolean schemaCreated) {}
