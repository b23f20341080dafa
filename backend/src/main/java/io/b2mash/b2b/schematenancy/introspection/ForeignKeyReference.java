package io.b2mash.b2b.schematenancy.introspection;

/**
 * Target of a foreign key. {@code table} is schema-qualified ({@code schema.table}) only when the
 * referenced table lives outside the schema being introspected; {@code column} never carries a
 * qualifier.
 */
public record ForeignKeyReference(String table, String column) {}
