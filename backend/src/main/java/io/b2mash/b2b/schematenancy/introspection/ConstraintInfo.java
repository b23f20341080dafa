package io.b2mash.b2b.schematenancy.introspection;

import java.util.List;

/**
 * A key, check constraint or index on one table.
 *
 * @param columns constrained columns in key order
 * @param primaryKey whether this is the primary key (or the index backing it)
 * @param unique whether values must be unique
 * @param foreignKey referenced table and column, or null when not a foreign key
 * @param check whether this is a CHECK constraint
 * @param index whether an index exists under this name
 */
public record ConstraintInfo(
    List<String> columns,
    boolean primaryKey,
    boolean unique,
    ForeignKeyReference foreignKey,
    boolean check,
    boolean index) {}
