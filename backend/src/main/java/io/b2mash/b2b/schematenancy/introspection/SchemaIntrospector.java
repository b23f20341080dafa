package io.b2mash.b2b.schematenancy.introspection;

import io.b2mash.b2b.schematenancy.config.TenancyProperties;
import io.b2mash.b2b.schematenancy.introspection.TableInfo.TableType;
import io.b2mash.b2b.schematenancy.multitenancy.ConnectionSchemaContext;
import java.sql.Array;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads table and constraint metadata for the schema a {@link ConnectionSchemaContext} currently
 * points at. Nothing here takes a schema name; callers scope the context first.
 */
@Component
public class SchemaIntrospector {

  private static final Logger log = LoggerFactory.getLogger(SchemaIntrospector.class);

  private static final String TABLE_LIST_SQL =
      """
      SELECT c.relname, c.relkind
      FROM pg_catalog.pg_class c
      JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
      WHERE c.relkind IN ('r', 'v')
        AND n.nspname = ?
        AND pg_catalog.pg_table_is_visible(c.oid)
      ORDER BY c.relname
      """;

  // PKs, FKs and uniques. FK targets come from pg_constraint so no name splitting is needed.
  private static final String KEY_CONSTRAINTS_SQL =
      """
      SELECT
          kc.constraint_name,
          kc.column_name,
          c.constraint_type,
          ref.referenced_schema,
          ref.referenced_table,
          ref.referenced_column
      FROM information_schema.key_column_usage AS kc
      JOIN information_schema.table_constraints AS c ON
          kc.table_schema = c.table_schema AND
          kc.table_name = c.table_name AND
          kc.constraint_name = c.constraint_name
      LEFT JOIN LATERAL (
          SELECT
              fn.nspname::text AS referenced_schema,
              fc.relname::text AS referenced_table,
              fa.attname::text AS referenced_column
          FROM pg_catalog.pg_constraint con
          JOIN pg_catalog.pg_class tc ON tc.oid = con.conrelid
          JOIN pg_catalog.pg_namespace tn ON tn.oid = tc.relnamespace
          JOIN pg_catalog.pg_class fc ON fc.oid = con.confrelid
          JOIN pg_catalog.pg_namespace fn ON fn.oid = fc.relnamespace
          JOIN pg_catalog.pg_attribute fa ON
              fa.attrelid = con.confrelid AND
              fa.attnum = con.confkey[kc.ordinal_position::int]
          WHERE con.contype = 'f'
              AND con.conname = kc.constraint_name
              AND tc.relname = kc.table_name
              AND tn.nspname = kc.table_schema
      ) AS ref ON c.constraint_type = 'FOREIGN KEY'
      WHERE
          kc.table_schema = ? AND
          kc.table_name = ?
      ORDER BY kc.constraint_name, kc.ordinal_position
      """;

  private static final String CHECK_CONSTRAINTS_SQL =
      """
      SELECT con.conname::text, a.attname::text
      FROM pg_catalog.pg_constraint con
      JOIN pg_catalog.pg_class c ON c.oid = con.conrelid
      JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
      LEFT JOIN LATERAL unnest(con.conkey) WITH ORDINALITY AS k(attnum, ord) ON true
      LEFT JOIN pg_catalog.pg_attribute a ON a.attrelid = c.oid AND a.attnum = k.attnum
      WHERE con.contype = 'c'
          AND n.nspname = ?
          AND c.relname = ?
      ORDER BY con.conname, k.ord
      """;

  private static final String INDEXES_SQL =
      """
      SELECT
          ic.relname::text,
          ARRAY(
              SELECT a.attname::text
              FROM unnest(idx.indkey) WITH ORDINALITY AS k(attnum, ord)
              LEFT JOIN pg_catalog.pg_attribute a ON a.attrelid = c.oid AND a.attnum = k.attnum
              ORDER BY k.ord
          ),
          idx.indisunique,
          idx.indisprimary
      FROM pg_catalog.pg_index idx
      JOIN pg_catalog.pg_class c ON c.oid = idx.indrelid
      JOIN pg_catalog.pg_class ic ON ic.oid = idx.indexrelid
      JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
      WHERE n.nspname = ?
          AND c.relname = ?
      ORDER BY ic.relname
      """;

  private final Set<String> ignoredTables;

  public SchemaIntrospector(TenancyProperties properties) {
    this.ignoredTables = Set.copyOf(properties.ignoredTables());
  }

  /** Tables and views in the current schema that the search path resolves to that schema. */
  public List<TableInfo> listTables(ConnectionSchemaContext context) {
    return context
        .jdbc()
        .sql(TABLE_LIST_SQL)
        .param(context.currentSchema())
        .query(
            (rs, rowNum) ->
                new TableInfo(
                    rs.getString(1),
                    "v".equals(rs.getString(2)) ? TableType.VIEW : TableType.TABLE))
        .list()
        .stream()
        .filter(table -> !ignoredTables.contains(table.name()))
        .toList();
  }

  /**
   * Keys, checks and indexes of {@code tableName} in the current schema, keyed by constraint name.
   * An index that backs a constraint shares its name and is folded into the same entry with the
   * flags of both.
   */
  public Map<String, ConstraintInfo> getConstraints(
      ConnectionSchemaContext context, String tableName) {
    String schema = context.currentSchema();
    var constraints = new LinkedHashMap<String, ConstraintBuilder>();

    context
        .jdbc()
        .sql(KEY_CONSTRAINTS_SQL)
        .params(schema, tableName)
        .query(
            rs -> {
              String kind = rs.getString(3);
              var constraint =
                  constraints.computeIfAbsent(rs.getString(1), name -> new ConstraintBuilder());
              switch (kind) {
                case "PRIMARY KEY" -> {
                  constraint.primaryKey = true;
                  constraint.unique = true;
                }
                case "UNIQUE" -> constraint.unique = true;
                case "FOREIGN KEY" -> {
                  if (constraint.foreignKey == null && rs.getString(5) != null) {
                    constraint.foreignKey =
                        new ForeignKeyReference(
                            qualify(schema, rs.getString(4), rs.getString(5)), rs.getString(6));
                  }
                }
                default -> log.debug("Ignoring key constraint kind {}", kind);
              }
              constraint.columns.add(rs.getString(2));
            });

    context
        .jdbc()
        .sql(CHECK_CONSTRAINTS_SQL)
        .params(schema, tableName)
        .query(
            rs -> {
              var constraint =
                  constraints.computeIfAbsent(rs.getString(1), name -> new ConstraintBuilder());
              constraint.check = true;
              // Column-less checks come back as a single row without a column
              String column = rs.getString(2);
              if (column != null) {
                constraint.columns.add(column);
              }
            });

    context
        .jdbc()
        .sql(INDEXES_SQL)
        .params(schema, tableName)
        .query(
            rs -> {
              var constraint =
                  constraints.computeIfAbsent(rs.getString(1), name -> new ConstraintBuilder());
              if (constraint.columns.isEmpty()) {
                constraint.columns.addAll(columnNames(rs.getArray(2)));
              }
              constraint.index = true;
              constraint.unique |= rs.getBoolean(3);
              constraint.primaryKey |= rs.getBoolean(4);
            });

    var result = new LinkedHashMap<String, ConstraintInfo>();
    constraints.forEach((name, builder) -> result.put(name, builder.build()));
    return result;
  }

  private static String qualify(String currentSchema, String schema, String table) {
    return currentSchema.equals(schema) ? table : schema + "." + table;
  }

  // Expression index keys have no attribute name
  private static List<String> columnNames(Array array) throws SQLException {
    var names = new ArrayList<String>();
    if (array == null) {
      return names;
    }
    for (Object name : (Object[]) array.getArray()) {
      if (name != null) {
        names.add(name.toString());
      }
    }
    return names;
  }

  private static final class ConstraintBuilder {
    private final List<String> columns = new ArrayList<>();
    private boolean primaryKey;
    private boolean unique;
    private ForeignKeyReference foreignKey;
    private boolean check;
    private boolean index;

    private ConstraintInfo build() {
      return new ConstraintInfo(List.copyOf(columns), primaryKey, unique, foreignKey, check, index);
    }
  }
}
