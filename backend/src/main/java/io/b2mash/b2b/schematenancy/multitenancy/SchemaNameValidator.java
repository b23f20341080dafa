package io.b2mash.b2b.schematenancy.multitenancy;

import io.b2mash.b2b.schematenancy.exception.InvalidSchemaNameException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks candidate schema identifiers before they are spliced into DDL or a search path. Names are
 * interpolated unquoted, so only lowercase ASCII letters, digits and underscores are accepted and
 * the first character may not be a digit.
 */
public final class SchemaNameValidator {

  /** PostgreSQL truncates identifiers beyond NAMEDATALEN - 1 bytes. */
  public static final int MAX_LENGTH = 63;

  private static final Pattern SCHEMA_PATTERN = Pattern.compile("^[a-z_][a-z0-9_]*$");
  private static final String SYSTEM_PREFIX = "pg_";
  private static final List<String> BUILT_IN_RESERVED = List.of("information_schema");

  private final String publicSchemaName;
  private final Set<String> reservedNames;

  public SchemaNameValidator(String publicSchemaName) {
    this(publicSchemaName, List.of());
  }

  public SchemaNameValidator(String publicSchemaName, Collection<String> extraReservedNames) {
    if (publicSchemaName == null || !SCHEMA_PATTERN.matcher(publicSchemaName).matches()) {
      throw new IllegalArgumentException("Invalid public schema name: " + publicSchemaName);
    }
    this.publicSchemaName = publicSchemaName;
    var reserved = new HashSet<String>(BUILT_IN_RESERVED);
    reserved.add(publicSchemaName);
    extraReservedNames.forEach(name -> reserved.add(normalize(name)));
    this.reservedNames = Set.copyOf(reserved);
  }

  /** Lowercases a schema name the way it is stored. Null stays null. */
  public static String normalize(String schemaName) {
    return schemaName == null ? null : schemaName.toLowerCase(Locale.ROOT);
  }

  public String publicSchemaName() {
    return publicSchemaName;
  }

  public boolean isValid(String schemaName) {
    return rejectionReason(schemaName) == null;
  }

  public void validate(String schemaName) {
    String reason = rejectionReason(schemaName);
    if (reason != null) {
      throw new InvalidSchemaNameException(schemaName, reason);
    }
  }

  private String rejectionReason(String schemaName) {
    if (schemaName == null || schemaName.isEmpty()) {
      return "must not be empty";
    }
    if (schemaName.getBytes(StandardCharsets.UTF_8).length > MAX_LENGTH) {
      return "must not exceed " + MAX_LENGTH + " bytes";
    }
    if (!SCHEMA_PATTERN.matcher(schemaName).matches()) {
      return "may only contain lowercase letters, digits and underscores and must not start with a"
          + " digit";
    }
    if (schemaName.startsWith(SYSTEM_PREFIX)) {
      return "the " + SYSTEM_PREFIX + " prefix is reserved for system schemas";
    }
    if (reservedNames.contains(schemaName)) {
      return "name is reserved";
    }
    return null;
  }
}
