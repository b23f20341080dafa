package io.b2mash.b2b.schematenancy.provisioning;

import io.b2mash.b2b.schematenancy.exception.SchemaAlreadyExistsException;
import io.b2mash.b2b.schematenancy.exception.SchemaDoesNotExistException;
import io.b2mash.b2b.schematenancy.multitenancy.ConnectionSchemaContext;
import io.b2mash.b2b.schematenancy.multitenancy.SchemaStatements;
import io.b2mash.b2b.schematenancy.tenant.Tenant;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Creates and drops tenant schemas. The only component that issues {@code CREATE SCHEMA} or {@code
 * DROP SCHEMA}.
 */
@Service
public class SchemaLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(SchemaLifecycleService.class);

  private static final String DUPLICATE_SCHEMA = "42P06";
  private static final String INVALID_SCHEMA_NAME = "3F000";

  private final SchemaStatements statements;
  private final TenantMigrator tenantMigrator;

  public SchemaLifecycleService(SchemaStatements statements, TenantMigrator tenantMigrator) {
    this.statements = statements;
    this.tenantMigrator = tenantMigrator;
  }

  /**
   * Creates the tenant's schema and optionally migrates it. The context is back on the public
   * schema when this returns or throws.
   *
   * @return true if a schema was created, false if {@code checkIfExists} found one already
   */
  public boolean createSchema(
      ConnectionSchemaContext context,
      Tenant tenant,
      boolean checkIfExists,
      boolean applyMigrations) {
    String schemaName = tenant.getSchemaName();
    String createStatement = statements.createSchema(schemaName);

    RuntimeException failure = null;
    try {
      if (checkIfExists && context.schemaExists(schemaName)) {
        log.info("Schema {} already exists, skipping creation", schemaName);
        return false;
      }
      try {
        context.execute(createStatement);
      } catch (DataAccessException e) {
        if (hasSqlState(e, DUPLICATE_SCHEMA)) {
          throw new SchemaAlreadyExistsException(schemaName, e);
        }
        throw e;
      }
      log.info("Created schema {}", schemaName);

      if (applyMigrations) {
        context.setSchema(schemaName);
        tenantMigrator.migrate(schemaName);
      }
      return true;
    } catch (RuntimeException e) {
      failure = e;
      throw e;
    } finally {
      restorePublic(context, failure);
    }
  }

  /** Drops the tenant's schema and everything in it. */
  public void dropSchema(ConnectionSchemaContext context, Tenant tenant) {
    String schemaName = tenant.getSchemaName();
    String dropStatement = statements.dropSchemaCascade(schemaName);
    try {
      context.execute(dropStatement);
    } catch (DataAccessException e) {
      if (hasSqlState(e, INVALID_SCHEMA_NAME)) {
        throw new SchemaDoesNotExistException(schemaName, e);
      }
      throw e;
    }
    log.info("Dropped schema {}", schemaName);
    if (context.isCurrent(schemaName)) {
      context.setToPublic();
    }
  }

  public boolean schemaExists(ConnectionSchemaContext context, String schemaName) {
    return context.schemaExists(schemaName);
  }

  private void restorePublic(ConnectionSchemaContext context, RuntimeException failure) {
    try {
      context.setToPublic();
    } catch (RuntimeException e) {
      if (failure == null) {
        throw e;
      }
      failure.addSuppressed(e);
    }
  }

  private static boolean hasSqlState(DataAccessException e, String sqlState) {
    return e.getMostSpecificCause() instanceof SQLException sqlException
        && sqlState.equals(sqlException.getSQLState());
  }
}
