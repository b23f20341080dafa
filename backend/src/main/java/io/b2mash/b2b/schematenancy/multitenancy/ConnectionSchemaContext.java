package io.b2mash.b2b.schematenancy.multitenancy;

import io.b2mash.b2b.schematenancy.exception.SchemaDoesNotExistException;
import java.sql.Connection;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * One borrowed connection plus the schema its search path currently points at.
 *
 * <p>The search path is a session setting: it survives commits and is not undone when a statement
 * completes, so whoever switches must switch back. {@link #close()} always restores the public
 * schema before handing the connection back to the pool.
 *
 * <p>Not thread-safe. A context belongs to a single logical operation and must not be shared.
 */
public class ConnectionSchemaContext implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ConnectionSchemaContext.class);

  static final String MDC_TENANT_SCHEMA = "tenantSchema";

  /** Hands a connection back; {@code reusable} is false after a failed reset. */
  @FunctionalInterface
  interface ConnectionRelease {
    void release(Connection connection, boolean reusable) throws SQLException;
  }

  private final Connection connection;
  private final SchemaStatements statements;
  private final String publicSchemaName;
  private final ConnectionRelease connectionRelease;
  private final JdbcClient jdbc;

  private String currentSchema;
  private boolean closed;

  ConnectionSchemaContext(
      Connection connection,
      SchemaStatements statements,
      String publicSchemaName,
      ConnectionRelease connectionRelease) {
    this.connection = connection;
    this.statements = statements;
    this.publicSchemaName = publicSchemaName;
    this.connectionRelease = connectionRelease;
    this.jdbc = JdbcClient.create(new SingleConnectionDataSource(connection, true));
    this.currentSchema = publicSchemaName;
  }

  public String currentSchema() {
    return currentSchema;
  }

  public String publicSchemaName() {
    return publicSchemaName;
  }

  public boolean isPublic() {
    return publicSchemaName.equals(currentSchema);
  }

  public boolean isCurrent(String schemaName) {
    return currentSchema.equals(schemaName);
  }

  public void setSchema(String schemaName) {
    setSchema(schemaName, false);
  }

  /**
   * Points the search path at {@code schemaName, public}, or at public alone for the public schema.
   * On failure the previous schema stays current.
   *
   * @throws SchemaDoesNotExistException if {@code checkExists} is set and the schema is absent
   */
  public void setSchema(String schemaName, boolean checkExists) {
    ensureOpen();
    String statement = statements.searchPath(schemaName);
    if (checkExists && !publicSchemaName.equals(schemaName) && !schemaExists(schemaName)) {
      throw new SchemaDoesNotExistException(schemaName);
    }
    jdbc.sql(statement).update();
    currentSchema = schemaName;
    if (isPublic()) {
      MDC.remove(MDC_TENANT_SCHEMA);
    } else {
      MDC.put(MDC_TENANT_SCHEMA, schemaName);
    }
    log.debug("Search path switched to {}", schemaName);
  }

  public void setToPublic() {
    setSchema(publicSchemaName);
  }

  public boolean schemaExists(String schemaName) {
    ensureOpen();
    return jdbc.sql(
            "SELECT EXISTS(SELECT 1 FROM pg_catalog.pg_namespace WHERE nspname = ?)")
        .param(schemaName)
        .query(Boolean.class)
        .single();
  }

  /** Runs a statement built by {@link SchemaStatements} on this connection. */
  public void execute(String statement) {
    ensureOpen();
    jdbc.sql(statement).update();
  }

  /** Client bound to this connection; everything it runs sees the current search path. */
  public JdbcClient jdbc() {
    ensureOpen();
    return jdbc;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException failure = null;
    try {
      jdbc.sql(statements.publicSearchPath()).update();
      currentSchema = publicSchemaName;
    } catch (RuntimeException e) {
      log.error("Failed to restore search path from {} before release", currentSchema, e);
      failure = e;
    }
    MDC.remove(MDC_TENANT_SCHEMA);
    try {
      connectionRelease.release(connection, failure == null);
    } catch (SQLException e) {
      var releaseFailure =
          new DataAccessResourceFailureException("Failed to release connection", e);
      if (failure == null) {
        failure = releaseFailure;
      } else {
        failure.addSuppressed(releaseFailure);
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Schema context is closed");
    }
  }
}
