package io.b2mash.b2b.schematenancy.multitenancy;

import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.stereotype.Component;

/**
 * Borrows pooled connections as {@link ConnectionSchemaContext}s. Each context starts on the public
 * schema and must be closed, typically with try-with-resources.
 */
@Component
public class SchemaContextFactory {

  private static final Logger log = LoggerFactory.getLogger(SchemaContextFactory.class);

  private final DataSource dataSource;
  private final SchemaStatements statements;

  public SchemaContextFactory(DataSource dataSource, SchemaStatements statements) {
    this.dataSource = dataSource;
    this.statements = statements;
  }

  public ConnectionSchemaContext open() {
    Connection connection;
    try {
      connection = dataSource.getConnection();
    } catch (SQLException e) {
      throw new CannotGetJdbcConnectionException(
          "Failed to obtain connection for schema context", e);
    }
    var context = wrap(connection);
    try {
      context.setToPublic();
    } catch (RuntimeException e) {
      // Release connection on setup failure to prevent pool leak
      try {
        release(connection, false);
      } catch (SQLException releaseFailure) {
        e.addSuppressed(releaseFailure);
      }
      throw e;
    }
    return context;
  }

  ConnectionSchemaContext wrap(Connection connection) {
    return new ConnectionSchemaContext(
        connection, statements, statements.publicSchemaName(), this::release);
  }

  private void release(Connection connection, boolean reusable) throws SQLException {
    if (!reusable && dataSource instanceof HikariDataSource hikari) {
      // Search path state unknown: never hand this connection to another caller
      log.warn("Evicting connection with unknown search path from the pool");
      hikari.evictConnection(connection);
      return;
    }
    connection.close();
  }
}
