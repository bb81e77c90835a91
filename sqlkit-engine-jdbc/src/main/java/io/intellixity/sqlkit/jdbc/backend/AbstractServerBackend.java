package io.intellixity.sqlkit.jdbc.backend;

import io.intellixity.sqlkit.descriptor.ResolvedDescriptor;
import io.intellixity.sqlkit.error.BackendException;
import io.intellixity.sqlkit.error.DatabaseNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.Properties;

/**
 * Shared logic for networked backends, where the target database lives on a server next to others.
 * <p>
 * Existence checks and CREATE/DROP DATABASE go through a throwaway connection to the server rather than to
 * the target database. Check-then-create is not atomic: two processes creating the same database at once
 * may both see it absent, and the slower CREATE then fails with a backend error.
 */
abstract class AbstractServerBackend implements Backend {
  private static final Logger log = LoggerFactory.getLogger(AbstractServerBackend.class);

  /** JDBC URL of the server itself (no target database, or the maintenance database). */
  protected abstract String serverUrl(ResolvedDescriptor descriptor);

  /** Single-parameter query returning a row iff the database named by the parameter exists. */
  protected abstract String existsSql();

  /** Driver parameters as they should appear on the JDBC URL. */
  protected Map<String, String> driverParams(ResolvedDescriptor descriptor) {
    return descriptor.params();
  }

  @Override
  public void ensureExists(ResolvedDescriptor descriptor, boolean mustExist) {
    String database = descriptor.database();
    try (Connection c = openServerConnection(descriptor)) {
      if (databaseExists(c, database)) return;
      if (mustExist) throw new DatabaseNotFoundException(descriptor.redactedUrl());

      // CREATE DATABASE cannot run inside a transaction on some servers.
      c.setAutoCommit(true);
      try (Statement st = c.createStatement()) {
        st.execute("CREATE DATABASE " + dialect().quoteIdent(database));
      }
      log.info("sqlkit.create_database backend={} database={}", kind(), database);
    } catch (SQLException e) {
      throw new BackendException("Failed to ensure database '" + database + "' exists", e);
    }
  }

  @Override
  public void drop(ResolvedDescriptor descriptor) {
    String database = descriptor.database();
    try (Connection c = openServerConnection(descriptor)) {
      c.setAutoCommit(true);
      try (Statement st = c.createStatement()) {
        st.execute("DROP DATABASE IF EXISTS " + dialect().quoteIdent(database));
      }
      log.info("sqlkit.drop backend={} database={}", kind(), database);
    } catch (SQLException e) {
      throw new BackendException("Failed to drop database '" + database + "'", e);
    }
  }

  protected final boolean databaseExists(Connection c, String database) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement(existsSql())) {
      ps.setString(1, database);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }

  protected Connection openServerConnection(ResolvedDescriptor descriptor) throws SQLException {
    Properties props = new Properties();
    if (descriptor.user() != null) props.setProperty("user", descriptor.user());
    if (descriptor.password() != null) props.setProperty("password", descriptor.password());
    return DriverManager.getConnection(serverUrl(descriptor), props);
  }

  protected final String hostPort(ResolvedDescriptor descriptor) {
    return descriptor.host() + (descriptor.port() == null ? "" : ":" + descriptor.port());
  }

  protected final String queryString(ResolvedDescriptor descriptor) {
    Map<String, String> params = driverParams(descriptor);
    if (params.isEmpty()) return "";
    StringBuilder sb = new StringBuilder("?");
    String sep = "";
    for (var e : params.entrySet()) {
      sb.append(sep).append(e.getKey());
      if (!e.getValue().isEmpty()) sb.append('=').append(e.getValue());
      sep = "&";
    }
    return sb.toString();
  }
}
