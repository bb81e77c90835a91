package io.intellixity.sqlkit.descriptor;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A descriptor after scheme detection and indirection: exactly one backend, with its location parsed out.
 * <p>
 * For SQLite only {@link #path()} is meaningful (null for in-memory). For networked backends
 * {@link #host()} and {@link #database()} are always set; user, password and port are optional.
 */
public record ResolvedDescriptor(BackendKind kind,
                                 String url,
                                 String host,
                                 Integer port,
                                 String user,
                                 String password,
                                 String database,
                                 Path path,
                                 Map<String, String> params) {
  public ResolvedDescriptor {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(url, "url");
    params = (params == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  static ResolvedDescriptor memory(String url) {
    return new ResolvedDescriptor(BackendKind.SQLITE_MEMORY, url, null, null, null, null, null, null, null);
  }

  static ResolvedDescriptor file(String url, Path path) {
    return new ResolvedDescriptor(BackendKind.SQLITE_FILE, url, null, null, null, null, null,
        Objects.requireNonNull(path, "path"), null);
  }

  /** Copy of this descriptor addressing another database on the same server. */
  public ResolvedDescriptor withDatabase(String otherDatabase) {
    if (!kind.networked()) throw new IllegalStateException("Not a server descriptor: " + kind);
    return new ResolvedDescriptor(kind, url, host, port, user, password, otherDatabase, path, params);
  }

  /** The descriptor with the password replaced, safe for logs and error messages. */
  public String redactedUrl() {
    if (password == null || password.isEmpty()) return url;
    return url.replace(":" + password + "@", ":***@");
  }

  @Override
  public String toString() {
    return redactedUrl();
  }
}
