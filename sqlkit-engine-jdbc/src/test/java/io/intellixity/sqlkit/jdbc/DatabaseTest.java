package io.intellixity.sqlkit.jdbc;

import io.intellixity.sqlkit.config.DatabaseOptions;
import io.intellixity.sqlkit.error.BackendException;
import io.intellixity.sqlkit.error.ConfigurationException;
import io.intellixity.sqlkit.error.ConfirmationRequiredException;
import io.intellixity.sqlkit.error.DatabaseNotFoundException;
import io.intellixity.sqlkit.error.UnsupportedBackendException;
import io.intellixity.sqlkit.query.Row;
import io.intellixity.sqlkit.query.SqlQuery;
import io.intellixity.sqlkit.schema.SchemaDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DatabaseTest {
  @TempDir
  Path tmp;

  private String fileUrl(String name) {
    return "sqlite:///" + tmp.resolve(name).toAbsolutePath();
  }

  private static long countWidgets(Database db) {
    return db.inSession(false, s -> s.count(SqlQuery.of("SELECT * FROM widgets")));
  }

  @Test
  void fileDatabase_isCreatedWithSchema() throws Exception {
    Path file = tmp.resolve("nested/dir/app.db");
    try (Database db = new Database("sqlite:///" + file.toAbsolutePath(), Widget.SCHEMA)) {
      assertTrue(Files.isRegularFile(file));
      boolean exists = db.inSession(false, s -> {
        try {
          return db.engine().dialect().tableExists(s.connection(), "widgets");
        } catch (java.sql.SQLException e) {
          throw new IllegalStateException(e);
        }
      });
      assertTrue(exists);
      assertEquals(0L, countWidgets(db));
    }
  }

  @Test
  void reopeningKeepsCommittedData() {
    String url = fileUrl("keep.db");
    try (Database db = new Database(url, Widget.SCHEMA)) {
      db.useSession(true, s -> s.add(Widget.TYPE, new Widget(null, "bolt", 1L)));
    }
    try (Database db = new Database(url, Widget.SCHEMA, true)) {
      assertEquals(1L, countWidgets(db));
    }
  }

  @Test
  void existingTablesAreLeftAlone() {
    String url = fileUrl("legacy.db");
    try (Database db = new Database(url, SchemaDefinition.empty())) {
      db.useSession(true, s -> {
        s.execute("CREATE TABLE widgets (id INTEGER PRIMARY KEY, name TEXT, weight INTEGER, legacy TEXT)");
        s.execute("INSERT INTO widgets (name, weight, legacy) VALUES (?, ?, ?)", "old", 1L, "x");
      });
    }
    try (Database db = new Database(url, Widget.SCHEMA)) {
      List<Row> rows = db.inSession(false, s -> s.select(SqlQuery.of("SELECT * FROM widgets")));
      assertEquals(1, rows.size());
      assertEquals("x", rows.get(0).getString("legacy"));
    }
  }

  @Test
  void mustExist_missingFileFailsWithoutCreatingIt() {
    Path file = tmp.resolve("absent.db");
    DatabaseNotFoundException e = assertThrows(DatabaseNotFoundException.class,
        () -> new Database("sqlite:///" + file.toAbsolutePath(), Widget.SCHEMA, true));
    assertTrue(e.getMessage().contains("absent.db"));
    assertFalse(Files.exists(file));
  }

  @Test
  void mustExist_isInvalidForInMemory() {
    assertThrows(ConfigurationException.class, () -> new Database("sqlite://", Widget.SCHEMA, true));
  }

  @Test
  void unsupportedScheme() {
    assertThrows(UnsupportedBackendException.class, () -> new Database("oracle://x/y", Widget.SCHEMA));
  }

  @Test
  void inSession_rollsBackWhenWorkThrows() {
    try (Database db = new Database("sqlite://", Widget.SCHEMA)) {
      IllegalStateException e = assertThrows(IllegalStateException.class, () -> db.useSession(true, s -> {
        s.add(Widget.TYPE, new Widget(null, "bolt", 1L));
        throw new IllegalStateException("boom");
      }));
      assertEquals("boom", e.getMessage());
      assertEquals(0L, countWidgets(db));
    }
  }

  @Test
  void inSession_releaseFailureDoesNotMaskWorkFailure() {
    try (Database db = new Database("sqlite://", Widget.SCHEMA)) {
      IllegalStateException e = assertThrows(IllegalStateException.class, () -> db.useSession(true, s -> {
        s.add(Widget.TYPE, new Widget(null, "bolt", 1L));
        try {
          s.connection().close();
        } catch (java.sql.SQLException sqle) {
          throw new AssertionError(sqle);
        }
        throw new IllegalStateException("boom");
      }));
      assertEquals("boom", e.getMessage());
      assertTrue(e.getSuppressed().length > 0);
      assertTrue(java.util.Arrays.stream(e.getSuppressed()).allMatch(BackendException.class::isInstance));

      // The pooled connection went back and the insert was discarded.
      assertEquals(0L, countWidgets(db));
    }
  }

  @Test
  void inSession_releaseFailureWithoutWorkFailureIsThrown() {
    try (Database db = new Database("sqlite://", Widget.SCHEMA)) {
      assertThrows(BackendException.class, () -> db.useSession(false, s -> {
        try {
          s.connection().close();
        } catch (java.sql.SQLException sqle) {
          throw new AssertionError(sqle);
        }
      }));
      assertEquals(0L, countWidgets(db));
    }
  }

  @Test
  void inSession_withoutCommitDiscardsWork() {
    try (Database db = new Database("sqlite://", Widget.SCHEMA)) {
      db.useSession(false, s -> s.add(Widget.TYPE, new Widget(null, "bolt", 1L)));
      assertEquals(0L, countWidgets(db));
      db.useSession(true, s -> s.add(Widget.TYPE, new Widget(null, "bolt", 1L)));
      assertEquals(1L, countWidgets(db));
    }
  }

  @Test
  void inMemory_dataIsSharedAcrossSessions() {
    try (Database db = new Database("sqlite://", Widget.SCHEMA)) {
      db.useSession(true, s -> s.getOrCreate(Widget.TYPE, Map.of("name", "gear")));
      assertTrue(db.inSession(false, s -> s.get(Widget.TYPE, Map.of("name", "gear"))).isPresent());
    }
  }

  @Test
  void drop_withoutConfirmationKeepsDatabaseUsable() {
    String url = fileUrl("careful.db");
    try (Database db = new Database(url, Widget.SCHEMA)) {
      assertThrows(ConfirmationRequiredException.class, () -> db.drop(false));
      assertFalse(db.isDropped());
      assertEquals(0L, countWidgets(db));
    }
  }

  @Test
  void drop_deletesFileAndDisablesInstance() {
    Path file = tmp.resolve("doomed.db");
    Database db = new Database("sqlite:///" + file.toAbsolutePath(), Widget.SCHEMA);
    db.useSession(true, s -> s.add(Widget.TYPE, new Widget(null, "bolt", 1L)));

    db.drop(true);

    assertTrue(db.isDropped());
    assertFalse(Files.exists(file));
    assertThrows(IllegalStateException.class, db::openSession);
    assertThrows(IllegalStateException.class, () -> db.drop(true));
    db.close();
  }

  @Test
  void drop_failureLeavesInstanceClosedButNotDropped() throws Exception {
    Path file = tmp.resolve("vanished.db");
    // One pooled connection, so no background fill can recreate the file after it is deleted.
    Database db = new Database("sqlite:///" + file.toAbsolutePath(), Widget.SCHEMA, false,
        DatabaseOptions.defaults().withMaximumPoolSize(1));
    Files.delete(file);

    assertThrows(DatabaseNotFoundException.class, () -> db.drop(true));

    assertFalse(db.isDropped());
    assertTrue(db.engine().isClosed());
    IllegalStateException e = assertThrows(IllegalStateException.class, db::openSession);
    assertTrue(e.getMessage().startsWith("Database is closed"));
  }

  @Test
  void drop_inMemoryDisposesEngine() {
    Database db = new Database("sqlite://", Widget.SCHEMA);
    db.drop(true);
    assertTrue(db.engine().isClosed());
    assertThrows(IllegalStateException.class, db::openSession);
  }

  @Test
  void closedDatabaseRejectsSessions() {
    Database db = new Database("sqlite://", Widget.SCHEMA);
    db.close();
    db.close();
    assertThrows(IllegalStateException.class, db::openSession);
  }

  @Test
  void indirectDescriptorIsKeptAsUrl() throws Exception {
    Path target = tmp.resolve("indirect.db");
    Path pointer = tmp.resolve("db.url");
    Files.writeString(pointer, "# where the data lives\nsqlite:///" + target.toAbsolutePath() + "\n");

    String url = "file://" + pointer.toAbsolutePath();
    try (Database db = new Database(url, Widget.SCHEMA)) {
      assertEquals(url, db.url());
      assertEquals("sqlite:///" + target.toAbsolutePath(), db.toString());
      assertTrue(Files.isRegularFile(target));
    }
  }

  @Test
  void echoOptionStillRunsStatements() {
    DatabaseOptions options = DatabaseOptions.defaults().withEcho(true);
    try (Database db = new Database("sqlite://", Widget.SCHEMA, false, options)) {
      assertTrue(db.engine().echo());
      db.useSession(true, s -> s.add(Widget.TYPE, new Widget(null, "bolt", 1L)));
      assertEquals(1L, countWidgets(db));
    }
  }
}
