package com.consullo.workbench.persistence;

import com.consullo.workbench.config.WorkbenchConfig;
import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.ProjectKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * {@link PersistenceLayer} backed by one SQLite database in write-ahead-log mode plus a {@link SnapshotFile}.
 *
 * <p>Each operation borrows its own connection, so readers never wait on each other. Writers are already serialized
 * by the store; SQLite's own locking covers the rest.
 *
 * @since 1.0
 */
public final class SqlitePersistenceLayer implements PersistenceLayer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SqlitePersistenceLayer.class);

  private static final String CREATE_TABLE_SQL = """
      CREATE TABLE IF NOT EXISTS %s (
          id          INTEGER PRIMARY KEY AUTOINCREMENT,
          project_key TEXT    NOT NULL,
          %s          TEXT    NOT NULL,
          content     TEXT    NOT NULL,
          created_at  INTEGER NOT NULL
      )
      """;

  private static final String CREATE_INDEX_SQL = """
      CREATE INDEX IF NOT EXISTS idx_%1$s_project ON %1$s (project_key, %2$s)
      """;

  private static final String INSERT_SQL = """
      INSERT INTO %s (project_key, %s, content, created_at) VALUES (?, ?, ?, ?)
      """;

  private static final String SELECT_BY_PROJECT_SQL = """
      SELECT id, %2$s, content, created_at
      FROM %1$s
      WHERE project_key = ?
      ORDER BY created_at ASC, id ASC
      """;

  private static final String SELECT_BY_SCOPE_SQL = """
      SELECT id, %2$s, content, created_at
      FROM %1$s
      WHERE project_key = ? AND %2$s = ?
      ORDER BY created_at ASC, id ASC
      """;

  private static final String DELETE_SQL = """
      DELETE FROM %s WHERE project_key = ? AND id = ?
      """;

  private final DataSource dataSource;
  private final SnapshotFile snapshots;
  private final Clock clock;

  public SqlitePersistenceLayer(final Path databaseFile, final SnapshotFile snapshots, final Clock clock)
      throws PersistenceException {
    Validate.notNull(databaseFile, "databaseFile must not be null");
    Validate.notNull(snapshots, "snapshots must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.snapshots = snapshots;
    this.clock = clock;

    try {
      final Path parent = databaseFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
    } catch (final IOException e) {
      throw new PersistenceException("Failed to create database directory for " + databaseFile, e);
    }

    final SQLiteConfig sqliteConfig = new SQLiteConfig();
    sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
    sqliteConfig.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
    sqliteConfig.setBusyTimeout(5_000);
    final SQLiteDataSource sqlite = new SQLiteDataSource(sqliteConfig);
    sqlite.setUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath());
    this.dataSource = sqlite;

    createTables();
  }

  /**
   * Opens the database and snapshot file named by the configuration.
   *
   * @param config configuration
   * @return persistence layer
   * @throws PersistenceException if the database cannot be opened
   */
  public static SqlitePersistenceLayer open(final WorkbenchConfig config) throws PersistenceException {
    return new SqlitePersistenceLayer(config.databaseFile(),
        new SnapshotFile(config.snapshotDirectory(), config.snapshotId()), Clock.systemUTC());
  }

  private void createTables() throws PersistenceException {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (final RecordKind kind : RecordKind.values()) {
        stmt.execute(CREATE_TABLE_SQL.formatted(kind.table(), kind.scopeColumn()));
        stmt.execute(CREATE_INDEX_SQL.formatted(kind.table(), kind.scopeColumn()));
      }
      LOGGER.info("Record tables ensured in {}", conn.getMetaData().getURL());
    } catch (final SQLException e) {
      throw new PersistenceException("Failed to create record tables", e);
    }
  }

  @Override
  public PersistedRecord appendRecord(final RecordKind kind, final ProjectKey projectKey, final String scope,
      final String content) throws PersistenceException {
    Objects.requireNonNull(projectKey, "projectKey is required");
    Validate.notNull(kind, "kind must not be null");
    Validate.notBlank(scope, "scope must not be blank");
    Validate.notNull(content, "content must not be null");

    final Instant createdAt = Instant.ofEpochMilli(clock.millis());
    try (Connection conn = dataSource.getConnection()) {
      try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL.formatted(kind.table(), kind.scopeColumn()))) {
        stmt.setString(1, projectKey.value());
        stmt.setString(2, scope);
        stmt.setString(3, content);
        stmt.setLong(4, createdAt.toEpochMilli());
        stmt.executeUpdate();
      }
      try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
        rs.next();
        final long id = rs.getLong(1);
        LOGGER.debug("Appended {} record {} for project {}", kind, id, projectKey);
        return new PersistedRecord(id, kind, projectKey, scope, content, createdAt);
      }
    } catch (final SQLException e) {
      throw new PersistenceException("Failed to append " + kind + " record for project " + projectKey, e);
    }
  }

  @Override
  public List<PersistedRecord> queryRecords(final ProjectKey projectKey, final RecordKind kind, final String scope)
      throws PersistenceException {
    Objects.requireNonNull(projectKey, "projectKey is required");
    Validate.notNull(kind, "kind must not be null");

    final String sql = (scope == null ? SELECT_BY_PROJECT_SQL : SELECT_BY_SCOPE_SQL)
        .formatted(kind.table(), kind.scopeColumn());
    final List<PersistedRecord> records = new ArrayList<>();
    try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, projectKey.value());
      if (scope != null) {
        stmt.setString(2, scope);
      }
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          records.add(new PersistedRecord(rs.getLong(1), kind, projectKey, rs.getString(2), rs.getString(3),
              Instant.ofEpochMilli(rs.getLong(4))));
        }
      }
    } catch (final SQLException e) {
      throw new PersistenceException("Failed to query " + kind + " records for project " + projectKey, e);
    }
    return records;
  }

  @Override
  public boolean deleteRecord(final ProjectKey projectKey, final RecordKind kind, final long id)
      throws PersistenceException {
    Objects.requireNonNull(projectKey, "projectKey is required");
    Validate.notNull(kind, "kind must not be null");

    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(DELETE_SQL.formatted(kind.table()))) {
      stmt.setString(1, projectKey.value());
      stmt.setLong(2, id);
      final int deleted = stmt.executeUpdate();
      LOGGER.debug("Deleted {} {} record(s) with id {} for project {}", deleted, kind, id, projectKey);
      return deleted > 0;
    } catch (final SQLException e) {
      throw new PersistenceException("Failed to delete " + kind + " record " + id, e);
    }
  }

  @Override
  public Optional<AppState> loadSnapshot() throws PersistenceException {
    return snapshots.load();
  }

  @Override
  public void saveSnapshot(final AppState state) throws PersistenceException {
    snapshots.save(state);
  }

  @Override
  public void close() {
    // connections are per call; nothing stays open
    LOGGER.debug("Persistence closed");
  }
}
