package com.consullo.workbench.persistence;

import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.ProjectKey;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for project-partitioned records and the recovery snapshot.
 *
 * <p>Every record operation takes a {@link ProjectKey}; there is no way to read across projects. Writes only come
 * from the store's mutation thread, reads may run concurrently.
 *
 * @since 1.0
 */
public interface PersistenceLayer extends AutoCloseable {

  /**
   * Appends a record.
   *
   * @param kind record kind
   * @param projectKey partition key
   * @param scope file path or activity area
   * @param content text
   * @return the stored record with its id and timestamp
   * @throws PersistenceException if the write failed
   */
  PersistedRecord appendRecord(RecordKind kind, ProjectKey projectKey, String scope, String content)
      throws PersistenceException;

  /**
   * Reads records of one project, oldest first.
   *
   * @param projectKey partition key, required
   * @param kind record kind
   * @param scope scope to match, or {@code null} for every scope of the project
   * @return matching records
   * @throws PersistenceException if the read failed
   */
  List<PersistedRecord> queryRecords(ProjectKey projectKey, RecordKind kind, String scope)
      throws PersistenceException;

  /**
   * Deletes a record, only if it belongs to the given project.
   *
   * @return {@code true} when a row was deleted
   * @throws PersistenceException if the write failed
   */
  boolean deleteRecord(ProjectKey projectKey, RecordKind kind, long id) throws PersistenceException;

  Optional<AppState> loadSnapshot() throws PersistenceException;

  void saveSnapshot(AppState state) throws PersistenceException;

  @Override
  void close();
}
