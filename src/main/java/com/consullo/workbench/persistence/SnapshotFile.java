package com.consullo.workbench.persistence;

import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.StateJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON recovery file {@code <directory>/<id>.json}.
 *
 * <p>Writes go to a temporary sibling that is then moved over the target, so a crash never leaves a truncated
 * snapshot behind. A file that cannot be parsed is logged and treated as absent.
 *
 * @since 1.0
 */
public final class SnapshotFile {

  private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotFile.class);

  private final Path file;
  private final ObjectMapper mapper;

  public SnapshotFile(final Path directory, final String id) {
    Validate.notNull(directory, "directory must not be null");
    Validate.notBlank(id, "id must not be blank");
    this.file = directory.resolve(id + ".json");
    this.mapper = StateJson.mapper();
  }

  public Path path() {
    return file;
  }

  public Optional<AppState> load() throws PersistenceException {
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    final byte[] bytes;
    try {
      bytes = Files.readAllBytes(file);
    } catch (final IOException e) {
      throw new PersistenceException("Failed to read snapshot " + file, e);
    }
    try {
      return Optional.of(mapper.readValue(bytes, AppState.class));
    } catch (final IOException | IllegalArgumentException e) {
      LOGGER.warn("Ignoring unreadable snapshot {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  public void save(final AppState state) throws PersistenceException {
    Validate.notNull(state, "state must not be null");
    final Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Files.createDirectories(file.getParent());
      Files.write(tmp, mapper.writeValueAsBytes(state));
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (final AtomicMoveNotSupportedException e) {
        LOGGER.debug("Atomic move unsupported for {}, replacing", file);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (final IOException e) {
      throw new PersistenceException("Failed to write snapshot " + file, e);
    }
  }
}
