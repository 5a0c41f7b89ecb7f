package com.consullo.workbench.persistence;

import com.consullo.workbench.state.AppState;
import com.consullo.workbench.state.FileComment;
import com.consullo.workbench.state.ProjectKey;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SqlitePersistenceLayerTest {

  private static final ProjectKey ALPHA = ProjectKey.derive("/work/alpha");
  private static final ProjectKey BETA = ProjectKey.derive("/work/beta");

  @TempDir
  Path tempDir;

  private SteppingClock clock;
  private SqlitePersistenceLayer persistence;

  @BeforeEach
  void setUp() throws Exception {
    clock = new SteppingClock(1_700_000_000_000L);
    persistence = new SqlitePersistenceLayer(tempDir.resolve("db/workbench.db"),
        new SnapshotFile(tempDir.resolve("snapshots"), "default"), clock);
  }

  @Test
  @DisplayName("Should assign ids and timestamps to appended records")
  void appendRecord_NewRecord_ReturnsStoredRecord() throws Exception {
    final PersistedRecord first = persistence.appendRecord(RecordKind.COMMENT, ALPHA, "/a.txt", "first");
    final PersistedRecord second = persistence.appendRecord(RecordKind.COMMENT, ALPHA, "/a.txt", "second");

    assertThat(second.id()).isGreaterThan(first.id());
    assertThat(first.createdAt()).isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
    assertThat(first.toComment()).isEqualTo(new FileComment(first.id(), "/a.txt", "first", first.createdAt()));
  }

  @Test
  @DisplayName("Should never return records of another project")
  void queryRecords_TwoProjects_Isolated() throws Exception {
    persistence.appendRecord(RecordKind.COMMENT, ALPHA, "/a.txt", "alpha note");
    persistence.appendRecord(RecordKind.COMMENT, BETA, "/a.txt", "beta note");

    assertThat(persistence.queryRecords(ALPHA, RecordKind.COMMENT, "/a.txt"))
        .extracting(PersistedRecord::content).containsExactly("alpha note");
    assertThat(persistence.queryRecords(BETA, RecordKind.COMMENT, null))
        .extracting(PersistedRecord::content).containsExactly("beta note");
  }

  @Test
  @DisplayName("Should keep comments and activity in separate stores")
  void queryRecords_DifferentKinds_Separated() throws Exception {
    persistence.appendRecord(RecordKind.COMMENT, ALPHA, "/a.txt", "comment");
    persistence.appendRecord(RecordKind.ACTIVITY, ALPHA, "terminal", "session started");

    assertThat(persistence.queryRecords(ALPHA, RecordKind.ACTIVITY, null))
        .extracting(PersistedRecord::scope).containsExactly("terminal");
    assertThat(persistence.queryRecords(ALPHA, RecordKind.COMMENT, null))
        .extracting(PersistedRecord::content).containsExactly("comment");
  }

  @Test
  @DisplayName("Should filter by scope and order by creation time then id")
  void queryRecords_Scope_FilteredAndOrdered() throws Exception {
    persistence.appendRecord(RecordKind.COMMENT, ALPHA, "/a.txt", "one");
    clock.stop();
    persistence.appendRecord(RecordKind.COMMENT, ALPHA, "/b.txt", "other file");
    persistence.appendRecord(RecordKind.COMMENT, ALPHA, "/a.txt", "two");
    persistence.appendRecord(RecordKind.COMMENT, ALPHA, "/a.txt", "three");

    final List<PersistedRecord> records = persistence.queryRecords(ALPHA, RecordKind.COMMENT, "/a.txt");

    assertThat(records).extracting(PersistedRecord::content).containsExactly("one", "two", "three");
  }

  @Test
  @DisplayName("Should delete only within the owning project")
  void deleteRecord_OtherProject_NotDeleted() throws Exception {
    final PersistedRecord note = persistence.appendRecord(RecordKind.COMMENT, ALPHA, "/a.txt", "keep me");

    assertThat(persistence.deleteRecord(BETA, RecordKind.COMMENT, note.id())).isFalse();
    assertThat(persistence.queryRecords(ALPHA, RecordKind.COMMENT, null)).hasSize(1);

    assertThat(persistence.deleteRecord(ALPHA, RecordKind.COMMENT, note.id())).isTrue();
    assertThat(persistence.deleteRecord(ALPHA, RecordKind.COMMENT, note.id())).isFalse();
    assertThat(persistence.queryRecords(ALPHA, RecordKind.COMMENT, null)).isEmpty();
  }

  @Test
  @DisplayName("Should refuse every operation without a project key")
  void operations_NullProjectKey_Rejected() {
    assertThatThrownBy(() -> persistence.appendRecord(RecordKind.COMMENT, null, "/a", "x"))
        .isInstanceOf(NullPointerException.class).hasMessage("projectKey is required");
    assertThatThrownBy(() -> persistence.queryRecords(null, RecordKind.COMMENT, null))
        .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> persistence.deleteRecord(null, RecordKind.COMMENT, 1L))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  @DisplayName("Should keep records across reopening the database")
  void reopen_ExistingDatabase_RecordsSurvive() throws Exception {
    persistence.appendRecord(RecordKind.ACTIVITY, ALPHA, "project", "opened /work/alpha");
    persistence.close();

    final SqlitePersistenceLayer reopened = new SqlitePersistenceLayer(tempDir.resolve("db/workbench.db"),
        new SnapshotFile(tempDir.resolve("snapshots"), "default"), clock);

    assertThat(reopened.queryRecords(ALPHA, RecordKind.ACTIVITY, "project")).hasSize(1);
  }

  @Test
  @DisplayName("Should delegate snapshots to the snapshot file")
  void saveSnapshot_ThenLoad_ReturnsState() throws Exception {
    assertThat(persistence.loadSnapshot()).isEmpty();

    persistence.saveSnapshot(AppState.initial());

    assertThat(persistence.loadSnapshot()).contains(AppState.initial());
  }

  /** Advances one millisecond per reading until stopped. */
  private static final class SteppingClock extends Clock {

    private final AtomicLong millis;
    private volatile boolean stopped;

    SteppingClock(final long start) {
      this.millis = new AtomicLong(start);
    }

    void stop() {
      stopped = true;
    }

    @Override
    public long millis() {
      return stopped ? millis.get() : millis.getAndIncrement();
    }

    @Override
    public Instant instant() {
      return Instant.ofEpochMilli(millis());
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
      return this;
    }
  }
}
