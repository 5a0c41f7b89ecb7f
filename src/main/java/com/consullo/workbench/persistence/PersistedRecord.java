package com.consullo.workbench.persistence;

import com.consullo.workbench.state.FileComment;
import com.consullo.workbench.state.ProjectKey;
import java.time.Instant;
import org.apache.commons.lang3.Validate;

/**
 * A stored comment or activity line.
 *
 * @param id row id, unique within its kind
 * @param kind record kind
 * @param projectKey partition key
 * @param scope file path for comments, area for activity lines
 * @param content text
 * @param createdAt creation time, millisecond precision
 * @since 1.0
 */
public record PersistedRecord(long id, RecordKind kind, ProjectKey projectKey, String scope, String content,
    Instant createdAt) {

  public PersistedRecord {
    Validate.notNull(kind, "kind must not be null");
    Validate.notNull(projectKey, "projectKey must not be null");
    Validate.notBlank(scope, "scope must not be blank");
    Validate.notNull(content, "content must not be null");
    Validate.notNull(createdAt, "createdAt must not be null");
  }

  public FileComment toComment() {
    Validate.validState(kind == RecordKind.COMMENT, "record %s is not a comment", id);
    return new FileComment(id, scope, content, createdAt);
  }
}
