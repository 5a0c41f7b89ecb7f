package com.consullo.workbench.state;

import java.time.Instant;
import org.apache.commons.lang3.Validate;

/**
 * A persisted comment attached to a file, as shown for the selected file.
 *
 * @param id record id
 * @param path file path
 * @param content comment text
 * @param createdAt creation time
 */
public record FileComment(long id, String path, String content, Instant createdAt) {

  public FileComment {
    Validate.notBlank(path, "path must not be blank");
    Validate.notNull(content, "content must not be null");
    Validate.notNull(createdAt, "createdAt must not be null");
  }
}
