package com.consullo.workbench.persistence;

/**
 * Kind of durable record, one table each.
 */
public enum RecordKind {
  /** File comment, scoped by file path. */
  COMMENT("file_comments", "path"),
  /** Activity log line, scoped by area such as {@code terminal}, {@code project} or {@code chat}. */
  ACTIVITY("activity_logs", "scope");

  private final String table;
  private final String scopeColumn;

  RecordKind(final String table, final String scopeColumn) {
    this.table = table;
    this.scopeColumn = scopeColumn;
  }

  public String table() {
    return table;
  }

  public String scopeColumn() {
    return scopeColumn;
  }
}
