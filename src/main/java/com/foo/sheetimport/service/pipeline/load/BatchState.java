package com.foo.sheetimport.service.pipeline.load;

/**
 * Lifecycle of a group of rows during loading.
 *
 * <pre>
 * PENDING -> ATTEMPTING_BATCH -> PERSISTED
 *                             -> ATTEMPTING_SUB_BATCH -> PERSISTED
 *                                                     -> DROPPED
 * </pre>
 */
public enum BatchState {
  PENDING,
  ATTEMPTING_BATCH,
  ATTEMPTING_SUB_BATCH,
  PERSISTED,
  DROPPED;

  public BatchState start() {
    if (this != PENDING) {
      throw new IllegalStateException("Cannot start from " + this);
    }
    return ATTEMPTING_BATCH;
  }

  public BatchState onAttempt(WriteAttempt attempt) {
    return switch (this) {
      case ATTEMPTING_BATCH -> attempt.succeeded() ? PERSISTED : ATTEMPTING_SUB_BATCH;
      case ATTEMPTING_SUB_BATCH -> attempt.succeeded() ? PERSISTED : DROPPED;
      default -> throw new IllegalStateException("No write is attempted in state " + this);
    };
  }
}
