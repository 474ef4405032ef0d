package com.foo.sheetimport.service.pipeline.load;

/** Result of one insert attempt. {@code failure} is {@code null} on success. */
public record WriteAttempt(int rows, String failure) {

  public static WriteAttempt succeeded(int rows) {
    return new WriteAttempt(rows, null);
  }

  public static WriteAttempt failed(int rows, Exception cause) {
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    return new WriteAttempt(rows, message);
  }

  public boolean succeeded() {
    return failure == null;
  }
}
