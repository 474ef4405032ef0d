package com.foo.sheetimport.service.pipeline.read;

import lombok.Getter;

/** The source spreadsheet could not be turned into a dataset. */
@Getter
public class DatasetReadException extends RuntimeException {

  private final String source;

  public DatasetReadException(String source, String message) {
    super(message);
    this.source = source;
  }

  public DatasetReadException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
  }
}
