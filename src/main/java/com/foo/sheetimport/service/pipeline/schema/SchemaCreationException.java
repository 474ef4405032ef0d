package com.foo.sheetimport.service.pipeline.schema;

import lombok.Getter;

/** The target table could not be dropped or created. Nothing was loaded. */
@Getter
public class SchemaCreationException extends RuntimeException {

  private final String tableName;

  public SchemaCreationException(String tableName, Throwable cause) {
    super("Failed to create table '%s': %s".formatted(tableName, cause.getMessage()), cause);
    this.tableName = tableName;
  }
}
