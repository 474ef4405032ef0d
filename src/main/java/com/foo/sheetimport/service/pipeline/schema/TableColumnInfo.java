package com.foo.sheetimport.service.pipeline.schema;

public record TableColumnInfo(String name, String dataType) {

  @Override
  public String toString() {
    return name + ": " + dataType;
  }
}
