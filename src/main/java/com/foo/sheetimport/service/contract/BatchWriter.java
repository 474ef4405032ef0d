package com.foo.sheetimport.service.contract;

import com.foo.sheetimport.dataset.DatasetRow;
import java.util.List;

/**
 * Writes a group of rows to the target table as a single all-or-nothing operation.
 *
 * <p>Implementations signal a rejected write with a {@link
 * org.springframework.dao.DataAccessException}; the caller decides whether to retry.
 */
@FunctionalInterface
public interface BatchWriter {

  void write(List<DatasetRow> rows);
}
