package com.foo.sheetimport.service.pipeline;

import com.foo.sheetimport.config.SheetImportProperties;
import com.foo.sheetimport.service.file.ImportUploadFileService;
import com.foo.sheetimport.service.pipeline.TableImportOrchestrator.ImportSummary;
import com.foo.sheetimport.service.pipeline.load.DroppedRange;
import com.foo.sheetimport.service.pipeline.schema.SchemaGenerator;
import com.foo.sheetimport.service.pipeline.schema.TableColumnInfo;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

/** Stores an uploaded workbook in a private temp directory, imports it, then cleans up. */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableImportRequestService {

  private final TableImportOrchestrator orchestrator;
  private final ImportUploadFileService uploadFileService;
  private final SheetImportProperties properties;

  public ImportSummary upload(MultipartFile file, String tableName, String sheetName)
      throws IOException {
    checkFileSize(file);
    SchemaGenerator.requireValidTableName(tableName);

    Path requestDir = Files.createTempDirectory(properties.getTempDirectoryPath(), "upload-");
    try {
      Path xlsxFile = uploadFileService.storeAndValidateXlsx(file, requestDir);
      return orchestrator.importWorkbook(xlsxFile, tableName, sheetName);
    } finally {
      deleteRequestDirectory(requestDir);
    }
  }

  public Map<String, Object> toApiResponse(ImportSummary summary) {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("success", true);
    response.put("partial", summary.partial());
    response.put("tableName", summary.tableName());
    response.put("rowsRead", summary.rowsRead());
    response.put("emptyRowsRemoved", summary.emptyRowsRemoved());
    response.put("duplicateRowsRemoved", summary.duplicateRowsRemoved());
    response.put("rowsAttempted", summary.rowsAttempted());
    response.put("rowsPersisted", summary.rowsPersisted());
    response.put("rowsDropped", summary.rowsDropped());
    response.put("tableRowCount", summary.tableRowCount());
    response.put("columnCount", summary.columnCount());
    response.put("columns", columnsOf(summary.columns()));
    response.put("droppedRanges", droppedRangesOf(summary.droppedRanges()));
    response.put(
        "message",
        summary.partial()
            ? summary.rowsDropped() + "개 행이 오류로 제외되었습니다"
            : "데이터 업로드 완료");
    return response;
  }

  private List<Map<String, Object>> columnsOf(List<TableColumnInfo> columns) {
    return columns.stream()
        .map(c -> Map.<String, Object>of("name", c.name(), "type", c.dataType()))
        .toList();
  }

  private List<Map<String, Object>> droppedRangesOf(List<DroppedRange> ranges) {
    return ranges.stream()
        .map(
            r ->
                Map.<String, Object>of(
                    "firstSheetRow", r.firstSourceRow(),
                    "lastSheetRow", r.lastSourceRow(),
                    "rows", r.size(),
                    "cause", r.cause()))
        .toList();
  }

  private void checkFileSize(MultipartFile file) {
    long maxBytes = (long) properties.getMaxFileSizeMb() * 1024 * 1024;
    if (file.getSize() > maxBytes) {
      throw new MaxUploadSizeExceededException(maxBytes);
    }
  }

  private void deleteRequestDirectory(Path requestDir) {
    try {
      FileSystemUtils.deleteRecursively(requestDir);
    } catch (IOException e) {
      log.warn("Failed to delete temp upload directory {}", requestDir, e);
    }
  }
}
