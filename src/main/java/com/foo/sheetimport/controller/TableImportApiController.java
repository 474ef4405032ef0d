package com.foo.sheetimport.controller;

import com.foo.sheetimport.config.SheetImportProperties;
import com.foo.sheetimport.service.pipeline.TableImportOrchestrator.ImportSummary;
import com.foo.sheetimport.service.pipeline.TableImportRequestService;
import com.foo.sheetimport.service.pipeline.schema.TableInspector;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/import")
public class TableImportApiController {

  private final TableImportRequestService importRequestService;
  private final TableInspector tableInspector;
  private final SheetImportProperties properties;

  @PostMapping
  public ResponseEntity<Map<String, Object>> uploadToDefaultTable(
      @RequestPart("file") MultipartFile file,
      @RequestParam(value = "sheet", required = false) String sheet)
      throws IOException {
    return upload(properties.getDefaultTableName(), file, sheet);
  }

  @PostMapping("/{tableName}")
  public ResponseEntity<Map<String, Object>> upload(
      @PathVariable String tableName,
      @RequestPart("file") MultipartFile file,
      @RequestParam(value = "sheet", required = false) String sheet)
      throws IOException {
    ImportSummary summary = importRequestService.upload(file, tableName, sheet);
    return ResponseEntity.ok(importRequestService.toApiResponse(summary));
  }

  @GetMapping("/{tableName}/preview")
  public ResponseEntity<Map<String, Object>> preview(
      @PathVariable String tableName,
      @RequestParam(value = "limit", required = false) Integer limit) {
    int effectiveLimit = limit != null ? limit : properties.getPreviewLimit();
    List<Map<String, Object>> rows = tableInspector.preview(tableName, effectiveLimit);

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("success", true);
    response.put("tableName", tableName);
    response.put("rows", rows);
    return ResponseEntity.ok(response);
  }
}
