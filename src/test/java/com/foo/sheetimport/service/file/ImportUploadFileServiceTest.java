package com.foo.sheetimport.service.file;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

class ImportUploadFileServiceTest {

  private static final String XLSX_CONTENT_TYPE =
      "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

  private ImportUploadFileService uploadFileService;

  @TempDir Path tempDir;

  @BeforeEach
  void setUp() {
    uploadFileService = new ImportUploadFileService();
  }

  @Test
  void xlsxFile_isStoredUnderTempDir() throws IOException {
    MockMultipartFile file =
        new MockMultipartFile("file", "licenses.xlsx", XLSX_CONTENT_TYPE, createXlsxBytes());

    Path result = uploadFileService.storeAndValidateXlsx(file, tempDir);

    assertThat(result.getParent()).isEqualTo(tempDir);
    assertThat(result.getFileName().toString()).isEqualTo("licenses.xlsx");
    assertThat(result).exists();
  }

  @Test
  void xlsFile_rejected() throws IOException {
    MockMultipartFile file =
        new MockMultipartFile("file", "licenses.xls", "application/vnd.ms-excel", createXlsxBytes());

    assertThatThrownBy(() -> uploadFileService.storeAndValidateXlsx(file, tempDir))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining(".xlsx");
  }

  @Test
  void unsupportedExtension_throws() {
    MockMultipartFile file =
        new MockMultipartFile("file", "licenses.csv", "text/csv", "a,b,c".getBytes());

    assertThatThrownBy(() -> uploadFileService.storeAndValidateXlsx(file, tempDir))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void missingFilename_throws() {
    MockMultipartFile file =
        new MockMultipartFile("file", null, "application/octet-stream", new byte[0]);

    assertThatThrownBy(() -> uploadFileService.storeAndValidateXlsx(file, tempDir))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void pathTraversalFilename_isSanitized() throws IOException {
    MockMultipartFile file =
        new MockMultipartFile(
            "file", "../../../etc/licenses.xlsx", XLSX_CONTENT_TYPE, createXlsxBytes());

    Path result = uploadFileService.storeAndValidateXlsx(file, tempDir);

    assertThat(result.getParent()).isEqualTo(tempDir);
    assertThat(result.getFileName().toString()).doesNotContain("..").doesNotContain("/");
  }

  @Test
  void disguisedContent_throwsSecurityException() {
    MockMultipartFile file =
        new MockMultipartFile(
            "file", "malicious.xlsx", XLSX_CONTENT_TYPE, new byte[] {0x25, 0x50, 0x44, 0x46, 0x2D});

    assertThatThrownBy(() -> uploadFileService.storeAndValidateXlsx(file, tempDir))
        .isInstanceOf(SecurityException.class);
  }

  private byte[] createXlsxBytes() throws IOException {
    try (XSSFWorkbook wb = new XSSFWorkbook()) {
      wb.createSheet("Sheet1").createRow(0).createCell(0).setCellValue("License Number");
      ByteArrayOutputStream bos = new ByteArrayOutputStream();
      wb.write(bos);
      return bos.toByteArray();
    }
  }
}
