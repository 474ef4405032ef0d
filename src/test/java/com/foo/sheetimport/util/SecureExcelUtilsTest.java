package com.foo.sheetimport.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

class SecureExcelUtilsTest {

  @TempDir Path tempDir;

  // ========== sanitizeFilename ==========

  @ParameterizedTest
  @NullSource
  @ValueSource(strings = {"", "   ", "\t"})
  void sanitizeFilename_nullOrBlank_throws(String input) {
    assertThatThrownBy(() -> SecureExcelUtils.sanitizeFilename(input))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sanitizeFilename_pathTraversal_keepsBareName() {
    assertThat(SecureExcelUtils.sanitizeFilename("../../../etc/licenses.xlsx"))
        .isEqualTo("licenses.xlsx");
    assertThat(SecureExcelUtils.sanitizeFilename("C:\\Users\\Admin\\licenses.xlsx"))
        .isEqualTo("licenses.xlsx");
  }

  @Test
  void sanitizeFilename_controlAndSpecialCharacters_removed() {
    assertThat(SecureExcelUtils.sanitizeFilename("test\u0000\u0001file.xlsx"))
        .isEqualTo("testfile.xlsx");
    assertThat(SecureExcelUtils.sanitizeFilename("test<>:\"|?*file.xlsx"))
        .doesNotContain("<", ">", ":", "\"", "|", "?", "*");
  }

  @Test
  void sanitizeFilename_koreanCharacters_preserved() {
    assertThat(SecureExcelUtils.sanitizeFilename("상업용_라이선스.xlsx")).isEqualTo("상업용_라이선스.xlsx");
  }

  @ParameterizedTest
  @ValueSource(strings = {"data.xls", "data.csv", "data"})
  void sanitizeFilename_invalidExtension_throws(String filename) {
    assertThatThrownBy(() -> SecureExcelUtils.sanitizeFilename(filename))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("extension");
  }

  // ========== validateFileContent ==========

  @Test
  void validateFileContent_realWorkbook_passes() throws IOException {
    Path xlsx = createWorkbookFile("valid.xlsx");

    assertThatCode(() -> SecureExcelUtils.validateFileContent(xlsx)).doesNotThrowAnyException();
  }

  @Test
  void validateFileContent_wrongMagicBytes_throwsSecurityException() throws IOException {
    // .xlsx 확장자지만 PDF 내용
    Path fake = tempDir.resolve("fake.xlsx");
    Files.write(fake, new byte[] {0x25, 0x50, 0x44, 0x46});

    assertThatThrownBy(() -> SecureExcelUtils.validateFileContent(fake))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("XLSX");
  }

  @Test
  void validateFileContent_tooSmall_throwsSecurityException() throws IOException {
    Path tiny = tempDir.resolve("tiny.xlsx");
    Files.write(tiny, new byte[] {0x50});

    assertThatThrownBy(() -> SecureExcelUtils.validateFileContent(tiny))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("too small");
  }

  @Test
  void validateFileContent_nonXlsxName_throwsSecurityException() throws IOException {
    Path xls = tempDir.resolve("legacy.xls");
    Files.write(xls, new byte[] {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0});

    assertThatThrownBy(() -> SecureExcelUtils.validateFileContent(xls))
        .isInstanceOf(SecurityException.class);
  }

  // ========== createWorkbook ==========

  @Test
  void createWorkbook_opensValidFile() throws IOException {
    Path xlsx = createWorkbookFile("open.xlsx");

    try (Workbook wb = SecureExcelUtils.createWorkbook(xlsx)) {
      assertThat(wb.getSheetAt(0).getRow(0).getCell(0).getStringCellValue()).isEqualTo("Name");
    }
  }

  @Test
  void createWorkbook_zipThatIsNotWorkbook_throwsIOException() throws IOException {
    Path notWorkbook = tempDir.resolve("archive.xlsx");
    try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(notWorkbook))) {
      zip.putNextEntry(new ZipEntry("readme.txt"));
      zip.write("hello".getBytes());
      zip.closeEntry();
    }

    assertThatThrownBy(() -> SecureExcelUtils.createWorkbook(notWorkbook))
        .isInstanceOf(IOException.class);
  }

  private Path createWorkbookFile(String name) throws IOException {
    Path file = tempDir.resolve(name);
    try (XSSFWorkbook wb = new XSSFWorkbook();
        OutputStream os = Files.newOutputStream(file)) {
      wb.createSheet("Sheet1").createRow(0).createCell(0).setCellValue("Name");
      wb.write(os);
    }
    return file;
  }
}
