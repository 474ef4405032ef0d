package com.foo.sheetimport.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackageAccess;
import org.apache.poi.openxml4j.util.ZipSecureFile;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.util.IOUtils;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Opening uploaded workbooks safely.
 *
 * <p>Checks the ZIP signature before handing the file to POI and caps decompression so that a zip
 * bomb fails fast instead of exhausting memory. POI's OOXML parsers have external entities
 * disabled.
 */
public final class SecureExcelUtils {

  // 단일 레코드/바이트 배열 최대 크기 (200 MB)
  private static final int MAX_BYTE_ARRAY_SIZE = 200_000_000;

  // 압축 해제 비율 하한, 이보다 작으면 zip bomb 으로 간주
  private static final double MIN_INFLATE_RATIO = 0.01;

  // 압축 해제된 단일 엔트리 최대 크기 (500 MB)
  private static final long MAX_ENTRY_SIZE = 500L * 1024 * 1024;

  private static final byte[] XLSX_MAGIC = {0x50, 0x4B, 0x03, 0x04};

  static {
    IOUtils.setByteArrayMaxOverride(MAX_BYTE_ARRAY_SIZE);
    ZipSecureFile.setMinInflateRatio(MIN_INFLATE_RATIO);
    ZipSecureFile.setMaxEntrySize(MAX_ENTRY_SIZE);
  }

  private SecureExcelUtils() {}

  /**
   * Opens an {@code .xlsx} file read-only after validating its signature.
   *
   * @throws SecurityException if the content is not an xlsx package
   * @throws IOException if POI cannot open the package
   */
  public static Workbook createWorkbook(Path path) throws IOException {
    validateFileContent(path);
    try {
      OPCPackage pkg = OPCPackage.open(path.toFile(), PackageAccess.READ);
      return new XSSFWorkbook(pkg);
    } catch (Exception e) {
      throw new IOException("Failed to open XLSX file securely: " + e.getMessage(), e);
    }
  }

  public static void validateFileContent(Path path) throws IOException {
    String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (!fileName.endsWith(".xlsx")) {
      throw new SecurityException("Only .xlsx files are supported.");
    }
    if (!matchesMagicBytes(readFileHeader(path, XLSX_MAGIC.length))) {
      throw new SecurityException(
          "File content does not match XLSX format. The file may be corrupted or disguised.");
    }
  }

  /**
   * Reduces a client supplied file name to a bare, safe {@code .xlsx} name.
   *
   * @throws IllegalArgumentException if nothing usable remains or the extension is wrong
   */
  public static String sanitizeFilename(String originalFilename) {
    if (originalFilename == null || originalFilename.isBlank()) {
      throw new IllegalArgumentException("Filename cannot be null or empty");
    }

    String filename = originalFilename;
    int lastSlash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
    if (lastSlash >= 0) {
      filename = filename.substring(lastSlash + 1);
    }

    filename =
        filename
            .replaceAll("[\\x00-\\x1F\\x7F]", "")
            .replaceAll("[^a-zA-Z0-9.\\-_\\s\\uAC00-\\uD7AF\\u1100-\\u11FF\\u3130-\\u318F]", "_")
            .replaceAll("\\.{2,}", ".")
            .replaceAll("^[.\\s]+|[.\\s]+$", "");

    if (filename.isBlank()) {
      throw new IllegalArgumentException("Filename is invalid after sanitization");
    }
    if (!filename.toLowerCase(Locale.ROOT).endsWith(".xlsx")) {
      throw new IllegalArgumentException("Invalid file extension");
    }
    return filename;
  }

  private static byte[] readFileHeader(Path path, int length) throws IOException {
    try (InputStream is = Files.newInputStream(path)) {
      byte[] header = is.readNBytes(length);
      if (header.length < length) {
        throw new SecurityException("File is too small to be a valid Excel file");
      }
      return header;
    }
  }

  private static boolean matchesMagicBytes(byte[] header) {
    for (int i = 0; i < XLSX_MAGIC.length; i++) {
      if (header[i] != XLSX_MAGIC[i]) {
        return false;
      }
    }
    return true;
  }
}
