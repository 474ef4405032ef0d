package com.foo.sheetimport.service.file;

import com.foo.sheetimport.util.SecureExcelUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

@Service
public class ImportUploadFileService {

  /** .xlsx 파일만 허용한다. */
  public Path storeAndValidateXlsx(MultipartFile file, Path tempDir) throws IOException {
    String originalName = file.getOriginalFilename();
    if (originalName == null || originalName.isBlank()) {
      throw new IllegalArgumentException("파일명이 없습니다");
    }

    String lowerOriginalName = originalName.trim().toLowerCase(Locale.ROOT);
    if (lowerOriginalName.endsWith(".xls")) {
      throw new IllegalArgumentException("지원하지 않는 파일 형식입니다. .xlsx 파일만 업로드 가능합니다.");
    }
    if (!lowerOriginalName.endsWith(".xlsx")) {
      throw new IllegalArgumentException("유효하지 않은 파일 확장자입니다.");
    }

    Path targetPath = tempDir.resolve(SecureExcelUtils.sanitizeFilename(originalName));
    file.transferTo(targetPath);
    SecureExcelUtils.validateFileContent(targetPath);
    return targetPath;
  }
}
