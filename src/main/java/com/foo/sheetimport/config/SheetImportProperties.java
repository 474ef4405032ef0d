package com.foo.sheetimport.config;

import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "sheet.import")
public class SheetImportProperties {

  /** Table used when the caller does not name one. */
  @NotBlank private String defaultTableName = "commercial";

  @Min(1)
  private int maxFileSizeMb = 10;

  @Min(1)
  private int previewLimit = 5;

  private String tempDirectory = System.getProperty("java.io.tmpdir") + "/sheet-imports";

  @PostConstruct
  public void init() throws IOException {
    Path tempDir = Path.of(tempDirectory);
    if (!Files.exists(tempDir)) {
      Files.createDirectories(tempDir);
    }
  }

  public Path getTempDirectoryPath() {
    return Path.of(tempDirectory);
  }
}
