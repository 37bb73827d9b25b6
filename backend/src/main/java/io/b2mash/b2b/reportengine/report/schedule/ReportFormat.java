package io.b2mash.b2b.reportengine.report.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.b2mash.b2b.reportengine.export.ExportFormat;
import java.util.Locale;

/** Report-facing delivery formats and their export pipeline counterparts. */
public enum ReportFormat {
  EXCEL(ExportFormat.XLSX),
  CSV(ExportFormat.CSV),
  PDF(ExportFormat.PDF);

  private final ExportFormat exportFormat;

  ReportFormat(ExportFormat exportFormat) {
    this.exportFormat = exportFormat;
  }

  public ExportFormat toExportFormat() {
    return exportFormat;
  }

  /** Lenient parse; unknown or missing values fall back to EXCEL. */
  @JsonCreator
  public static ReportFormat fromValue(String value) {
    if (value == null) {
      return EXCEL;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if ("XLSX".equals(normalized)) {
      return EXCEL;
    }
    for (ReportFormat format : values()) {
      if (format.name().equals(normalized)) {
        return format;
      }
    }
    return EXCEL;
  }

  public static ReportFormat fromExportFormat(ExportFormat format) {
    if (format == null) {
      return EXCEL;
    }
    for (ReportFormat candidate : values()) {
      if (candidate.exportFormat == format) {
        return candidate;
      }
    }
    return EXCEL;
  }
}
