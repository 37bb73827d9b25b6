package io.b2mash.b2b.reportengine.report.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.reportengine.export.ExportFormat;
import org.junit.jupiter.api.Test;

class ReportFormatTest {

  @Test
  void fromValue_mapsKnownFormatsCaseInsensitively() {
    assertThat(ReportFormat.fromValue("csv")).isEqualTo(ReportFormat.CSV);
    assertThat(ReportFormat.fromValue(" PDF ")).isEqualTo(ReportFormat.PDF);
    assertThat(ReportFormat.fromValue("Excel")).isEqualTo(ReportFormat.EXCEL);
    assertThat(ReportFormat.fromValue("xlsx")).isEqualTo(ReportFormat.EXCEL);
  }

  @Test
  void fromValue_unknownOrMissingFallsBackToExcel() {
    assertThat(ReportFormat.fromValue(null)).isEqualTo(ReportFormat.EXCEL);
    assertThat(ReportFormat.fromValue("docx")).isEqualTo(ReportFormat.EXCEL);
  }

  @Test
  void exportFormatMappingIsSymmetric() {
    for (ReportFormat format : ReportFormat.values()) {
      assertThat(ReportFormat.fromExportFormat(format.toExportFormat())).isEqualTo(format);
    }
    assertThat(ReportFormat.EXCEL.toExportFormat()).isEqualTo(ExportFormat.XLSX);
  }
}
