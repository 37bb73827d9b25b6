package io.b2mash.b2b.reportengine.export;

/** File formats the export pipeline renders. */
public enum ExportFormat {
  XLSX,
  CSV,
  PDF
}
