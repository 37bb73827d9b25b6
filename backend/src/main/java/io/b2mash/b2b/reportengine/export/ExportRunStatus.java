package io.b2mash.b2b.reportengine.export;

public enum ExportRunStatus {
  PENDING,
  SUCCESS,
  FAILED
}
