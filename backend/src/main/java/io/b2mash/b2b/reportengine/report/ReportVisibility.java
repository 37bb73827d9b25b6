package io.b2mash.b2b.reportengine.report;

public enum ReportVisibility {
  PRIVATE,
  TEAM,
  EVERYONE
}
