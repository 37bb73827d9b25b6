package io.b2mash.b2b.reportengine.report.filter;

public enum FilterLogic {
  AND,
  OR
}
