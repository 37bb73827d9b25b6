package io.b2mash.b2b.reportengine.report.dto;

import java.util.List;

/** One page of the report list. {@code page} is 1-based. */
public record ReportPageResponse(
    List<SavedReportResponse> data, long total, int page, int pageSize) {}
