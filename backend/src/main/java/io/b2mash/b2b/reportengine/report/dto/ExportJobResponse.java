package io.b2mash.b2b.reportengine.report.dto;

public record ExportJobResponse(String status, String jobId) {}
