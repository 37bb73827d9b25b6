package io.b2mash.b2b.reportengine.ai;

import io.b2mash.b2b.reportengine.report.dto.CreateReportRequest;

/**
 * @param report unsaved draft, ready to be posted to the create endpoint
 * @param results the AI service's query results
 */
public record AiGenerateResponse(
    CreateReportRequest report, Object results, String interpretation) {}
