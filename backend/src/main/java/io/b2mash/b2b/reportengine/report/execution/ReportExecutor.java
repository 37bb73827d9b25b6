package io.b2mash.b2b.reportengine.report.execution;

/** Runs a flattened report configuration against tenant data. */
public interface ReportExecutor {

  /**
   * @throws io.b2mash.b2b.reportengine.exception.ReportExecutionException when the execution
   *     fails or times out
   */
  ReportResult execute(ReportConfig config, String orgId);
}
