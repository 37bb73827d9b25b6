package io.b2mash.b2b.reportengine.report.execution;

import io.b2mash.b2b.reportengine.multitenancy.RequestScopes;
import io.b2mash.b2b.reportengine.report.SavedReportRepository;
import io.b2mash.b2b.reportengine.report.SavedReportService;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs saved reports. Not transactional: the executor call can be slow and must not hold a
 * connection, and runs of the same report are allowed to overlap.
 */
@Service
public class ReportRunService {

  private static final Logger log = LoggerFactory.getLogger(ReportRunService.class);

  private final SavedReportService savedReportService;
  private final SavedReportRepository savedReportRepository;
  private final ReportConfigBuilder configBuilder;
  private final ReportExecutor reportExecutor;

  public ReportRunService(
      SavedReportService savedReportService,
      SavedReportRepository savedReportRepository,
      ReportConfigBuilder configBuilder,
      ReportExecutor reportExecutor) {
    this.savedReportService = savedReportService;
    this.savedReportRepository = savedReportRepository;
    this.configBuilder = configBuilder;
    this.reportExecutor = reportExecutor;
  }

  /**
   * Executes the report and, on success only, records run statistics. Executor failures propagate
   * unchanged and leave the statistics untouched.
   */
  public ReportResult run(UUID reportId, RunReportRequest overrides) {
    String orgId = RequestScopes.requireOrgId();
    var report = savedReportService.requireReport(reportId);
    var config = configBuilder.build(report, overrides);

    long started = System.nanoTime();
    var result = reportExecutor.execute(config, orgId);
    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    savedReportRepository.recordRun(
        report.getId(), orgId, Instant.now(), durationMs, result.totalCount());

    log.info(
        "Ran report: id={}, entityType={}, rows={}, durationMs={}",
        report.getId(),
        config.entityType().getKey(),
        result.totalCount(),
        durationMs);
    return result;
  }
}
