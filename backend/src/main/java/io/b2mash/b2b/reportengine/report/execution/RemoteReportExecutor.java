package io.b2mash.b2b.reportengine.report.execution;

import io.b2mash.b2b.reportengine.exception.ReportExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Delegates execution to the query service over HTTP. Timeouts come from the client config. */
@Component
public class RemoteReportExecutor implements ReportExecutor {

  private static final Logger log = LoggerFactory.getLogger(RemoteReportExecutor.class);

  static final String ORGANIZATION_HEADER = "X-Organization-Id";

  private final RestClient restClient;

  public RemoteReportExecutor(@Qualifier("reportExecutorRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public ReportResult execute(ReportConfig config, String orgId) {
    try {
      var result =
          restClient
              .post()
              .uri("/internal/report-executions")
              .header(ORGANIZATION_HEADER, orgId)
              .contentType(MediaType.APPLICATION_JSON)
              .body(config)
              .retrieve()
              .body(ReportResult.class);
      if (result == null) {
        throw new ReportExecutionException("Report executor returned an empty response", null);
      }
      return result;
    } catch (RestClientException e) {
      log.error(
          "Report execution failed: entityType={}, orgId={}, error={}",
          config.entityType().getKey(),
          orgId,
          e.getMessage());
      throw new ReportExecutionException("Report execution failed: " + e.getMessage(), e);
    }
  }
}
