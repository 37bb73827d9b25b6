package io.b2mash.b2b.reportengine.report.schedule;

import jakarta.validation.Valid;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reports/{reportId}/schedule")
public class ReportScheduleController {

  private final ReportScheduleService reportScheduleService;

  public ReportScheduleController(ReportScheduleService reportScheduleService) {
    this.reportScheduleService = reportScheduleService;
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER', 'CCO')")
  public ResponseEntity<ReportScheduleResponse> create(
      @PathVariable UUID reportId, @Valid @RequestBody ReportScheduleRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(reportScheduleService.create(reportId, request));
  }

  @GetMapping
  public ResponseEntity<ReportScheduleResponse> get(@PathVariable UUID reportId) {
    return ResponseEntity.ok(reportScheduleService.get(reportId));
  }

  @PutMapping
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER', 'CCO')")
  public ResponseEntity<ReportScheduleResponse> update(
      @PathVariable UUID reportId, @Valid @RequestBody ReportScheduleRequest request) {
    return ResponseEntity.ok(reportScheduleService.update(reportId, request));
  }

  @DeleteMapping
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER', 'CCO')")
  public ResponseEntity<Void> delete(@PathVariable UUID reportId) {
    reportScheduleService.delete(reportId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/pause")
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER', 'CCO')")
  public ResponseEntity<ReportScheduleResponse> pause(@PathVariable UUID reportId) {
    return ResponseEntity.ok(reportScheduleService.pause(reportId));
  }

  @PostMapping("/resume")
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER', 'CCO')")
  public ResponseEntity<ReportScheduleResponse> resume(@PathVariable UUID reportId) {
    return ResponseEntity.ok(reportScheduleService.resume(reportId));
  }

  @PostMapping("/run-now")
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER', 'CCO')")
  public ResponseEntity<Map<String, Object>> runNow(@PathVariable UUID reportId) {
    UUID runId = reportScheduleService.runNow(reportId);
    return ResponseEntity.accepted().body(Map.of("runId", runId, "status", "PENDING"));
  }
}
