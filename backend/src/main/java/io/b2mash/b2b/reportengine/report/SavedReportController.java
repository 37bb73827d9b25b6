package io.b2mash.b2b.reportengine.report;

import io.b2mash.b2b.reportengine.multitenancy.RequestScopes;
import io.b2mash.b2b.reportengine.report.dto.CreateReportRequest;
import io.b2mash.b2b.reportengine.report.dto.ExportJobResponse;
import io.b2mash.b2b.reportengine.report.dto.FavoriteResponse;
import io.b2mash.b2b.reportengine.report.dto.ReportPageResponse;
import io.b2mash.b2b.reportengine.report.dto.SavedReportResponse;
import io.b2mash.b2b.reportengine.report.dto.UpdateReportRequest;
import io.b2mash.b2b.reportengine.report.execution.ReportResult;
import io.b2mash.b2b.reportengine.report.execution.ReportRunService;
import io.b2mash.b2b.reportengine.report.execution.RunReportRequest;
import io.b2mash.b2b.reportengine.report.field.FieldGroup;
import io.b2mash.b2b.reportengine.report.field.ReportFieldRegistry;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reports")
public class SavedReportController {

  private final SavedReportService savedReportService;
  private final ReportRunService reportRunService;
  private final ReportFieldRegistry fieldRegistry;

  public SavedReportController(
      SavedReportService savedReportService,
      ReportRunService reportRunService,
      ReportFieldRegistry fieldRegistry) {
    this.savedReportService = savedReportService;
    this.reportRunService = reportRunService;
    this.fieldRegistry = fieldRegistry;
  }

  @GetMapping("/fields/{entityType}")
  public ResponseEntity<List<FieldGroup>> fields(@PathVariable String entityType) {
    return ResponseEntity.ok(
        fieldRegistry.getFieldGroups(entityType, RequestScopes.requireOrgId()));
  }

  @GetMapping("/templates")
  public ResponseEntity<List<SavedReportResponse>> templates() {
    return ResponseEntity.ok(savedReportService.templates());
  }

  @GetMapping
  public ResponseEntity<ReportPageResponse> list(
      @RequestParam(required = false) ReportVisibility visibility,
      @RequestParam(name = "isTemplate", required = false) Boolean template,
      @RequestParam(required = false) String search,
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(defaultValue = "0") int pageSize) {
    return ResponseEntity.ok(savedReportService.list(visibility, template, search, page, pageSize));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER', 'POLICY_AUTHOR')")
  public ResponseEntity<SavedReportResponse> create(
      @Valid @RequestBody CreateReportRequest request) {
    var response = savedReportService.create(request);
    return ResponseEntity.created(URI.create("/api/reports/" + response.id())).body(response);
  }

  @GetMapping("/{id}")
  public ResponseEntity<SavedReportResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(savedReportService.get(id));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER', 'POLICY_AUTHOR')")
  public ResponseEntity<SavedReportResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateReportRequest request) {
    return ResponseEntity.ok(savedReportService.update(id, request));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER')")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    savedReportService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/run")
  public ResponseEntity<ReportResult> run(
      @PathVariable UUID id, @Valid @RequestBody(required = false) RunReportRequest request) {
    return ResponseEntity.ok(reportRunService.run(id, request));
  }

  @PostMapping("/{id}/duplicate")
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER', 'POLICY_AUTHOR')")
  public ResponseEntity<SavedReportResponse> duplicate(@PathVariable UUID id) {
    var response = savedReportService.duplicate(id);
    return ResponseEntity.status(HttpStatus.CREATED)
        .location(URI.create("/api/reports/" + response.id()))
        .body(response);
  }

  @PostMapping("/{id}/favorite")
  public ResponseEntity<FavoriteResponse> toggleFavorite(@PathVariable UUID id) {
    return ResponseEntity.ok(savedReportService.toggleFavorite(id));
  }

  @PostMapping("/{id}/export")
  public ResponseEntity<ExportJobResponse> export(@PathVariable UUID id) {
    return ResponseEntity.ok(savedReportService.requestExport(id));
  }
}
