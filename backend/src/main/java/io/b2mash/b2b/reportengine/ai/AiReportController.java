package io.b2mash.b2b.reportengine.ai;

import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reports")
public class AiReportController {

  private final AiReportService aiReportService;

  public AiReportController(AiReportService aiReportService) {
    this.aiReportService = aiReportService;
  }

  @PostMapping("/ai-generate")
  @PreAuthorize("hasAnyRole('SYSTEM_ADMIN', 'COMPLIANCE_OFFICER')")
  public ResponseEntity<AiGenerateResponse> generate(
      @Valid @RequestBody AiGenerateRequest request) {
    return ResponseEntity.ok(aiReportService.generate(request));
  }
}
