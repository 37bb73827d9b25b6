package io.b2mash.b2b.reportengine.report.template;

import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Internal endpoint used by tenant provisioning. Secured by API key. */
@RestController
@RequestMapping("/internal/report-templates")
public class ReportTemplateController {

  private final ReportTemplatePackSeeder seeder;

  public ReportTemplateController(ReportTemplatePackSeeder seeder) {
    this.seeder = seeder;
  }

  @PostMapping("/seed")
  public ResponseEntity<Map<String, Object>> seed(@RequestParam String orgId) {
    int created = seeder.seedForOrganization(orgId);
    return ResponseEntity.ok(Map.of("orgId", orgId, "created", created));
  }
}
