package io.b2mash.b2b.reportengine.report;

import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.b2b.reportengine.TestcontainersConfiguration;
import io.b2mash.b2b.reportengine.ai.AiQueryClient;
import io.b2mash.b2b.reportengine.report.execution.ReportExecutor;
import io.b2mash.b2b.reportengine.report.execution.ReportResult;
import io.b2mash.b2b.reportengine.security.Roles;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class SavedReportLifecycleIntegrationTest {

  private static final String API_KEY = "test-api-key";
  private static final String ORG_ID = "org_lifecycle";
  private static final String OTHER_ORG_ID = "org_lifecycle_other";

  private static final String CREATE_BODY =
      """
      {
        "name": "Open high severity cases",
        "entityType": "cases",
        "columns": ["referenceNumber", "status", "severity"],
        "filters": [
          {"logic": "AND", "conditions": [
            {"field": "severity", "operator": "eq", "value": "HIGH"}
          ]}
        ],
        "visibility": "TEAM"
      }
      """;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ReportExecutor reportExecutor;
  @MockitoBean private AiQueryClient aiQueryClient;

  @Test
  void createRunAndReadBackStatistics() throws Exception {
    String id = createReport(officerJwt(ORG_ID));
    when(reportExecutor.execute(any(), eq(ORG_ID)))
        .thenReturn(
            new ReportResult(
                List.of(new ReportResult.Column("severity", "Severity", "enum")),
                List.of(Map.of("severity", "HIGH")),
                7,
                null,
                new ReportResult.Summary(7, 12)));

    mockMvc
        .perform(post("/api/reports/" + id + "/run").with(officerJwt(ORG_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalCount").value(7))
        .andExpect(jsonPath("$.rows[0].severity").value("HIGH"));

    mockMvc
        .perform(get("/api/reports/" + id).with(officerJwt(ORG_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.lastRunRowCount").value(7))
        .andExpect(jsonPath("$.lastRunAt").exists())
        .andExpect(jsonPath("$.visibility").value("TEAM"));
  }

  @Test
  void reportsAreInvisibleToOtherOrganizations() throws Exception {
    String id = createReport(officerJwt(ORG_ID));

    mockMvc
        .perform(get("/api/reports/" + id).with(officerJwt(OTHER_ORG_ID)))
        .andExpect(status().isNotFound());
  }

  @Test
  void employeesCannotCreateOrDelete() throws Exception {
    String id = createReport(officerJwt(ORG_ID));

    mockMvc
        .perform(
            post("/api/reports")
                .with(employeeJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(CREATE_BODY))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(delete("/api/reports/" + id).with(employeeJwt()))
        .andExpect(status().isForbidden());
  }

  @Test
  void unauthenticatedRequestsAreRejected() throws Exception {
    mockMvc.perform(get("/api/reports")).andExpect(status().isUnauthorized());
  }

  @Test
  void scheduleLifecycle() throws Exception {
    String id = createReport(officerJwt(ORG_ID));

    mockMvc
        .perform(
            post("/api/reports/" + id + "/schedule")
                .with(officerJwt(ORG_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "scheduleType": "WEEKLY",
                      "scheduleConfig": {"time": "07:30", "dayOfWeek": 1},
                      "format": "CSV",
                      "recipients": ["cco@example.com"]
                    }
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.format").value("CSV"))
        .andExpect(jsonPath("$.isActive").value(true))
        .andExpect(jsonPath("$.nextRunAt").exists());

    mockMvc
        .perform(get("/api/reports/" + id).with(officerJwt(ORG_ID)))
        .andExpect(jsonPath("$.scheduledExportId").exists());

    mockMvc
        .perform(post("/api/reports/" + id + "/schedule/pause").with(officerJwt(ORG_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isActive").value(false))
        .andExpect(jsonPath("$.nextRunAt").doesNotExist());

    mockMvc
        .perform(post("/api/reports/" + id + "/schedule/run-now").with(officerJwt(ORG_ID)))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("PENDING"));

    mockMvc
        .perform(delete("/api/reports/" + id + "/schedule").with(officerJwt(ORG_ID)))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(get("/api/reports/" + id + "/schedule").with(officerJwt(ORG_ID)))
        .andExpect(status().isNotFound());
  }

  @Test
  void seedingTemplatesRequiresApiKeyAndIsIdempotent() throws Exception {
    String orgId = "org_lifecycle_templates";

    mockMvc
        .perform(post("/internal/report-templates/seed").param("orgId", orgId))
        .andExpect(status().isUnauthorized());

    mockMvc
        .perform(
            post("/internal/report-templates/seed")
                .param("orgId", orgId)
                .header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.created").value(6));
    mockMvc
        .perform(
            post("/internal/report-templates/seed")
                .param("orgId", orgId)
                .header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.created").value(0));

    mockMvc
        .perform(get("/api/reports/templates").with(officerJwt(orgId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].name").value(hasItem("Open Cases by Severity")));
  }

  private String createReport(JwtRequestPostProcessor jwt) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/reports")
                    .with(jwt)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(CREATE_BODY))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private JwtRequestPostProcessor officerJwt(String orgId) {
    return memberJwt("user_officer_" + orgId, orgId, Roles.COMPLIANCE_OFFICER);
  }

  private JwtRequestPostProcessor employeeJwt() {
    return memberJwt("user_employee", ORG_ID, Roles.EMPLOYEE);
  }

  private JwtRequestPostProcessor memberJwt(String subject, String orgId, String role) {
    return jwt()
        .jwt(j -> j.subject(subject).claim("org_id", orgId).claim("org_role", role))
        .authorities(List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_PREFIX + role)));
  }
}
