package io.b2mash.b2b.reportengine.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.reportengine.audit.AuditEventRecord;
import io.b2mash.b2b.reportengine.audit.AuditService;
import io.b2mash.b2b.reportengine.config.ReportingConfig.ReportingProperties;
import io.b2mash.b2b.reportengine.exception.ForbiddenException;
import io.b2mash.b2b.reportengine.exception.InvalidStateException;
import io.b2mash.b2b.reportengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.reportengine.member.MemberNameResolver;
import io.b2mash.b2b.reportengine.multitenancy.RequestScopes;
import io.b2mash.b2b.reportengine.report.dto.CreateReportRequest;
import io.b2mash.b2b.reportengine.report.dto.UpdateReportRequest;
import io.b2mash.b2b.reportengine.report.field.ReportFieldRegistry;
import io.b2mash.b2b.reportengine.report.field.StaticFieldSource;
import io.b2mash.b2b.reportengine.security.Roles;
import io.b2mash.b2b.reportengine.testutil.TestReportFactory;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

@ExtendWith(MockitoExtension.class)
class SavedReportServiceTest {

  private static final String ORG_ID = "org_reports";
  private static final UUID OWNER_ID = UUID.randomUUID();
  private static final UUID OTHER_MEMBER_ID = UUID.randomUUID();

  @Mock private SavedReportRepository savedReportRepository;
  @Mock private AuditService auditService;
  @Mock private MemberNameResolver memberNameResolver;

  private SavedReportService service;

  @BeforeEach
  void setUp() {
    var validator =
        new ReportDefinitionValidator(new ReportFieldRegistry(List.of(new StaticFieldSource())));
    service =
        new SavedReportService(
            savedReportRepository,
            validator,
            auditService,
            memberNameResolver,
            new ReportingProperties(
                new ReportingProperties.Paging(20, 100), new ReportingProperties.Run(1000)));
  }

  @Test
  void create_defaultsToPrivateTableAndAudits() {
    when(savedReportRepository.save(any(SavedReport.class))).thenAnswer(i -> i.getArgument(0));
    when(memberNameResolver.resolveNameOrNull(OWNER_ID)).thenReturn("Olivia Owner");

    var response =
        as(
            OWNER_ID,
            Roles.COMPLIANCE_OFFICER,
            () ->
                service.create(
                    createRequest(
                        "Open cases",
                        List.of("referenceNumber", "status"),
                        List.of(TestReportFactory.statusGroup("NEW")),
                        null)));

    assertThat(response.name()).isEqualTo("Open cases");
    assertThat(response.visibility()).isEqualTo(ReportVisibility.PRIVATE);
    assertThat(response.visualization()).isEqualTo(ReportVisualization.TABLE);
    assertThat(response.template()).isFalse();
    assertThat(response.favorite()).isFalse();
    assertThat(response.createdById()).isEqualTo(OWNER_ID);
    assertThat(response.createdByName()).isEqualTo("Olivia Owner");

    var audit = captureAudit();
    assertThat(audit.eventType()).isEqualTo("report.created");
    assertThat(audit.organizationId()).isEqualTo(ORG_ID);
    assertThat(audit.actorId()).isEqualTo(OWNER_ID);
    assertThat(audit.details()).containsEntry("entityType", "cases");
  }

  @Test
  void create_unknownFieldsAreRejectedWithoutSaving() {
    var request =
        createRequest(
            "Broken",
            List.of("status", "favouriteColour"),
            List.of(
                Map.of(
                    "logic",
                    "AND",
                    "conditions",
                    List.of(Map.of("field", "mood", "operator", "eq", "value", "grumpy")))),
            null);

    assertThatThrownBy(() -> as(OWNER_ID, Roles.COMPLIANCE_OFFICER, () -> service.create(request)))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e ->
                assertThat((List<Object>) e.getBody().getProperties().get("invalidFields"))
                    .containsExactly("favouriteColour", "mood"));
    verify(savedReportRepository, never()).save(any());
  }

  @Test
  void create_unknownEntityTypeIsRejected() {
    var widgets =
        new CreateReportRequest(
            "Widgets",
            null,
            "widgets",
            List.of("id"),
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null);

    assertThatThrownBy(() -> as(OWNER_ID, Roles.COMPLIANCE_OFFICER, () -> service.create(widgets)))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getBody().getTitle()).isEqualTo("Invalid entity type"));
    verify(savedReportRepository, never()).save(any());
  }

  @Test
  void create_averageOfNonNumericFieldIsRejected() {
    var request =
        createRequest(
            "Bad average",
            List.of("status"),
            null,
            List.of(new ReportAggregation("status", AggregationFunction.AVG, null)));

    assertThatThrownBy(() -> as(OWNER_ID, Roles.COMPLIANCE_OFFICER, () -> service.create(request)))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getBody().getTitle()).isEqualTo("Invalid aggregation"));
    verify(savedReportRepository, never()).save(any());
  }

  @Test
  void create_unknownFilterOperatorIsRejected() {
    var request =
        createRequest(
            "Bad operator",
            List.of("status"),
            List.of(
                Map.of(
                    "conditions",
                    List.of(Map.of("field", "status", "operator", "like", "value", "N%")))),
            null);

    assertThatThrownBy(() -> as(OWNER_ID, Roles.COMPLIANCE_OFFICER, () -> service.create(request)))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getBody().getTitle()).isEqualTo("Invalid report filters"));
    verify(savedReportRepository, never()).save(any());
  }

  @Test
  void update_byNonOwnerIsForbidden() {
    var report = TestReportFactory.persistedCasesReport(ORG_ID, "Open cases", OWNER_ID);
    when(savedReportRepository.findByIdAndOrganizationId(report.getId(), ORG_ID))
        .thenReturn(Optional.of(report));

    assertThatThrownBy(
            () ->
                as(
                    OTHER_MEMBER_ID,
                    Roles.EMPLOYEE,
                    () -> service.update(report.getId(), renameRequest("Hijacked"))))
        .isInstanceOf(ForbiddenException.class);
    verify(savedReportRepository, never()).save(any());
    assertThat(report.getName()).isEqualTo("Open cases");
  }

  @Test
  void update_bySystemAdminRecordsOnlyChangedFields() {
    var report = TestReportFactory.persistedCasesReport(ORG_ID, "Open cases", OWNER_ID);
    when(savedReportRepository.findByIdAndOrganizationId(report.getId(), ORG_ID))
        .thenReturn(Optional.of(report));
    when(savedReportRepository.save(any(SavedReport.class))).thenAnswer(i -> i.getArgument(0));

    var update =
        new UpdateReportRequest(
            "Open cases v2",
            null,
            null,
            List.of("referenceNumber", "status", "severity"),
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            ReportVisibility.TEAM,
            null,
            null);

    var response =
        as(OTHER_MEMBER_ID, Roles.SYSTEM_ADMIN, () -> service.update(report.getId(), update));

    assertThat(response.name()).isEqualTo("Open cases v2");
    assertThat(response.visibility()).isEqualTo(ReportVisibility.TEAM);
    assertThat(response.createdById()).isEqualTo(OWNER_ID);
    assertThat(response.filters()).isEqualTo(List.of(TestReportFactory.statusGroup("NEW")));

    var audit = captureAudit();
    assertThat(audit.eventType()).isEqualTo("report.updated");
    @SuppressWarnings("unchecked")
    var changes = (Map<String, Object>) audit.details().get("changes");
    assertThat(changes).containsOnlyKeys("name", "visibility");
    assertThat(changes.get("name")).isEqualTo(Map.of("old", "Open cases", "new", "Open cases v2"));
  }

  @Test
  void duplicate_isPrivateNonTemplateCopyOwnedByCaller() {
    var source = TestReportFactory.persistedCasesReport(ORG_ID, "Open cases", OWNER_ID);
    source.changeVisibility(ReportVisibility.EVERYONE);
    source.markTemplate(true, "compliance");
    source.toggleFavorite();
    source.present(
        ReportVisualization.BAR,
        new ChartConfig(
            "severity", null, null, Map.of("HIGH", "#f00"), true, true, false, null, null),
        "createdAt",
        SortOrder.DESC);
    when(savedReportRepository.findByIdAndOrganizationId(source.getId(), ORG_ID))
        .thenReturn(Optional.of(source));
    when(savedReportRepository.save(any(SavedReport.class))).thenAnswer(i -> i.getArgument(0));

    var copy = as(OTHER_MEMBER_ID, Roles.POLICY_AUTHOR, () -> service.duplicate(source.getId()));

    assertThat(copy.name()).isEqualTo("Open cases (Copy)");
    assertThat(copy.createdById()).isEqualTo(OTHER_MEMBER_ID);
    assertThat(copy.visibility()).isEqualTo(ReportVisibility.PRIVATE);
    assertThat(copy.template()).isFalse();
    assertThat(copy.templateCategory()).isNull();
    assertThat(copy.favorite()).isFalse();
    assertThat(copy.lastRunAt()).isNull();
    assertThat(copy.scheduledExportId()).isNull();
    assertThat(copy.entityType()).isEqualTo(source.getEntityType());
    assertThat(copy.columns()).isEqualTo(source.getColumns());
    assertThat(copy.filters()).isEqualTo(source.getFilters()).isNotSameAs(source.getFilters());
    assertThat(copy.filters().get(0)).isNotSameAs(source.getFilters().get(0));
    assertThat(copy.visualization()).isEqualTo(ReportVisualization.BAR);
    assertThat(copy.chartConfig()).isEqualTo(source.getChartConfig());
    assertThat(copy.sortOrder()).isEqualTo(SortOrder.DESC);

    var audit = captureAudit();
    assertThat(audit.eventType()).isEqualTo("report.duplicated");
    assertThat(audit.details()).containsEntry("originalReportId", source.getId());
  }

  @Test
  void toggleFavorite_twiceRestoresOriginalValue() {
    var report = TestReportFactory.persistedCasesReport(ORG_ID, "Open cases", OWNER_ID);
    when(savedReportRepository.findByIdAndOrganizationId(report.getId(), ORG_ID))
        .thenReturn(Optional.of(report));

    var first = as(OWNER_ID, Roles.EMPLOYEE, () -> service.toggleFavorite(report.getId()));
    var second = as(OWNER_ID, Roles.EMPLOYEE, () -> service.toggleFavorite(report.getId()));

    assertThat(first.favorite()).isTrue();
    assertThat(second.favorite()).isFalse();
    assertThat(report.isFavorite()).isFalse();
  }

  @Test
  void get_reportOfAnotherOrganizationIsNotFound() {
    var id = UUID.randomUUID();
    when(savedReportRepository.findByIdAndOrganizationId(id, ORG_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> as(OWNER_ID, Roles.EMPLOYEE, () -> service.get(id)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void delete_byOwnerAuditsDeletion() {
    var report = TestReportFactory.persistedCasesReport(ORG_ID, "Open cases", OWNER_ID);
    when(savedReportRepository.findByIdAndOrganizationId(report.getId(), ORG_ID))
        .thenReturn(Optional.of(report));

    as(
        OWNER_ID,
        Roles.COMPLIANCE_OFFICER,
        () -> {
          service.delete(report.getId());
          return null;
        });

    verify(savedReportRepository).delete(report);
    assertThat(captureAudit().eventType()).isEqualTo("report.deleted");
  }

  @Test
  @SuppressWarnings("unchecked")
  void list_clampsPageSizeAndResolvesCreatorNames() {
    var report = TestReportFactory.persistedCasesReport(ORG_ID, "Open cases", OWNER_ID);
    when(savedReportRepository.findAll(any(Specification.class), any(Pageable.class)))
        .thenAnswer(i -> new PageImpl<>(List.of(report), i.getArgument(1), 1));
    when(memberNameResolver.resolveNames(any())).thenReturn(Map.of(OWNER_ID, "Olivia Owner"));

    var oversized = as(OWNER_ID, Roles.EMPLOYEE, () -> service.list(null, null, null, 0, 500));
    var defaulted = as(OWNER_ID, Roles.EMPLOYEE, () -> service.list(null, null, "open", 3, 0));

    assertThat(oversized.page()).isEqualTo(1);
    assertThat(oversized.pageSize()).isEqualTo(100);
    assertThat(oversized.total()).isEqualTo(1);
    assertThat(oversized.data())
        .singleElement()
        .satisfies(r -> assertThat(r.createdByName()).isEqualTo("Olivia Owner"));
    assertThat(defaulted.page()).isEqualTo(3);
    assertThat(defaulted.pageSize()).isEqualTo(20);
  }

  private AuditEventRecord captureAudit() {
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    return captor.getValue();
  }

  private static <T> T as(UUID memberId, String role, Supplier<T> action) {
    return RequestScopes.callAs(new RequestScopes.Snapshot(ORG_ID, memberId, role), action);
  }

  private static UpdateReportRequest renameRequest(String name) {
    return new UpdateReportRequest(
        name, null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  private static CreateReportRequest createRequest(
      String name,
      List<String> columns,
      List<Map<String, Object>> filters,
      List<ReportAggregation> aggregation) {
    return new CreateReportRequest(
        name,
        null,
        "cases",
        columns,
        filters,
        null,
        aggregation,
        null,
        null,
        null,
        null,
        null,
        null,
        null);
  }
}
