package io.b2mash.b2b.reportengine.report.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.reportengine.report.ReportDefinitionValidator;
import io.b2mash.b2b.reportengine.report.ReportVisibility;
import io.b2mash.b2b.reportengine.report.SavedReport;
import io.b2mash.b2b.reportengine.report.SavedReportRepository;
import io.b2mash.b2b.reportengine.report.field.ReportFieldRegistry;
import io.b2mash.b2b.reportengine.report.field.StaticFieldSource;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class ReportTemplatePackSeederTest {

  private static final String ORG_ID = "org_templates";

  @Mock private SavedReportRepository savedReportRepository;

  private ReportTemplatePackSeeder seeder;

  @BeforeEach
  void setUp() {
    seeder =
        new ReportTemplatePackSeeder(
            savedReportRepository,
            new TransactionTemplate(mock(PlatformTransactionManager.class)));
  }

  @Test
  void everyTemplateReferencesKnownFields() {
    var validator =
        new ReportDefinitionValidator(new ReportFieldRegistry(List.of(new StaticFieldSource())));

    for (var spec : ReportTemplatePackSeeder.TEMPLATES) {
      assertThatCode(
              () ->
                  validator.validate(
                      spec.entityType(),
                      ORG_ID,
                      spec.columns(),
                      spec.filters(),
                      spec.groupBy(),
                      spec.sortBy(),
                      spec.aggregation()))
          .as(spec.name())
          .doesNotThrowAnyException();
    }
  }

  @Test
  void seed_createsSharedTemplatesOwnedBySystem() {
    when(savedReportRepository.existsByOrganizationIdAndTemplateTrueAndName(eq(ORG_ID), any()))
        .thenReturn(false);

    int created = seeder.seedForOrganization(ORG_ID);

    assertThat(created).isEqualTo(ReportTemplatePackSeeder.TEMPLATES.size());
    var captor = ArgumentCaptor.forClass(SavedReport.class);
    verify(savedReportRepository, times(created)).save(captor.capture());
    assertThat(captor.getAllValues())
        .allSatisfy(
            report -> {
              assertThat(report.isTemplate()).isTrue();
              assertThat(report.getTemplateCategory()).isNotBlank();
              assertThat(report.getVisibility()).isEqualTo(ReportVisibility.EVERYONE);
              assertThat(report.getCreatedById())
                  .isEqualTo(ReportTemplatePackSeeder.SYSTEM_CREATOR_ID);
              assertThat(report.getOrganizationId()).isEqualTo(ORG_ID);
            });
  }

  @Test
  void seed_skipsTemplatesThatAlreadyExist() {
    when(savedReportRepository.existsByOrganizationIdAndTemplateTrueAndName(eq(ORG_ID), any()))
        .thenAnswer(i -> "Open Cases by Severity".equals(i.getArgument(1)));

    int created = seeder.seedForOrganization(ORG_ID);

    assertThat(created).isEqualTo(ReportTemplatePackSeeder.TEMPLATES.size() - 1);
    var captor = ArgumentCaptor.forClass(SavedReport.class);
    verify(savedReportRepository, times(created)).save(captor.capture());
    assertThat(captor.getAllValues())
        .extracting(SavedReport::getName)
        .doesNotContain("Open Cases by Severity");
  }
}
