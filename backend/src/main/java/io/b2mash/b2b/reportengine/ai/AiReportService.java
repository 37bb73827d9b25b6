package io.b2mash.b2b.reportengine.ai;

import io.b2mash.b2b.reportengine.multitenancy.RequestScopes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Generates unsaved report drafts from natural-language questions. Nothing is persisted. */
@Service
public class AiReportService {

  private static final Logger log = LoggerFactory.getLogger(AiReportService.class);

  private final AiQueryClient aiQueryClient;
  private final AiReportDraftMapper draftMapper;

  public AiReportService(AiQueryClient aiQueryClient, AiReportDraftMapper draftMapper) {
    this.aiQueryClient = aiQueryClient;
    this.draftMapper = draftMapper;
  }

  public AiGenerateResponse generate(AiGenerateRequest request) {
    String orgId = RequestScopes.requireOrgId();
    var memberId = RequestScopes.requireMemberId();

    var result =
        aiQueryClient.executeQuery(new AiQueryRequest(request.query(), true), memberId, orgId);
    var draft = draftMapper.toDraft(request.query(), result);

    log.info(
        "Generated report draft: entityType={}, columns={}, visualization={}",
        draft.entityType(),
        draft.columns().size(),
        draft.visualization());

    return new AiGenerateResponse(draft, result.data(), result.interpretedQuery());
  }
}
