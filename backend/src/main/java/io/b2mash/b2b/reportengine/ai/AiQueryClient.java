package io.b2mash.b2b.reportengine.ai;

import java.util.UUID;

/** Turns a natural-language question into a parsed query plus its results. */
public interface AiQueryClient {

  /**
   * @throws io.b2mash.b2b.reportengine.exception.AiQueryFailedException when the service fails
   */
  AiQueryResult executeQuery(AiQueryRequest request, UUID memberId, String orgId);
}
