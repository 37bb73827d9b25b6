package io.b2mash.b2b.reportengine.ai;

import io.b2mash.b2b.reportengine.exception.AiQueryFailedException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class RemoteAiQueryClient implements AiQueryClient {

  private static final Logger log = LoggerFactory.getLogger(RemoteAiQueryClient.class);

  private final RestClient restClient;

  public RemoteAiQueryClient(@Qualifier("aiQueryRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public AiQueryResult executeQuery(AiQueryRequest request, UUID memberId, String orgId) {
    try {
      var result =
          restClient
              .post()
              .uri("/internal/ai-queries")
              .header("X-Organization-Id", orgId)
              .header("X-Member-Id", String.valueOf(memberId))
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(AiQueryResult.class);
      if (result == null) {
        throw new AiQueryFailedException("AI query service returned an empty response", null);
      }
      return result;
    } catch (RestClientException e) {
      log.error("AI query failed: orgId={}, error={}", orgId, e.getMessage());
      throw new AiQueryFailedException("AI query failed: " + e.getMessage(), e);
    }
  }
}
