package io.b2mash.b2b.reportengine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({
  ReportingConfig.ReportingProperties.class,
  ReportingConfig.ReportExecutorProperties.class,
  ReportingConfig.AiQueryProperties.class
})
public class ReportingConfig {

  /**
   * Paging and run defaults.
   *
   * @param list page sizes for the report list
   * @param run defaults applied when a run request omits them
   */
  @ConfigurationProperties("reporting")
  public record ReportingProperties(@DefaultValue Paging list, @DefaultValue Run run) {

    public record Paging(
        @DefaultValue("20") int defaultPageSize, @DefaultValue("100") int maxPageSize) {}

    public record Run(@DefaultValue("1000") int defaultLimit) {}
  }

  @ConfigurationProperties("reporting.executor")
  public record ReportExecutorProperties(
      String baseUrl,
      @DefaultValue("5s") Duration connectTimeout,
      @DefaultValue("60s") Duration readTimeout) {}

  @ConfigurationProperties("reporting.ai-query")
  public record AiQueryProperties(
      String baseUrl,
      @DefaultValue("5s") Duration connectTimeout,
      @DefaultValue("30s") Duration readTimeout) {}

  @Bean
  RestClient reportExecutorRestClient(ReportExecutorProperties props) {
    return RestClient.builder()
        .baseUrl(props.baseUrl())
        .requestFactory(requestFactory(props.connectTimeout(), props.readTimeout()))
        .build();
  }

  @Bean
  RestClient aiQueryRestClient(AiQueryProperties props) {
    return RestClient.builder()
        .baseUrl(props.baseUrl())
        .requestFactory(requestFactory(props.connectTimeout(), props.readTimeout()))
        .build();
  }

  private static SimpleClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    var factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
