package io.b2mash.b2b.reportengine.security;

import io.b2mash.b2b.reportengine.member.MemberFilter;
import io.b2mash.b2b.reportengine.multitenancy.RequestLoggingFilter;
import io.b2mash.b2b.reportengine.multitenancy.TenantFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * The request filters are components so they can be injected into {@link SecurityConfig}; they
 * must only run inside the security chain, after bearer-token authentication.
 */
@Configuration
public class FilterRegistrationConfig {

  @Bean
  FilterRegistrationBean<ApiKeyAuthFilter> apiKeyAuthFilterRegistration(ApiKeyAuthFilter filter) {
    return disabled(filter);
  }

  @Bean
  FilterRegistrationBean<TenantFilter> tenantFilterRegistration(TenantFilter filter) {
    return disabled(filter);
  }

  @Bean
  FilterRegistrationBean<MemberFilter> memberFilterRegistration(MemberFilter filter) {
    return disabled(filter);
  }

  @Bean
  FilterRegistrationBean<RequestLoggingFilter> requestLoggingFilterRegistration(
      RequestLoggingFilter filter) {
    return disabled(filter);
  }

  private static <T extends OncePerRequestFilter> FilterRegistrationBean<T> disabled(T filter) {
    var registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }
}
