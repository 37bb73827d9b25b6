package io.b2mash.b2b.reportengine.security;

import io.b2mash.b2b.reportengine.member.MemberFilter;
import io.b2mash.b2b.reportengine.multitenancy.RequestLoggingFilter;
import io.b2mash.b2b.reportengine.multitenancy.TenantFilter;
import java.util.List;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

  private final ReportingJwtAuthenticationConverter jwtAuthConverter;
  private final ApiKeyAuthFilter apiKeyAuthFilter;
  private final TenantFilter tenantFilter;
  private final MemberFilter memberFilter;
  private final RequestLoggingFilter requestLoggingFilter;
  private final Environment environment;

  public SecurityConfig(
      ReportingJwtAuthenticationConverter jwtAuthConverter,
      ApiKeyAuthFilter apiKeyAuthFilter,
      TenantFilter tenantFilter,
      MemberFilter memberFilter,
      RequestLoggingFilter requestLoggingFilter,
      Environment environment) {
    this.jwtAuthConverter = jwtAuthConverter;
    this.apiKeyAuthFilter = apiKeyAuthFilter;
    this.tenantFilter = tenantFilter;
    this.memberFilter = memberFilter;
    this.requestLoggingFilter = requestLoggingFilter;
    this.environment = environment;
  }

  /**
   * Staff API ({@code /api/**}) authenticated by JWT with tenant and member resolution; internal
   * endpoints ({@code /internal/**}) authenticated by API key.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/info")
                    .permitAll()
                    .requestMatchers("/internal/**")
                    .hasRole("INTERNAL_SERVICE")
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 -> oauth2.jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter)))
        .addFilterBefore(apiKeyAuthFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(tenantFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(memberFilter, TenantFilter.class)
        .addFilterAfter(requestLoggingFilter, MemberFilter.class);

    return http.build();
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    List<String> origins =
        Binder.get(environment)
            .bind("cors.allowed-origins", Bindable.listOf(String.class))
            .orElse(List.of());

    var config = new CorsConfiguration();
    if (!origins.isEmpty()) {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setAllowCredentials(true);
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
