package io.b2mash.tenantedge.security;

import io.b2mash.tenantedge.multitenancy.TenantLoggingFilter;
import io.b2mash.tenantedge.multitenancy.TenantResolutionFilter;
import io.b2mash.tenantedge.session.SessionGuardFilter;
import java.util.List;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * Single filter chain for the edge. Internal endpoints require the service API key; everything
 * else is guarded by tenant resolution and the session guard, which answer with redirects, 401 or
 * 403 themselves.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final ApiKeyAuthFilter apiKeyAuthFilter;
  private final TenantResolutionFilter tenantResolutionFilter;
  private final SessionGuardFilter sessionGuardFilter;
  private final TenantLoggingFilter tenantLoggingFilter;
  private final Environment environment;

  public SecurityConfig(
      ApiKeyAuthFilter apiKeyAuthFilter,
      TenantResolutionFilter tenantResolutionFilter,
      SessionGuardFilter sessionGuardFilter,
      TenantLoggingFilter tenantLoggingFilter,
      Environment environment) {
    this.apiKeyAuthFilter = apiKeyAuthFilter;
    this.tenantResolutionFilter = tenantResolutionFilter;
    this.sessionGuardFilter = sessionGuardFilter;
    this.tenantLoggingFilter = tenantLoggingFilter;
    this.environment = environment;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/internal/**")
                    .hasRole(Roles.INTERNAL_SERVICE)
                    .anyRequest()
                    .permitAll())
        .addFilterBefore(apiKeyAuthFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterAfter(tenantResolutionFilter, ApiKeyAuthFilter.class)
        .addFilterAfter(sessionGuardFilter, TenantResolutionFilter.class)
        .addFilterAfter(tenantLoggingFilter, SessionGuardFilter.class);

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
