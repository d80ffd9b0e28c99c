package com.teamplatform.provisioning.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamplatform.provisioning.credential.AuthorizationGate;
import com.teamplatform.provisioning.credential.CredentialAudience;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
public class ProvisioningSecurityConfig {

  private static final String INTERNAL_SERVICE_AUTHORITY =
      CredentialAuthenticationToken.audienceAuthority(CredentialAudience.INTERNAL_SERVICE.name());

  @Bean
  JsonSecurityErrorHandler jsonSecurityErrorHandler(ObjectMapper objectMapper) {
    return new JsonSecurityErrorHandler(objectMapper);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      AuthorizationGate authorizationGate,
      AuthProperties authProperties,
      JsonSecurityErrorHandler jsonSecurityErrorHandler)
      throws Exception {
    // Filter を Bean にするとサーブレットフィルタとしても二重登録されるため、ここで生成する
    final CredentialAuthenticationFilter credentialAuthenticationFilter =
        new CredentialAuthenticationFilter(
            authorizationGate,
            jsonSecurityErrorHandler,
            jsonSecurityErrorHandler,
            authProperties.sessionCookieName());
    final TenantScopeAuthorizationManager tenantAdminOnly =
        new TenantScopeAuthorizationManager(authorizationGate, false);
    final TenantScopeAuthorizationManager tenantAdminOrService =
        new TenantScopeAuthorizationManager(authorizationGate, true);

    http.csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(
            handling ->
                handling
                    .authenticationEntryPoint(jsonSecurityErrorHandler)
                    .accessDeniedHandler(jsonSecurityErrorHandler))
        .addFilterBefore(credentialAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/public/signup")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/internal/provision/**")
                    .hasAuthority(INTERNAL_SERVICE_AUTHORITY)
                    .requestMatchers(HttpMethod.GET, "/tenants/{tenantId}/provision-status")
                    .access(tenantAdminOrService)
                    .requestMatchers("/admin/tenants/{tenantId}/revocations")
                    .access(tenantAdminOnly)
                    .requestMatchers(HttpMethod.GET, "/whoami")
                    .authenticated()
                    .anyRequest()
                    .denyAll());
    return http.build();
  }
}
