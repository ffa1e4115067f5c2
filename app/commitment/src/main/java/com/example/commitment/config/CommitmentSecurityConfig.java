/*
 * どこで: Commitment セキュリティ設定
 * 何を: 内部トークン認証と、利用者本人/管理者の認可ルールを定義する
 * なぜ: gateway 経由の要求だけを受け付け、他人のコミットメントを操作させないため
 */
package com.example.commitment.config;

import java.util.Set;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

@Configuration
@EnableConfigurationProperties(InternalApiProperties.class)
public class CommitmentSecurityConfig {

  private static final String OWNER_PATH_VARIABLE = "userId";
  private static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(
      InternalApiProperties properties) {
    return new InternalApiAuthenticationFilter(properties);
  }

  @Bean
  AuthorizationManager<RequestAuthorizationContext> userOwnershipAuthorizationManager() {
    return new UserOwnershipAuthorizationManager(OWNER_PATH_VARIABLE, Set.of(ADMIN_AUTHORITY));
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      InternalApiAuthenticationFilter internalApiAuthenticationFilter,
      AuthorizationManager<RequestAuthorizationContext> userOwnershipAuthorizationManager)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(internalApiAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers("/v1/admin/**")
                    .hasRole("ADMIN")
                    .requestMatchers("/v1/users/{userId}/**")
                    .access(userOwnershipAuthorizationManager)
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
