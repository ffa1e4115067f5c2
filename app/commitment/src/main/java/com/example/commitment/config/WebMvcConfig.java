/*
 * どこで: Commitment Web 設定
 * 何を: RequestMdcInterceptor を /v1 配下の API に適用する
 * なぜ: actuator のヘルスチェックやメトリクス収集でログ用キーを作らないため
 */
package com.example.commitment.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private static final String API_PATH_PATTERN = "/v1/**";

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(API_PATH_PATTERN);
  }
}
