/*
 * どこで: Commitment API の MDC 設定
 * 何を: リクエスト ID/利用者/対象デバイス/対象コミットメントをログの MDC に載せる
 * なぜ: 1 件のコミットメント操作を API ログとスイープログで横断して追えるようにするため
 */
package com.example.commitment.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String USER_ID_HEADER = "X-User-Id";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";
  // パス変数名 -> MDC キー
  private static final Map<String, String> PATH_VARIABLE_KEYS =
      Map.of("deviceId", "device_id", "commitmentId", "commitment_id");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String requestId = resolveRequestId(request);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    put(keys, "request_id", requestId);
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", ClientIps.resolve(request));
    put(keys, "user_id", resolveUserId(request));
    final Map<String, String> pathVariables = pathVariables(request);
    PATH_VARIABLE_KEYS.forEach((variable, key) -> put(keys, key, pathVariables.get(variable)));
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys) {
      rawKeys.stream()
          .filter(String.class::isInstance)
          .map(String.class::cast)
          .forEach(MDC::remove);
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(REQUEST_ID_HEADER);
    return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
  }

  // 認証済み principal を優先し、なければ gateway が転送した利用者 ID を使う
  private String resolveUserId(HttpServletRequest request) {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication != null
        && authentication.isAuthenticated()
        && !"anonymousUser".equals(authentication.getName())) {
      return authentication.getName();
    }
    return request.getHeader(USER_ID_HEADER);
  }

  @SuppressWarnings("unchecked")
  private Map<String, String> pathVariables(HttpServletRequest request) {
    final Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return attribute instanceof Map<?, ?> map ? (Map<String, String>) map : Map.of();
  }

  private void put(List<String> keys, String key, @Nullable String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
