/*
 * どこで: Healthion Web 設定
 * 何を: API リクエストごとに相関 ID と呼び出し元を MDC へ載せ、応答ヘッダにも相関 ID を返す
 * なぜ: フロントエンドの問い合わせとサーバーログを request_id で突き合わせられるようにするため
 */
package com.healthion.bff.config;

import com.healthion.common.RequestIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.Optional;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";

  private static final List<String> MDC_KEYS =
      List.of("request_id", "http_method", "http_path", "client_ip", "user_id");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = RequestIds.acceptOrNew(request.getHeader(REQUEST_ID_HEADER));
    response.setHeader(REQUEST_ID_HEADER, requestId);
    MDC.put("request_id", requestId);
    MDC.put("http_method", request.getMethod());
    MDC.put("http_path", request.getRequestURI());
    final String clientIp = clientIp(request);
    if (clientIp != null && !clientIp.isBlank()) {
      MDC.put("client_ip", clientIp);
    }
    currentSubject().ifPresent(subject -> MDC.put("user_id", subject));
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    MDC_KEYS.forEach(MDC::remove);
  }

  private static String clientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  // bearer token の subject。ローカル users.id ではない。
  private static Optional<String> currentSubject() {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication instanceof JwtAuthenticationToken jwtAuthentication) {
      return Optional.ofNullable(jwtAuthentication.getToken().getSubject())
          .filter(subject -> !subject.isBlank());
    }
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken) {
      return Optional.empty();
    }
    return Optional.ofNullable(authentication.getName()).filter(name -> !name.isBlank());
  }
}
