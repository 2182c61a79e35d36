package com.healthion.bff.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
    SecurityContextHolder.clearContext();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    SecurityContextHolder.getContext()
        .setAuthentication(
            new JwtAuthenticationToken(
                Jwt.withTokenValue("token").header("alg", "RS256").subject("auth0|1").build()));

    final MockHttpServletRequest request =
        new MockHttpServletRequest("GET", "/v1/wearables/connections");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("GET");
    assertThat(MDC.get("http_path")).isEqualTo("/v1/wearables/connections");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.get("user_id")).isEqualTo("auth0|1");
    assertThat(response.getHeader("X-Request-Id")).isEqualTo("req-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("client_ip")).isNull();
    assertThat(MDC.get("user_id")).isNull();
  }

  @Test
  void replacesUnsafeRequestIdAndSkipsAnonymousUser() {
    SecurityContextHolder.getContext()
        .setAuthentication(
            new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/auth/me");
    request.addHeader("X-Request-Id", "bad id\n");
    request.setRemoteAddr("192.168.0.5");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).hasSize(36).isEqualTo(response.getHeader("X-Request-Id"));
    assertThat(MDC.get("client_ip")).isEqualTo("192.168.0.5");
    assertThat(MDC.get("user_id")).isNull();
  }

  @Test
  void fallsBackToAuthenticationName() {
    final TestingAuthenticationToken authentication =
        new TestingAuthenticationToken("service-account", "N/A");
    authentication.setAuthenticated(true);
    SecurityContextHolder.getContext().setAuthentication(authentication);

    interceptor.preHandle(
        new MockHttpServletRequest("GET", "/v1/auth/me"), new MockHttpServletResponse(), null);

    assertThat(MDC.get("user_id")).isEqualTo("service-account");
  }
}
