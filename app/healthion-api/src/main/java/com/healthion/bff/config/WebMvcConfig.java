package com.healthion.bff.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** API リクエストにだけ MDC を付与する。probe や scrape の actuator 呼び出しは対象外。 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  static final String API_PATH_PATTERN = "/v1/**";

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry
        .addInterceptor(requestMdcInterceptor)
        .addPathPatterns(API_PATH_PATTERN)
        .excludePathPatterns("/actuator/**");
  }
}
