/*
 * どこで: Healthion 設定
 * 何を: wearables platform 呼び出し専用 RestClient を提供する
 * なぜ: 通常 API と長時間の import で timeout を分けるため
 */
package com.healthion.bff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({UpstreamClientProperties.class, RegistrationLockProperties.class})
public class UpstreamClientConfig {

  @Bean
  RestClient upstreamRestClient(RestClient.Builder builder, UpstreamClientProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient upstreamImportRestClient(
      RestClient.Builder builder, UpstreamClientProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(
            requestFactory(properties.connectTimeout(), properties.importReadTimeout()))
        .build();
  }

  private SimpleClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
