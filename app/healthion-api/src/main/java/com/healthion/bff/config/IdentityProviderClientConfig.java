package com.healthion.bff.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class IdentityProviderClientConfig {

  @Bean
  RestClient identityProviderRestClient(
      RestClient.Builder builder, IdentityProviderProperties properties) {
    // userinfo 取得専用。JWT 検証は JwtDecoder 側で行う。
    return builder
        .baseUrl(properties.issuer())
        .requestFactory(userinfoRequestFactory(properties))
        .build();
  }

  static SimpleClientHttpRequestFactory userinfoRequestFactory(
      IdentityProviderProperties properties) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(properties.connectTimeout());
    factory.setReadTimeout(properties.readTimeout());
    return factory;
  }
}
