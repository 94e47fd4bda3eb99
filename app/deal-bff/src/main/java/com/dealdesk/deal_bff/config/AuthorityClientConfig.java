/*
 * どこで: Deal-BFF 設定
 * 何を: authority 呼び出し専用 RestClient を提供する
 * なぜ: baseUrl とタイムアウトを authority 向けに閉じ込めるため
 */
package com.dealdesk.deal_bff.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class AuthorityClientConfig {

  @Bean
  RestClient authorityRestClient(RestClient.Builder builder, AuthorityClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    // タイムアウトは transport 側に委ね、超過は UNAVAILABLE として分類する
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
