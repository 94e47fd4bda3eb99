/*
 * どこで: Deal-BFF 設定
 * 何を: authority サービス呼び出し設定を保持する
 * なぜ: 下流 URL・パス・タイムアウトを外部化するため
 */
package com.dealdesk.deal_bff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bff.authority")
public record AuthorityClientProperties(
    String baseUrl,
    Duration connectTimeout,
    Duration readTimeout,
    String explainPath,
    String eventsPath,
    String verifyEventsPath,
    String snapshotPath) {

  public AuthorityClientProperties {
    baseUrl = isBlank(baseUrl) ? "http://authority:3001" : baseUrl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    explainPath = isBlank(explainPath) ? "/deals/{dealId}/explain" : explainPath;
    eventsPath = isBlank(eventsPath) ? "/deals/{dealId}/events" : eventsPath;
    verifyEventsPath =
        isBlank(verifyEventsPath) ? "/deals/{dealId}/events/verify" : verifyEventsPath;
    snapshotPath = isBlank(snapshotPath) ? "/deals/{dealId}/snapshot" : snapshotPath;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
