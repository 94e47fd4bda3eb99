/*
 * どこで: Deal-BFF 設定
 * 何を: アクション種別から authority のイベント種別への追加対応表を保持する
 * なぜ: 旧語彙のアクションを再デプロイなしで対応表へ加えられるようにするため
 */
package com.dealdesk.deal_bff.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bff.actions")
public record ActionVocabularyProperties(Map<String, String> eventTypes) {

  public ActionVocabularyProperties {
    eventTypes = eventTypes == null ? Map.of() : Map.copyOf(eventTypes);
  }
}
