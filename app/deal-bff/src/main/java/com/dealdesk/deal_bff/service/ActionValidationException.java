/*
 * どこで: Deal-BFF サービス層
 * 何を: 下流呼び出し前に検出したアクション要求の不備を表現する
 * なぜ: 台帳にも authority にも触れずに 400 で即時に返すため
 */
package com.dealdesk.deal_bff.service;

public class ActionValidationException extends RuntimeException {

  public ActionValidationException(String message) {
    super(message);
  }
}
