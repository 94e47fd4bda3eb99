/*
 * どこで: Deal-BFF サービス補助
 * 何を: deal ID から 64-bit advisory lock のキーを生成する
 * なぜ: hashtext(32-bit) の衝突による不要な直列化を避けるため
 */
package com.dealdesk.deal_bff.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class AdvisoryLockKeyGenerator {

  static final int LOCK_KEY_BYTES = 8;
  private static final String NAMESPACE = "deal-events:";

  public long generate(String dealId) {
    // SHA-256 の先頭 8byte を Big Endian の long として使う
    final byte[] hashed = hash(NAMESPACE + dealId);
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String value) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
