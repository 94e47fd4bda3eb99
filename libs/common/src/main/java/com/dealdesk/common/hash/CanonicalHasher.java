/*
 * どこで: Common ハッシュ
 * 何を: 任意のネスト構造をキー順固定の JSON に正規化し SHA-256 の hex を返す
 * なぜ: 組み立て順が違うだけの同一 payload から同じ冪等性キーを導出するため
 */
package com.dealdesk.common.hash;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Deterministic JSON serialization plus SHA-256 digest.
 *
 * <p>Object keys are sorted at every nesting level, arrays keep their order and a {@code null}
 * input (or a {@code null} field) is rendered as the JSON literal {@code null}. Numbers that are
 * numerically equal serialize identically, so {@code 100}, {@code 100.0} and {@code 1e2} all
 * become {@code 100}.
 */
public class CanonicalHasher {

  private final ObjectMapper objectMapper;

  public CanonicalHasher(ObjectMapper objectMapper) {
    // 出力整形の設定がハッシュ値へ混ざらないよう固定する
    this.objectMapper = objectMapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
  }

  public String hash(Object value) {
    return sha256Hex(canonicalize(value));
  }

  public String canonicalize(Object value) {
    final JsonNode tree = value == null ? NullNode.getInstance() : objectMapper.valueToTree(value);
    try {
      return objectMapper.writeValueAsString(sortKeys(tree));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize payload for hashing", ex);
    }
  }

  public String sha256Hex(String input) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return toHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  private JsonNode sortKeys(JsonNode node) {
    if (node == null || node.isMissingNode()) {
      return NullNode.getInstance();
    }
    if (node.isObject()) {
      final List<String> names = new ArrayList<>();
      final Iterator<String> iterator = node.fieldNames();
      iterator.forEachRemaining(names::add);
      Collections.sort(names);
      // ObjectNode は挿入順を保持するため、ソート済みの順に詰め直せば出力順も固定される
      final ObjectNode sorted = objectMapper.createObjectNode();
      for (String name : names) {
        sorted.set(name, sortKeys(node.get(name)));
      }
      return sorted;
    }
    if (node.isArray()) {
      final ArrayNode copy = objectMapper.createArrayNode();
      for (JsonNode element : node) {
        copy.add(sortKeys(element));
      }
      return copy;
    }
    if (node.isNumber()) {
      return normalizeNumber(node);
    }
    return node;
  }

  // 100 / 100.0 / 1e2 を同じ表記にそろえる
  private JsonNode normalizeNumber(JsonNode node) {
    if (node.isDouble() || node.isFloat()) {
      final double raw = node.doubleValue();
      if (Double.isNaN(raw) || Double.isInfinite(raw)) {
        return node;
      }
    }
    final BigDecimal value = node.decimalValue().stripTrailingZeros();
    if (value.scale() <= 0) {
      return BigIntegerNode.valueOf(value.toBigIntegerExact());
    }
    return DecimalNode.valueOf(value);
  }

  private String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
