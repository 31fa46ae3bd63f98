/*
 * どこで: Casework サービス補助
 * 何を: Idempotency 判定用のリクエスト fingerprint を生成する
 * なぜ: 同一キーで異なるリクエストを検出するため
 */
package com.casedesk.casework.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RequestFingerprinter {

  private final ObjectMapper objectMapper;

  public String fingerprint(String operation, String resourcePath, Object body) {
    final ObjectNode canonical = objectMapper.createObjectNode();
    canonical.put("operation", operation);
    canonical.put("resource_path", resourcePath);
    final JsonNode bodyNode = body == null ? NullNode.getInstance() : objectMapper.valueToTree(body);
    canonical.set("body", canonicalize(bodyNode));
    try {
      final String json = objectMapper.writeValueAsString(canonical);
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return toHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize request for idempotency", ex);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  // キー順を再帰的に固定し、同じ内容なら同じ JSON になるようにする
  private JsonNode canonicalize(JsonNode node) {
    if (node.isObject()) {
      final Map<String, JsonNode> sorted = new TreeMap<>();
      final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        sorted.put(field.getKey(), canonicalize(field.getValue()));
      }
      final ObjectNode result = objectMapper.createObjectNode();
      sorted.forEach(result::set);
      return result;
    }
    if (node.isArray()) {
      final ArrayNode result = objectMapper.createArrayNode();
      node.forEach(element -> result.add(canonicalize(element)));
      return result;
    }
    return node;
  }

  private String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
