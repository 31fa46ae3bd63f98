/*
 * どこで: Casework サービス補助
 * 何を: エンティティ識別子から 64-bit advisory lock のキーを生成する
 * なぜ: hashtext(32-bit) の衝突による不要な直列化を避けるため
 */
package com.casedesk.casework.service;

import com.google.common.annotations.VisibleForTesting;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class AdvisoryLockKeyGenerator {

  @VisibleForTesting
  static final int LOCK_KEY_BYTES = 8;

  public long generate(String qualifiedName) {
    // SHA-256 の先頭 8byte を Big Endian の long として使う。
    final byte[] hashed = hash(qualifiedName);
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String qualifiedName) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(qualifiedName.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
