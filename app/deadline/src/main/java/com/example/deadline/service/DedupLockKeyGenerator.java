/*
 * Where: Deadline service helpers
 * What: Derives a 64-bit advisory lock key from a dedup key
 * Why: hashtext() is only 32-bit and would serialise unrelated keys more often
 */
package com.example.deadline.service;

import com.example.deadline.model.NotificationType;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class DedupLockKeyGenerator {

  static final int LOCK_KEY_BYTES = 8;

  public long generate(String userId, NotificationType type, String academicYearId) {
    return generate(userId + '|' + type.name() + '|' + academicYearId);
  }

  public long generate(String dedupKey) {
    // first 8 bytes of SHA-256, big endian
    return ByteBuffer.wrap(sha256(dedupKey), 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] sha256(String value) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
