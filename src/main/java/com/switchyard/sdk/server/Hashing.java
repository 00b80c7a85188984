package com.switchyard.sdk.server;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * Encapsulates the hashing used for percentage bucketing and for obfuscating names in client payloads.
 * <p>
 * Every function here is pure: the same input always yields the same output, in any process and in
 * any of the SDKs that share this algorithm.
 */
abstract class Hashing {
  private Hashing() {}
  
  static final String HASH_NONE = "none";
  static final String HASH_DJB2 = "djb2";
  static final String HASH_SHA256 = "sha256";
  
  static final int PASS_PERCENTAGE_BUCKETS = 10000;
  static final int USER_BUCKETS = 1000;
  
  /**
   * Returns the first 8 bytes of the SHA-256 digest of the input, as a big-endian 64-bit value.
   * Callers that need an unsigned value must use the unsigned operations of {@link Long}.
   */
  static long sha256Prefix(String input) {
    byte[] digest = DigestUtils.sha256(input.getBytes(StandardCharsets.UTF_8));
    return ByteBuffer.wrap(digest, 0, 8).getLong();
  }
  
  /**
   * Returns the bucket in [0, buckets) for the input, treating the digest prefix as unsigned.
   */
  static long bucket(String input, int buckets) {
    return Long.remainderUnsigned(sha256Prefix(input), buckets);
  }
  
  /**
   * Tests whether a unit passes a rule's percentage rollout. The hash input is
   * {@code specSalt + "." + ruleSalt + "." + unitId}.
   */
  static boolean passesPercentage(String specSalt, String ruleSalt, String unitId, double passPercentage) {
    long b = bucket(specSalt + "." + ruleSalt + "." + unitId, PASS_PERCENTAGE_BUCKETS);
    return b < passPercentage * 100;
  }
  
  /**
   * Returns the {@code user_bucket} condition value in [0, 1000).
   */
  static long userBucket(String salt, String unitId) {
    return bucket(salt + "." + unitId, USER_BUCKETS);
  }
  
  static String sha256Base64(String input) {
    return Base64.getEncoder().encodeToString(DigestUtils.sha256(input.getBytes(StandardCharsets.UTF_8)));
  }
  
  /**
   * The 32-bit djb2 hash over the Unicode code points of the input, rendered as an unsigned base-10
   * string.
   */
  static String djb2(String input) {
    int hash = 0;
    for (int i = 0; i < input.length(); ) {
      int c = input.codePointAt(i);
      hash = (hash << 5) - hash + c;
      i += Character.charCount(c);
    }
    return Long.toString(Integer.toUnsignedLong(hash));
  }
  
  /**
   * Hashes a name for a client payload with the given algorithm. Unknown algorithms fall back to sha256.
   */
  static String hashName(String algorithm, String name) {
    String algo = algorithm == null ? HASH_SHA256 : algorithm.toLowerCase(Locale.ROOT);
    switch (algo) {
    case HASH_NONE:
      return name;
    case HASH_DJB2:
      return djb2(name);
    default:
      return sha256Base64(name);
    }
  }
  
  /**
   * The key under which id list members are stored: the first 8 characters of the base64 SHA-256 of
   * the id. Id list files contain these prefixes rather than raw ids.
   */
  static String idListKey(String id) {
    return sha256Base64(id).substring(0, 8);
  }
  
  /**
   * The signed interpretation of the digest prefix, used for exposure sampling.
   */
  static long samplingHash(String input) {
    return sha256Prefix(input);
  }
}
