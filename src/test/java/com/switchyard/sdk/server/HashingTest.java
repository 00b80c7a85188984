package com.switchyard.sdk.server;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class HashingTest {
  @Test
  public void djb2IsUnsigned32BitDecimal() {
    assertEquals("99162322", Hashing.djb2("hello"));
    assertEquals("3041939949", Hashing.djb2("gate_a"));
    assertEquals("0", Hashing.djb2(""));
  }

  @Test
  public void djb2HashesSupplementaryCharactersAsOneCodePoint() {
    assertEquals("128512", Hashing.djb2("\uD83D\uDE00"));
    assertEquals("131519", Hashing.djb2("a\uD83D\uDE00"));
  }

  @Test
  public void hashNameByAlgorithm() {
    assertEquals("gate_a", Hashing.hashName("none", "gate_a"));
    assertEquals("3041939949", Hashing.hashName("djb2", "gate_a"));
    assertEquals("3041939949", Hashing.hashName("DJB2", "gate_a"));
    assertEquals("lkk3/dPAG9QBRH+jslai/AuABXeUzW1NW4Y14gXowY4=", Hashing.hashName("sha256", "gate_a"));
  }

  @Test
  public void unknownOrMissingAlgorithmFallsBackToSha256() {
    String sha = Hashing.sha256Base64("gate_a");
    assertEquals(sha, Hashing.hashName(null, "gate_a"));
    assertEquals(sha, Hashing.hashName("md5", "gate_a"));
  }

  @Test
  public void idListKeyIsEightCharacterPrefix() {
    assertEquals("xsKJ5J6c", Hashing.idListKey("user-1"));
  }

  @Test
  public void passPercentageUsesJoinedSalts() {
    // "salt.rule.user-1" falls in bucket 8512 of 10000
    assertTrue(Hashing.passesPercentage("salt", "rule", "user-1", 85.2));
    assertFalse(Hashing.passesPercentage("salt", "rule", "user-1", 85.0));
  }

  @Test
  public void passPercentageBounds() {
    for (String id: new String[] { "a", "b", "user-1", "user-2", "user-3" }) {
      assertTrue(Hashing.passesPercentage("salt", "rule", id, 100));
      assertFalse(Hashing.passesPercentage("salt", "rule", id, 0));
    }
  }

  @Test
  public void userBucketIsStable() {
    assertThat(Hashing.userBucket("bsalt", "user-1"), equalTo(651L));
    assertThat(Hashing.userBucket("bsalt", "user-2"), equalTo(307L));
  }

  @Test
  public void bucketIsAlwaysInRange() {
    for (int i = 0; i < 1000; i++) {
      long b = Hashing.bucket("input-" + i, 10000);
      assertThat(b, greaterThanOrEqualTo(0L));
      assertThat(b, lessThan(10000L));
    }
  }
}
