package com.switchyard.sdk;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class UserTest {
  @Test
  public void identity() {
    assertTrue(User.of("u").hasIdentity());
    assertFalse(User.of("").hasIdentity());
    assertFalse(User.builder(null).build().hasIdentity());
    assertTrue(User.builder(null).customID("stableID", "s").build().hasIdentity());
    assertFalse(User.builder(null).customID("stableID", "").build().hasIdentity());
  }

  @Test
  public void builderSetsAllAttributes() {
    User u = User.builder("u")
        .email("a@b.com")
        .ip("1.2.3.4")
        .userAgent("agent")
        .country("US")
        .locale("en_US")
        .appVersion("1.2.3")
        .custom("level", 3)
        .custom("name", "n")
        .custom("vip", true)
        .privateAttribute("secret", "s")
        .customID("companyID", "c")
        .environment("tier", "staging")
        .build();
    assertEquals("u", u.getUserID());
    assertEquals("a@b.com", u.getEmail());
    assertEquals("1.2.3.4", u.getIp());
    assertEquals("agent", u.getUserAgent());
    assertEquals("US", u.getCountry());
    assertEquals("en_US", u.getLocale());
    assertEquals("1.2.3", u.getAppVersion());
    assertEquals(ConfigValue.of(3), u.getCustom().get("level"));
    assertEquals(ConfigValue.of(true), u.getCustom().get("vip"));
    assertEquals(ConfigValue.of("s"), u.getPrivateAttributes().get("secret"));
    assertEquals("c", u.getCustomIDs().get("companyID"));
    assertEquals("staging", u.getEnvironment().get("tier"));
  }

  @Test
  public void nullValuesRemoveEntries() {
    User u = User.builder("u")
        .custom("a", "x").custom("a", (String)null)
        .privateAttribute("p", "x").privateAttribute("p", (String)null)
        .customID("stableID", "s").customID("stableID", null)
        .environment("tier", "t").environment("tier", null)
        .build();
    assertTrue(u.getCustom().isEmpty());
    assertTrue(u.getPrivateAttributes().isEmpty());
    assertTrue(u.getCustomIDs().isEmpty());
    assertTrue(u.getEnvironment().isEmpty());
  }

  @Test
  public void toBuilderCopiesEverything() {
    User u = User.builder("u").email("e").privateAttribute("p", "x").customID("stableID", "s")
        .environment("tier", "t").build();
    assertEquals(u, u.toBuilder().build());
    assertEquals(u.hashCode(), u.toBuilder().build().hashCode());
    assertNotEquals(u, u.toBuilder().email("other").build());
  }

  @Test
  public void loggableValueOmitsPrivateAttributesAndNulls() {
    User u = User.builder("u").email("e").custom("level", 2).privateAttribute("secret", "hidden")
        .customID("stableID", "s").environment("tier", "production").build();
    ConfigValue v = u.toLoggableValue();
    assertEquals(ConfigValue.of("u"), v.get("userID"));
    assertEquals(ConfigValue.of("e"), v.get("email"));
    assertTrue(v.get("ip").isNull());
    assertEquals(ConfigValue.of(2), v.get("custom").get("level"));
    assertEquals(ConfigValue.of("s"), v.get("customIDs").get("stableID"));
    assertEquals(ConfigValue.of("production"), v.get("environment").get("tier"));
    assertTrue(v.get("privateAttributes").isNull());
    assertFalse(v.toJsonString().contains("hidden"));
    assertFalse(u.toString().contains("hidden"));
  }

  @Test
  public void minimalUserHasOnlyId() {
    ConfigValue v = User.of("u").toLoggableValue();
    assertEquals(1, v.size());
  }
}
