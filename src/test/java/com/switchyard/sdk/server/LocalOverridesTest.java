package com.switchyard.sdk.server;

import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.User;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

@SuppressWarnings("javadoc")
public class LocalOverridesTest {
  private static final User user = User.builder("u1").customID("companyID", "c1").build();
  private static final ConfigValue red = ConfigValue.buildObject().put("color", "red").build();
  private static final ConfigValue green = ConfigValue.buildObject().put("color", "green").build();

  private final LocalOverrides overrides = new LocalOverrides();

  @Test
  public void noOverrideReturnsNull() {
    assertNull(overrides.getGate("g", user));
    assertNull(overrides.getConfig("c", user));
    assertNull(overrides.getLayer("l", user));
  }

  @Test
  public void globalOverrideAppliesToEveryone() {
    overrides.overrideGate("g", true, null);
    LocalOverrides.Match<Boolean> m = overrides.getGate("g", User.of("anyone"));
    assertEquals(Boolean.TRUE, m.value);
    assertEquals(LocalOverrides.OVERRIDE_RULE_ID, m.ruleID);
  }

  @Test
  public void idOverrideMatchesUserIdOrCustomId() {
    overrides.overrideConfig("c", red, "u1");
    overrides.overrideConfig("c2", green, "c1");

    LocalOverrides.Match<ConfigValue> byUserId = overrides.getConfig("c", user);
    assertEquals(red, byUserId.value);
    assertEquals(LocalOverrides.ID_OVERRIDE_RULE_ID, byUserId.ruleID);

    assertEquals(green, overrides.getConfig("c2", user).value);
    assertNull(overrides.getConfig("c", User.of("u2")));
  }

  @Test
  public void idOverrideWinsOverGlobal() {
    overrides.overrideLayer("l", red, null);
    overrides.overrideLayer("l", green, "u1");
    assertEquals(green, overrides.getLayer("l", user).value);
    assertEquals(red, overrides.getLayer("l", User.of("u2")).value);
  }

  @Test
  public void laterOverrideReplacesEarlier() {
    overrides.overrideGate("g", true, null);
    overrides.overrideGate("g", false, null);
    assertEquals(Boolean.FALSE, overrides.getGate("g", user).value);
  }

  @Test
  public void removeDropsAllOverridesForName() {
    overrides.overrideGate("g", true, null);
    overrides.overrideGate("g", true, "u1");
    overrides.overrideGate("other", true, null);
    overrides.removeGateOverride("g");
    assertNull(overrides.getGate("g", user));
    assertEquals(Boolean.TRUE, overrides.getGate("other", user).value);

    overrides.removeConfigOverride("missing");
    overrides.removeLayerOverride("missing");
  }

  @Test
  public void removeAllClearsEverything() {
    overrides.overrideGate("g", true, null);
    overrides.overrideConfig("c", red, null);
    overrides.overrideLayer("l", green, null);
    overrides.removeAll();
    assertNull(overrides.getGate("g", user));
    assertNull(overrides.getConfig("c", user));
    assertNull(overrides.getLayer("l", user));
  }
}
