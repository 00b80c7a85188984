package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.User;

import java.util.HashMap;
import java.util.Map;

/**
 * Developer-forced values for gates, configs and layers, scoped to this client instance.
 * <p>
 * An override either applies to everyone (registered without an id) or to one unit id, matched
 * against the user id and every custom id. Id-scoped overrides win over global ones. The maps are
 * copy-on-write, so lookups never lock.
 */
final class LocalOverrides {
  static final String OVERRIDE_RULE_ID = "local:override";
  static final String ID_OVERRIDE_RULE_ID = "local:id_override";
  
  // An empty id key marks a global override.
  private static final String ALL_IDS = "";
  
  static final class Match<T> {
    final T value;
    final String ruleID;
    
    Match(T value, String ruleID) {
      this.value = value;
      this.ruleID = ruleID;
    }
  }
  
  private final Object lock = new Object();
  private volatile ImmutableMap<String, ImmutableMap<String, Boolean>> gates = ImmutableMap.of();
  private volatile ImmutableMap<String, ImmutableMap<String, ConfigValue>> configs = ImmutableMap.of();
  private volatile ImmutableMap<String, ImmutableMap<String, ConfigValue>> layers = ImmutableMap.of();
  
  void overrideGate(String name, boolean value, String id) {
    synchronized (lock) {
      gates = put(gates, name, id, value);
    }
  }
  
  void overrideConfig(String name, ConfigValue value, String id) {
    synchronized (lock) {
      configs = put(configs, name, id, value);
    }
  }
  
  void overrideLayer(String name, ConfigValue value, String id) {
    synchronized (lock) {
      layers = put(layers, name, id, value);
    }
  }
  
  void removeGateOverride(String name) {
    synchronized (lock) {
      gates = remove(gates, name);
    }
  }
  
  void removeConfigOverride(String name) {
    synchronized (lock) {
      configs = remove(configs, name);
    }
  }
  
  void removeLayerOverride(String name) {
    synchronized (lock) {
      layers = remove(layers, name);
    }
  }
  
  void removeAll() {
    synchronized (lock) {
      gates = ImmutableMap.of();
      configs = ImmutableMap.of();
      layers = ImmutableMap.of();
    }
  }
  
  Match<Boolean> getGate(String name, User user) {
    return find(gates.get(name), user);
  }
  
  Match<ConfigValue> getConfig(String name, User user) {
    return find(configs.get(name), user);
  }
  
  Match<ConfigValue> getLayer(String name, User user) {
    return find(layers.get(name), user);
  }
  
  private static <T> Match<T> find(Map<String, T> byId, User user) {
    if (byId == null) {
      return null;
    }
    if (user != null) {
      T v = user.getUserID() == null ? null : byId.get(user.getUserID());
      if (v != null) {
        return new Match<>(v, ID_OVERRIDE_RULE_ID);
      }
      for (String customID: user.getCustomIDs().values()) {
        v = byId.get(customID);
        if (v != null) {
          return new Match<>(v, ID_OVERRIDE_RULE_ID);
        }
      }
    }
    T all = byId.get(ALL_IDS);
    return all == null ? null : new Match<>(all, OVERRIDE_RULE_ID);
  }
  
  private static <T> ImmutableMap<String, ImmutableMap<String, T>> put(
      ImmutableMap<String, ImmutableMap<String, T>> current, String name, String id, T value) {
    Map<String, ImmutableMap<String, T>> outer = new HashMap<>(current);
    Map<String, T> inner = new HashMap<>();
    if (current.containsKey(name)) {
      inner.putAll(current.get(name));
    }
    inner.put(id == null ? ALL_IDS : id, value);
    outer.put(name, ImmutableMap.copyOf(inner));
    return ImmutableMap.copyOf(outer);
  }
  
  private static <T> ImmutableMap<String, ImmutableMap<String, T>> remove(
      ImmutableMap<String, ImmutableMap<String, T>> current, String name) {
    if (!current.containsKey(name)) {
      return current;
    }
    Map<String, ImmutableMap<String, T>> outer = new HashMap<>(current);
    outer.remove(name);
    return ImmutableMap.copyOf(outer);
  }
}
