package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.switchyard.sdk.ConfigValue;

import java.util.Map;

/**
 * Server-controlled SDK settings carried in the spec document's {@code sdk_configs} and
 * {@code sdk_flags} sections, such as the exposure sampling mode.
 */
final class SdkConfigs {
  static final SdkConfigs EMPTY = new SdkConfigs(ImmutableMap.<String, ConfigValue>of(),
      ImmutableMap.<String, Boolean>of());
  
  static final String SAMPLING_MODE = "sampling_mode";
  static final String SPECIAL_CASE_SAMPLING_RATE = "special_case_sampling_rate";
  
  private final ImmutableMap<String, ConfigValue> configs;
  private final ImmutableMap<String, Boolean> flags;
  
  SdkConfigs(Map<String, ConfigValue> configs, Map<String, Boolean> flags) {
    this.configs = ImmutableMap.copyOf(configs);
    this.flags = ImmutableMap.copyOf(flags);
  }
  
  /**
   * Returns a string setting, or null if it is missing or not a string.
   */
  String getString(String key) {
    ConfigValue v = configs.get(key);
    return v == null ? null : v.stringValue();
  }
  
  /**
   * Returns a numeric setting, or null if it is missing or not a number.
   */
  Long getLong(String key) {
    ConfigValue v = configs.get(key);
    return v == null || !v.isNumber() ? null : v.longValue();
  }
  
  boolean isFlagOn(String key) {
    Boolean b = flags.get(key);
    return b != null && b;
  }
}
