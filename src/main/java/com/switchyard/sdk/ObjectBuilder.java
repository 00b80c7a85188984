package com.switchyard.sdk;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A builder created by {@link ConfigValue#buildObject()}. Properties keep insertion order, and
 * setting a key that was already set replaces its value in place.
 * <p>
 * Builder methods are not thread-safe.
 */
public final class ObjectBuilder {
  private final Map<String, ConfigValue> map = new LinkedHashMap<>();
  
  ObjectBuilder() {}
  
  /**
   * Sets a property.
   * 
   * @param key the property name
   * @param value the value; null is stored as a JSON null
   * @return the same builder
   */
  public ObjectBuilder put(String key, ConfigValue value) {
    map.put(key, ConfigValue.normalize(value));
    return this;
  }
  
  /**
   * Sets a string property.
   * 
   * @param key the property name
   * @param value the value
   * @return the same builder
   */
  public ObjectBuilder put(String key, String value) {
    return put(key, ConfigValue.of(value));
  }
  
  /**
   * Sets a boolean property.
   * 
   * @param key the property name
   * @param value the value
   * @return the same builder
   */
  public ObjectBuilder put(String key, boolean value) {
    return put(key, ConfigValue.of(value));
  }
  
  /**
   * Sets a numeric property.
   * 
   * @param key the property name
   * @param value the value
   * @return the same builder
   */
  public ObjectBuilder put(String key, long value) {
    return put(key, ConfigValue.of(value));
  }
  
  /**
   * Sets a numeric property.
   * 
   * @param key the property name
   * @param value the value
   * @return the same builder
   */
  public ObjectBuilder put(String key, double value) {
    return put(key, ConfigValue.of(value));
  }
  
  /**
   * Copies every property of an object value into this builder, replacing existing keys.
   * 
   * @param value an object value; other types are ignored
   * @return the same builder
   */
  public ObjectBuilder putAll(ConfigValue value) {
    if (value != null) {
      for (Map.Entry<String, ConfigValue> e: value.asMap().entrySet()) {
        map.put(e.getKey(), e.getValue());
      }
    }
    return this;
  }
  
  /**
   * Returns an object containing the builder's current properties.
   * 
   * @return an object value
   */
  public ConfigValue build() {
    return ConfigValueObject.fromMap(ImmutableMap.copyOf(map));
  }
}
