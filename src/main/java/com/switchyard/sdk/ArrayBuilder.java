package com.switchyard.sdk;

import com.google.common.collect.ImmutableList;

/**
 * A builder created by {@link ConfigValue#buildArray()}.
 * <p>
 * Builder methods are not thread-safe.
 */
public final class ArrayBuilder {
  private final ImmutableList.Builder<ConfigValue> builder = ImmutableList.builder();
  
  ArrayBuilder() {}
  
  /**
   * Adds a new element to the builder.
   * 
   * @param value the new element; null is stored as a JSON null
   * @return the same builder
   */
  public ArrayBuilder add(ConfigValue value) {
    builder.add(ConfigValue.normalize(value));
    return this;
  }
  
  /**
   * Adds a new string element to the builder.
   * 
   * @param value the new element
   * @return the same builder
   */
  public ArrayBuilder add(String value) {
    return add(ConfigValue.of(value));
  }
  
  /**
   * Adds a new numeric element to the builder.
   * 
   * @param value the new element
   * @return the same builder
   */
  public ArrayBuilder add(double value) {
    return add(ConfigValue.of(value));
  }

  /**
   * Adds a new boolean element to the builder.
   * 
   * @param value the new element
   * @return the same builder
   */
  public ArrayBuilder add(boolean value) {
    return add(ConfigValue.of(value));
  }
  
  /**
   * Returns an array containing the builder's current elements.
   * 
   * @return an array value
   */
  public ConfigValue build() {
    return ConfigValueArray.fromList(builder.build());
  }
}
