package com.switchyard.sdk;

/**
 * Describes the type of a {@link ConfigValue}. These correspond to the standard types in JSON.
 */
public enum ConfigValueType {
  /**
   * The value is null.
   */
  NULL,
  /**
   * The value is a boolean.
   */
  BOOLEAN,
  /**
   * The value is numeric. JSON does not distinguish integers from floating-point numbers.
   */
  NUMBER,
  /**
   * The value is a string.
   */
  STRING,
  /**
   * The value is an ordered list of values.
   */
  ARRAY,
  /**
   * The value is an ordered map of string keys to values.
   */
  OBJECT
}
