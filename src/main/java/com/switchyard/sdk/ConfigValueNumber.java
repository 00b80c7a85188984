package com.switchyard.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(ConfigValueTypeAdapter.class)
final class ConfigValueNumber extends ConfigValue {
  private static final ConfigValueNumber ZERO = new ConfigValueNumber(0);
  private final double value;
  
  static ConfigValueNumber fromDouble(double value) {
    return value == 0 ? ZERO : new ConfigValueNumber(value);
  }
  
  private ConfigValueNumber(double value) {
    this.value = value;
  }
  
  public ConfigValueType getType() {
    return ConfigValueType.NUMBER;
  }
  
  @Override
  public boolean isNumber() {
    return true;
  }
  
  @Override
  public boolean isInt() {
    return isInteger(value);
  }
  
  @Override
  public int intValue() {
    return (int)value;
  }

  @Override
  public long longValue() {
    return (long)value;
  }

  @Override
  public double doubleValue() {
    return value;
  }

  @Override
  public String toComparableString() {
    return toJsonString();
  }
  
  @Override
  public String toJsonString() {
    return isInt() ? String.valueOf(longValue()) : String.valueOf(value);
  }
  
  @Override
  void write(JsonWriter writer) throws IOException {
    if (isInt()) {
      writer.value(longValue());
    } else {
      writer.value(value);
    }
  }
}
