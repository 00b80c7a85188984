package com.switchyard.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(ConfigValueTypeAdapter.class)
final class ConfigValueString extends ConfigValue {
  private static final ConfigValueString EMPTY = new ConfigValueString("");
  private final String value;
  
  static ConfigValueString fromString(String value) {
    return value.isEmpty() ? EMPTY : new ConfigValueString(value);
  }
  
  private ConfigValueString(String value) {
    this.value = value;
  }
  
  public ConfigValueType getType() {
    return ConfigValueType.STRING;
  }
  
  @Override
  public boolean isString() {
    return true;
  }
  
  @Override
  public String stringValue() {
    return value;
  }
  
  @Override
  public String toComparableString() {
    return value;
  }
  
  @Override
  void write(JsonWriter writer) throws IOException {
    writer.value(value);
  }
}
