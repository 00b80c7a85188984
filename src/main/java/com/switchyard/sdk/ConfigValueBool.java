package com.switchyard.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(ConfigValueTypeAdapter.class)
final class ConfigValueBool extends ConfigValue {
  static final ConfigValueBool TRUE = new ConfigValueBool(true);
  static final ConfigValueBool FALSE = new ConfigValueBool(false);
  
  private final boolean value;
  
  private ConfigValueBool(boolean value) {
    this.value = value;
  }
  
  public ConfigValueType getType() {
    return ConfigValueType.BOOLEAN;
  }
  
  @Override
  public boolean booleanValue() {
    return value;
  }
  
  @Override
  public String toComparableString() {
    return String.valueOf(value);
  }
  
  @Override
  public String toJsonString() {
    return value ? "true" : "false";
  }
  
  @Override
  void write(JsonWriter writer) throws IOException {
    writer.value(value);
  }
}
