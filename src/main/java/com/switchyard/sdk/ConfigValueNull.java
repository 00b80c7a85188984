package com.switchyard.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(ConfigValueTypeAdapter.class)
final class ConfigValueNull extends ConfigValue {
  static final ConfigValueNull INSTANCE = new ConfigValueNull();
  
  public ConfigValueType getType() {
    return ConfigValueType.NULL;
  }
  
  public boolean isNull() {
    return true;
  }
  
  @Override
  public String toJsonString() {
    return "null";
  }
  
  @Override
  void write(JsonWriter writer) throws IOException {
    writer.nullValue();
  }
}
