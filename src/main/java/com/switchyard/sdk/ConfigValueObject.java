package com.switchyard.sdk;

import com.google.common.collect.ImmutableMap;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.Map;

@JsonAdapter(ConfigValueTypeAdapter.class)
final class ConfigValueObject extends ConfigValue {
  private static final ConfigValueObject EMPTY = new ConfigValueObject(ImmutableMap.<String, ConfigValue>of());
  private final ImmutableMap<String, ConfigValue> map;
  
  static ConfigValueObject fromMap(ImmutableMap<String, ConfigValue> map) {
    return map.isEmpty() ? EMPTY : new ConfigValueObject(map);
  }
  
  private ConfigValueObject(ImmutableMap<String, ConfigValue> map) {
    this.map = map;
  }
  
  public ConfigValueType getType() {
    return ConfigValueType.OBJECT;
  }
  
  @Override
  public int size() {
    return map.size();
  }
  
  @Override
  public Iterable<String> keys() {
    return map.keySet();
  }
  
  @Override
  public Iterable<ConfigValue> values() {
    return map.values();
  }
  
  @Override
  public Map<String, ConfigValue> asMap() {
    return map;
  }
  
  @Override
  public ConfigValue get(String name) {
    ConfigValue v = name == null ? null : map.get(name);
    return v == null ? ofNull() : v;
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.beginObject();
    for (Map.Entry<String, ConfigValue> e: map.entrySet()) {
      writer.name(e.getKey());
      e.getValue().write(writer);
    }
    writer.endObject();
  }
}
