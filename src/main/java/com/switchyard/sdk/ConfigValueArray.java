package com.switchyard.sdk;

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.List;

@JsonAdapter(ConfigValueTypeAdapter.class)
final class ConfigValueArray extends ConfigValue {
  private static final ConfigValueArray EMPTY = new ConfigValueArray(ImmutableList.<ConfigValue>of());
  private final ImmutableList<ConfigValue> list;

  static ConfigValueArray fromList(ImmutableList<ConfigValue> list) {
    return list.isEmpty() ? EMPTY : new ConfigValueArray(list);
  }

  private ConfigValueArray(ImmutableList<ConfigValue> list) {
    this.list = list;
  }

  public ConfigValueType getType() {
    return ConfigValueType.ARRAY;
  }
  
  @Override
  public int size() {
    return list.size();
  }
  
  @Override
  public Iterable<ConfigValue> values() {
    return list;
  }
  
  @Override
  public List<ConfigValue> asList() {
    return list;
  }
  
  @Override
  public ConfigValue get(int index) {
    if (index >= 0 && index < list.size()) {
      return list.get(index);
    }
    return ofNull();
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.beginArray();
    for (ConfigValue v: list) {
      v.write(writer);
    }
    writer.endArray();
  }
}
