package com.switchyard.sdk;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

final class ConfigValueTypeAdapter extends TypeAdapter<ConfigValue> {
  static final ConfigValueTypeAdapter INSTANCE = new ConfigValueTypeAdapter();
  
  @Override
  public ConfigValue read(JsonReader reader) throws IOException {
    JsonToken token = reader.peek();
    switch (token) {
    case BEGIN_ARRAY:
      ArrayBuilder ab = ConfigValue.buildArray();
      reader.beginArray();
      while (reader.peek() != JsonToken.END_ARRAY) {
        ab.add(read(reader));
      }
      reader.endArray();
      return ab.build();
    case BEGIN_OBJECT:
      ObjectBuilder ob = ConfigValue.buildObject();
      reader.beginObject();
      while (reader.peek() != JsonToken.END_OBJECT) {
        String key = reader.nextName();
        ConfigValue value = read(reader);
        ob.put(key, value);
      }
      reader.endObject();
      return ob.build();
    case BOOLEAN:
      return ConfigValue.of(reader.nextBoolean());
    case NULL:
      reader.nextNull();
      return ConfigValue.ofNull();
    case NUMBER:
      return ConfigValue.of(reader.nextDouble());
    case STRING:
      return ConfigValue.of(reader.nextString());
    default:
      throw new IllegalStateException("unexpected JSON token " + token);
    }
  }

  @Override
  public void write(JsonWriter writer, ConfigValue value) throws IOException {
    ConfigValue.normalize(value).write(writer);
  }
}
