package com.switchyard.sdk;

import com.google.gson.Gson;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An immutable instance of any data type that is allowed in JSON.
 * <p>
 * Every value that appears in a config spec (default values, rule return values, condition targets)
 * and every value returned from a dynamic config or layer is represented with this type. It is a closed
 * variant: {@link #getType()} tells you which of the JSON types it holds, and the typed accessors such
 * as {@link #stringValue()} return a neutral default instead of throwing when the type does not match.
 * <p>
 * A Java {@code null} is never a valid {@link ConfigValue}; use {@link #ofNull()} or
 * {@link #normalize(ConfigValue)} to get the JSON null instance.
 */
@JsonAdapter(ConfigValueTypeAdapter.class)
public abstract class ConfigValue {
  static final Gson gson = new Gson();
  
  /**
   * Returns the same value if non-null, or {@link #ofNull()} if null.
   * 
   * @param value a value or null
   * @return a non-null value
   */
  public static ConfigValue normalize(ConfigValue value) {
    return value == null ? ofNull() : value;
  }
  
  /**
   * Returns an instance for a null value. The same instance is always used.
   * 
   * @return the JSON null value
   */
  public static ConfigValue ofNull() {
    return ConfigValueNull.INSTANCE;
  }
  
  /**
   * Returns an instance for a boolean value.
   * 
   * @param value a boolean
   * @return a value
   */
  public static ConfigValue of(boolean value) {
    return value ? ConfigValueBool.TRUE : ConfigValueBool.FALSE;
  }
  
  /**
   * Returns an instance for a numeric value.
   * 
   * @param value an integer
   * @return a value
   */
  public static ConfigValue of(int value) {
    return ConfigValueNumber.fromDouble(value);
  }
  
  /**
   * Returns an instance for a numeric value. Integers beyond 53 bits lose precision, as in JSON.
   * 
   * @param value a long
   * @return a value
   */
  public static ConfigValue of(long value) {
    return ConfigValueNumber.fromDouble(value);
  }
  
  /**
   * Returns an instance for a numeric value.
   * 
   * @param value a double
   * @return a value
   */
  public static ConfigValue of(double value) {
    return ConfigValueNumber.fromDouble(value);
  }
  
  /**
   * Returns an instance for a string value, or {@link #ofNull()} if the string is null.
   * 
   * @param value a string or null
   * @return a value
   */
  public static ConfigValue of(String value) {
    return value == null ? ofNull() : ConfigValueString.fromString(value);
  }
  
  /**
   * Starts building an array value.
   * 
   * @return an {@link ArrayBuilder}
   */
  public static ArrayBuilder buildArray() {
    return new ArrayBuilder();
  }
  
  /**
   * Creates an array value from the given values.
   * 
   * @param values any number of values
   * @return an array value
   */
  public static ConfigValue arrayOf(ConfigValue... values) {
    ArrayBuilder builder = buildArray();
    for (ConfigValue v: values) {
      builder.add(v);
    }
    return builder.build();
  }
  
  /**
   * Creates an array value from a list of strings.
   * 
   * @param values a list of strings
   * @return an array value
   */
  public static ConfigValue arrayOfStrings(Collection<String> values) {
    ArrayBuilder builder = buildArray();
    if (values != null) {
      for (String v: values) {
        builder.add(v);
      }
    }
    return builder.build();
  }
  
  /**
   * Starts building an object value. Keys keep the order in which they were added.
   * 
   * @return an {@link ObjectBuilder}
   */
  public static ObjectBuilder buildObject() {
    return new ObjectBuilder();
  }
  
  /**
   * Parses a value from a JSON string.
   * 
   * @param json a JSON string
   * @return a value
   * @throws com.google.gson.JsonParseException if the string is not valid JSON
   */
  public static ConfigValue parse(String json) {
    return normalize(gson.fromJson(json, ConfigValue.class));
  }
  
  /**
   * Returns the type of this value.
   * 
   * @return the value type
   */
  public abstract ConfigValueType getType();
  
  /**
   * Tests whether this value is a null.
   * 
   * @return true if this is a JSON null
   */
  public boolean isNull() {
    return false;
  }
  
  /**
   * Tests whether this value is a number.
   * 
   * @return true if this is a number
   */
  public boolean isNumber() {
    return false;
  }
  
  /**
   * Tests whether this value is a number with no fractional part.
   * 
   * @return true if this is an integral number
   */
  public boolean isInt() {
    return false;
  }
  
  /**
   * Tests whether this value is a string.
   * 
   * @return true if this is a string
   */
  public boolean isString() {
    return false;
  }
  
  /**
   * Returns this value as a boolean if it is a boolean, otherwise false.
   * 
   * @return a boolean
   */
  public boolean booleanValue() {
    return false;
  }
  
  /**
   * Returns this value as an int if it is numeric, otherwise zero.
   * 
   * @return an int
   */
  public int intValue() {
    return 0;
  }
  
  /**
   * Returns this value as a long if it is numeric, otherwise zero.
   * 
   * @return a long
   */
  public long longValue() {
    return 0;
  }
  
  /**
   * Returns this value as a double if it is numeric, otherwise zero.
   * 
   * @return a double
   */
  public double doubleValue() {
    return 0;
  }
  
  /**
   * Returns this value as a string if it is a string, otherwise null.
   * 
   * @return a string or null
   */
  public String stringValue() {
    return null;
  }
  
  /**
   * Returns the number of elements in an array or object; zero for all other types.
   * 
   * @return the size
   */
  public int size() {
    return 0;
  }
  
  /**
   * Enumerates the elements of an array, or the property values of an object. Returns an empty
   * iterable for all other types.
   * 
   * @return the values
   */
  public Iterable<ConfigValue> values() {
    return Collections.emptyList();
  }
  
  /**
   * Enumerates the keys of an object; an empty iterable for all other types.
   * 
   * @return the keys
   */
  public Iterable<String> keys() {
    return Collections.emptyList();
  }
  
  /**
   * Returns an array element by index, or {@link #ofNull()} if this is not an array or the index is
   * out of range.
   * 
   * @param index the index
   * @return the element
   */
  public ConfigValue get(int index) {
    return ofNull();
  }
  
  /**
   * Returns an object property by name, or {@link #ofNull()} if this is not an object or there is
   * no such property.
   * 
   * @param name the property name
   * @return the property value
   */
  public ConfigValue get(String name) {
    return ofNull();
  }
  
  /**
   * Returns the properties of an object as an immutable map. Returns an empty map for all other types.
   * 
   * @return a map
   */
  public Map<String, ConfigValue> asMap() {
    return Collections.emptyMap();
  }
  
  /**
   * Returns the elements of an array as an immutable list. Returns an empty list for all other types.
   * 
   * @return a list
   */
  public List<ConfigValue> asList() {
    return Collections.emptyList();
  }
  
  /**
   * Returns a string representation of this value for operators that compare strings: the string
   * itself for strings, the JSON form for numbers and booleans, and null for null, arrays and objects.
   * 
   * @return a string or null
   */
  public String toComparableString() {
    return null;
  }
  
  /**
   * Converts this value to its JSON serialization.
   * 
   * @return a JSON string
   */
  public String toJsonString() {
    StringWriter sw = new StringWriter();
    try (JsonWriter jw = new JsonWriter(sw)) {
      write(jw);
    } catch (IOException e) {
      throw new IllegalStateException(e); // StringWriter never throws
    }
    return sw.toString();
  }
  
  abstract void write(JsonWriter writer) throws IOException;
  
  @Override
  public String toString() {
    return toJsonString();
  }
  
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConfigValue)) {
      return false;
    }
    ConfigValue other = (ConfigValue)o;
    if (getType() != other.getType()) {
      return false;
    }
    switch (getType()) {
    case NULL:
      return true;
    case BOOLEAN:
      return booleanValue() == other.booleanValue();
    case NUMBER:
      return doubleValue() == other.doubleValue();
    case STRING:
      return stringValue().equals(other.stringValue());
    case ARRAY:
      return asList().equals(other.asList());
    case OBJECT:
      return asMap().equals(other.asMap());
    default:
      return false;
    }
  }
  
  @Override
  public int hashCode() {
    switch (getType()) {
    case NULL:
      return 0;
    case BOOLEAN:
      return booleanValue() ? 1 : 2;
    case NUMBER:
      return Double.hashCode(doubleValue());
    case STRING:
      return stringValue().hashCode();
    case ARRAY:
      return asList().hashCode();
    case OBJECT:
      return asMap().hashCode();
    default:
      return 0;
    }
  }
  
  static boolean isInteger(double value) {
    return value == (double)((long)value);
  }
}
