package com.switchyard.sdk.server.interfaces;

import com.google.common.collect.ImmutableList;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.ConfigValueType;

import java.util.List;
import java.util.Map;

/**
 * Base class for JSON-valued evaluation results, with typed accessors that return the caller's
 * fallback when a key is missing or holds a value of a different type.
 */
public abstract class EvaluatedConfig {
  private final String name;
  private final ConfigValue value;
  private final String ruleID;
  private final String groupName;
  private final String idType;
  private final EvaluationDetails evaluationDetails;
  private final ImmutableList<SecondaryExposure> secondaryExposures;
  
  EvaluatedConfig(String name, ConfigValue value, String ruleID, String groupName, String idType,
      EvaluationDetails evaluationDetails, List<SecondaryExposure> secondaryExposures) {
    this.name = name;
    this.value = value == null || value.getType() != ConfigValueType.OBJECT ?
        ConfigValue.buildObject().build() : value;
    this.ruleID = ruleID == null ? "" : ruleID;
    this.groupName = groupName;
    this.idType = idType;
    this.evaluationDetails = evaluationDetails;
    this.secondaryExposures = secondaryExposures == null ? ImmutableList.<SecondaryExposure>of() :
      ImmutableList.copyOf(secondaryExposures);
  }
  
  public String getName() {
    return name;
  }
  
  /**
   * Returns the whole value as an object. Reading it this way does not log parameter exposures.
   * 
   * @return an object value
   */
  public ConfigValue getValue() {
    return value;
  }
  
  public String getRuleID() {
    return ruleID;
  }
  
  public String getGroupName() {
    return groupName;
  }
  
  public String getIdType() {
    return idType;
  }
  
  public EvaluationDetails getEvaluationDetails() {
    return evaluationDetails;
  }
  
  public List<SecondaryExposure> getSecondaryExposures() {
    return secondaryExposures;
  }
  
  /**
   * Called whenever a parameter is read through one of the typed accessors and exists.
   * 
   * @param key the parameter name
   */
  protected void onParameterAccess(String key) {}
  
  private ConfigValue lookup(String key, ConfigValueType expectedType) {
    ConfigValue v = value.get(key);
    if (v.isNull()) {
      return null;
    }
    onParameterAccess(key);
    return v.getType() == expectedType ? v : null;
  }
  
  public String getString(String key, String fallback) {
    ConfigValue v = lookup(key, ConfigValueType.STRING);
    return v == null ? fallback : v.stringValue();
  }
  
  public boolean getBoolean(String key, boolean fallback) {
    ConfigValue v = lookup(key, ConfigValueType.BOOLEAN);
    return v == null ? fallback : v.booleanValue();
  }
  
  public double getDouble(String key, double fallback) {
    ConfigValue v = lookup(key, ConfigValueType.NUMBER);
    return v == null ? fallback : v.doubleValue();
  }
  
  public int getInt(String key, int fallback) {
    ConfigValue v = lookup(key, ConfigValueType.NUMBER);
    return v == null ? fallback : v.intValue();
  }
  
  public long getLong(String key, long fallback) {
    ConfigValue v = lookup(key, ConfigValueType.NUMBER);
    return v == null ? fallback : v.longValue();
  }
  
  public List<ConfigValue> getArray(String key, List<ConfigValue> fallback) {
    ConfigValue v = lookup(key, ConfigValueType.ARRAY);
    return v == null ? fallback : v.asList();
  }
  
  public Map<String, ConfigValue> getObject(String key, Map<String, ConfigValue> fallback) {
    ConfigValue v = lookup(key, ConfigValueType.OBJECT);
    return v == null ? fallback : v.asMap();
  }
}
