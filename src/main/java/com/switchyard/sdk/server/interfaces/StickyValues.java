package com.switchyard.sdk.server.interfaces;

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.SerializedName;
import com.switchyard.sdk.ConfigValue;

import java.util.List;

/**
 * A persisted (sticky) evaluation of an experiment for one unit.
 * <p>
 * Instances are serialized to JSON by the SDK and handed to a
 * {@link com.switchyard.sdk.server.subsystems.UserPersistentStorage}.
 */
public final class StickyValues {
  private boolean value;
  @SerializedName("json_value") private ConfigValue jsonValue;
  @SerializedName("rule_id") private String ruleID;
  @SerializedName("group_name") private String groupName;
  @SerializedName("secondary_exposures") private List<SecondaryExposure> secondaryExposures;
  @SerializedName("undelegated_secondary_exposures") private List<SecondaryExposure> undelegatedSecondaryExposures;
  @SerializedName("config_delegate") private String configDelegate;
  @SerializedName("explicit_parameters") private List<String> explicitParameters;
  private long time;
  @SerializedName("config_version") private Integer configVersion;
  
  StickyValues() {} // for Gson
  
  /**
   * Creates an instance.
   * 
   * @param value the boolean result
   * @param jsonValue the config value
   * @param ruleID the rule id
   * @param groupName the experiment group
   * @param secondaryExposures secondary exposures
   * @param undelegatedSecondaryExposures undelegated secondary exposures
   * @param configDelegate the delegate experiment, for layers
   * @param explicitParameters the delegate's explicit parameters, for layers
   * @param time the time the value was persisted
   * @param configVersion the spec version, if known
   */
  public StickyValues(boolean value, ConfigValue jsonValue, String ruleID, String groupName,
      List<SecondaryExposure> secondaryExposures, List<SecondaryExposure> undelegatedSecondaryExposures,
      String configDelegate, List<String> explicitParameters, long time, Integer configVersion) {
    this.value = value;
    this.jsonValue = jsonValue;
    this.ruleID = ruleID;
    this.groupName = groupName;
    this.secondaryExposures = secondaryExposures;
    this.undelegatedSecondaryExposures = undelegatedSecondaryExposures;
    this.configDelegate = configDelegate;
    this.explicitParameters = explicitParameters;
    this.time = time;
    this.configVersion = configVersion;
  }
  
  public boolean getValue() {
    return value;
  }
  
  public ConfigValue getJsonValue() {
    return ConfigValue.normalize(jsonValue);
  }
  
  public String getRuleID() {
    return ruleID == null ? "" : ruleID;
  }
  
  public String getGroupName() {
    return groupName;
  }
  
  public List<SecondaryExposure> getSecondaryExposures() {
    return secondaryExposures == null ? ImmutableList.<SecondaryExposure>of() : secondaryExposures;
  }
  
  public List<SecondaryExposure> getUndelegatedSecondaryExposures() {
    return undelegatedSecondaryExposures == null ? ImmutableList.<SecondaryExposure>of() :
      undelegatedSecondaryExposures;
  }
  
  public String getConfigDelegate() {
    return configDelegate;
  }
  
  public List<String> getExplicitParameters() {
    return explicitParameters == null ? ImmutableList.<String>of() : explicitParameters;
  }
  
  public long getTime() {
    return time;
  }
  
  public Integer getConfigVersion() {
    return configVersion;
  }
}
