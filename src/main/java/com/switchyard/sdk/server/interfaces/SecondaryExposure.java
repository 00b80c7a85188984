package com.switchyard.sdk.server.interfaces;

import com.switchyard.sdk.ConfigValue;

import java.util.Objects;

/**
 * A record of a nested gate that was consulted while evaluating another spec.
 */
public final class SecondaryExposure {
  private final String gate;
  private final String gateValue;
  private final String ruleID;
  
  /**
   * Creates an instance.
   * 
   * @param gate the nested gate name
   * @param gateValue {@code "true"} or {@code "false"}
   * @param ruleID the rule id that produced the nested gate's value
   */
  public SecondaryExposure(String gate, String gateValue, String ruleID) {
    this.gate = gate;
    this.gateValue = gateValue;
    this.ruleID = ruleID;
  }
  
  public String getGate() {
    return gate;
  }
  
  public String getGateValue() {
    return gateValue;
  }
  
  public String getRuleID() {
    return ruleID;
  }
  
  /**
   * Returns the JSON representation used in events and client snapshots.
   * 
   * @return an object value
   */
  public ConfigValue toValue() {
    return ConfigValue.buildObject()
        .put("gate", gate)
        .put("gateValue", gateValue)
        .put("ruleID", ruleID)
        .build();
  }
  
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SecondaryExposure)) return false;
    SecondaryExposure other = (SecondaryExposure)o;
    return Objects.equals(gate, other.gate) && Objects.equals(gateValue, other.gateValue) &&
        Objects.equals(ruleID, other.ruleID);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(gate, gateValue, ruleID);
  }
  
  @Override
  public String toString() {
    return toValue().toJsonString();
  }
}
