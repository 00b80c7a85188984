package com.switchyard.sdk.server.interfaces;

import com.switchyard.sdk.ConfigValue;

/**
 * The arm selected for a user by a contextual multi-armed bandit.
 */
public final class CMABAssignment {
  private final String name;
  private final String groupID;
  private final String groupName;
  private final ConfigValue value;
  private final String ruleID;
  private final EvaluationDetails evaluationDetails;
  
  /**
   * Creates an instance.
   * 
   * @param name the CMAB name
   * @param groupID the selected arm id, or null if the user was not assigned an arm
   * @param groupName the selected arm name
   * @param value the arm's parameter values, or the CMAB default value
   * @param ruleID the rule id logged with the exposure
   * @param evaluationDetails the evaluation details
   */
  public CMABAssignment(String name, String groupID, String groupName, ConfigValue value, String ruleID,
      EvaluationDetails evaluationDetails) {
    this.name = name;
    this.groupID = groupID;
    this.groupName = groupName;
    this.value = ConfigValue.normalize(value);
    this.ruleID = ruleID == null ? "" : ruleID;
    this.evaluationDetails = evaluationDetails;
  }
  
  public String getName() {
    return name;
  }
  
  public String getGroupID() {
    return groupID;
  }
  
  public String getGroupName() {
    return groupName;
  }
  
  public ConfigValue getValue() {
    return value;
  }
  
  public String getRuleID() {
    return ruleID;
  }
  
  public EvaluationDetails getEvaluationDetails() {
    return evaluationDetails;
  }
}
