package com.switchyard.sdk.server.interfaces;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The result of evaluating a gate.
 */
public final class FeatureGate {
  private final String name;
  private final boolean value;
  private final String ruleID;
  private final String idType;
  private final EvaluationDetails evaluationDetails;
  private final ImmutableList<SecondaryExposure> secondaryExposures;
  
  /**
   * Creates an instance.
   * 
   * @param name the gate name
   * @param value the gate value
   * @param ruleID the rule that produced the value
   * @param idType the gate's id type
   * @param evaluationDetails the evaluation details
   * @param secondaryExposures nested gate exposures
   */
  public FeatureGate(String name, boolean value, String ruleID, String idType,
      EvaluationDetails evaluationDetails, List<SecondaryExposure> secondaryExposures) {
    this.name = name;
    this.value = value;
    this.ruleID = ruleID == null ? "" : ruleID;
    this.idType = idType;
    this.evaluationDetails = evaluationDetails;
    this.secondaryExposures = secondaryExposures == null ? ImmutableList.<SecondaryExposure>of() :
      ImmutableList.copyOf(secondaryExposures);
  }
  
  public String getName() {
    return name;
  }
  
  public boolean getValue() {
    return value;
  }
  
  public String getRuleID() {
    return ruleID;
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
}
