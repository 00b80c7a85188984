package com.switchyard.sdk.server.interfaces;

import com.switchyard.sdk.ConfigValue;

import java.util.List;

/**
 * The result of evaluating a dynamic config or an experiment.
 */
public final class DynamicConfig extends EvaluatedConfig {
  private final boolean userInExperiment;
  private final boolean experimentActive;
  
  /**
   * Creates an instance.
   * 
   * @param name the config name
   * @param value the object value
   * @param ruleID the rule that produced the value
   * @param groupName the experiment group, if any
   * @param idType the config's id type
   * @param userInExperiment true if the rule was an experiment group
   * @param experimentActive true if the experiment is active
   * @param evaluationDetails the evaluation details
   * @param secondaryExposures nested gate exposures
   */
  public DynamicConfig(String name, ConfigValue value, String ruleID, String groupName, String idType,
      boolean userInExperiment, boolean experimentActive, EvaluationDetails evaluationDetails,
      List<SecondaryExposure> secondaryExposures) {
    super(name, value, ruleID, groupName, idType, evaluationDetails, secondaryExposures);
    this.userInExperiment = userInExperiment;
    this.experimentActive = experimentActive;
  }
  
  /**
   * Returns an empty config, used when a config does not exist or evaluation failed.
   * 
   * @param name the config name
   * @param details the evaluation details
   * @return an empty config
   */
  public static DynamicConfig empty(String name, EvaluationDetails details) {
    return new DynamicConfig(name, null, "", null, null, false, false, details, null);
  }
  
  public boolean isUserInExperiment() {
    return userInExperiment;
  }
  
  public boolean isExperimentActive() {
    return experimentActive;
  }
}
