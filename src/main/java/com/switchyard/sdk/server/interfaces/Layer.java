package com.switchyard.sdk.server.interfaces;

import com.switchyard.sdk.ConfigValue;

import java.util.List;

/**
 * The result of evaluating a layer.
 * <p>
 * Reading a parameter through one of the typed accessors logs a layer exposure for that parameter,
 * unless the layer was fetched with exposure logging disabled.
 */
public final class Layer extends EvaluatedConfig {
  /**
   * Receives parameter accesses.
   */
  public interface ParameterExposureListener {
    /**
     * Called when a parameter is read.
     * 
     * @param layer the layer
     * @param parameterName the parameter
     */
    void onParameterExposure(Layer layer, String parameterName);
  }
  
  private final String allocatedExperimentName;
  private final ParameterExposureListener listener;
  
  /**
   * Creates an instance.
   * 
   * @param name the layer name
   * @param value the object value
   * @param ruleID the rule that produced the value
   * @param groupName the experiment group, if any
   * @param allocatedExperimentName the delegate experiment, or null
   * @param evaluationDetails the evaluation details
   * @param secondaryExposures nested gate exposures
   * @param listener receives parameter accesses; may be null
   */
  public Layer(String name, ConfigValue value, String ruleID, String groupName, String allocatedExperimentName,
      EvaluationDetails evaluationDetails, List<SecondaryExposure> secondaryExposures,
      ParameterExposureListener listener) {
    super(name, value, ruleID, groupName, null, evaluationDetails, secondaryExposures);
    this.allocatedExperimentName = allocatedExperimentName;
    this.listener = listener;
  }
  
  /**
   * Returns an empty layer, used when a layer does not exist or evaluation failed.
   * 
   * @param name the layer name
   * @param details the evaluation details
   * @return an empty layer
   */
  public static Layer empty(String name, EvaluationDetails details) {
    return new Layer(name, null, "", null, null, details, null, null);
  }
  
  /**
   * Returns the experiment currently allocated within this layer, or null.
   * 
   * @return the experiment name or null
   */
  public String getAllocatedExperimentName() {
    return allocatedExperimentName;
  }
  
  @Override
  protected void onParameterAccess(String key) {
    if (listener != null) {
      listener.onParameterExposure(this, key);
    }
  }
}
