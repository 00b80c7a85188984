package com.switchyard.sdk.server.interfaces;

import com.switchyard.sdk.User;

/**
 * Receives every evaluation, with the exposure event it produced. The exposure is passed even when
 * exposure logging was disabled for the call or the event was sampled out. Callbacks run on the
 * evaluating thread and must not block.
 */
public interface EvaluationCallbacks {
  default void onGate(User user, FeatureGate gate, Event exposure) {}
  
  default void onConfig(User user, DynamicConfig config, Event exposure) {}
  
  default void onExperiment(User user, DynamicConfig experiment, Event exposure) {}
  
  default void onLayerParameter(User user, Layer layer, String parameterName, Event exposure) {}
}
