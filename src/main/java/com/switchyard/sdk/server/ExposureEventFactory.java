package com.switchyard.sdk.server;

import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.User;
import com.switchyard.sdk.server.ExposureSampler.EntityKind;
import com.switchyard.sdk.server.interfaces.EvaluationDetails;
import com.switchyard.sdk.server.interfaces.Event;
import com.switchyard.sdk.server.interfaces.SecondaryExposure;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes exposure and custom events from evaluation results and applies the sampling decision.
 */
final class ExposureEventFactory {
  static final String GATE_EXPOSURE_EVENT = "switchyard::gate_exposure";
  static final String CONFIG_EXPOSURE_EVENT = "switchyard::config_exposure";
  static final String LAYER_EXPOSURE_EVENT = "switchyard::layer_exposure";
  static final String DIAGNOSTICS_EVENT = "switchyard::diagnostics";
  
  /**
   * An exposure event and whether it should be delivered.
   */
  static final class Exposure {
    final Event event;
    final boolean shouldLog;
    
    Exposure(Event event, boolean shouldLog) {
      this.event = event;
      this.shouldLog = shouldLog;
    }
  }
  
  private final ExposureSampler sampler;
  
  ExposureEventFactory(ExposureSampler sampler) {
    this.sampler = sampler;
  }
  
  Exposure newGateExposure(User user, String gateName, EvalResult result, boolean manual) {
    Map<String, String> metadata = new HashMap<>();
    metadata.put("gate", gateName);
    metadata.put("gateValue", String.valueOf(result.getValue()));
    metadata.put("ruleID", result.getRuleID());
    return finish(EntityKind.GATE, GATE_EXPOSURE_EVENT, gateName, user, result, metadata,
        result.getSecondaryExposures(), manual, null, null);
  }
  
  Exposure newConfigExposure(User user, String configName, EvalResult result, boolean manual) {
    Map<String, String> metadata = new HashMap<>();
    metadata.put("config", configName);
    metadata.put("ruleID", result.getRuleID());
    metadata.put("rulePassed", String.valueOf(result.getValue()));
    return finish(EntityKind.CONFIG, CONFIG_EXPOSURE_EVENT, configName, user, result, metadata,
        result.getSecondaryExposures(), manual, null, null);
  }
  
  /**
   * Builds a layer parameter exposure. A parameter owned by the allocated experiment is attributed to
   * it and carries all secondary exposures; any other parameter carries only the layer's own.
   */
  Exposure newLayerExposure(User user, String layerName, EvalResult result, String parameterName,
      boolean manual) {
    boolean explicit = result.getExplicitParameters().contains(parameterName);
    String allocatedExperiment = "";
    List<SecondaryExposure> exposures = result.getUndelegatedSecondaryExposures();
    if (explicit) {
      allocatedExperiment = result.getConfigDelegate() == null ? "" : result.getConfigDelegate();
      exposures = result.getSecondaryExposures();
    }
    Map<String, String> metadata = new HashMap<>();
    metadata.put("config", layerName);
    metadata.put("ruleID", result.getRuleID());
    metadata.put("allocatedExperiment", allocatedExperiment);
    metadata.put("parameterName", parameterName);
    metadata.put("isExplicitParameter", String.valueOf(explicit));
    return finish(EntityKind.LAYER, LAYER_EXPOSURE_EVENT, layerName, user, result, metadata, exposures,
        manual, parameterName, allocatedExperiment);
  }
  
  static Event newCustomEvent(User user, String eventName, ConfigValue value, Map<String, String> metadata) {
    return new Event(eventName, user, value, metadata, null, System.currentTimeMillis());
  }
  
  private Exposure finish(EntityKind kind, String eventName, String name, User user, EvalResult result,
      Map<String, String> metadata, List<SecondaryExposure> exposures, boolean manual,
      String parameterName, String allocatedExperiment) {
    if (manual) {
      metadata.put("isManualExposure", "true");
    }
    if (result.getConfigVersion() != null) {
      metadata.put("configVersion", String.valueOf(result.getConfigVersion()));
    }
    EvaluationDetails details = result.getEvaluationDetails();
    if (details != null) {
      metadata.put("reason", details.detailedReason());
      metadata.put("configSyncTime", String.valueOf(details.getConfigSyncTime()));
      metadata.put("initTime", String.valueOf(details.getInitTime()));
      metadata.put("serverTime", String.valueOf(details.getServerTime()));
    }
    if (result.getDerivedDeviceMetadata() != null) {
      metadata.putAll(result.getDerivedDeviceMetadata());
    }
    ExposureSampler.Decision decision = sampler.decide(kind, name, result, user, parameterName,
        allocatedExperiment);
    Event event = new Event(eventName, user, null, metadata, exposures, System.currentTimeMillis());
    Map<String, ConfigValue> samplingMetadata = decision.toSamplingMetadata();
    if (!samplingMetadata.isEmpty()) {
      event = event.withSamplingMetadata(samplingMetadata);
    }
    return new Exposure(event, decision.shouldLog);
  }
}
