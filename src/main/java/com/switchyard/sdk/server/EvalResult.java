package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.server.interfaces.EvaluationDetails;
import com.switchyard.sdk.server.interfaces.SecondaryExposure;
import com.switchyard.sdk.server.interfaces.StickyValues;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Internal container for the result of evaluating one spec. Instances are immutable; the evaluator
 * assembles them with {@link Builder}.
 */
final class EvalResult {
  private final boolean value;
  private final ConfigValue jsonValue;
  private final String ruleID;
  private final String groupName;
  private final String idType;
  private final ImmutableList<SecondaryExposure> secondaryExposures;
  private final ImmutableList<SecondaryExposure> undelegatedSecondaryExposures;
  private final String configDelegate;
  private final ImmutableSet<String> explicitParameters;
  private final boolean experimentGroup;
  private final boolean experimentActive;
  private final Long samplingRate;
  private final boolean forwardAllExposures;
  private final boolean hasSeenAnalyticalGates;
  private final Integer configVersion;
  private final ImmutableMap<String, String> derivedDeviceMetadata;
  private final EvaluationDetails evaluationDetails;
  
  private EvalResult(Builder b) {
    this.value = b.value;
    this.jsonValue = b.jsonValue == null ? ConfigValue.ofNull() : b.jsonValue;
    this.ruleID = b.ruleID == null ? "" : b.ruleID;
    this.groupName = b.groupName;
    this.idType = b.idType;
    this.secondaryExposures = b.secondaryExposures == null ? ImmutableList.<SecondaryExposure>of() :
      ImmutableList.copyOf(b.secondaryExposures);
    this.undelegatedSecondaryExposures = b.undelegatedSecondaryExposures == null ? this.secondaryExposures :
      ImmutableList.copyOf(b.undelegatedSecondaryExposures);
    this.configDelegate = b.configDelegate;
    this.explicitParameters = b.explicitParameters == null ? ImmutableSet.<String>of() :
      ImmutableSet.copyOf(b.explicitParameters);
    this.experimentGroup = b.experimentGroup;
    this.experimentActive = b.experimentActive;
    this.samplingRate = b.samplingRate;
    this.forwardAllExposures = b.forwardAllExposures;
    this.hasSeenAnalyticalGates = b.hasSeenAnalyticalGates;
    this.configVersion = b.configVersion;
    this.derivedDeviceMetadata = b.derivedDeviceMetadata == null ? null :
      ImmutableMap.copyOf(b.derivedDeviceMetadata);
    this.evaluationDetails = b.evaluationDetails;
  }
  
  static Builder builder() {
    return new Builder();
  }
  
  Builder toBuilder() {
    Builder b = new Builder();
    b.value = value;
    b.jsonValue = jsonValue;
    b.ruleID = ruleID;
    b.groupName = groupName;
    b.idType = idType;
    b.secondaryExposures = secondaryExposures;
    b.undelegatedSecondaryExposures = undelegatedSecondaryExposures;
    b.configDelegate = configDelegate;
    b.explicitParameters = explicitParameters;
    b.experimentGroup = experimentGroup;
    b.experimentActive = experimentActive;
    b.samplingRate = samplingRate;
    b.forwardAllExposures = forwardAllExposures;
    b.hasSeenAnalyticalGates = hasSeenAnalyticalGates;
    b.configVersion = configVersion;
    b.derivedDeviceMetadata = derivedDeviceMetadata;
    b.evaluationDetails = evaluationDetails;
    return b;
  }
  
  /**
   * Rebuilds a result from a persisted value. The replayed result carries the persisted rule,
   * group, exposures and delegate verbatim.
   */
  static EvalResult fromStickyValues(StickyValues sticky, EvaluationDetails details) {
    return builder()
        .value(sticky.getValue())
        .jsonValue(sticky.getJsonValue())
        .ruleID(sticky.getRuleID())
        .groupName(sticky.getGroupName())
        .secondaryExposures(sticky.getSecondaryExposures())
        .undelegatedSecondaryExposures(sticky.getUndelegatedSecondaryExposures())
        .configDelegate(sticky.getConfigDelegate())
        .explicitParameters(sticky.getExplicitParameters())
        .experimentGroup(true)
        .experimentActive(true)
        .configVersion(sticky.getConfigVersion())
        .evaluationDetails(details)
        .build();
  }
  
  StickyValues toStickyValues(long time) {
    return new StickyValues(value, jsonValue, ruleID, groupName, secondaryExposures,
        undelegatedSecondaryExposures, configDelegate, ImmutableList.copyOf(explicitParameters),
        time, configVersion);
  }
  
  EvalResult withEvaluationDetails(EvaluationDetails details) {
    return toBuilder().evaluationDetails(details).build();
  }
  
  boolean getValue() {
    return value;
  }
  
  ConfigValue getJsonValue() {
    return jsonValue;
  }
  
  String getRuleID() {
    return ruleID;
  }
  
  String getGroupName() {
    return groupName;
  }
  
  String getIdType() {
    return idType;
  }
  
  List<SecondaryExposure> getSecondaryExposures() {
    return secondaryExposures;
  }
  
  List<SecondaryExposure> getUndelegatedSecondaryExposures() {
    return undelegatedSecondaryExposures;
  }
  
  String getConfigDelegate() {
    return configDelegate;
  }
  
  ImmutableSet<String> getExplicitParameters() {
    return explicitParameters;
  }
  
  boolean isExperimentGroup() {
    return experimentGroup;
  }
  
  boolean isExperimentActive() {
    return experimentActive;
  }
  
  Long getSamplingRate() {
    return samplingRate;
  }
  
  boolean isForwardAllExposures() {
    return forwardAllExposures;
  }
  
  boolean hasSeenAnalyticalGates() {
    return hasSeenAnalyticalGates;
  }
  
  Integer getConfigVersion() {
    return configVersion;
  }
  
  Map<String, String> getDerivedDeviceMetadata() {
    return derivedDeviceMetadata;
  }
  
  EvaluationDetails getEvaluationDetails() {
    return evaluationDetails;
  }
  
  static final class Builder {
    private boolean value;
    private ConfigValue jsonValue;
    private String ruleID;
    private String groupName;
    private String idType;
    private List<SecondaryExposure> secondaryExposures;
    private List<SecondaryExposure> undelegatedSecondaryExposures;
    private String configDelegate;
    private Collection<String> explicitParameters;
    private boolean experimentGroup;
    private boolean experimentActive;
    private Long samplingRate;
    private boolean forwardAllExposures;
    private boolean hasSeenAnalyticalGates;
    private Integer configVersion;
    private Map<String, String> derivedDeviceMetadata;
    private EvaluationDetails evaluationDetails;
    
    Builder value(boolean value) {
      this.value = value;
      return this;
    }
    
    Builder jsonValue(ConfigValue jsonValue) {
      this.jsonValue = jsonValue;
      return this;
    }
    
    Builder ruleID(String ruleID) {
      this.ruleID = ruleID;
      return this;
    }
    
    Builder groupName(String groupName) {
      this.groupName = groupName;
      return this;
    }
    
    Builder idType(String idType) {
      this.idType = idType;
      return this;
    }
    
    Builder secondaryExposures(List<SecondaryExposure> secondaryExposures) {
      this.secondaryExposures = secondaryExposures;
      return this;
    }
    
    Builder undelegatedSecondaryExposures(List<SecondaryExposure> undelegatedSecondaryExposures) {
      this.undelegatedSecondaryExposures = undelegatedSecondaryExposures;
      return this;
    }
    
    Builder configDelegate(String configDelegate) {
      this.configDelegate = configDelegate;
      return this;
    }
    
    Builder explicitParameters(Collection<String> explicitParameters) {
      this.explicitParameters = explicitParameters;
      return this;
    }
    
    Builder experimentGroup(boolean experimentGroup) {
      this.experimentGroup = experimentGroup;
      return this;
    }
    
    Builder experimentActive(boolean experimentActive) {
      this.experimentActive = experimentActive;
      return this;
    }
    
    Builder samplingRate(Long samplingRate) {
      this.samplingRate = samplingRate;
      return this;
    }
    
    Builder forwardAllExposures(boolean forwardAllExposures) {
      this.forwardAllExposures = forwardAllExposures;
      return this;
    }
    
    Builder hasSeenAnalyticalGates(boolean hasSeenAnalyticalGates) {
      this.hasSeenAnalyticalGates = hasSeenAnalyticalGates;
      return this;
    }
    
    Builder configVersion(Integer configVersion) {
      this.configVersion = configVersion;
      return this;
    }
    
    Builder derivedDeviceMetadata(Map<String, String> derivedDeviceMetadata) {
      this.derivedDeviceMetadata = derivedDeviceMetadata;
      return this;
    }
    
    Builder evaluationDetails(EvaluationDetails evaluationDetails) {
      this.evaluationDetails = evaluationDetails;
      return this;
    }
    
    EvalResult build() {
      return new EvalResult(this);
    }
  }
}
