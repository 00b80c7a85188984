package com.switchyard.sdk.server;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.server.DataModelPreprocessing.ConditionPreprocessed;

import java.util.List;
import java.util.Map;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;

// IMPLEMENTATION NOTES:
//
// - All classes here are package-private. Applications never see specs directly, so we are free to change
// their details.
//
// - Classes deserialized reflectively by Gson have an empty constructor and non-final fields. Each also has a
// constructor taking all the fields, which tests use to build specs programmatically.
//
// - Collection getters turn null into an empty collection; a spec document may legitimately omit or null any
// list or map.
//
// - The "preprocessed" field of Condition must stay transient. It is filled in by afterDeserialized() (or by the
// constructor) so that the evaluator does not re-parse regexes or re-lowercase target lists per evaluation.

/**
 * Contains the internal data model for config specs, as they appear in a spec document.
 */
abstract class DataModel {
  private DataModel() {}
  
  static final String ENTITY_FEATURE_GATE = "feature_gate";
  static final String ENTITY_DYNAMIC_CONFIG = "dynamic_config";
  static final String ENTITY_EXPERIMENT = "experiment";
  static final String ENTITY_AUTOTUNE = "autotune";
  static final String ENTITY_LAYER = "layer";
  static final String ENTITY_SEGMENT = "segment";
  static final String ENTITY_HOLDOUT = "holdout";
  
  static final String TYPE_FEATURE_GATE = "feature_gate";
  static final String TYPE_DYNAMIC_CONFIG = "dynamic_config";
  
  /**
   * The top-level spec document, as downloaded or bootstrapped.
   */
  static final class SpecsResponse {
    @SerializedName("feature_gates") private List<ConfigSpec> featureGates;
    @SerializedName("dynamic_configs") private List<ConfigSpec> dynamicConfigs;
    @SerializedName("layer_configs") private List<ConfigSpec> layerConfigs;
    private Map<String, List<String>> layers;
    @SerializedName("id_lists") private Map<String, Boolean> idLists;
    @SerializedName("cmab_configs") private Map<String, CMABSpec> cmabConfigs;
    @SerializedName("sdk_configs") private Map<String, ConfigValue> sdkConfigs;
    @SerializedName("sdk_flags") private Map<String, Boolean> sdkFlags;
    @SerializedName("sdk_keys_to_app_ids") private Map<String, String> sdkKeysToAppIds;
    @SerializedName("hashed_sdk_keys_to_app_ids") private Map<String, String> hashedSdkKeysToAppIds;
    @SerializedName("hashed_sdk_keys_to_entities") private Map<String, KeyEntities> hashedSdkKeysToEntities;
    @SerializedName("hashed_sdk_key_used") private String hashedSdkKeyUsed;
    @SerializedName("session_replay_info") private ConfigValue sessionReplayInfo;
    private Map<String, Integer> diagnostics;
    @SerializedName("has_updates") private boolean hasUpdates;
    private long time;
    
    SpecsResponse() {}
    
    SpecsResponse(List<ConfigSpec> featureGates, List<ConfigSpec> dynamicConfigs, List<ConfigSpec> layerConfigs,
        Map<String, List<String>> layers, Map<String, CMABSpec> cmabConfigs, Map<String, ConfigValue> sdkConfigs,
        boolean hasUpdates, long time) {
      this.featureGates = featureGates;
      this.dynamicConfigs = dynamicConfigs;
      this.layerConfigs = layerConfigs;
      this.layers = layers;
      this.cmabConfigs = cmabConfigs;
      this.sdkConfigs = sdkConfigs;
      this.hasUpdates = hasUpdates;
      this.time = time;
    }
    
    List<ConfigSpec> getFeatureGates() {
      return featureGates == null ? emptyList() : featureGates;
    }
    
    List<ConfigSpec> getDynamicConfigs() {
      return dynamicConfigs == null ? emptyList() : dynamicConfigs;
    }
    
    List<ConfigSpec> getLayerConfigs() {
      return layerConfigs == null ? emptyList() : layerConfigs;
    }
    
    Map<String, List<String>> getLayers() {
      return layers == null ? emptyMap() : layers;
    }
    
    Map<String, Boolean> getIdLists() {
      return idLists == null ? emptyMap() : idLists;
    }
    
    Map<String, CMABSpec> getCmabConfigs() {
      return cmabConfigs == null ? emptyMap() : cmabConfigs;
    }
    
    Map<String, ConfigValue> getSdkConfigs() {
      return sdkConfigs == null ? emptyMap() : sdkConfigs;
    }
    
    Map<String, Boolean> getSdkFlags() {
      return sdkFlags == null ? emptyMap() : sdkFlags;
    }
    
    Map<String, String> getSdkKeysToAppIds() {
      return sdkKeysToAppIds == null ? emptyMap() : sdkKeysToAppIds;
    }
    
    Map<String, String> getHashedSdkKeysToAppIds() {
      return hashedSdkKeysToAppIds == null ? emptyMap() : hashedSdkKeysToAppIds;
    }
    
    Map<String, KeyEntities> getHashedSdkKeysToEntities() {
      return hashedSdkKeysToEntities == null ? emptyMap() : hashedSdkKeysToEntities;
    }
    
    String getHashedSdkKeyUsed() {
      return hashedSdkKeyUsed;
    }
    
    ConfigValue getSessionReplayInfo() {
      return ConfigValue.normalize(sessionReplayInfo);
    }
    
    Map<String, Integer> getDiagnostics() {
      return diagnostics == null ? emptyMap() : diagnostics;
    }
    
    boolean isHasUpdates() {
      return hasUpdates;
    }
    
    long getTime() {
      return time;
    }
  }
  
  /**
   * A gate, dynamic config, experiment, autotune, layer, segment or holdout.
   */
  static final class ConfigSpec {
    private String name;
    private String type;
    private String entity;
    private String salt;
    private boolean enabled;
    private List<ConfigRule> rules;
    private ConfigValue defaultValue;
    private String idType;
    private List<String> explicitParameters;
    private Boolean isActive;
    private Boolean hasSharedParams;
    private List<String> targetAppIDs;
    private Integer version;
    private Boolean forwardAllExposures;
    
    ConfigSpec() {}
    
    ConfigSpec(String name, String type, String entity, String salt, boolean enabled, List<ConfigRule> rules,
        ConfigValue defaultValue, String idType, List<String> explicitParameters, Boolean isActive,
        Boolean hasSharedParams, List<String> targetAppIDs, Integer version, Boolean forwardAllExposures) {
      this.name = name;
      this.type = type;
      this.entity = entity;
      this.salt = salt;
      this.enabled = enabled;
      this.rules = rules;
      this.defaultValue = defaultValue;
      this.idType = idType;
      this.explicitParameters = explicitParameters;
      this.isActive = isActive;
      this.hasSharedParams = hasSharedParams;
      this.targetAppIDs = targetAppIDs;
      this.version = version;
      this.forwardAllExposures = forwardAllExposures;
    }
    
    String getName() {
      return name;
    }
    
    String getType() {
      return type;
    }
    
    String getEntity() {
      return entity == null ? "" : entity;
    }
    
    String getSalt() {
      return salt == null ? "" : salt;
    }
    
    boolean isEnabled() {
      return enabled;
    }
    
    List<ConfigRule> getRules() {
      return rules == null ? emptyList() : rules;
    }
    
    ConfigValue getDefaultValue() {
      return ConfigValue.normalize(defaultValue);
    }
    
    String getIdType() {
      return idType;
    }
    
    List<String> getExplicitParameters() {
      return explicitParameters == null ? emptyList() : explicitParameters;
    }
    
    boolean isActive() {
      return isActive != null && isActive;
    }
    
    boolean hasSharedParams() {
      return hasSharedParams != null && hasSharedParams;
    }
    
    List<String> getTargetAppIDs() {
      return targetAppIDs == null ? emptyList() : targetAppIDs;
    }
    
    Integer getVersion() {
      return version;
    }
    
    boolean isForwardAllExposures() {
      return forwardAllExposures != null && forwardAllExposures;
    }
    
    boolean isDynamicConfigType() {
      return TYPE_DYNAMIC_CONFIG.equalsIgnoreCase(type);
    }
    
    boolean isEntity(String kind) {
      return kind.equalsIgnoreCase(getEntity());
    }
  }
  
  static final class ConfigRule {
    private String name;
    private String id;
    private String groupName;
    private String salt;
    private double passPercentage;
    private List<Condition> conditions;
    private ConfigValue returnValue;
    private String idType;
    private String configDelegate;
    private Boolean isExperimentGroup;
    private Long samplingRate;
    private Boolean isControlGroup;
    
    ConfigRule() {}
    
    ConfigRule(String name, String id, String groupName, String salt, double passPercentage,
        List<Condition> conditions, ConfigValue returnValue, String idType, String configDelegate,
        Boolean isExperimentGroup, Long samplingRate, Boolean isControlGroup) {
      this.name = name;
      this.id = id;
      this.groupName = groupName;
      this.salt = salt;
      this.passPercentage = passPercentage;
      this.conditions = conditions;
      this.returnValue = returnValue;
      this.idType = idType;
      this.configDelegate = configDelegate;
      this.isExperimentGroup = isExperimentGroup;
      this.samplingRate = samplingRate;
      this.isControlGroup = isControlGroup;
    }
    
    String getName() {
      return name;
    }
    
    String getId() {
      return id == null ? "" : id;
    }
    
    String getGroupName() {
      return groupName;
    }
    
    String getSalt() {
      return salt;
    }
    
    double getPassPercentage() {
      return passPercentage;
    }
    
    List<Condition> getConditions() {
      return conditions == null ? emptyList() : conditions;
    }
    
    ConfigValue getReturnValue() {
      return ConfigValue.normalize(returnValue);
    }
    
    String getIdType() {
      return idType;
    }
    
    String getConfigDelegate() {
      return configDelegate;
    }
    
    boolean isExperimentGroup() {
      return isExperimentGroup != null && isExperimentGroup;
    }
    
    Long getSamplingRate() {
      return samplingRate;
    }
    
    boolean isControlGroup() {
      return isControlGroup != null && isControlGroup;
    }
  }
  
  @JsonAdapter(JsonHelpers.PostProcessingDeserializableTypeAdapterFactory.class)
  static final class Condition implements JsonHelpers.PostProcessingDeserializable {
    private String type;
    private String operator;
    private String field;
    private ConfigValue targetValue;
    private Map<String, ConfigValue> additionalValues;
    private String idType;
    
    transient ConditionPreprocessed preprocessed;
    
    Condition() {}
    
    Condition(String type, String operator, String field, ConfigValue targetValue,
        Map<String, ConfigValue> additionalValues, String idType) {
      this.type = type;
      this.operator = operator;
      this.field = field;
      this.targetValue = targetValue;
      this.additionalValues = additionalValues;
      this.idType = idType;
      afterDeserialized();
    }
    
    String getType() {
      return type == null ? "" : type;
    }
    
    String getOperator() {
      return operator == null ? "" : operator;
    }
    
    String getField() {
      return field;
    }
    
    ConfigValue getTargetValue() {
      return ConfigValue.normalize(targetValue);
    }
    
    Map<String, ConfigValue> getAdditionalValues() {
      return additionalValues == null ? emptyMap() : additionalValues;
    }
    
    String getIdType() {
      return idType;
    }
    
    @Override
    public void afterDeserialized() {
      preprocessed = DataModelPreprocessing.preprocessCondition(this);
    }
  }
  
  /**
   * A contextual multi-armed bandit.
   */
  static final class CMABSpec {
    private String name;
    private String salt;
    private boolean enabled;
    private String targetingGateName;
    private ConfigValue defaultValue;
    private String idType;
    private Integer version;
    private List<CMABGroup> groups;
    private Boolean higherIsBetter;
    private Map<String, CMABGroupConfig> config;
    
    CMABSpec() {}
    
    CMABSpec(String name, String salt, boolean enabled, String targetingGateName, ConfigValue defaultValue,
        String idType, List<CMABGroup> groups, Boolean higherIsBetter, Map<String, CMABGroupConfig> config) {
      this.name = name;
      this.salt = salt;
      this.enabled = enabled;
      this.targetingGateName = targetingGateName;
      this.defaultValue = defaultValue;
      this.idType = idType;
      this.groups = groups;
      this.higherIsBetter = higherIsBetter;
      this.config = config;
    }
    
    String getName() {
      return name;
    }
    
    String getSalt() {
      return salt == null ? "" : salt;
    }
    
    boolean isEnabled() {
      return enabled;
    }
    
    String getTargetingGateName() {
      return targetingGateName;
    }
    
    ConfigValue getDefaultValue() {
      return ConfigValue.normalize(defaultValue);
    }
    
    String getIdType() {
      return idType;
    }
    
    Integer getVersion() {
      return version;
    }
    
    List<CMABGroup> getGroups() {
      return groups == null ? emptyList() : groups;
    }
    
    boolean isHigherBetter() {
      return higherIsBetter == null || higherIsBetter;
    }
    
    Map<String, CMABGroupConfig> getConfig() {
      return config == null ? emptyMap() : config;
    }
  }
  
  static final class CMABGroup {
    private String id;
    private String name;
    private ConfigValue parameterValues;
    
    CMABGroup() {}
    
    CMABGroup(String id, String name, ConfigValue parameterValues) {
      this.id = id;
      this.name = name;
      this.parameterValues = parameterValues;
    }
    
    String getId() {
      return id;
    }
    
    String getName() {
      return name;
    }
    
    ConfigValue getParameterValues() {
      return ConfigValue.normalize(parameterValues);
    }
  }
  
  /**
   * The linear scoring model for one arm.
   */
  static final class CMABGroupConfig {
    private double intercept;
    private Map<String, Double> weightsNumerical;
    private Map<String, Map<String, Double>> weightsCategorical;
    
    CMABGroupConfig() {}
    
    CMABGroupConfig(double intercept, Map<String, Double> weightsNumerical,
        Map<String, Map<String, Double>> weightsCategorical) {
      this.intercept = intercept;
      this.weightsNumerical = weightsNumerical;
      this.weightsCategorical = weightsCategorical;
    }
    
    double getIntercept() {
      return intercept;
    }
    
    Map<String, Double> getWeightsNumerical() {
      return weightsNumerical == null ? emptyMap() : weightsNumerical;
    }
    
    Map<String, Map<String, Double>> getWeightsCategorical() {
      return weightsCategorical == null ? emptyMap() : weightsCategorical;
    }
  }
  
  /**
   * The gates and configs visible to one client key.
   */
  static final class KeyEntities {
    private List<String> gates;
    private List<String> configs;
    
    KeyEntities() {}
    
    KeyEntities(List<String> gates, List<String> configs) {
      this.gates = gates;
      this.configs = configs;
    }
    
    List<String> getGates() {
      return gates == null ? emptyList() : gates;
    }
    
    List<String> getConfigs() {
      return configs == null ? emptyList() : configs;
    }
  }
  
  /**
   * One entry of the id list manifest.
   */
  static final class IdListManifestEntry {
    private String name;
    private long size;
    private long creationTime;
    private String url;
    private String fileID;
    
    IdListManifestEntry() {}
    
    IdListManifestEntry(String name, long size, long creationTime, String url, String fileID) {
      this.name = name;
      this.size = size;
      this.creationTime = creationTime;
      this.url = url;
      this.fileID = fileID;
    }
    
    String getName() {
      return name;
    }
    
    long getSize() {
      return size;
    }
    
    long getCreationTime() {
      return creationTime;
    }
    
    String getUrl() {
      return url;
    }
    
    String getFileID() {
      return fileID;
    }
  }
}
