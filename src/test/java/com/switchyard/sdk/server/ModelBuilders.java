package com.switchyard.sdk.server;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.server.DataModel.CMABSpec;
import com.switchyard.sdk.server.DataModel.Condition;
import com.switchyard.sdk.server.DataModel.ConfigRule;
import com.switchyard.sdk.server.DataModel.ConfigSpec;
import com.switchyard.sdk.server.DataModel.IdListManifestEntry;
import com.switchyard.sdk.server.DataModel.KeyEntities;
import com.switchyard.sdk.server.DataModel.SpecsResponse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Arrays.asList;

@SuppressWarnings("javadoc")
public abstract class ModelBuilders {
  public static SpecBuilder gateBuilder(String name) {
    return new SpecBuilder(name, DataModel.TYPE_FEATURE_GATE, DataModel.ENTITY_FEATURE_GATE);
  }

  public static SpecBuilder configBuilder(String name) {
    return new SpecBuilder(name, DataModel.TYPE_DYNAMIC_CONFIG, DataModel.ENTITY_DYNAMIC_CONFIG);
  }

  public static SpecBuilder experimentBuilder(String name) {
    return new SpecBuilder(name, DataModel.TYPE_DYNAMIC_CONFIG, DataModel.ENTITY_EXPERIMENT).active(true);
  }

  public static SpecBuilder layerBuilder(String name) {
    return new SpecBuilder(name, DataModel.TYPE_DYNAMIC_CONFIG, DataModel.ENTITY_LAYER);
  }

  public static RuleBuilder ruleBuilder(String id) {
    return new RuleBuilder(id);
  }

  public static SpecsBuilder specsBuilder(long time) {
    return new SpecsBuilder(time);
  }

  /**
   * A gate that passes for everyone.
   */
  public static ConfigSpec alwaysOnGate(String name) {
    return gateBuilder(name).rules(ruleBuilder("rule-on").conditions(publicCondition()).build()).build();
  }

  public static Condition publicCondition() {
    return new Condition("public", null, null, null, null, null);
  }

  public static Condition passGate(String gateName) {
    return new Condition("pass_gate", null, null, ConfigValue.of(gateName), null, null);
  }

  public static Condition failGate(String gateName) {
    return new Condition("fail_gate", null, null, ConfigValue.of(gateName), null, null);
  }

  public static Condition userField(String field, String operator, ConfigValue target) {
    return new Condition("user_field", operator, field, target, null, null);
  }

  public static Condition condition(String type, String operator, String field, ConfigValue target) {
    return new Condition(type, operator, field, target, null, null);
  }

  public static Condition conditionWithIdType(String type, String operator, ConfigValue target, String idType) {
    return new Condition(type, operator, null, target, null, idType);
  }

  public static Condition userBucket(String salt, String operator, ConfigValue target) {
    Map<String, ConfigValue> additional = new HashMap<>();
    additional.put("salt", ConfigValue.of(salt));
    return new Condition("user_bucket", operator, null, target, additional, null);
  }

  public static ConfigValue stringArray(String... values) {
    return ConfigValue.arrayOfStrings(asList(values));
  }

  public static class SpecBuilder {
    private final String name;
    private String type;
    private String entity;
    private String salt;
    private boolean enabled = true;
    private List<ConfigRule> rules = new ArrayList<>();
    private ConfigValue defaultValue;
    private String idType = "userID";
    private List<String> explicitParameters;
    private Boolean isActive;
    private Boolean hasSharedParams;
    private List<String> targetAppIDs;
    private Integer version;
    private Boolean forwardAllExposures;

    private SpecBuilder(String name, String type, String entity) {
      this.name = name;
      this.type = type;
      this.entity = entity;
      this.salt = name + "-salt";
    }

    public ConfigSpec build() {
      return new ConfigSpec(name, type, entity, salt, enabled, rules, defaultValue, idType, explicitParameters,
          isActive, hasSharedParams, targetAppIDs, version, forwardAllExposures);
    }

    public SpecBuilder entity(String entity) {
      this.entity = entity;
      return this;
    }

    public SpecBuilder salt(String salt) {
      this.salt = salt;
      return this;
    }

    public SpecBuilder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public SpecBuilder rules(ConfigRule... rules) {
      this.rules = new ArrayList<>(Arrays.asList(rules));
      return this;
    }

    public SpecBuilder defaultValue(ConfigValue defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public SpecBuilder idType(String idType) {
      this.idType = idType;
      return this;
    }

    public SpecBuilder explicitParameters(String... names) {
      this.explicitParameters = asList(names);
      return this;
    }

    public SpecBuilder active(boolean isActive) {
      this.isActive = isActive;
      return this;
    }

    public SpecBuilder hasSharedParams(boolean hasSharedParams) {
      this.hasSharedParams = hasSharedParams;
      return this;
    }

    public SpecBuilder targetAppIDs(String... ids) {
      this.targetAppIDs = asList(ids);
      return this;
    }

    public SpecBuilder version(int version) {
      this.version = version;
      return this;
    }

    public SpecBuilder forwardAllExposures(boolean forwardAllExposures) {
      this.forwardAllExposures = forwardAllExposures;
      return this;
    }
  }

  public static class RuleBuilder {
    private final String id;
    private String name;
    private String groupName;
    private String salt;
    private double passPercentage = 100;
    private List<Condition> conditions = new ArrayList<>();
    private ConfigValue returnValue;
    private String idType = "userID";
    private String configDelegate;
    private Boolean isExperimentGroup;
    private Long samplingRate;
    private Boolean isControlGroup;

    private RuleBuilder(String id) {
      this.id = id;
      this.name = id;
      this.salt = id;
    }

    public ConfigRule build() {
      return new ConfigRule(name, id, groupName, salt, passPercentage, conditions, returnValue, idType,
          configDelegate, isExperimentGroup, samplingRate, isControlGroup);
    }

    public RuleBuilder groupName(String groupName) {
      this.groupName = groupName;
      return this;
    }

    public RuleBuilder salt(String salt) {
      this.salt = salt;
      return this;
    }

    public RuleBuilder passPercentage(double passPercentage) {
      this.passPercentage = passPercentage;
      return this;
    }

    public RuleBuilder conditions(Condition... conditions) {
      this.conditions = new ArrayList<>(Arrays.asList(conditions));
      return this;
    }

    public RuleBuilder returnValue(ConfigValue returnValue) {
      this.returnValue = returnValue;
      return this;
    }

    public RuleBuilder idType(String idType) {
      this.idType = idType;
      return this;
    }

    public RuleBuilder configDelegate(String configDelegate) {
      this.configDelegate = configDelegate;
      return this;
    }

    public RuleBuilder experimentGroup(boolean isExperimentGroup) {
      this.isExperimentGroup = isExperimentGroup;
      return this;
    }

    public RuleBuilder samplingRate(long samplingRate) {
      this.samplingRate = samplingRate;
      return this;
    }

    public RuleBuilder controlGroup(boolean isControlGroup) {
      this.isControlGroup = isControlGroup;
      return this;
    }
  }

  /**
   * Builds a spec document through its JSON form, so that every section of the document can be set
   * the same way the SDK would receive it.
   */
  public static class SpecsBuilder {
    private final long time;
    private final List<ConfigSpec> gates = new ArrayList<>();
    private final List<ConfigSpec> configs = new ArrayList<>();
    private final List<ConfigSpec> layerConfigs = new ArrayList<>();
    private final Map<String, List<String>> layers = new LinkedHashMap<>();
    private final Map<String, CMABSpec> cmabs = new LinkedHashMap<>();
    private final Map<String, ConfigValue> sdkConfigs = new LinkedHashMap<>();
    private final Map<String, String> sdkKeysToAppIds = new LinkedHashMap<>();
    private final Map<String, String> hashedSdkKeysToAppIds = new LinkedHashMap<>();
    private final Map<String, KeyEntities> hashedSdkKeysToEntities = new LinkedHashMap<>();
    private final Map<String, Integer> diagnostics = new LinkedHashMap<>();
    private boolean hasUpdates = true;
    private String hashedSdkKeyUsed;
    private ConfigValue sessionReplayInfo;

    private SpecsBuilder(long time) {
      this.time = time;
    }

    public SpecsBuilder gates(ConfigSpec... specs) {
      gates.addAll(asList(specs));
      return this;
    }

    public SpecsBuilder configs(ConfigSpec... specs) {
      configs.addAll(asList(specs));
      return this;
    }

    public SpecsBuilder layerConfigs(ConfigSpec... specs) {
      layerConfigs.addAll(asList(specs));
      return this;
    }

    public SpecsBuilder layer(String layerName, String... experiments) {
      layers.put(layerName, asList(experiments));
      return this;
    }

    public SpecsBuilder cmab(CMABSpec cmab) {
      cmabs.put(cmab.getName(), cmab);
      return this;
    }

    public SpecsBuilder sdkConfig(String key, ConfigValue value) {
      sdkConfigs.put(key, value);
      return this;
    }

    public SpecsBuilder sdkKeyToAppId(String clientKey, String appId) {
      sdkKeysToAppIds.put(clientKey, appId);
      return this;
    }

    public SpecsBuilder hashedSdkKeyToAppId(String clientKey, String appId) {
      hashedSdkKeysToAppIds.put(Hashing.djb2(clientKey), appId);
      return this;
    }

    public SpecsBuilder keyEntities(String clientKey, List<String> gateNames, List<String> configNames) {
      hashedSdkKeysToEntities.put(Hashing.djb2(clientKey), new KeyEntities(gateNames, configNames));
      return this;
    }

    public SpecsBuilder diagnostics(String context, int rate) {
      diagnostics.put(context, rate);
      return this;
    }

    public SpecsBuilder hasUpdates(boolean hasUpdates) {
      this.hasUpdates = hasUpdates;
      return this;
    }

    public SpecsBuilder hashedSdkKeyUsed(String hashedSdkKeyUsed) {
      this.hashedSdkKeyUsed = hashedSdkKeyUsed;
      return this;
    }

    public SpecsBuilder sessionReplayInfo(ConfigValue sessionReplayInfo) {
      this.sessionReplayInfo = sessionReplayInfo;
      return this;
    }

    public String json() {
      JsonObject o = new JsonObject();
      o.add("feature_gates", tree(gates));
      o.add("dynamic_configs", tree(configs));
      o.add("layer_configs", tree(layerConfigs));
      o.add("layers", tree(layers));
      o.add("cmab_configs", tree(cmabs));
      o.add("sdk_configs", JsonHelpers.gsonInstance().toJsonTree(sdkConfigs,
          new TypeToken<Map<String, ConfigValue>>() {}.getType()));
      o.add("sdk_keys_to_app_ids", tree(sdkKeysToAppIds));
      o.add("hashed_sdk_keys_to_app_ids", tree(hashedSdkKeysToAppIds));
      o.add("hashed_sdk_keys_to_entities", tree(hashedSdkKeysToEntities));
      o.add("diagnostics", tree(diagnostics));
      if (hashedSdkKeyUsed != null) {
        o.addProperty("hashed_sdk_key_used", hashedSdkKeyUsed);
      }
      if (sessionReplayInfo != null) {
        o.add("session_replay_info", JsonHelpers.gsonInstance().toJsonTree(sessionReplayInfo, ConfigValue.class));
      }
      o.addProperty("has_updates", hasUpdates);
      o.addProperty("time", time);
      return JsonHelpers.gsonInstance().toJson(o);
    }

    public SpecsResponse build() {
      return JsonHelpers.deserialize(json(), SpecsResponse.class);
    }

    private static JsonElement tree(Object o) {
      return JsonHelpers.gsonInstance().toJsonTree(o);
    }
  }

  public static IdListManifestEntry manifestEntry(String name, long size, long creationTime, String url,
      String fileID) {
    return new IdListManifestEntry(name, size, creationTime, url, fileID);
  }
}
