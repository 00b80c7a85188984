package com.switchyard.sdk.server;

import com.switchyard.sdk.ArrayBuilder;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.ConfigValueType;
import com.switchyard.sdk.ObjectBuilder;
import com.switchyard.sdk.User;
import com.switchyard.sdk.server.DataModel.ConfigRule;
import com.switchyard.sdk.server.DataModel.ConfigSpec;
import com.switchyard.sdk.server.DataModel.KeyEntities;
import com.switchyard.sdk.server.interfaces.ClientSnapshotOptions;
import com.switchyard.sdk.server.interfaces.SecondaryExposure;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Renders the bulk payload that a client-side SDK uses to bootstrap its evaluations.
 * <p>
 * Entity maps are keyed by hashed name and emitted in sorted order, so that the payload for a given
 * user and spec document is always the same string.
 */
final class ClientSnapshotBuilder {
  static final String GENERATOR = "switchyard-" + Version.SDK_TYPE;

  private static final String ENTITY_SEGMENT = "segment";
  private static final String ENTITY_HOLDOUT = "holdout";
  private static final String ENTITY_EXPERIMENT = "experiment";
  private static final String ENTITY_FEATURE_GATE = "feature_gate";
  private static final String ID_TYPE_STABLE_ID = "stableid";

  private final SpecStore store;
  private final Evaluator evaluator;
  private final ConfigValue sdkMetadata;

  ClientSnapshotBuilder(SpecStore store, Evaluator evaluator, ConfigValue sdkMetadata) {
    this.store = store;
    this.evaluator = evaluator;
    this.sdkMetadata = sdkMetadata;
  }

  ConfigValue build(User user, ClientSnapshotOptions options) {
    if (options == null) {
      options = ClientSnapshotOptions.DEFAULT;
    }
    SpecSnapshot snapshot = store.getSnapshot();
    KeyEntities entities = SpecStore.getEntitiesForKey(snapshot, options.getClientKey());
    String targetAppID = options.getTargetAppID() != null ? options.getTargetAppID() :
      SpecStore.getAppIdForKey(snapshot, options.getClientKey());
    EvalContext ctx = EvalContext.of(user).withSpecs(snapshot).withTargetAppID(targetAppID);
    String algorithm = options.getHashAlgorithm();

    Map<String, ConfigValue> gates = new TreeMap<>();
    for (ConfigSpec spec: snapshot.gates.values()) {
      if (spec.isEntity(ENTITY_SEGMENT) || spec.isEntity(ENTITY_HOLDOUT)) {
        continue;
      }
      if (!isIncluded(spec, entities == null ? null : entities.getGates(), targetAppID, options)) {
        continue;
      }
      EvalResult result = evaluateGate(ctx, spec, options);
      String hashed = Hashing.hashName(algorithm, spec.getName());
      gates.put(hashed, baseEntry(hashed, result).put("value", result.getValue()).build());
    }

    Map<String, ConfigValue> configs = new TreeMap<>();
    for (ConfigSpec spec: snapshot.configs.values()) {
      if (!isIncluded(spec, entities == null ? null : entities.getConfigs(), targetAppID, options)) {
        continue;
      }
      String hashed = Hashing.hashName(algorithm, spec.getName());
      configs.put(hashed, configEntry(ctx, hashed, spec, options));
    }

    Map<String, ConfigValue> layers = new TreeMap<>();
    for (ConfigSpec spec: snapshot.layerConfigs.values()) {
      if (!isIncluded(spec, entities == null ? null : entities.getConfigs(), targetAppID, options)) {
        continue;
      }
      String hashed = Hashing.hashName(algorithm, spec.getName());
      layers.put(hashed, layerEntry(ctx, hashed, spec, options));
    }

    ObjectBuilder evaluatedKeys = ConfigValue.buildObject();
    if (user.getUserID() != null) {
      evaluatedKeys.put("userID", user.getUserID());
    }
    if (!user.getCustomIDs().isEmpty()) {
      ObjectBuilder ids = ConfigValue.buildObject();
      for (Map.Entry<String, String> e: new TreeMap<>(user.getCustomIDs()).entrySet()) {
        ids.put(e.getKey(), e.getValue());
      }
      evaluatedKeys.put("customIDs", ids.build());
    }

    return ConfigValue.buildObject()
        .put("feature_gates", toObject(gates))
        .put("dynamic_configs", toObject(configs))
        .put("layer_configs", toObject(layers))
        .put("sdkParams", ConfigValue.buildObject().build())
        .put("has_updates", true)
        .put("generator", GENERATOR)
        .put("evaluated_keys", evaluatedKeys.build())
        .put("time", snapshot.time)
        .put("hash_used", algorithm)
        .put("user", user.toLoggableValue())
        .put("sdkInfo", sdkMetadata == null ? ConfigValue.ofNull() : sdkMetadata)
        .build();
  }

  private boolean isIncluded(ConfigSpec spec, List<String> allowedNames, String targetAppID,
      ClientSnapshotOptions options) {
    if (allowedNames != null && !allowedNames.contains(spec.getName())) {
      return false;
    }
    if (targetAppID != null && !spec.getTargetAppIDs().contains(targetAppID)) {
      return false;
    }
    Set<String> types = options.getConfigTypesToInclude();
    if (types != null) {
      String entity = spec.getEntity() == null ? "" : spec.getEntity().toLowerCase(Locale.ROOT);
      return types.contains(entity) || (spec.isEntity(ENTITY_FEATURE_GATE) && types.contains("gate"));
    }
    return true;
  }

  private EvalResult evaluateGate(EvalContext ctx, ConfigSpec spec, ClientSnapshotOptions options) {
    return options.isIncludeLocalOverrides() ? evaluator.checkGate(ctx, spec.getName()) :
      evaluator.evaluate(ctx, spec);
  }

  private EvalResult evaluateConfig(EvalContext ctx, ConfigSpec spec, ClientSnapshotOptions options) {
    return options.isIncludeLocalOverrides() ? evaluator.getConfig(ctx, spec.getName()) :
      evaluator.evaluate(ctx, spec);
  }

  private ConfigValue configEntry(EvalContext ctx, String hashed, ConfigSpec spec, ClientSnapshotOptions options) {
    EvalResult result = evaluateConfig(ctx, spec, options);
    ConfigValue value = result.getJsonValue();
    boolean isExperiment = spec.isEntity(ENTITY_EXPERIMENT);
    if (isExperiment && options.isUseControlForUsersNotInExperiment() && spec.isActive()
        && !result.isExperimentGroup()) {
      ConfigRule control = findControlRule(spec);
      if (control != null) {
        value = control.getReturnValue();
      }
    }
    ObjectBuilder b = baseEntry(hashed, result);
    if (isExperiment && spec.hasSharedParams()) {
      value = mergeWithLayerDefaults(ctx.specs, spec.getName(), value);
    }
    b.put("value", objectOrEmpty(value))
        .put("group", result.getRuleID())
        .put("is_device_based", isDeviceBased(spec));
    if (result.getGroupName() != null) {
      b.put("group_name", result.getGroupName());
    }
    if (isExperiment) {
      b.put("is_user_in_experiment", result.isExperimentGroup())
          .put("is_experiment_active", spec.isActive());
      if (spec.hasSharedParams()) {
        b.put("is_in_layer", true)
            .put("explicit_parameters", ConfigValue.arrayOfStrings(spec.getExplicitParameters()));
      }
    }
    return b.build();
  }

  private ConfigValue layerEntry(EvalContext ctx, String hashed, ConfigSpec spec, ClientSnapshotOptions options) {
    EvalResult result = options.isIncludeLocalOverrides() ? evaluator.getLayer(ctx, spec.getName()) :
      evaluator.evaluate(ctx, spec);
    ObjectBuilder b = baseEntry(hashed, result)
        .put("value", objectOrEmpty(result.getJsonValue()))
        .put("group", result.getRuleID())
        .put("is_device_based", isDeviceBased(spec))
        .put("undelegated_secondary_exposures", exposuresValue(result.getUndelegatedSecondaryExposures()));
    if (result.getGroupName() != null) {
      b.put("group_name", result.getGroupName());
    }
    List<String> explicitParameters = spec.getExplicitParameters();
    String delegate = result.getConfigDelegate();
    if (delegate != null && !delegate.isEmpty()) {
      ConfigSpec delegateSpec = ctx.specs.configs.get(delegate);
      if (delegateSpec != null) {
        EvalResult delegateResult = evaluator.evaluate(ctx, delegateSpec);
        b.put("allocated_experiment_name", Hashing.hashName(options.getHashAlgorithm(), delegate))
            .put("is_user_in_experiment", delegateResult.isExperimentGroup())
            .put("is_experiment_active", delegateSpec.isActive());
        if (!delegateSpec.getExplicitParameters().isEmpty()) {
          explicitParameters = delegateSpec.getExplicitParameters();
        }
      }
    }
    b.put("explicit_parameters", ConfigValue.arrayOfStrings(explicitParameters));
    return b.build();
  }

  private ObjectBuilder baseEntry(String hashedName, EvalResult result) {
    return ConfigValue.buildObject()
        .put("name", hashedName)
        .put("rule_id", result.getRuleID())
        .put("secondary_exposures", exposuresValue(result.getSecondaryExposures()));
  }

  private static ConfigValue mergeWithLayerDefaults(SpecSnapshot specs, String experimentName, ConfigValue value) {
    String layerName = specs.experimentToLayer.get(experimentName);
    ConfigSpec layer = layerName == null ? null : specs.layerConfigs.get(layerName);
    if (layer == null) {
      return value;
    }
    ObjectBuilder merged = ConfigValue.buildObject();
    merged.putAll(objectOrEmpty(layer.getDefaultValue()));
    merged.putAll(objectOrEmpty(value));
    return merged.build();
  }

  private static ConfigRule findControlRule(ConfigSpec spec) {
    for (ConfigRule rule: spec.getRules()) {
      if (rule.isControlGroup()) {
        return rule;
      }
    }
    return null;
  }

  private static boolean isDeviceBased(ConfigSpec spec) {
    return spec.getIdType() != null && spec.getIdType().toLowerCase(Locale.ROOT).equals(ID_TYPE_STABLE_ID);
  }

  // Duplicates are dropped; the first occurrence keeps its position.
  private static ConfigValue exposuresValue(List<SecondaryExposure> exposures) {
    ArrayBuilder b = ConfigValue.buildArray();
    if (exposures != null) {
      for (SecondaryExposure e: new LinkedHashSet<>(exposures)) {
        b.add(e.toValue());
      }
    }
    return b.build();
  }

  private static ConfigValue objectOrEmpty(ConfigValue v) {
    return v != null && v.getType() == ConfigValueType.OBJECT ? v :
      ConfigValue.buildObject().build();
  }

  private static ConfigValue toObject(Map<String, ConfigValue> map) {
    ObjectBuilder b = ConfigValue.buildObject();
    for (Map.Entry<String, ConfigValue> e: map.entrySet()) {
      b.put(e.getKey(), e.getValue());
    }
    return b.build();
  }
}
