package com.switchyard.sdk.server;

import com.launchdarkly.logging.LDLogger;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.ConfigValueType;
import com.switchyard.sdk.User;
import com.switchyard.sdk.server.DataModel.CMABGroup;
import com.switchyard.sdk.server.DataModel.CMABGroupConfig;
import com.switchyard.sdk.server.DataModel.CMABSpec;
import com.switchyard.sdk.server.DataModel.Condition;
import com.switchyard.sdk.server.DataModel.ConfigRule;
import com.switchyard.sdk.server.DataModel.ConfigSpec;
import com.switchyard.sdk.server.interfaces.EvaluationDetails;
import com.switchyard.sdk.server.interfaces.EvaluationDetails.Reason;
import com.switchyard.sdk.server.interfaces.SecondaryExposure;
import com.switchyard.sdk.server.interfaces.StickyValues;
import com.switchyard.sdk.server.subsystems.CountryLookup;
import com.switchyard.sdk.server.subsystems.UserAgentParser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.switchyard.sdk.server.EvaluatorHelpers.getFromEnvironment;
import static com.switchyard.sdk.server.EvaluatorHelpers.getFromUser;
import static com.switchyard.sdk.server.EvaluatorHelpers.getUnitID;
import static com.switchyard.sdk.server.EvaluatorHelpers.isEmpty;
import static com.switchyard.sdk.server.EvaluatorHelpers.normalizeUserAgentField;

/**
 * Encapsulates the rule evaluation logic. The Evaluator reads specs and id lists from the
 * {@link SpecStore} and never modifies it; it performs no I/O, so an evaluation is always local and
 * non-blocking. Each evaluation reads a single {@link SpecSnapshot}, taken when it starts.
 */
class Evaluator {
  //
  // IMPLEMENTATION NOTES ABOUT THIS FILE
  //
  // 1. Every condition of a rule is evaluated, even after one has failed, so that the secondary exposures
  // of all nested gates are collected the same way in every SDK.
  //
  // 2. State that must be tracked across the whole evaluation (the nesting depth guard, device metadata
  // derived from the user agent, whether an unsupported condition was seen) lives in the mutable
  // EvaluatorState object rather than in the result objects.
  //
  // 3. A nested reference that would exceed MAX_DEPTH does not throw; the condition simply does not match.
  // This is what stops cyclic specs (a gate that passes on itself) from recursing forever.
  //

  static final int MAX_DEPTH = 20;
  static final String RULE_ID_DEFAULT = "default";
  static final String RULE_ID_DISABLED = "disabled";
  static final String CMAB_EXPLORE_SUFFIX = ":explore";

  private final SpecStore store;
  private final LocalOverrides overrides;
  private final UserAgentParser userAgentParser;
  private final CountryLookup countryLookup;
  private final LDLogger logger;

  /**
   * This object holds mutable state that Evaluator may need during an evaluation.
   */
  private static class EvaluatorState {
    private boolean unsupported = false;
    private boolean depthExceeded = false;
    private boolean hasSeenAnalyticalGates = false;
    private Map<String, String> deviceMetadata = null;
  }

  Evaluator(SpecStore store, LocalOverrides overrides, UserAgentParser userAgentParser,
      CountryLookup countryLookup, LDLogger logger) {
    this.store = store;
    this.overrides = overrides;
    this.userAgentParser = userAgentParser == null ? UserAgentParser.NONE : userAgentParser;
    this.countryLookup = countryLookup == null ? CountryLookup.NONE : countryLookup;
    this.logger = logger;
  }

  /**
   * Evaluates a feature gate, applying local overrides first.
   */
  EvalResult checkGate(EvalContext context, String gateName) {
    EvalContext ctx = pinned(context);
    LocalOverrides.Match<Boolean> override = overrides.getGate(gateName, ctx.user);
    if (override != null) {
      return EvalResult.builder()
          .value(override.value)
          .ruleID(override.ruleID)
          .evaluationDetails(store.createEvaluationDetails(ctx.specs, Reason.LOCAL_OVERRIDE))
          .build();
    }
    ConfigSpec gate = ctx.specs.gates.get(gateName);
    if (gate == null) {
      return unrecognized(ctx);
    }
    return evaluateTopLevel(ctx, gate);
  }

  /**
   * Evaluates a dynamic config, applying local overrides first. Experiments are evaluated through
   * {@link #getExperiment(EvalContext, String)} so that persisted values can be replayed.
   */
  EvalResult getConfig(EvalContext context, String configName) {
    EvalContext ctx = pinned(context);
    LocalOverrides.Match<ConfigValue> override = overrides.getConfig(configName, ctx.user);
    if (override != null) {
      return EvalResult.builder()
          .value(true)
          .jsonValue(override.value)
          .ruleID(override.ruleID)
          .evaluationDetails(store.createEvaluationDetails(ctx.specs, Reason.LOCAL_OVERRIDE))
          .build();
    }
    ConfigSpec config = ctx.specs.configs.get(configName);
    if (config == null) {
      return unrecognized(ctx);
    }
    return evaluateTopLevel(ctx, config);
  }

  /**
   * Evaluates an experiment. If the context carries persisted values, the experiment is active and a
   * value was persisted for it, that value is replayed instead of evaluating the rules.
   */
  EvalResult getExperiment(EvalContext context, String experimentName) {
    EvalContext ctx = pinned(context);
    if (ctx.persistedValues != null && overrides.getConfig(experimentName, ctx.user) == null) {
      ConfigSpec config = ctx.specs.configs.get(experimentName);
      StickyValues sticky = ctx.persistedValues.get(experimentName);
      if (config != null && config.isActive() && sticky != null) {
        return EvalResult.fromStickyValues(sticky, store.createEvaluationDetails(ctx.specs, Reason.PERSISTED))
            .toBuilder()
            .idType(config.getIdType())
            .forwardAllExposures(config.isForwardAllExposures())
            .build();
      }
    }
    return getConfig(ctx, experimentName);
  }

  /**
   * Evaluates a layer. A persisted value is replayed only while the experiment it was allocated to is
   * still active.
   */
  EvalResult getLayer(EvalContext context, String layerName) {
    EvalContext ctx = pinned(context);
    LocalOverrides.Match<ConfigValue> override = overrides.getLayer(layerName, ctx.user);
    if (override != null) {
      return EvalResult.builder()
          .value(true)
          .jsonValue(override.value)
          .ruleID(override.ruleID)
          .evaluationDetails(store.createEvaluationDetails(ctx.specs, Reason.LOCAL_OVERRIDE))
          .build();
    }
    ConfigSpec layer = ctx.specs.layerConfigs.get(layerName);
    if (layer == null) {
      return unrecognized(ctx);
    }
    if (ctx.persistedValues != null) {
      StickyValues sticky = ctx.persistedValues.get(layerName);
      if (sticky != null && sticky.getConfigDelegate() != null) {
        ConfigSpec delegate = ctx.specs.configs.get(sticky.getConfigDelegate());
        if (delegate != null && delegate.isActive()) {
          return EvalResult.fromStickyValues(sticky, store.createEvaluationDetails(ctx.specs, Reason.PERSISTED))
              .toBuilder()
              .idType(layer.getIdType())
              .build();
        }
      }
    }
    return evaluateTopLevel(ctx, layer);
  }

  /**
   * Assigns a user to one arm of a contextual multi-armed bandit. The winning arm's id is the rule id;
   * an arm chosen by hashing because no scoring model is available has {@link #CMAB_EXPLORE_SUFFIX}
   * appended.
   */
  EvalResult getCMAB(EvalContext context, String cmabName) {
    EvalContext ctx = pinned(context);
    CMABSpec cmab = ctx.specs.cmabs.get(cmabName);
    if (cmab == null) {
      return unrecognized(ctx);
    }
    EvaluationDetails details = store.createEvaluationDetails(ctx.specs, Reason.NONE);
    EvalResult.Builder result = EvalResult.builder()
        .jsonValue(cmab.getDefaultValue())
        .idType(cmab.getIdType())
        .configVersion(cmab.getVersion())
        .evaluationDetails(details);
    if (!cmab.isEnabled()) {
      return result.ruleID(RULE_ID_DISABLED).build();
    }
    List<CMABGroup> groups = cmab.getGroups();
    if (groups.isEmpty()) {
      return result.ruleID(RULE_ID_DEFAULT).build();
    }
    String targetingGate = cmab.getTargetingGateName();
    if (targetingGate != null && !targetingGate.isEmpty()) {
      EvaluatorState state = new EvaluatorState();
      List<SecondaryExposure> exposures = new ArrayList<>();
      Boolean targeted = evaluateNestedGate(ctx, targetingGate, exposures, state, 0);
      result.secondaryExposures(exposures);
      if (targeted == null || !targeted) {
        return result.ruleID(RULE_ID_DEFAULT).build();
      }
    }
    String unitID = getUnitID(ctx.user, cmab.getIdType());
    Map<String, CMABGroupConfig> models = cmab.getConfig();
    CMABGroup best = null;
    double bestScore = 0;
    for (CMABGroup group: groups) {
      CMABGroupConfig model = models.get(group.getId());
      if (model == null) {
        continue;
      }
      double score = scoreGroup(ctx.user, model);
      if (best == null || (cmab.isHigherBetter() ? score > bestScore : score < bestScore)) {
        best = group;
        bestScore = score;
      }
    }
    String ruleID;
    if (best == null) {
      int index = (int)Hashing.bucket(cmab.getSalt() + "." + unitID, groups.size());
      best = groups.get(index);
      ruleID = best.getId() + CMAB_EXPLORE_SUFFIX;
    } else {
      ruleID = best.getId();
    }
    return result
        .value(true)
        .jsonValue(best.getParameterValues())
        .ruleID(ruleID)
        .groupName(best.getName())
        .experimentGroup(true)
        .build();
  }

  private static double scoreGroup(User user, CMABGroupConfig model) {
    double score = model.getIntercept();
    for (Map.Entry<String, Double> w: model.getWeightsNumerical().entrySet()) {
      Double n = EvaluatorTypeConversion.valueToNumber(getFromUser(user, w.getKey()));
      if (n != null && w.getValue() != null) {
        score += n * w.getValue();
      }
    }
    for (Map.Entry<String, Map<String, Double>> w: model.getWeightsCategorical().entrySet()) {
      String category = getFromUser(user, w.getKey()).toComparableString();
      if (category != null && w.getValue() != null) {
        Double weight = w.getValue().get(category);
        if (weight != null) {
          score += weight;
        }
      }
    }
    return score;
  }

  /**
   * Evaluates a spec directly, without local overrides or persisted values. Used when rendering
   * client snapshots.
   */
  EvalResult evaluate(EvalContext ctx, ConfigSpec spec) {
    return evaluateTopLevel(pinned(ctx), spec);
  }
  
  private EvalContext pinned(EvalContext ctx) {
    return ctx.specs == null ? ctx.withSpecs(store.getSnapshot()) : ctx;
  }

  private EvalResult unrecognized(EvalContext ctx) {
    return EvalResult.builder()
        .evaluationDetails(store.createEvaluationDetails(ctx.specs, Reason.UNRECOGNIZED))
        .build();
  }

  private EvalResult evaluateTopLevel(EvalContext ctx, ConfigSpec spec) {
    EvaluatorState state = new EvaluatorState();
    EvalResult result = evaluateSpec(ctx, spec, state, 0);
    if (state.depthExceeded) {
      logger.warn("Evaluation of \"{}\" exceeded the maximum nesting depth of {}; nested references were treated as no match",
          spec.getName(), MAX_DEPTH);
    }
    EvaluationDetails details = store.createEvaluationDetails(ctx.specs,
        state.unsupported ? Reason.UNSUPPORTED : Reason.NONE);
    return result.toBuilder()
        .hasSeenAnalyticalGates(state.hasSeenAnalyticalGates)
        .derivedDeviceMetadata(state.deviceMetadata)
        .evaluationDetails(details)
        .build();
  }

  private EvalResult evaluateSpec(EvalContext ctx, ConfigSpec spec, EvaluatorState state, int depth) {
    boolean isDynamicConfig = spec.isDynamicConfigType();
    ConfigValue defaultValue = isDynamicConfig ? objectOrEmpty(spec.getDefaultValue()) : null;
    EvalResult.Builder base = EvalResult.builder()
        .idType(spec.getIdType())
        .experimentActive(spec.isActive())
        .forwardAllExposures(spec.isForwardAllExposures())
        .configVersion(spec.getVersion());

    if (!spec.isEnabled()) {
      return base.jsonValue(defaultValue).ruleID(RULE_ID_DISABLED).build();
    }

    List<SecondaryExposure> exposures = new ArrayList<>();
    List<ConfigRule> rules = spec.getRules();
    int nRules = rules.size();
    for (int i = 0; i < nRules; i++) {
      ConfigRule rule = rules.get(i);
      if (!ruleMatches(ctx, rule, exposures, state, depth)) {
        continue;
      }
      EvalResult delegated = evaluateDelegate(ctx, rule, exposures, state, depth);
      if (delegated != null) {
        return delegated;
      }
      String idType = rule.getIdType() != null ? rule.getIdType() : spec.getIdType();
      String ruleSalt = rule.getSalt() == null || rule.getSalt().isEmpty() ? rule.getId() : rule.getSalt();
      boolean pass = Hashing.passesPercentage(spec.getSalt(), ruleSalt, getUnitID(ctx.user, idType),
          rule.getPassPercentage());
      ConfigValue value = null;
      if (isDynamicConfig) {
        value = pass ? objectOrEmpty(rule.getReturnValue()) : defaultValue;
      }
      return base
          .value(pass)
          .jsonValue(value)
          .ruleID(rule.getId())
          .groupName(rule.getGroupName())
          .experimentGroup(rule.isExperimentGroup())
          .samplingRate(rule.getSamplingRate())
          .secondaryExposures(exposures)
          .undelegatedSecondaryExposures(exposures)
          .build();
    }
    return base
        .jsonValue(defaultValue)
        .ruleID(RULE_ID_DEFAULT)
        .secondaryExposures(exposures)
        .undelegatedSecondaryExposures(exposures)
        .build();
  }

  // Returns null if the rule has no delegate or the delegate does not exist.
  private EvalResult evaluateDelegate(EvalContext ctx, ConfigRule rule, List<SecondaryExposure> exposures,
      EvaluatorState state, int depth) {
    String delegateName = rule.getConfigDelegate();
    if (delegateName == null || delegateName.isEmpty()) {
      return null;
    }
    ConfigSpec delegate = ctx.specs.configs.get(delegateName);
    if (delegate == null) {
      return null;
    }
    if (depth + 1 > MAX_DEPTH) {
      state.depthExceeded = true;
      return null;
    }
    EvalResult result = evaluateSpec(ctx, delegate, state, depth + 1);
    List<SecondaryExposure> all = new ArrayList<>(exposures);
    all.addAll(result.getSecondaryExposures());
    return result.toBuilder()
        .configDelegate(delegateName)
        .secondaryExposures(all)
        .undelegatedSecondaryExposures(exposures)
        .explicitParameters(delegate.getExplicitParameters())
        .build();
  }

  private boolean ruleMatches(EvalContext ctx, ConfigRule rule, List<SecondaryExposure> exposures,
      EvaluatorState state, int depth) {
    boolean matched = true;
    for (Condition c: rule.getConditions()) {
      if (!conditionMatches(ctx, c, exposures, state, depth)) {
        matched = false;
      }
    }
    return matched;
  }

  private boolean conditionMatches(EvalContext ctx, Condition c, List<SecondaryExposure> exposures,
      EvaluatorState state, int depth) {
    User user = ctx.user;
    String type = c.getType().toLowerCase(Locale.ROOT);
    ConfigValue value;
    switch (type) {
    case "public":
      return true;
    case "pass_gate":
    case "fail_gate": {
      String gateName = c.getTargetValue().stringValue();
      if (gateName == null) {
        return false;
      }
      Boolean passed = evaluateNestedGate(ctx, gateName, exposures, state, depth);
      if (passed == null) {
        return false;
      }
      return "pass_gate".equals(type) ? passed : !passed;
    }
    case "multi_pass_gate":
    case "multi_fail_gate": {
      boolean anyPassed = false;
      for (ConfigValue g: c.getTargetValue().values()) {
        String gateName = g.stringValue();
        if (gateName == null) {
          continue;
        }
        Boolean passed = evaluateNestedGate(ctx, gateName, exposures, state, depth);
        if (passed == null) {
          return false;
        }
        if (passed) {
          anyPassed = true;
          break;
        }
      }
      return "multi_pass_gate".equals(type) ? anyPassed : !anyPassed;
    }
    case "ip_based":
      value = getFromUser(user, c.getField());
      if (isEmpty(value) && c.getField() != null && "country".equalsIgnoreCase(c.getField())) {
        String ip = getFromUser(user, "ip").stringValue();
        String country = ip == null ? null : countryLookup.lookupCountry(ip);
        value = country == null ? ConfigValue.ofNull() : ConfigValue.of(country);
      }
      break;
    case "ua_based":
      value = getFromUser(user, c.getField());
      if (isEmpty(value)) {
        value = lookupUserAgent(user, c.getField(), state);
      }
      break;
    case "user_field":
      value = getFromUser(user, c.getField());
      break;
    case "environment_field":
      value = getFromEnvironment(user, c.getField());
      break;
    case "current_time":
      value = ConfigValue.of(System.currentTimeMillis() / 1000);
      break;
    case "user_bucket": {
      ConfigValue salt = c.getAdditionalValues().get("salt");
      String saltString = salt == null ? null : salt.toComparableString();
      value = saltString == null ? ConfigValue.ofNull() :
        ConfigValue.of(Hashing.userBucket(saltString, getUnitID(user, c.getIdType())));
      break;
    }
    case "unit_id":
      value = ConfigValue.of(getUnitID(user, c.getIdType()));
      break;
    case "target_app":
      value = ctx.targetAppID == null ? ConfigValue.ofNull() : ConfigValue.of(ctx.targetAppID);
      break;
    default:
      logger.debug("Unsupported condition type \"{}\"", c.getType());
      state.unsupported = true;
      return false;
    }

    String op = c.getOperator().toLowerCase(Locale.ROOT);
    if (!EvaluatorOperators.isKnown(op)) {
      logger.debug("Unsupported operator \"{}\"", c.getOperator());
      state.unsupported = true;
      return false;
    }
    if (EvaluatorOperators.IN_SEGMENT_LIST.equals(op) || EvaluatorOperators.NOT_IN_SEGMENT_LIST.equals(op)) {
      boolean inList = false;
      String listName = c.getTargetValue().stringValue();
      String id = value.stringValue();
      if (listName != null && id != null) {
        IdList list = store.getIdList(listName);
        inList = list != null && list.contains(Hashing.idListKey(id));
      }
      return EvaluatorOperators.IN_SEGMENT_LIST.equals(op) ? inList : !inList;
    }
    return EvaluatorOperators.apply(op, value, c.getTargetValue(), c.preprocessed);
  }

  // Evaluates a gate referenced from a condition and records the secondary exposure. Returns null if
  // the reference would exceed the depth bound.
  private Boolean evaluateNestedGate(EvalContext ctx, String gateName, List<SecondaryExposure> exposures,
      EvaluatorState state, int depth) {
    if (depth + 1 > MAX_DEPTH) {
      state.depthExceeded = true;
      return null;
    }
    boolean passed;
    String ruleID;
    LocalOverrides.Match<Boolean> override = overrides.getGate(gateName, ctx.user);
    if (override != null) {
      passed = override.value;
      ruleID = override.ruleID;
    } else {
      ConfigSpec gate = ctx.specs.gates.get(gateName);
      if (gate == null) {
        passed = false;
        ruleID = "";
      } else {
        EvalResult r = evaluateSpec(ctx, gate, state, depth + 1);
        passed = r.getValue();
        ruleID = r.getRuleID();
        exposures.addAll(r.getSecondaryExposures());
        if (gate.isForwardAllExposures()) {
          state.hasSeenAnalyticalGates = true;
        }
      }
    }
    exposures.add(new SecondaryExposure(gateName, String.valueOf(passed), ruleID));
    return passed;
  }

  private ConfigValue lookupUserAgent(User user, String field, EvaluatorState state) {
    String normalized = normalizeUserAgentField(field);
    String userAgent = user.getUserAgent();
    if (normalized == null || userAgent == null || userAgent.isEmpty()) {
      return ConfigValue.ofNull();
    }
    String result = userAgentParser.lookup(userAgent, normalized);
    if (result == null) {
      return ConfigValue.ofNull();
    }
    if (state.deviceMetadata == null) {
      state.deviceMetadata = new HashMap<>();
    }
    state.deviceMetadata.put(normalized, result);
    return ConfigValue.of(result);
  }

  private static ConfigValue objectOrEmpty(ConfigValue v) {
    return v != null && v.getType() == ConfigValueType.OBJECT ? v :
      ConfigValue.buildObject().build();
  }
}
