package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.User;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

import static com.google.common.base.Strings.nullToEmpty;

/**
 * Decides whether an exposure is delivered, bounding telemetry volume without ever dropping the
 * first exposure of a (name, rule id) pair.
 * <p>
 * Decisions are made in this order, and the first that applies wins:
 * <ol>
 * <li> results of local overrides are always logged;
 * <li> with no sampling mode, mode {@code none}, or an environment tier other than production, every
 * exposure is logged;
 * <li> specs that forward all exposures, or that consulted such a gate, are always logged;
 * <li> the first exposure of a (name, rule id) pair within the key set's window is logged;
 * <li> if a sampling rate applies (the rule's own rate, or the special-case rate for the
 * {@code default}, {@code disabled} and blank rule ids), an exposure whose fingerprint was already
 * seen in the window is a duplicate and is dropped; otherwise it is kept when
 * {@code hash(fingerprint) % rate == 0}.
 * </ol>
 * Only mode {@code on} drops anything. Mode {@code shadow} logs every exposure but records what
 * would have happened in the event's sampling metadata.
 */
final class ExposureSampler {
  static final String MODE_ON = "on";
  static final String MODE_SHADOW = "shadow";
  static final String MODE_NONE = "none";
  static final String PRODUCTION_TIER = "production";
  
  static final String SHADOW_LOGGED = "logged";
  static final String SHADOW_DROPPED = "dropped";
  
  enum EntityKind { GATE, CONFIG, LAYER }
  
  static final class Decision {
    final boolean shouldLog;
    final Long samplingRate;
    final String shadowLogged;
    final String samplingMode;
    
    Decision(boolean shouldLog, Long samplingRate, String shadowLogged, String samplingMode) {
      this.shouldLog = shouldLog;
      this.samplingRate = samplingRate;
      this.shadowLogged = shadowLogged;
      this.samplingMode = samplingMode;
    }
    
    /**
     * The annotations to attach to the event; empty if there are none.
     */
    Map<String, ConfigValue> toSamplingMetadata() {
      ImmutableMap.Builder<String, ConfigValue> b = ImmutableMap.builder();
      if (samplingMode != null && !samplingMode.isEmpty()) {
        b.put("samplingMode", ConfigValue.of(samplingMode));
      }
      if (samplingRate != null) {
        b.put("samplingRate", ConfigValue.of(samplingRate));
      }
      if (shadowLogged != null) {
        b.put("shadowLogged", ConfigValue.of(shadowLogged));
      }
      return b.build();
    }
  }
  
  private final TtlKeySet seenKeys;
  private final Supplier<SdkConfigs> sdkConfigs;
  private final String environmentTier;
  
  ExposureSampler(TtlKeySet seenKeys, Supplier<SdkConfigs> sdkConfigs, String environmentTier) {
    this.seenKeys = seenKeys;
    this.sdkConfigs = sdkConfigs;
    this.environmentTier = environmentTier == null ? PRODUCTION_TIER : environmentTier;
  }
  
  Decision decide(EntityKind kind, String name, EvalResult result, User user,
      String parameterName, String allocatedExperiment) {
    SdkConfigs configs = sdkConfigs.get();
    String mode = configs.getString(SdkConfigs.SAMPLING_MODE);
    String ruleID = result.getRuleID();
    
    if (ruleID.endsWith(":override") || ruleID.endsWith(":id_override")) {
      return new Decision(true, null, null, mode);
    }
    if (mode == null || mode.isEmpty() || MODE_NONE.equals(mode) ||
        !PRODUCTION_TIER.equals(environmentTier.toLowerCase(Locale.ROOT))) {
      return new Decision(true, null, null, mode);
    }
    if (result.isForwardAllExposures() || result.hasSeenAnalyticalGates()) {
      return new Decision(true, null, null, mode);
    }
    if (seenKeys.add(name + "_" + ruleID)) {
      return new Decision(true, null, null, mode);
    }
    
    Long rate = result.getSamplingRate();
    if (rate == null && isSpecialCaseRule(ruleID)) {
      Long special = configs.getLong(SdkConfigs.SPECIAL_CASE_SAMPLING_RATE);
      rate = special == null || special == 0 ? null : special;
    }
    if (rate == null || rate <= 0) {
      return new Decision(true, null, null, mode);
    }
    
    String fingerprint = fingerprint(kind, name, result, user, parameterName, allocatedExperiment);
    // a fingerprint already seen in this reset window is a repeat, so it is dropped even at rate 1
    boolean keep = seenKeys.add("fp:" + fingerprint) && Hashing.samplingHash(fingerprint) % rate == 0;
    String shadowLogged = keep ? SHADOW_LOGGED : SHADOW_DROPPED;
    
    switch (mode) {
    case MODE_ON:
      return new Decision(keep, rate, shadowLogged, mode);
    case MODE_SHADOW:
      return new Decision(true, rate, shadowLogged, mode);
    default:
      return new Decision(true, null, null, mode);
    }
  }
  
  private static boolean isSpecialCaseRule(String ruleID) {
    return ruleID.isEmpty() || Evaluator.RULE_ID_DEFAULT.equals(ruleID) ||
        Evaluator.RULE_ID_DISABLED.equals(ruleID);
  }
  
  static String fingerprint(EntityKind kind, String name, EvalResult result, User user,
      String parameterName, String allocatedExperiment) {
    String userKey = userKey(user);
    switch (kind) {
    case GATE:
      return "n:" + name + ";u:" + userKey + "r:" + result.getRuleID() + ";v:" + result.getValue();
    case LAYER:
      return "n:" + name + ";e:" + nullToEmpty(allocatedExperiment) + ";p:" + nullToEmpty(parameterName) +
          ";u:" + userKey + "r:" + result.getRuleID();
    default:
      return "n:" + name + ";u:" + userKey + "r:" + result.getRuleID();
    }
  }
  
  // Custom ids are sorted so that the key does not depend on map iteration order.
  static String userKey(User user) {
    StringBuilder sb = new StringBuilder("u:").append(nullToEmpty(user.getUserID())).append(';');
    for (Map.Entry<String, String> e: new TreeMap<>(user.getCustomIDs()).entrySet()) {
      sb.append(e.getKey()).append(':').append(e.getValue()).append(';');
    }
    return sb.toString();
  }
}
