package com.switchyard.sdk.server;

import com.switchyard.sdk.User;
import com.switchyard.sdk.server.interfaces.StickyValues;

import java.util.Map;

/**
 * The explicit inputs of one evaluation: the user, the persisted values to replay (if any), the client
 * scope used by {@code target_app} conditions, and the spec snapshot that every lookup of the
 * evaluation reads. A null snapshot is replaced by the store's current one when evaluation starts.
 */
final class EvalContext {
  final User user;
  final Map<String, StickyValues> persistedValues;
  final String targetAppID;
  final SpecSnapshot specs;
  
  EvalContext(User user, Map<String, StickyValues> persistedValues, String targetAppID, SpecSnapshot specs) {
    this.user = user;
    this.persistedValues = persistedValues;
    this.targetAppID = targetAppID;
    this.specs = specs;
  }
  
  static EvalContext of(User user) {
    return new EvalContext(user, null, null, null);
  }
  
  EvalContext withPersistedValues(Map<String, StickyValues> values) {
    return new EvalContext(user, values, targetAppID, specs);
  }
  
  EvalContext withTargetAppID(String appID) {
    return new EvalContext(user, persistedValues, appID, specs);
  }
  
  EvalContext withSpecs(SpecSnapshot snapshot) {
    return new EvalContext(user, persistedValues, targetAppID, snapshot);
  }
}
